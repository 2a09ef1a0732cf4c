package com.mesosphere.secretsmanager.backend.vault;

/**
 * Cluster information returned by Vault's health endpoint.
 */
public final class VaultHealth {

  private final String clusterName;
  private final String clusterId;
  private final String version;
  private final boolean sealed;

  public VaultHealth(String clusterName, String clusterId, String version, boolean sealed) {
    this.clusterName = clusterName;
    this.clusterId = clusterId;
    this.version = version;
    this.sealed = sealed;
  }

  public String getClusterName() {
    return clusterName;
  }

  public String getClusterId() {
    return clusterId;
  }

  public String getVersion() {
    return version;
  }

  public boolean isSealed() {
    return sealed;
  }

  @Override
  public String toString() {
    return String.format("cluster_name=%s cluster_id=%s version=%s sealed=%s",
        clusterName, clusterId, version, sealed);
  }
}
