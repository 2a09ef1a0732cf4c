package com.mesosphere.secretsmanager.config;

import com.google.common.collect.ImmutableSet;

import java.io.File;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * This class encapsulates the secrets manager settings retrieved from the environment. Presented as
 * a non-static object to simplify tests, which construct it from a map.
 */
public final class ManagerConfig {

  /**
   * Envvar selecting the backend: {@code vault} or {@code azure-kv}.
   */
  static final String BACKEND_ENV = "BACKEND";

  /**
   * Envvar for the connect and read timeout of every backend HTTP call, in seconds.
   */
  static final String BACKEND_TIMEOUT_S_ENV = "BACKEND_TIMEOUT_S";

  /**
   * Envvar for how long to wait before reconciling a record again after a successful
   * reconciliation, in seconds. This is what picks up changes made in the backend.
   */
  static final String RECONCILE_PERIOD_S_ENV = "RECONCILE_PERIOD_S";

  /**
   * Comma-separated namespaces to manage. Empty means all namespaces.
   */
  static final String WATCH_NAMESPACES_ENV = "WATCH_NAMESPACES";

  /**
   * Comma-separated namespaces whose records never produce a target secret.
   */
  static final String EXCLUDE_NAMESPACES_ENV = "EXCLUDE_NAMESPACES";

  static final String VAULT_ADDR_ENV = "VAULT_ADDR";
  static final String VAULT_AUTH_METHOD_ENV = "VAULT_AUTH_METHOD";
  static final String VAULT_ROLE_ID_ENV = "VAULT_ROLE_ID";
  static final String VAULT_SECRET_ID_ENV = "VAULT_SECRET_ID";
  static final String VAULT_KUBERNETES_ROLE_ENV = "VAULT_KUBERNETES_ROLE";
  static final String VAULT_KUBERNETES_TOKEN_PATH_ENV = "VAULT_KUBERNETES_TOKEN_PATH";
  static final String VAULT_APPROLE_PATH_ENV = "VAULT_APPROLE_PATH";
  static final String VAULT_KUBERNETES_PATH_ENV = "VAULT_KUBERNETES_PATH";

  /**
   * Envvar for the token TTL, in seconds, under which the renewal loop renews the token.
   */
  static final String VAULT_MAX_TOKEN_TTL_S_ENV = "VAULT_MAX_TOKEN_TTL_S";

  static final String VAULT_TOKEN_POLLING_PERIOD_S_ENV = "VAULT_TOKEN_POLLING_PERIOD_S";
  static final String VAULT_RENEW_TTL_INCREMENT_S_ENV = "VAULT_RENEW_TTL_INCREMENT_S";

  /**
   * Envvar selecting the KV engine version: {@code kv1} or {@code kv2}.
   */
  static final String VAULT_ENGINE_ENV = "VAULT_ENGINE";

  static final String AZURE_KV_NAME_ENV = "AZURE_KV_NAME";
  static final String AZURE_TENANT_ID_ENV = "AZURE_TENANT_ID";
  static final String AZURE_CLIENT_ID_ENV = "AZURE_CLIENT_ID";
  static final String AZURE_CLIENT_SECRET_ENV = "AZURE_CLIENT_SECRET";
  static final String AZURE_MANAGED_CLIENT_ID_ENV = "AZURE_MANAGED_CLIENT_ID";
  static final String AZURE_MANAGED_RESOURCE_ID_ENV = "AZURE_MANAGED_RESOURCE_ID";

  /**
   * Envvar pointing to the YAML file of secret definitions.
   */
  static final String SECRET_DEFINITIONS_PATH_ENV = "SECRET_DEFINITIONS_PATH";

  static final String SECRET_DEFINITIONS_REFRESH_S_ENV = "SECRET_DEFINITIONS_REFRESH_S";

  /**
   * Envvar pointing to the root directory under which target secrets are written.
   */
  static final String SECRETS_OUTPUT_DIR_ENV = "SECRETS_OUTPUT_DIR";

  /**
   * Controls whether deadlocks should lead to the process exiting (enabled by default).
   * If this envvar is set (to anything at all), the process will not exit if a deadlock is encountered.
   */
  static final String DISABLE_DEADLOCK_EXIT_ENV = "DISABLE_DEADLOCK_EXIT";

  static final String DEFAULT_VAULT_ADDR = "https://127.0.0.1:8200";
  static final String DEFAULT_KUBERNETES_TOKEN_PATH = "/var/run/secrets/kubernetes.io/serviceaccount/token";

  private final EnvStore envStore;

  private ManagerConfig(EnvStore envStore) {
    this.envStore = envStore;
  }

  public static ManagerConfig fromEnv() {
    return fromEnvStore(EnvStore.fromEnv());
  }

  public static ManagerConfig fromEnvStore(EnvStore envStore) {
    return new ManagerConfig(envStore);
  }

  public String getBackend() {
    return envStore.getOptional(BACKEND_ENV, "vault");
  }

  public Duration getBackendTimeout() {
    return envStore.getOptionalSeconds(BACKEND_TIMEOUT_S_ENV, 5);
  }

  public Duration getReconcilePeriod() {
    return envStore.getOptionalSeconds(RECONCILE_PERIOD_S_ENV, 5);
  }

  public Set<String> getWatchNamespaces() {
    return ImmutableSet.copyOf(envStore.getOptionalStringList(WATCH_NAMESPACES_ENV));
  }

  public Set<String> getExcludeNamespaces() {
    return ImmutableSet.copyOf(envStore.getOptionalStringList(EXCLUDE_NAMESPACES_ENV));
  }

  public String getVaultAddress() {
    return envStore.getOptional(VAULT_ADDR_ENV, DEFAULT_VAULT_ADDR);
  }

  public String getVaultAuthMethod() {
    return envStore.getOptional(VAULT_AUTH_METHOD_ENV, "approle");
  }

  public String getVaultRoleId() {
    return envStore.getRequired(VAULT_ROLE_ID_ENV);
  }

  public String getVaultSecretId() {
    return envStore.getRequired(VAULT_SECRET_ID_ENV);
  }

  public String getVaultKubernetesRole() {
    return envStore.getRequired(VAULT_KUBERNETES_ROLE_ENV);
  }

  public File getVaultKubernetesTokenFile() {
    return new File(envStore.getOptional(VAULT_KUBERNETES_TOKEN_PATH_ENV, DEFAULT_KUBERNETES_TOKEN_PATH));
  }

  public String getVaultAppRolePath() {
    return envStore.getOptional(VAULT_APPROLE_PATH_ENV, "approle");
  }

  public String getVaultKubernetesPath() {
    return envStore.getOptional(VAULT_KUBERNETES_PATH_ENV, "kubernetes");
  }

  public long getVaultMaxTokenTtlSec() {
    return envStore.getOptionalSeconds(VAULT_MAX_TOKEN_TTL_S_ENV, 300).getSeconds();
  }

  public Duration getVaultTokenPollingPeriod() {
    return envStore.getOptionalSeconds(VAULT_TOKEN_POLLING_PERIOD_S_ENV, 15);
  }

  public long getVaultRenewTtlIncrementSec() {
    return envStore.getOptionalSeconds(VAULT_RENEW_TTL_INCREMENT_S_ENV, 600).getSeconds();
  }

  public String getVaultEngine() {
    return envStore.getOptional(VAULT_ENGINE_ENV, "kv2");
  }

  public String getAzureKeyVaultName() {
    return envStore.getRequired(AZURE_KV_NAME_ENV);
  }

  public Optional<String> getAzureTenantId() {
    return Optional.ofNullable(envStore.getOptional(AZURE_TENANT_ID_ENV, null));
  }

  public Optional<String> getAzureClientId() {
    return Optional.ofNullable(envStore.getOptional(AZURE_CLIENT_ID_ENV, null));
  }

  public Optional<String> getAzureClientSecret() {
    return Optional.ofNullable(envStore.getOptional(AZURE_CLIENT_SECRET_ENV, null));
  }

  public Optional<String> getAzureManagedClientId() {
    return Optional.ofNullable(envStore.getOptional(AZURE_MANAGED_CLIENT_ID_ENV, null));
  }

  public Optional<String> getAzureManagedResourceId() {
    return Optional.ofNullable(envStore.getOptional(AZURE_MANAGED_RESOURCE_ID_ENV, null));
  }

  public File getSecretDefinitionsFile() {
    return new File(envStore.getRequired(SECRET_DEFINITIONS_PATH_ENV));
  }

  public Duration getSecretDefinitionsRefreshPeriod() {
    return envStore.getOptionalSeconds(SECRET_DEFINITIONS_REFRESH_S_ENV, 60);
  }

  public File getSecretsOutputDir() {
    return new File(envStore.getRequired(SECRETS_OUTPUT_DIR_ENV));
  }

  public boolean isDeadlockExitEnabled() {
    return !envStore.isPresent(DISABLE_DEADLOCK_EXIT_ENV);
  }

  /**
   * Returns a one-line summary of the non-credential settings.
   */
  @Override
  public String toString() {
    return String.format(
        "backend=%s timeout=%s reconcile_period=%s watch=%s exclude=%s",
        getBackend(), getBackendTimeout(), getReconcilePeriod(), getWatchNamespaces(), getExcludeNamespaces());
  }
}
