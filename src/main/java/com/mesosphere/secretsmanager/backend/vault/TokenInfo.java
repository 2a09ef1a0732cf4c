package com.mesosphere.secretsmanager.backend.vault;

/**
 * Result of a token self-lookup: remaining lifetime and whether Vault allows renewing it.
 */
public final class TokenInfo {

  private final long ttlSeconds;
  private final boolean renewable;

  public TokenInfo(long ttlSeconds, boolean renewable) {
    this.ttlSeconds = ttlSeconds;
    this.renewable = renewable;
  }

  public long getTtlSeconds() {
    return ttlSeconds;
  }

  public boolean isRenewable() {
    return renewable;
  }

  @Override
  public String toString() {
    return String.format("ttl=%ds renewable=%s", ttlSeconds, renewable);
  }
}
