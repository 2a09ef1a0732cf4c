package com.mesosphere.secretsmanager.backend.vault;

/**
 * Lifecycle of the token held by a {@link VaultBackendClient}.
 */
public enum SessionState {
  LOGGED_OUT,
  LOGGING_IN,
  ACTIVE,
  CHECKING_TTL,
  RENEWING
}
