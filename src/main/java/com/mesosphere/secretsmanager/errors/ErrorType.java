package com.mesosphere.secretsmanager.errors;

/**
 * Machine-readable cause of a {@link SecretsManagerException}. Each type belongs to exactly one
 * {@link Source}, which tells an operator which remote system is unhealthy.
 */
public enum ErrorType {

  /**
   * No credential in the configured chain could log in.
   */
  AUTHENTICATION_FAILED(Source.BACKEND),

  /**
   * The session token is close to expiry but the backend refuses to renew it.
   */
  TOKEN_NOT_RENEWABLE(Source.BACKEND),

  /**
   * The configured backend kind is not implemented.
   */
  UNSUPPORTED_BACKEND(Source.CONFIGURATION),

  /**
   * The configured KV engine version is not implemented.
   */
  UNSUPPORTED_ENGINE(Source.CONFIGURATION),

  /**
   * A data source names an encoding with no registered decoder.
   */
  UNSUPPORTED_ENCODING(Source.CONFIGURATION),

  /**
   * A backend value is not valid for its declared encoding.
   */
  DECODE_ERROR(Source.BACKEND),

  BACKEND_SECRET_NOT_FOUND(Source.BACKEND),

  BACKEND_SECRET_FORBIDDEN(Source.BACKEND),

  /**
   * Network, permission or protocol failure talking to the backend.
   */
  UNKNOWN_BACKEND_ERROR(Source.BACKEND),

  /**
   * The requested object does not exist in the consumer store. Recovered locally in most places.
   */
  CONSUMER_STORE_NOT_FOUND(Source.CONSUMER_STORE),

  CONSUMER_STORE_ERROR(Source.CONSUMER_STORE);

  /**
   * The remote system a failure is attributed to. {@link #CONFIGURATION} covers declarations or
   * settings that are rejected before any remote call is made.
   */
  public enum Source {
    BACKEND,
    CONSUMER_STORE,
    CONFIGURATION
  }

  private final Source source;

  ErrorType(Source source) {
    this.source = source;
  }

  public Source getSource() {
    return source;
  }
}
