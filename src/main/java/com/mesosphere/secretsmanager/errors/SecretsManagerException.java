package com.mesosphere.secretsmanager.errors;

/**
 * Exception raised by backend clients, decoders and the reconciler. The nested {@link ErrorType}
 * is intended for metrics labels and for deciding how a failure is handled; the underlying cause,
 * if any, is nested for developer understanding.
 */
public class SecretsManagerException extends Exception {

  private final ErrorType type;

  public SecretsManagerException(ErrorType type, String message) {
    super(message);
    this.type = type;
  }

  public SecretsManagerException(ErrorType type, String message, Throwable cause) {
    super(message, cause);
    this.type = type;
  }

  public static SecretsManagerException backendSecretNotFound(String path, String key) {
    return new SecretsManagerException(
        ErrorType.BACKEND_SECRET_NOT_FOUND,
        String.format("secret key '%s' not found at '%s'", key, path));
  }

  public static SecretsManagerException unsupportedEncoding(String encoding) {
    return new SecretsManagerException(
        ErrorType.UNSUPPORTED_ENCODING, String.format("encoding '%s' not supported", encoding));
  }

  public static SecretsManagerException unsupportedEngine(String engine) {
    return new SecretsManagerException(
        ErrorType.UNSUPPORTED_ENGINE, String.format("vault engine '%s' not supported", engine));
  }

  public static SecretsManagerException unsupportedBackend(String backend) {
    return new SecretsManagerException(
        ErrorType.UNSUPPORTED_BACKEND, String.format("backend '%s' not supported", backend));
  }

  public ErrorType getType() {
    return type;
  }

  public ErrorType.Source getSource() {
    return type.getSource();
  }

  @Override
  public String getMessage() {
    return String.format("%s (errtype: %s)", super.getMessage(), type);
  }
}
