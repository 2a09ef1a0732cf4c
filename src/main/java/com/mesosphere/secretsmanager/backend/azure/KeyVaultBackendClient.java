package com.mesosphere.secretsmanager.backend.azure;

import com.mesosphere.secretsmanager.backend.BackendClient;
import com.mesosphere.secretsmanager.backend.azure.auth.TokenProvider;
import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;
import com.mesosphere.secretsmanager.http.HttpStatusException;
import com.mesosphere.secretsmanager.metrics.MetricsSink;

import org.apache.http.HttpStatus;
import org.slf4j.Logger;

import java.io.IOException;

/**
 * {@link BackendClient} for Azure Key Vault. There is no session to maintain: every read obtains an
 * access token from the (caching) {@link TokenProvider}. The {@code key} of a data source is
 * ignored since a Key Vault secret holds a single value.
 */
public class KeyVaultBackendClient implements BackendClient {

  public static final String NAME = "azure-kv";

  private static final Logger LOGGER = LoggingUtils.getLogger(KeyVaultBackendClient.class);

  private final KeyVaultApi api;
  private final TokenProvider tokenProvider;
  private final MetricsSink metrics;

  private KeyVaultBackendClient(KeyVaultApi api, TokenProvider tokenProvider, MetricsSink metrics) {
    this.api = api;
    this.tokenProvider = tokenProvider;
    this.metrics = metrics;
  }

  /**
   * Returns a new client after checking that the credential chain can obtain a token.
   *
   * @throws SecretsManagerException with type {@code AUTHENTICATION_FAILED} if no credential works
   */
  public static KeyVaultBackendClient create(
      String keyVaultName, KeyVaultApi api, TokenProvider tokenProvider, MetricsSink metrics)
      throws SecretsManagerException
  {
    try {
      tokenProvider.getToken();
    } catch (IOException e) {
      metrics.incrementLoginErrors(NAME);
      throw new SecretsManagerException(ErrorType.AUTHENTICATION_FAILED,
          String.format("Unable to obtain a token for Key Vault '%s'", keyVaultName), e);
    }
    LOGGER.info("Successfully logged into Azure Key Vault '{}'", keyVaultName);
    return new KeyVaultBackendClient(api, tokenProvider, metrics);
  }

  @Override
  public String readSecret(String path, String key) throws SecretsManagerException {
    String accessToken;
    try {
      accessToken = tokenProvider.getToken().getToken();
    } catch (IOException e) {
      metrics.incrementLoginErrors(NAME);
      throw new SecretsManagerException(ErrorType.AUTHENTICATION_FAILED,
          "Unable to obtain a Key Vault access token", e);
    }

    try {
      return api.getSecret(accessToken, path);
    } catch (HttpStatusException e) {
      ErrorType type = toErrorType(e.getStatusCode());
      metrics.incrementSecretReadErrors(NAME, type);
      if (type == ErrorType.BACKEND_SECRET_NOT_FOUND) {
        throw new SecretsManagerException(type, String.format("secret '%s' not found", path), e);
      }
      throw new SecretsManagerException(type, String.format("Failed to read secret '%s'", path), e);
    } catch (IOException e) {
      metrics.incrementSecretReadErrors(NAME, ErrorType.UNKNOWN_BACKEND_ERROR);
      throw new SecretsManagerException(
          ErrorType.UNKNOWN_BACKEND_ERROR, String.format("Failed to read secret '%s'", path), e);
    }
  }

  private static ErrorType toErrorType(int statusCode) {
    switch (statusCode) {
      case HttpStatus.SC_NOT_FOUND:
        return ErrorType.BACKEND_SECRET_NOT_FOUND;
      case HttpStatus.SC_FORBIDDEN:
        return ErrorType.BACKEND_SECRET_FORBIDDEN;
      default:
        return ErrorType.UNKNOWN_BACKEND_ERROR;
    }
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public void close() {
    // nothing to stop
  }
}
