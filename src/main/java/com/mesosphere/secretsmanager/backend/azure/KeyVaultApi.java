package com.mesosphere.secretsmanager.backend.azure;

import java.io.IOException;

/**
 * The subset of the Azure Key Vault REST API used by {@link KeyVaultBackendClient}.
 */
public interface KeyVaultApi {

  /**
   * Returns the current version of the named secret.
   *
   * @throws com.mesosphere.secretsmanager.http.HttpStatusException if Key Vault answered with an
   *                                                                 error status
   * @throws IOException                                             for any other failure
   */
  String getSecret(String accessToken, String name) throws IOException;
}
