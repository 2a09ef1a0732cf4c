package com.mesosphere.secretsmanager.backend.vault;

import org.json.JSONObject;

import java.io.IOException;

/**
 * Credential material used to log in to Vault through one of its auth methods. The payload is
 * built on every login, so credentials which rotate on disk are picked up by re-logins.
 */
public interface VaultCredential {

  /**
   * Returns the Vault API path to POST the login payload to, e.g. {@code auth/approle/login}.
   */
  String getLoginPath();

  /**
   * Returns the login request body.
   *
   * @throws IOException if the credential material could not be loaded
   */
  JSONObject getLoginPayload() throws IOException;
}
