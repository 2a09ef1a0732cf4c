package com.mesosphere.secretsmanager.backend.vault;

import org.json.JSONObject;

import java.io.IOException;
import java.util.Optional;

/**
 * The subset of the Vault HTTP API used by {@link VaultBackendClient}. Every call either returns a
 * result or throws an {@link IOException} describing a transport or status failure.
 */
public interface VaultApi {

  /**
   * Logs in with the provided credential.
   *
   * @return the new client token
   */
  String login(VaultCredential credential) throws IOException;

  /**
   * Reads a logical path.
   *
   * @return the full response body, or an empty Optional if nothing is stored at {@code path}
   */
  Optional<JSONObject> read(String token, String path) throws IOException;

  /**
   * Looks up the provided token.
   *
   * @throws IOException if the lookup failed, including when the token was revoked or its TTL
   *                     could not be parsed
   */
  TokenInfo lookupSelf(String token) throws IOException;

  /**
   * Extends the provided token's lease by {@code incrementSeconds}.
   */
  void renewSelf(String token, long incrementSeconds) throws IOException;

  VaultHealth health() throws IOException;
}
