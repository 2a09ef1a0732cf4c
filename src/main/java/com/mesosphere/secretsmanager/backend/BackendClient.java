package com.mesosphere.secretsmanager.backend;

import com.mesosphere.secretsmanager.errors.SecretsManagerException;

import java.io.Closeable;

/**
 * Read access to the secret-of-truth backend.
 */
public interface BackendClient extends Closeable {

  /**
   * Returns the raw (still encoded) string stored under {@code key} at {@code path}. Never triggers
   * a login or token renewal.
   *
   * @throws SecretsManagerException with type {@code BACKEND_SECRET_NOT_FOUND} if the path or key is
   *                                 absent, or another backend type for any other failure
   */
  String readSecret(String path, String key) throws SecretsManagerException;

  /**
   * Returns the short name of this backend, used to label logs and metrics.
   */
  String getName();

  /**
   * Stops any background activity owned by this client.
   */
  @Override
  void close();
}
