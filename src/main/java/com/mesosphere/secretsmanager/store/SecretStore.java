package com.mesosphere.secretsmanager.store;

/**
 * Consumer store holding materialized {@link TargetSecret}s, keyed by namespace and name.
 * <p>
 * Implementations must be thread-safe: reconciliations for different records call into the same
 * store concurrently.
 */
public interface SecretStore {

  /**
   * Returns the secret with the provided namespace and name.
   *
   * @throws StoreException with reason {@code NOT_FOUND} if it doesn't exist, or another reason if
   *                        the read failed
   */
  TargetSecret get(String namespace, String name) throws StoreException;

  /**
   * Creates a new secret.
   *
   * @throws StoreException with reason {@code ALREADY_EXISTS} if a secret with the same namespace
   *                        and name exists, or another reason if the write failed
   */
  void create(TargetSecret secret) throws StoreException;

  /**
   * Replaces an existing secret in full.
   *
   * @throws StoreException with reason {@code NOT_FOUND} if it doesn't exist, or another reason if
   *                        the write failed
   */
  void update(TargetSecret secret) throws StoreException;

  /**
   * Deletes a secret.
   *
   * @throws StoreException with reason {@code NOT_FOUND} if it doesn't exist, or another reason if
   *                        the delete failed
   */
  void delete(String namespace, String name) throws StoreException;
}
