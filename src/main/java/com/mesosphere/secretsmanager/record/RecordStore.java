package com.mesosphere.secretsmanager.record;

import com.mesosphere.secretsmanager.store.StoreException;

import java.util.Collection;
import java.util.Optional;

/**
 * Source of {@link SecretRecord}s, along with the ability to persist changes to their finalizers.
 */
public interface RecordStore {

  /**
   * Returns the record with the provided identity, or an empty Optional if it no longer exists.
   *
   * @throws StoreException if the store could not be read
   */
  Optional<SecretRecord> get(RecordIdentity identity) throws StoreException;

  /**
   * Returns the identities of all records currently known to the store.
   *
   * @throws StoreException if the store could not be read
   */
  Collection<RecordIdentity> list() throws StoreException;

  /**
   * Persists the finalizers of the provided record onto the stored copy. The stored declaration and
   * deletion state are kept, so a copy read before a newer declaration can't overwrite it. A stored
   * record which is marked for deletion and is left with no finalizers is removed instead.
   *
   * @throws StoreException with reason {@code NOT_FOUND} if the record does not exist, or another
   *                        reason if the write failed
   */
  void update(SecretRecord record) throws StoreException;
}
