package com.mesosphere.secretsmanager.record;

import com.mesosphere.secretsmanager.common.CycleDetectingLockUtils;
import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.store.StoreException;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.Consumer;

/**
 * Implementation of {@link RecordStore} which keeps records in local memory. Records are added and
 * marked for deletion by whoever owns the declarations, such as
 * {@link com.mesosphere.secretsmanager.config.SecretDefinitionsSync}, while
 * finalizer changes come from the reconciler through {@link #update(SecretRecord)}.
 * <p>
 * A record which is marked for deletion is only dropped once its finalizers are empty.
 */
public final class MemRecordStore implements RecordStore {

  private static final Logger LOGGER = LoggingUtils.getLogger(MemRecordStore.class);

  private final Map<RecordIdentity, SecretRecord> records = new TreeMap<>();

  private final List<Consumer<RecordIdentity>> listeners = new CopyOnWriteArrayList<>();

  private final Lock rlock;

  private final Lock rwlock;

  public MemRecordStore(boolean exitOnDeadlock) {
    ReadWriteLock lock = CycleDetectingLockUtils.newLock(exitOnDeadlock, MemRecordStore.class);
    this.rlock = lock.readLock();
    this.rwlock = lock.writeLock();
  }

  /**
   * Registers a callback which is invoked with the identity of every record that is added, changed,
   * or marked for deletion. Callbacks are invoked outside of the store lock.
   */
  public void addListener(Consumer<RecordIdentity> listener) {
    listeners.add(listener);
  }

  @Override
  public Optional<SecretRecord> get(RecordIdentity identity) {
    rlock.lock();
    try {
      return Optional.ofNullable(records.get(identity));
    } finally {
      rlock.unlock();
    }
  }

  @Override
  public Collection<RecordIdentity> list() {
    rlock.lock();
    try {
      return new TreeSet<>(records.keySet());
    } finally {
      rlock.unlock();
    }
  }

  @Override
  public void update(SecretRecord record) throws StoreException {
    rwlock.lock();
    try {
      RecordIdentity identity = record.getIdentity();
      SecretRecord current = records.get(identity);
      if (current == null) {
        throw StoreException.notFound(identity);
      }
      // Only finalizers come from the caller. Declaration and deletion state stay as stored.
      SecretRecord toStore = current.withFinalizers(record.getFinalizers());
      if (toStore.isDeletionRequested() && toStore.getFinalizers().isEmpty()) {
        LOGGER.info("Removing record {}: deletion requested and no finalizers remain", identity);
        records.remove(identity);
      } else {
        records.put(identity, toStore);
      }
    } finally {
      rwlock.unlock();
    }
  }

  /**
   * Adds a record, or replaces the declaration of an existing one. Finalizers already attached to
   * the stored record are kept, and a pending deletion is cancelled.
   *
   * @return whether the store content changed
   */
  public boolean put(SecretRecord record) {
    boolean changed;
    rwlock.lock();
    try {
      SecretRecord current = records.get(record.getIdentity());
      if (current == null) {
        records.put(record.getIdentity(), record);
        changed = true;
      } else if (!current.hasSameDeclaration(record) || current.isDeletionRequested()) {
        records.put(
            record.getIdentity(),
            record.toBuilder()
                .deletionRequested(false)
                .finalizers(current.getFinalizers())
                .build());
        changed = true;
      } else {
        changed = false;
      }
    } finally {
      rwlock.unlock();
    }
    if (changed) {
      notifyListeners(record.getIdentity());
    }
    return changed;
  }

  /**
   * Marks the record for deletion. A record without finalizers is removed right away.
   *
   * @return whether a record with the provided identity existed and was not already marked
   */
  public boolean markForDeletion(RecordIdentity identity) {
    rwlock.lock();
    try {
      SecretRecord current = records.get(identity);
      if (current == null || current.isDeletionRequested()) {
        return false;
      }
      if (current.getFinalizers().isEmpty()) {
        records.remove(identity);
      } else {
        records.put(identity, current.withDeletionRequested());
      }
    } finally {
      rwlock.unlock();
    }
    notifyListeners(identity);
    return true;
  }

  private void notifyListeners(RecordIdentity identity) {
    List<Consumer<RecordIdentity>> copy = new ArrayList<>(listeners);
    for (Consumer<RecordIdentity> listener : copy) {
      listener.accept(identity);
    }
  }
}
