package com.mesosphere.secretsmanager.store;

import com.mesosphere.secretsmanager.common.CycleDetectingLockUtils;
import com.mesosphere.secretsmanager.record.RecordIdentity;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * Implementation of {@link SecretStore} which keeps secrets in local memory. Counts writes so that
 * callers can check that a reconciliation was a no-op.
 */
public final class MemSecretStore implements SecretStore {

  private final Map<RecordIdentity, TargetSecret> secrets = new TreeMap<>();

  private final AtomicLong writeCount = new AtomicLong();

  private final Lock rlock;

  private final Lock rwlock;

  public MemSecretStore() {
    this(false);
  }

  public MemSecretStore(boolean exitOnDeadlock) {
    ReadWriteLock lock = CycleDetectingLockUtils.newLock(exitOnDeadlock, MemSecretStore.class);
    this.rlock = lock.readLock();
    this.rwlock = lock.writeLock();
  }

  @Override
  public TargetSecret get(String namespace, String name) throws StoreException {
    RecordIdentity identity = RecordIdentity.of(namespace, name);
    rlock.lock();
    try {
      TargetSecret secret = secrets.get(identity);
      if (secret == null) {
        throw StoreException.notFound(identity);
      }
      return secret;
    } finally {
      rlock.unlock();
    }
  }

  @Override
  public void create(TargetSecret secret) throws StoreException {
    RecordIdentity identity = RecordIdentity.of(secret.getNamespace(), secret.getName());
    rwlock.lock();
    try {
      if (secrets.containsKey(identity)) {
        throw new StoreException(
            StoreException.Reason.ALREADY_EXISTS, String.format("'%s' already exists", identity));
      }
      secrets.put(identity, secret);
      writeCount.incrementAndGet();
    } finally {
      rwlock.unlock();
    }
  }

  @Override
  public void update(TargetSecret secret) throws StoreException {
    RecordIdentity identity = RecordIdentity.of(secret.getNamespace(), secret.getName());
    rwlock.lock();
    try {
      if (!secrets.containsKey(identity)) {
        throw StoreException.notFound(identity);
      }
      secrets.put(identity, secret);
      writeCount.incrementAndGet();
    } finally {
      rwlock.unlock();
    }
  }

  @Override
  public void delete(String namespace, String name) throws StoreException {
    RecordIdentity identity = RecordIdentity.of(namespace, name);
    rwlock.lock();
    try {
      if (secrets.remove(identity) == null) {
        throw StoreException.notFound(identity);
      }
      writeCount.incrementAndGet();
    } finally {
      rwlock.unlock();
    }
  }

  public boolean contains(String namespace, String name) {
    rlock.lock();
    try {
      return secrets.containsKey(RecordIdentity.of(namespace, name));
    } finally {
      rlock.unlock();
    }
  }

  /**
   * Returns the number of successful create, update and delete calls so far.
   */
  public long getWriteCount() {
    return writeCount.get();
  }
}
