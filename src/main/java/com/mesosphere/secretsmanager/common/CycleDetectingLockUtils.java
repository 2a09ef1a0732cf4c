package com.mesosphere.secretsmanager.common;

import com.google.common.util.concurrent.CycleDetectingLockFactory;

import java.util.concurrent.locks.ReadWriteLock;

/**
 * Construction of read/write locks which detect lock-ordering cycles. Depending on configuration a
 * detected cycle either kills the process (so that it is restarted in a fresh state) or only logs a
 * warning.
 */
public final class CycleDetectingLockUtils {

  private static final CycleDetectingLockFactory.Policy LOG_AND_EXIT_POLICY =
      e -> ProcessExit.exit(ProcessExit.DEADLOCK_ENCOUNTERED, e);

  private CycleDetectingLockUtils() {
    // do not instantiate
  }

  /**
   * Returns a new cycle detecting lock named after the provided class.
   *
   * @param exitOnDeadlock whether to exit the process if a lock cycle is detected
   * @param parentClass    used to label the lock in any error messages
   */
  public static ReadWriteLock newLock(boolean exitOnDeadlock, Class<?> parentClass) {
    return CycleDetectingLockFactory
        .newInstance(exitOnDeadlock ? LOG_AND_EXIT_POLICY : CycleDetectingLockFactory.Policies.WARN)
        .newReentrantReadWriteLock(parentClass.getSimpleName());
  }
}
