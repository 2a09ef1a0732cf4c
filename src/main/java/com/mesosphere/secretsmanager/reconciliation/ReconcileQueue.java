package com.mesosphere.secretsmanager.reconciliation;

import com.mesosphere.secretsmanager.record.RecordIdentity;

import com.google.common.annotations.VisibleForTesting;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Schedule of pending reconciliations. Each identity is pending at most once (at its earliest due
 * time) and handed out to at most one caller at a time: an identity which is in flight is not
 * returned by {@link #pollDue()} until {@link #succeeded} or {@link #failed} is called for it.
 * <p>
 * Failures are retried with exponential backoff, starting at {@link #BASE_BACKOFF} and doubling up
 * to {@link #MAX_BACKOFF}. A success resets the backoff.
 */
public class ReconcileQueue {

  static final Duration BASE_BACKOFF = Duration.ofSeconds(1);
  static final Duration MAX_BACKOFF = Duration.ofMinutes(5);
  private static final int MULTIPLIER = 2;

  private final Clock clock;

  // All guarded by 'this'
  private final Map<RecordIdentity, Instant> pending = new TreeMap<>();
  private final Set<RecordIdentity> inFlight = new HashSet<>();
  private final Map<RecordIdentity, Duration> backoffs = new HashMap<>();

  public ReconcileQueue(Clock clock) {
    this.clock = clock;
  }

  /**
   * Schedules a reconciliation now.
   */
  public void enqueue(RecordIdentity identity) {
    enqueue(identity, Duration.ZERO);
  }

  /**
   * Schedules a reconciliation after {@code delay}. If the identity is already pending, the earlier
   * of the two due times wins.
   */
  public synchronized void enqueue(RecordIdentity identity, Duration delay) {
    Instant due = clock.instant().plus(delay);
    pending.merge(identity, due, (a, b) -> a.isBefore(b) ? a : b);
  }

  /**
   * Returns a due identity which isn't in flight, marking it in flight, or an empty Optional if
   * there is none.
   */
  public synchronized Optional<RecordIdentity> pollDue() {
    Instant now = clock.instant();
    Iterator<Map.Entry<RecordIdentity, Instant>> iter = pending.entrySet().iterator();
    while (iter.hasNext()) {
      Map.Entry<RecordIdentity, Instant> entry = iter.next();
      if (!entry.getValue().isAfter(now) && !inFlight.contains(entry.getKey())) {
        iter.remove();
        inFlight.add(entry.getKey());
        return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  /**
   * Releases an in-flight identity after a successful reconciliation, scheduling it again if the
   * result asks for it.
   */
  public synchronized void succeeded(RecordIdentity identity, ReconcileResult result) {
    inFlight.remove(identity);
    backoffs.remove(identity);
    if (result.getRequeueAfter().isPresent()) {
      enqueue(identity, result.getRequeueAfter().get());
    }
  }

  /**
   * Releases an in-flight identity after a failed reconciliation and schedules a retry.
   *
   * @return the delay until the retry
   */
  public synchronized Duration failed(RecordIdentity identity) {
    inFlight.remove(identity);
    Duration previous = backoffs.get(identity);
    Duration next;
    if (previous == null) {
      next = BASE_BACKOFF;
    } else {
      next = previous.multipliedBy(MULTIPLIER);
      if (next.compareTo(MAX_BACKOFF) > 0) {
        next = MAX_BACKOFF;
      }
    }
    backoffs.put(identity, next);
    enqueue(identity, next);
    return next;
  }

  public synchronized boolean isInFlight(RecordIdentity identity) {
    return inFlight.contains(identity);
  }

  @VisibleForTesting
  synchronized Optional<Instant> getDueTime(RecordIdentity identity) {
    return Optional.ofNullable(pending.get(identity));
  }

  public synchronized int size() {
    return pending.size();
  }
}
