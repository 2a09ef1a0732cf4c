package com.mesosphere.secretsmanager.reconciliation;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of a successful {@link Reconciler#reconcile} call.
 */
public final class ReconcileResult {

  private static final ReconcileResult DONE = new ReconcileResult(Optional.empty());

  private final Optional<Duration> requeueAfter;

  private ReconcileResult(Optional<Duration> requeueAfter) {
    this.requeueAfter = requeueAfter;
  }

  /**
   * Nothing more to do until something about the record changes.
   */
  public static ReconcileResult done() {
    return DONE;
  }

  public static ReconcileResult requeueAfter(Duration delay) {
    return new ReconcileResult(Optional.of(delay));
  }

  public Optional<Duration> getRequeueAfter() {
    return requeueAfter;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ReconcileResult && requeueAfter.equals(((ReconcileResult) o).requeueAfter);
  }

  @Override
  public int hashCode() {
    return requeueAfter.hashCode();
  }

  @Override
  public String toString() {
    return requeueAfter.map(d -> "requeue after " + d).orElse("done");
  }
}
