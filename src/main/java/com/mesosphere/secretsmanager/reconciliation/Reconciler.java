package com.mesosphere.secretsmanager.reconciliation;

import com.mesosphere.secretsmanager.record.RecordIdentity;

/**
 * Interface for a record Reconciler, which converges the target secret of a record with what the
 * backend holds (with the backend treated as source of truth).
 */
public interface Reconciler {

  /**
   * Runs one convergence step for the record with the provided identity.
   * <p>
   * NOTE: CALLS FOR DIFFERENT IDENTITIES MAY RUN CONCURRENTLY, BUT CALLERS MUST NOT RUN TWO CALLS
   * FOR THE SAME IDENTITY AT ONCE
   *
   * @return when the record should be reconciled again
   * @throws ReconcileException if the step failed; nothing was written past the failing operation
   */
  ReconcileResult reconcile(RecordIdentity identity) throws ReconcileException;
}
