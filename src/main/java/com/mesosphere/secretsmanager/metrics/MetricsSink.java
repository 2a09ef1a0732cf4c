package com.mesosphere.secretsmanager.metrics;

import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.record.RecordIdentity;

/**
 * Receives the operational measurements emitted by backend clients and the reconciler. Passed into
 * constructors instead of living in a process-wide registry, so that each test can observe its own
 * instance.
 */
public interface MetricsSink {

  // Backend session

  void recordTokenTtl(long ttlSeconds);

  void recordMaxTokenTtl(long ttlSeconds);

  void incrementTokenRenewalErrors(String operation, ErrorType type);

  void incrementLoginErrors(String backend);

  void incrementSecretReadErrors(String backend, ErrorType type);

  // Reconciliation

  void incrementSyncErrors(RecordIdentity identity);

  void recordLastSyncStatus(RecordIdentity identity, boolean success);

  void recordLastUpdated(RecordIdentity identity, long epochSeconds);

  void incrementConsumerReadErrors(RecordIdentity identity);

  void incrementConsumerUpdateErrors(RecordIdentity identity);

  /**
   * Drops every per-record metric of a record which is gone for good.
   */
  void removeRecordMetrics(RecordIdentity identity);
}
