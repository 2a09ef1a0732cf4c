package com.mesosphere.secretsmanager.reconciliation;

import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;
import com.mesosphere.secretsmanager.metrics.MetricsSink;
import com.mesosphere.secretsmanager.record.RecordIdentity;
import com.mesosphere.secretsmanager.record.RecordStore;
import com.mesosphere.secretsmanager.record.SecretRecord;
import com.mesosphere.secretsmanager.store.SecretData;
import com.mesosphere.secretsmanager.store.SecretStore;
import com.mesosphere.secretsmanager.store.StoreException;
import com.mesosphere.secretsmanager.store.TargetSecret;

import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Default {@link Reconciler}: projects a {@link SecretRecord} into its target secret, guarded by a
 * finalizer on the record.
 * <p>
 * The finalizer is always persisted before the first write to the consumer store, and only removed
 * once the target secret is confirmed deleted. A crash at any point therefore leaves either a
 * finalizer pointing to a secret that may exist, or no secret at all.
 */
public class SecretRecordReconciler implements Reconciler {

  public static final String FINALIZER = "secret.finalizer.secrets-manager.mesosphere.com";

  public static final String MANAGED_BY_LABEL = "managedBy";
  public static final String MANAGED_BY_VALUE = "secrets-manager";
  public static final String LAST_UPDATED_LABEL = "lastUpdatedAt";

  // Label values can't contain ':'
  static final DateTimeFormatter LAST_UPDATED_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH.mm.ss'Z'").withZone(ZoneOffset.UTC);

  private final RecordStore recordStore;
  private final StateResolver stateResolver;
  private final SecretStore secretStore;
  private final NamespaceFilter namespaceFilter;
  private final Duration reconcilePeriod;
  private final MetricsSink metrics;
  private final Clock clock;

  public SecretRecordReconciler(
      RecordStore recordStore,
      StateResolver stateResolver,
      SecretStore secretStore,
      NamespaceFilter namespaceFilter,
      Duration reconcilePeriod,
      MetricsSink metrics,
      Clock clock) {
    this.recordStore = recordStore;
    this.stateResolver = stateResolver;
    this.secretStore = secretStore;
    this.namespaceFilter = namespaceFilter;
    this.reconcilePeriod = reconcilePeriod;
    this.metrics = metrics;
    this.clock = clock;
  }

  @Override
  public ReconcileResult reconcile(RecordIdentity identity) throws ReconcileException {
    Logger logger = LoggingUtils.getLogger(getClass(), identity.toString());

    Optional<SecretRecord> maybeRecord;
    try {
      maybeRecord = recordStore.get(identity);
    } catch (StoreException e) {
      throw new ReconcileException(identity, new SecretsManagerException(
          ErrorType.CONSUMER_STORE_ERROR, "Unable to get record", e));
    }
    if (!maybeRecord.isPresent()) {
      logger.debug("Record no longer exists");
      return ReconcileResult.done();
    }
    SecretRecord record = maybeRecord.get();

    if (record.isDeletionRequested()) {
      return finalizeDeletion(record, logger);
    }

    if (!record.getFinalizers().has(FINALIZER)) {
      persistRecord(record.withFinalizers(record.getFinalizers().add(FINALIZER)), logger);
      logger.info("Added finalizer {}", FINALIZER);
      // Picked up again right away, now that the finalizer is stored.
      return ReconcileResult.requeueAfter(Duration.ZERO);
    }

    if (namespaceFilter.isExcluded(identity.getNamespace())) {
      logger.debug("Namespace {} is excluded, not writing target secret", identity.getNamespace());
      return ReconcileResult.done();
    }

    RecordIdentity target = record.getTargetIdentity();
    SecretData desired;
    try {
      desired = stateResolver.desiredState(record);
    } catch (SecretsManagerException e) {
      logger.error("Unable to get desired state for secret {}: {}", target, e.getMessage());
      throw syncFailed(identity, e);
    }

    SecretData current;
    try {
      current = stateResolver.currentState(target);
    } catch (SecretsManagerException e) {
      logger.error("Unable to get current state of secret {}: {}", target, e.getMessage());
      metrics.incrementConsumerReadErrors(identity);
      throw syncFailed(identity, e);
    }

    if (!desired.equals(current)) {
      logger.info("Secret {} must be updated", target);
      try {
        upsert(record, desired);
      } catch (SecretsManagerException e) {
        logger.error("Unable to upsert secret {}: {}", target, e.getMessage());
        metrics.incrementConsumerUpdateErrors(identity);
        throw syncFailed(identity, e);
      }
      metrics.recordLastUpdated(identity, clock.instant().getEpochSecond());
      logger.info("Secret {} updated with {} key(s)", target, desired.size());
    }
    metrics.recordLastSyncStatus(identity, true);
    return ReconcileResult.requeueAfter(reconcilePeriod);
  }

  private ReconcileResult finalizeDeletion(SecretRecord record, Logger logger) throws ReconcileException {
    if (!record.getFinalizers().has(FINALIZER)) {
      return ReconcileResult.done();
    }
    RecordIdentity target = record.getTargetIdentity();
    if (namespaceFilter.isExcluded(target.getNamespace())) {
      logger.info("Namespace {} is excluded, releasing record without deleting {}",
          target.getNamespace(), target);
    } else {
      try {
        secretStore.delete(target.getNamespace(), target.getName());
        logger.info("Secret {} deleted successfully", target);
      } catch (StoreException e) {
        if (e.getReason() != StoreException.Reason.NOT_FOUND) {
          logger.error("Unable to delete secret {}: {}", target, e.getMessage());
          throw new ReconcileException(record.getIdentity(), new SecretsManagerException(
              ErrorType.CONSUMER_STORE_ERROR, String.format("Unable to delete secret %s", target), e));
        }
        logger.info("Secret {} was already deleted", target);
      }
    }
    persistRecord(record.withFinalizers(record.getFinalizers().remove(FINALIZER)), logger);
    logger.info("Removed finalizer {}", FINALIZER);
    metrics.removeRecordMetrics(record.getIdentity());
    return ReconcileResult.done();
  }

  /**
   * Creates the target secret, or replaces it in full if it already exists.
   */
  private void upsert(SecretRecord record, SecretData data) throws SecretsManagerException {
    RecordIdentity target = record.getTargetIdentity();
    TargetSecret secret = TargetSecret.newBuilder(target.getNamespace(), target.getName())
        .type(record.getTargetType())
        .data(data)
        .labels(ImmutableMap.of(
            MANAGED_BY_LABEL, MANAGED_BY_VALUE,
            LAST_UPDATED_LABEL, LAST_UPDATED_FORMAT.format(clock.instant())))
        .build();
    try {
      try {
        secretStore.create(secret);
      } catch (StoreException e) {
        if (e.getReason() != StoreException.Reason.ALREADY_EXISTS) {
          throw e;
        }
        secretStore.update(secret);
      }
    } catch (StoreException e) {
      throw new SecretsManagerException(
          ErrorType.CONSUMER_STORE_ERROR, String.format("Unable to write secret %s", target), e);
    }
  }

  private void persistRecord(SecretRecord record, Logger logger) throws ReconcileException {
    try {
      recordStore.update(record);
    } catch (StoreException e) {
      logger.error("Unable to update record finalizers: {}", e.getMessage());
      ErrorType type = e.getReason() == StoreException.Reason.NOT_FOUND
          ? ErrorType.CONSUMER_STORE_NOT_FOUND
          : ErrorType.CONSUMER_STORE_ERROR;
      throw new ReconcileException(record.getIdentity(),
          new SecretsManagerException(type, "Unable to update record finalizers", e));
    }
  }

  private ReconcileException syncFailed(RecordIdentity identity, SecretsManagerException e) {
    metrics.incrementSyncErrors(identity);
    metrics.recordLastSyncStatus(identity, false);
    return new ReconcileException(identity, e);
  }
}
