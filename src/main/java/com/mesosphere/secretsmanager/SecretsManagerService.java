package com.mesosphere.secretsmanager;

import com.mesosphere.secretsmanager.backend.BackendClient;
import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.common.PeriodicTask;
import com.mesosphere.secretsmanager.config.ManagerConfig;
import com.mesosphere.secretsmanager.config.SecretDefinitionsSync;
import com.mesosphere.secretsmanager.metrics.MetricsSink;
import com.mesosphere.secretsmanager.reconciliation.NamespaceFilter;
import com.mesosphere.secretsmanager.reconciliation.ReconcileLoop;
import com.mesosphere.secretsmanager.reconciliation.ReconcileQueue;
import com.mesosphere.secretsmanager.reconciliation.SecretRecordReconciler;
import com.mesosphere.secretsmanager.reconciliation.StateResolver;
import com.mesosphere.secretsmanager.record.MemRecordStore;
import com.mesosphere.secretsmanager.store.SecretStore;

import org.slf4j.Logger;

import java.io.Closeable;
import java.io.File;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the record source, reconciler and reconcile loop around an already connected backend
 * client, and owns their lifecycle.
 */
public class SecretsManagerService implements Closeable {

  private static final Logger LOGGER = LoggingUtils.getLogger(SecretsManagerService.class);

  private static final int WORKER_COUNT = 4;

  private final BackendClient backendClient;
  private final MemRecordStore recordStore;
  private final SecretDefinitionsSync definitionsSync;
  private final PeriodicTask definitionsTask;
  private final ReconcileLoop reconcileLoop;

  public SecretsManagerService(
      ManagerConfig config,
      BackendClient backendClient,
      SecretStore secretStore,
      File definitionsFile,
      Duration definitionsRefreshPeriod,
      MetricsSink metrics) {
    this.backendClient = backendClient;
    this.recordStore = new MemRecordStore(config.isDeadlockExitEnabled());
    NamespaceFilter namespaceFilter =
        NamespaceFilter.of(config.getWatchNamespaces(), config.getExcludeNamespaces());
    LOGGER.info("Managing namespaces: {}", namespaceFilter);

    SecretRecordReconciler reconciler = new SecretRecordReconciler(
        recordStore,
        new StateResolver(backendClient, secretStore),
        secretStore,
        namespaceFilter,
        config.getReconcilePeriod(),
        metrics,
        Clock.systemUTC());
    this.reconcileLoop = new ReconcileLoop(
        reconciler, new ReconcileQueue(Clock.systemUTC()), namespaceFilter, WORKER_COUNT);
    recordStore.addListener(reconcileLoop::enqueue);

    this.definitionsSync = new SecretDefinitionsSync(definitionsFile, recordStore);
    this.definitionsTask = new PeriodicTask(
        "secret-definitions", definitionsSync, definitionsRefreshPeriod, definitionsRefreshPeriod);
  }

  /**
   * Loads the definitions once, then starts the periodic reload and the reconcile loop.
   */
  public void start() {
    definitionsSync.run();
    reconcileLoop.enqueueAll(recordStore.list());
    reconcileLoop.start();
    definitionsTask.start();
    LOGGER.info("Secrets manager started with {} record(s)", recordStore.list().size());
  }

  /**
   * Stops reloading definitions and token renewal, then waits for in-flight reconciliations.
   */
  @Override
  public void close() {
    definitionsTask.close();
    backendClient.close();
    reconcileLoop.close();
  }
}
