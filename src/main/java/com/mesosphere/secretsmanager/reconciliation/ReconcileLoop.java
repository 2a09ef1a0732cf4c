package com.mesosphere.secretsmanager.reconciliation;

import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.common.PeriodicTask;
import com.mesosphere.secretsmanager.record.RecordIdentity;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;

import java.io.Closeable;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Drives a {@link Reconciler} from a {@link ReconcileQueue}: a dispatcher hands due identities to a
 * bounded worker pool, and each result is fed back into the queue. Identities outside the watched
 * namespaces are never scheduled.
 * <p>
 * Closing stops dispatching and waits for in-flight reconciliations to finish. They are never
 * interrupted.
 */
public class ReconcileLoop implements Closeable {

  private static final Logger LOGGER = LoggingUtils.getLogger(ReconcileLoop.class);

  private static final Duration DISPATCH_INTERVAL = Duration.ofMillis(200);
  private static final long DRAIN_TIMEOUT_S = 30;

  private final Reconciler reconciler;
  private final ReconcileQueue queue;
  private final NamespaceFilter namespaceFilter;
  private final ExecutorService workers;
  private final PeriodicTask dispatcher;

  public ReconcileLoop(Reconciler reconciler, ReconcileQueue queue, NamespaceFilter namespaceFilter, int workerCount) {
    this(reconciler, queue, namespaceFilter, Executors.newFixedThreadPool(
        workerCount, new ThreadFactoryBuilder().setNameFormat("reconcile-worker-%d").setDaemon(true).build()));
  }

  @VisibleForTesting
  ReconcileLoop(Reconciler reconciler, ReconcileQueue queue, NamespaceFilter namespaceFilter, ExecutorService workers) {
    this.reconciler = reconciler;
    this.queue = queue;
    this.namespaceFilter = namespaceFilter;
    this.workers = workers;
    this.dispatcher = new PeriodicTask("reconcile-dispatcher", this::dispatch, Duration.ZERO, DISPATCH_INTERVAL);
  }

  public ReconcileLoop start() {
    dispatcher.start();
    return this;
  }

  /**
   * Schedules an immediate reconciliation of the identity, if its namespace is watched.
   */
  public void enqueue(RecordIdentity identity) {
    if (namespaceFilter.isWatched(identity.getNamespace())) {
      queue.enqueue(identity);
    } else {
      LOGGER.debug("Ignoring {}: namespace is not watched", identity);
    }
  }

  public void enqueueAll(Collection<RecordIdentity> identities) {
    identities.forEach(this::enqueue);
  }

  /**
   * Hands every due identity to the worker pool.
   */
  @VisibleForTesting
  void dispatch() {
    Optional<RecordIdentity> next;
    while ((next = queue.pollDue()).isPresent()) {
      RecordIdentity identity = next.get();
      try {
        workers.execute(() -> runOne(identity));
      } catch (RejectedExecutionException e) {
        // Shutting down: leave it for whoever runs next.
        queue.failed(identity);
        return;
      }
    }
  }

  @VisibleForTesting
  void runOne(RecordIdentity identity) {
    try {
      ReconcileResult result = reconciler.reconcile(identity);
      LOGGER.debug("Reconciled {}: {}", identity, result);
      queue.succeeded(identity, result);
    } catch (ReconcileException e) {
      Duration retry = queue.failed(identity);
      LOGGER.warn("{} (source: {}), retrying in {}", e.getMessage(), e.getSource(), retry);
    } catch (RuntimeException e) { // SUPPRESS CHECKSTYLE IllegalCatch
      Duration retry = queue.failed(identity);
      LOGGER.error(String.format("Unexpected error reconciling %s, retrying in %s", identity, retry), e);
    }
  }

  @Override
  public void close() {
    dispatcher.close();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(DRAIN_TIMEOUT_S, TimeUnit.SECONDS)) {
        LOGGER.warn("Reconciliations still running after {}s", DRAIN_TIMEOUT_S);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOGGER.info("Reconcile loop stopped");
  }
}
