package com.mesosphere.secretsmanager.common;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs a command on a fixed delay on its own daemon thread until {@link #close()} is called.
 * <p>
 * Exceptions thrown by the command are logged and the schedule continues: the task only ends on
 * explicit cancellation. Closing waits a bounded amount of time for a running iteration to finish
 * rather than interrupting it.
 */
public class PeriodicTask implements Closeable {

  private static final Logger LOGGER = LoggingUtils.getLogger(PeriodicTask.class);

  private static final long SHUTDOWN_TIMEOUT_S = 5;

  private final String name;
  private final Runnable command;
  private final Duration initialDelay;
  private final Duration period;
  private final ScheduledExecutorService executor;

  private boolean started = false;

  public PeriodicTask(String name, Runnable command, Duration initialDelay, Duration period) {
    this.name = name;
    this.command = command;
    this.initialDelay = initialDelay;
    this.period = period;
    this.executor = Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat(name + "-%d").setDaemon(true).build());
  }

  /**
   * Starts the timer. May only be called once.
   *
   * @return this
   */
  public synchronized PeriodicTask start() {
    if (started) {
      throw new IllegalStateException(String.format("Task %s was already started", name));
    }
    started = true;
    executor.scheduleWithFixedDelay(
        this::runOnce,
        initialDelay.toMillis(),
        period.toMillis(),
        TimeUnit.MILLISECONDS);
    LOGGER.info("Started periodic task {} with period {}", name, period);
    return this;
  }

  @VisibleForTesting
  void runOnce() {
    try {
      command.run();
    } catch (RuntimeException e) { // SUPPRESS CHECKSTYLE IllegalCatch
      // A thrown exception cancels all future executions.
      LOGGER.error(String.format("Periodic task %s failed, retrying on next tick", name), e);
    }
  }

  public boolean isRunning() {
    return started && !executor.isShutdown();
  }

  /**
   * Cancels future executions and waits for a running iteration to complete.
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_S, TimeUnit.SECONDS)) {
        LOGGER.warn("Periodic task {} did not finish within {}s", name, SHUTDOWN_TIMEOUT_S);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOGGER.info("Stopped periodic task {}", name);
  }
}
