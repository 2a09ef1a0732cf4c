package com.mesosphere.secretsmanager;

import com.mesosphere.secretsmanager.backend.BackendClient;
import com.mesosphere.secretsmanager.backend.BackendClientFactory;
import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.common.ProcessExit;
import com.mesosphere.secretsmanager.config.EnvStore;
import com.mesosphere.secretsmanager.config.ManagerConfig;
import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;
import com.mesosphere.secretsmanager.metrics.CodahaleMetricsSink;
import com.mesosphere.secretsmanager.store.DirectorySecretStore;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import org.slf4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * Main entry point: syncs the configured secret definitions from the backend into the output
 * directory until the process is stopped.
 */
public final class Main {

  private static final Logger LOGGER = LoggingUtils.getLogger(Main.class);

  private static final long METRICS_REPORT_PERIOD_S = 60;

  private Main() {
    // do not instantiate
  }

  public static void main(String[] args) {
    ManagerConfig config;
    try {
      config = ManagerConfig.fromEnv();
      LOGGER.info("Starting secrets manager: {}", config);
    } catch (EnvStore.ConfigException e) {
      LOGGER.error("Invalid configuration", e);
      ProcessExit.exit(ProcessExit.INITIALIZATION_FAILURE, e);
      return;
    }

    MetricRegistry registry = new MetricRegistry();
    Slf4jReporter reporter = Slf4jReporter.forRegistry(registry)
        .outputTo(LoggingUtils.getLogger(CodahaleMetricsSink.class))
        .build();
    CodahaleMetricsSink metrics = new CodahaleMetricsSink(registry);

    BackendClient backendClient;
    try {
      backendClient = BackendClientFactory.create(config, metrics);
    } catch (SecretsManagerException e) {
      LOGGER.error("Unable to create backend client", e);
      ProcessExit.exit(
          e.getType() == ErrorType.AUTHENTICATION_FAILED
              ? ProcessExit.BACKEND_LOGIN_FAILURE
              : ProcessExit.INITIALIZATION_FAILURE,
          e);
      return;
    } catch (EnvStore.ConfigException e) {
      LOGGER.error("Invalid backend configuration", e);
      ProcessExit.exit(ProcessExit.INITIALIZATION_FAILURE, e);
      return;
    }

    SecretsManagerService service;
    try {
      service = new SecretsManagerService(
          config,
          backendClient,
          new DirectorySecretStore(config.getSecretsOutputDir(), config.isDeadlockExitEnabled()),
          config.getSecretDefinitionsFile(),
          config.getSecretDefinitionsRefreshPeriod(),
          metrics);
    } catch (EnvStore.ConfigException e) {
      LOGGER.error("Invalid configuration", e);
      backendClient.close();
      ProcessExit.exit(ProcessExit.INITIALIZATION_FAILURE, e);
      return;
    }

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      LOGGER.info("Shutting down");
      service.close();
      reporter.stop();
    }, "shutdown"));

    reporter.start(METRICS_REPORT_PERIOD_S, TimeUnit.SECONDS);
    service.start();
  }
}
