package com.mesosphere.secretsmanager.metrics;

import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.record.RecordIdentity;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsSink} backed by a Dropwizard {@link MetricRegistry}. Labels are folded into dotted
 * metric names, e.g. {@code controller.sync_errors.my-namespace.my-secret}.
 */
public class CodahaleMetricsSink implements MetricsSink {

  static final String TOKEN_TTL = "vault.token_ttl";
  static final String MAX_TOKEN_TTL = "vault.max_token_ttl";
  static final String TOKEN_RENEWAL_ERRORS = "vault.token_renewal_errors";
  static final String LOGIN_ERRORS = "login_errors";
  static final String READ_SECRET_ERRORS = "read_secret_errors";

  static final String SYNC_ERRORS = "controller.sync_errors";
  static final String LAST_SYNC_STATUS = "controller.last_sync_status";
  static final String LAST_UPDATED = "controller.last_updated";
  static final String SECRET_READ_ERRORS = "controller.secret_read_errors";
  static final String SECRET_UPDATE_ERRORS = "controller.secret_update_errors";

  private static final ImmutableList<String> RECORD_METRICS = ImmutableList.of(
      SYNC_ERRORS, LAST_SYNC_STATUS, LAST_UPDATED, SECRET_READ_ERRORS, SECRET_UPDATE_ERRORS);

  private final MetricRegistry registry;

  // Gauges are registered once and then read from these holders.
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

  public CodahaleMetricsSink(MetricRegistry registry) {
    this.registry = registry;
  }

  public MetricRegistry getRegistry() {
    return registry;
  }

  @Override
  public void recordTokenTtl(long ttlSeconds) {
    setGauge(TOKEN_TTL, ttlSeconds);
  }

  @Override
  public void recordMaxTokenTtl(long ttlSeconds) {
    setGauge(MAX_TOKEN_TTL, ttlSeconds);
  }

  @Override
  public void incrementTokenRenewalErrors(String operation, ErrorType type) {
    registry.counter(MetricRegistry.name(TOKEN_RENEWAL_ERRORS, operation, label(type))).inc();
  }

  @Override
  public void incrementLoginErrors(String backend) {
    registry.counter(MetricRegistry.name(backend, LOGIN_ERRORS)).inc();
  }

  @Override
  public void incrementSecretReadErrors(String backend, ErrorType type) {
    registry.counter(MetricRegistry.name(backend, READ_SECRET_ERRORS, label(type))).inc();
  }

  @Override
  public void incrementSyncErrors(RecordIdentity identity) {
    registry.counter(name(SYNC_ERRORS, identity)).inc();
  }

  @Override
  public void recordLastSyncStatus(RecordIdentity identity, boolean success) {
    setGauge(name(LAST_SYNC_STATUS, identity), success ? 1 : 0);
  }

  @Override
  public void recordLastUpdated(RecordIdentity identity, long epochSeconds) {
    setGauge(name(LAST_UPDATED, identity), epochSeconds);
  }

  @Override
  public void incrementConsumerReadErrors(RecordIdentity identity) {
    registry.counter(name(SECRET_READ_ERRORS, identity)).inc();
  }

  @Override
  public void incrementConsumerUpdateErrors(RecordIdentity identity) {
    registry.counter(name(SECRET_UPDATE_ERRORS, identity)).inc();
  }

  @Override
  public void removeRecordMetrics(RecordIdentity identity) {
    for (String metric : RECORD_METRICS) {
      String name = name(metric, identity);
      registry.remove(name);
      gaugeValues.remove(name);
    }
  }

  @VisibleForTesting
  static String name(String metric, RecordIdentity identity) {
    return MetricRegistry.name(metric, identity.getNamespace(), identity.getName());
  }

  @VisibleForTesting
  static String label(ErrorType type) {
    return type.name().toLowerCase(Locale.ROOT);
  }

  private void setGauge(String name, long value) {
    gaugeValues.computeIfAbsent(name, key -> {
      AtomicLong holder = new AtomicLong();
      registry.register(key, (Gauge<Long>) holder::get);
      return holder;
    }).set(value);
  }
}
