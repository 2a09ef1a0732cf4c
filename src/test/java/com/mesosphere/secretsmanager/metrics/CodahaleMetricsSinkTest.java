package com.mesosphere.secretsmanager.metrics;

import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.record.RecordIdentity;

import com.codahale.metrics.MetricRegistry;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class CodahaleMetricsSinkTest {

    private static final RecordIdentity ID = RecordIdentity.of("payments", "db");

    private MetricRegistry registry;
    private CodahaleMetricsSink sink;

    @Before
    public void beforeEach() {
        registry = new MetricRegistry();
        sink = new CodahaleMetricsSink(registry);
    }

    @Test
    public void testCounters() {
        sink.incrementSyncErrors(ID);
        sink.incrementSyncErrors(ID);
        sink.incrementConsumerReadErrors(ID);
        sink.incrementConsumerUpdateErrors(ID);
        sink.incrementLoginErrors("vault");
        sink.incrementSecretReadErrors("azure-kv", ErrorType.BACKEND_SECRET_FORBIDDEN);
        sink.incrementTokenRenewalErrors("renew-self", ErrorType.UNKNOWN_BACKEND_ERROR);

        Assert.assertEquals(2, registry.counter("controller.sync_errors.payments.db").getCount());
        Assert.assertEquals(1, registry.counter("controller.secret_read_errors.payments.db").getCount());
        Assert.assertEquals(1, registry.counter("controller.secret_update_errors.payments.db").getCount());
        Assert.assertEquals(1, registry.counter("vault.login_errors").getCount());
        Assert.assertEquals(1, registry.counter("azure-kv.read_secret_errors.backend_secret_forbidden").getCount());
        Assert.assertEquals(1,
                registry.counter("vault.token_renewal_errors.renew-self.unknown_backend_error").getCount());
    }

    @Test
    public void testGaugesTrackLatestValue() {
        sink.recordLastSyncStatus(ID, false);
        Assert.assertEquals(0L, gauge("controller.last_sync_status.payments.db"));
        sink.recordLastSyncStatus(ID, true);
        Assert.assertEquals(1L, gauge("controller.last_sync_status.payments.db"));

        sink.recordTokenTtl(120);
        sink.recordTokenTtl(90);
        sink.recordMaxTokenTtl(300);
        sink.recordLastUpdated(ID, 1700000000L);
        Assert.assertEquals(90L, gauge("vault.token_ttl"));
        Assert.assertEquals(300L, gauge("vault.max_token_ttl"));
        Assert.assertEquals(1700000000L, gauge("controller.last_updated.payments.db"));
    }

    @Test
    public void testRemoveRecordMetrics() {
        RecordIdentity other = RecordIdentity.of("payments", "other");
        sink.incrementSyncErrors(ID);
        sink.incrementConsumerReadErrors(ID);
        sink.incrementConsumerUpdateErrors(ID);
        sink.recordLastSyncStatus(ID, true);
        sink.recordLastUpdated(ID, 1700000000L);
        sink.recordLastSyncStatus(other, true);
        sink.recordTokenTtl(60);

        sink.removeRecordMetrics(ID);

        Assert.assertTrue(registry.getCounters().isEmpty());
        Assert.assertEquals(2, registry.getGauges().size());
        Assert.assertEquals(1L, gauge("controller.last_sync_status.payments.other"));
        Assert.assertEquals(60L, gauge("vault.token_ttl"));

        // Recording again after removal registers a fresh gauge.
        sink.recordLastSyncStatus(ID, false);
        Assert.assertEquals(0L, gauge("controller.last_sync_status.payments.db"));
    }

    private long gauge(String name) {
        return (Long) registry.getGauges().get(name).getValue();
    }
}
