package com.mesosphere.secretsmanager;

import com.mesosphere.secretsmanager.backend.BackendClient;
import com.mesosphere.secretsmanager.config.EnvStore;
import com.mesosphere.secretsmanager.config.ManagerConfig;
import com.mesosphere.secretsmanager.metrics.MetricsSink;
import com.mesosphere.secretsmanager.store.MemSecretStore;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SecretsManagerServiceTest {

    private static final long TIMEOUT_MS = 10000;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Mock private BackendClient mockBackend;
    @Mock private MetricsSink mockMetrics;

    private File definitions;
    private MemSecretStore secretStore;
    private SecretsManagerService service;

    @Before
    public void beforeEach() throws Exception {
        MockitoAnnotations.initMocks(this);
        when(mockBackend.readSecret("kv/a", "v")).thenReturn("aGVsbG8=");
        definitions = folder.newFile("definitions.yml");
        FileUtils.writeStringToFile(definitions,
                "- name: s1\n"
                + "  namespaces: [ns, excluded]\n"
                + "  data:\n"
                + "    foo: {path: kv/a, key: v, encoding: base64}\n",
                StandardCharsets.UTF_8);
        secretStore = new MemSecretStore();
        ManagerConfig config = ManagerConfig.fromEnvStore(EnvStore.fromMap(ImmutableMap.of(
                "EXCLUDE_NAMESPACES", "excluded",
                "DISABLE_DEADLOCK_EXIT", "true")));
        service = new SecretsManagerService(
                config, mockBackend, secretStore, definitions, Duration.ofMillis(100), mockMetrics);
    }

    @After
    public void afterEach() {
        service.close();
    }

    @Test
    public void testSecretsFollowDefinitions() throws Exception {
        service.start();
        await(() -> secretStore.contains("ns", "s1"));
        Assert.assertFalse(secretStore.contains("excluded", "s1"));

        FileUtils.writeStringToFile(definitions, "[]\n", StandardCharsets.UTF_8);
        await(() -> !secretStore.contains("ns", "s1"));
    }

    @Test
    public void testCloseStopsBackend() {
        service.start();
        service.close();
        verify(mockBackend).close();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                Assert.fail("condition not met within " + TIMEOUT_MS + "ms");
            }
            Thread.sleep(50);
        }
    }
}
