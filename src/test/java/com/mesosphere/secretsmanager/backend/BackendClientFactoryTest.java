package com.mesosphere.secretsmanager.backend;

import com.mesosphere.secretsmanager.config.EnvStore;
import com.mesosphere.secretsmanager.config.ManagerConfig;
import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;
import com.mesosphere.secretsmanager.metrics.MetricsSink;

import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Map;

/**
 * Only covers configurations which fail before any backend is contacted.
 */
public class BackendClientFactoryTest {

    private final MetricsSink metrics = Mockito.mock(MetricsSink.class);

    @Test
    public void testUnsupportedBackend() {
        assertCreateFails(ImmutableMap.of("BACKEND", "aws-sm"), ErrorType.UNSUPPORTED_BACKEND);
    }

    @Test
    public void testUnsupportedEngine() {
        assertCreateFails(ImmutableMap.of(
                "BACKEND", "vault",
                "VAULT_ENGINE", "kv3",
                "VAULT_ROLE_ID", "role",
                "VAULT_SECRET_ID", "secret"), ErrorType.UNSUPPORTED_ENGINE);
    }

    @Test
    public void testUnsupportedAuthMethod() {
        assertCreateFails(ImmutableMap.of(
                "BACKEND", "vault",
                "VAULT_AUTH_METHOD", "ldap"), ErrorType.AUTHENTICATION_FAILED);
    }

    @Test(expected = EnvStore.ConfigException.class)
    public void testMissingKeyVaultName() throws Exception {
        BackendClientFactory.create(config(ImmutableMap.of("BACKEND", "azure-kv")), metrics);
    }

    private void assertCreateFails(Map<String, String> env, ErrorType type) {
        try {
            BackendClientFactory.create(config(env), metrics);
            Assert.fail("expected failure");
        } catch (SecretsManagerException e) {
            Assert.assertEquals(type, e.getType());
        }
    }

    private static ManagerConfig config(Map<String, String> env) {
        return ManagerConfig.fromEnvStore(EnvStore.fromMap(env));
    }
}
