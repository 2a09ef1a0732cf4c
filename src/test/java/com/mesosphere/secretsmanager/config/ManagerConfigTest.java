package com.mesosphere.secretsmanager.config;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;

public class ManagerConfigTest {

    @Test
    public void testDefaults() {
        ManagerConfig config = config(Collections.emptyMap());
        Assert.assertEquals("vault", config.getBackend());
        Assert.assertEquals(Duration.ofSeconds(5), config.getBackendTimeout());
        Assert.assertEquals(Duration.ofSeconds(5), config.getReconcilePeriod());
        Assert.assertTrue(config.getWatchNamespaces().isEmpty());
        Assert.assertTrue(config.getExcludeNamespaces().isEmpty());
        Assert.assertEquals("https://127.0.0.1:8200", config.getVaultAddress());
        Assert.assertEquals("approle", config.getVaultAuthMethod());
        Assert.assertEquals("approle", config.getVaultAppRolePath());
        Assert.assertEquals("kubernetes", config.getVaultKubernetesPath());
        Assert.assertEquals(
                new File(ManagerConfig.DEFAULT_KUBERNETES_TOKEN_PATH), config.getVaultKubernetesTokenFile());
        Assert.assertEquals(300, config.getVaultMaxTokenTtlSec());
        Assert.assertEquals(Duration.ofSeconds(15), config.getVaultTokenPollingPeriod());
        Assert.assertEquals(600, config.getVaultRenewTtlIncrementSec());
        Assert.assertEquals("kv2", config.getVaultEngine());
        Assert.assertFalse(config.getAzureTenantId().isPresent());
        Assert.assertEquals(Duration.ofSeconds(60), config.getSecretDefinitionsRefreshPeriod());
        Assert.assertTrue(config.isDeadlockExitEnabled());
    }

    @Test
    public void testOverrides() {
        ManagerConfig config = config(ImmutableMap.<String, String>builder()
                .put("BACKEND", "azure-kv")
                .put("RECONCILE_PERIOD_S", "30")
                .put("WATCH_NAMESPACES", "payments, billing")
                .put("EXCLUDE_NAMESPACES", "kube-system")
                .put("AZURE_KV_NAME", "my-vault")
                .put("AZURE_TENANT_ID", "tenant")
                .put("SECRET_DEFINITIONS_PATH", "/etc/secrets-manager/definitions.yml")
                .put("DISABLE_DEADLOCK_EXIT", "")
                .build());
        Assert.assertEquals("azure-kv", config.getBackend());
        Assert.assertEquals(Duration.ofSeconds(30), config.getReconcilePeriod());
        Assert.assertEquals(ImmutableSet.of("payments", "billing"), config.getWatchNamespaces());
        Assert.assertEquals(ImmutableSet.of("kube-system"), config.getExcludeNamespaces());
        Assert.assertEquals("my-vault", config.getAzureKeyVaultName());
        Assert.assertEquals("tenant", config.getAzureTenantId().get());
        Assert.assertEquals(new File("/etc/secrets-manager/definitions.yml"), config.getSecretDefinitionsFile());
        Assert.assertFalse(config.isDeadlockExitEnabled());
    }

    @Test
    public void testMissingRequiredSetting() {
        try {
            config(Collections.emptyMap()).getVaultRoleId();
            Assert.fail("expected failure");
        } catch (EnvStore.ConfigException e) {
            Assert.assertEquals(EnvStore.ConfigException.Type.NOT_FOUND, e.getType());
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("VAULT_ROLE_ID"));
        }
    }

    @Test(expected = EnvStore.ConfigException.class)
    public void testInvalidPeriod() {
        config(ImmutableMap.of("RECONCILE_PERIOD_S", "soon")).getReconcilePeriod();
    }

    private static ManagerConfig config(Map<String, String> env) {
        return ManagerConfig.fromEnvStore(EnvStore.fromMap(env));
    }
}
