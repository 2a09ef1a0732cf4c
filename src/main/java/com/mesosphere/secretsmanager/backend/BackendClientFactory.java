package com.mesosphere.secretsmanager.backend;

import com.mesosphere.secretsmanager.backend.azure.HttpKeyVaultApi;
import com.mesosphere.secretsmanager.backend.azure.KeyVaultBackendClient;
import com.mesosphere.secretsmanager.backend.azure.auth.CachedTokenProvider;
import com.mesosphere.secretsmanager.backend.azure.auth.ChainedTokenProvider;
import com.mesosphere.secretsmanager.backend.azure.auth.ClientSecretTokenClient;
import com.mesosphere.secretsmanager.backend.azure.auth.ManagedIdentityTokenClient;
import com.mesosphere.secretsmanager.backend.azure.auth.TokenProvider;
import com.mesosphere.secretsmanager.backend.vault.AppRoleCredential;
import com.mesosphere.secretsmanager.backend.vault.HttpVaultApi;
import com.mesosphere.secretsmanager.backend.vault.KubernetesCredential;
import com.mesosphere.secretsmanager.backend.vault.KvEngine;
import com.mesosphere.secretsmanager.backend.vault.VaultBackendClient;
import com.mesosphere.secretsmanager.backend.vault.VaultCredential;
import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.config.ManagerConfig;
import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;
import com.mesosphere.secretsmanager.http.BackendHttpClientBuilder;
import com.mesosphere.secretsmanager.http.BackendHttpExecutor;
import com.mesosphere.secretsmanager.metrics.MetricsSink;

import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link BackendClient} selected by the configuration. A Vault client comes back logged
 * in with its renewal task running.
 */
public final class BackendClientFactory {

  static final String AZURE_KEY_VAULT_RESOURCE = "https://vault.azure.net";

  private static final Logger LOGGER = LoggingUtils.getLogger(BackendClientFactory.class);

  /**
   * Azure tokens are refreshed this long before they expire.
   */
  private static final Duration AZURE_TOKEN_REFRESH_THRESHOLD = Duration.ofMinutes(5);

  private BackendClientFactory() {
    // do not instantiate
  }

  /**
   * @throws SecretsManagerException with type {@code UNSUPPORTED_BACKEND}, {@code UNSUPPORTED_ENGINE}
   *                                 or {@code AUTHENTICATION_FAILED} if no client could be built
   */
  public static BackendClient create(ManagerConfig config, MetricsSink metrics) throws SecretsManagerException {
    String backend = config.getBackend();
    BackendHttpExecutor httpExecutor =
        new BackendHttpExecutor(new BackendHttpClientBuilder().setTimeout(config.getBackendTimeout()));
    switch (backend) {
      case VaultBackendClient.NAME:
        return createVault(config, httpExecutor, metrics);
      case KeyVaultBackendClient.NAME:
        return createKeyVault(config, httpExecutor, metrics);
      default:
        throw SecretsManagerException.unsupportedBackend(backend);
    }
  }

  private static VaultBackendClient createVault(
      ManagerConfig config, BackendHttpExecutor httpExecutor, MetricsSink metrics) throws SecretsManagerException
  {
    KvEngine engine = KvEngine.fromName(config.getVaultEngine());
    LOGGER.info("Logging into Vault at {} (engine={}, auth={})",
        config.getVaultAddress(), engine.getName(), config.getVaultAuthMethod());
    return VaultBackendClient.newBuilder(
            new HttpVaultApi(config.getVaultAddress(), httpExecutor), createVaultCredential(config), metrics)
        .setEngine(engine)
        .setMaxTokenTtlSec(config.getVaultMaxTokenTtlSec())
        .setRenewTtlIncrementSec(config.getVaultRenewTtlIncrementSec())
        .setTokenPollingPeriod(config.getVaultTokenPollingPeriod())
        .setExitOnDeadlock(config.isDeadlockExitEnabled())
        .build()
        .start();
  }

  private static VaultCredential createVaultCredential(ManagerConfig config) throws SecretsManagerException {
    String method = config.getVaultAuthMethod();
    switch (method) {
      case "approle":
        return new AppRoleCredential(
            config.getVaultAppRolePath(), config.getVaultRoleId(), config.getVaultSecretId());
      case "kubernetes":
        return new KubernetesCredential(
            config.getVaultKubernetesPath(), config.getVaultKubernetesRole(), config.getVaultKubernetesTokenFile());
      default:
        throw new SecretsManagerException(
            ErrorType.AUTHENTICATION_FAILED, String.format("Vault auth method '%s' not supported", method));
    }
  }

  private static KeyVaultBackendClient createKeyVault(
      ManagerConfig config, BackendHttpExecutor httpExecutor, MetricsSink metrics) throws SecretsManagerException
  {
    String keyVaultName = config.getAzureKeyVaultName();
    List<TokenProvider> chain = new ArrayList<>();
    chain.add(new ManagedIdentityTokenClient(
        httpExecutor,
        AZURE_KEY_VAULT_RESOURCE,
        config.getAzureManagedClientId().orElse(null),
        config.getAzureManagedResourceId().orElse(null)));
    if (config.getAzureTenantId().isPresent()
        && config.getAzureClientId().isPresent()
        && config.getAzureClientSecret().isPresent()) {
      chain.add(new ClientSecretTokenClient(
          httpExecutor,
          config.getAzureTenantId().get(),
          config.getAzureClientId().get(),
          config.getAzureClientSecret().get(),
          AZURE_KEY_VAULT_RESOURCE + "/.default"));
    }
    TokenProvider tokenProvider = new CachedTokenProvider(
        new ChainedTokenProvider(chain), AZURE_TOKEN_REFRESH_THRESHOLD, config.isDeadlockExitEnabled());
    return KeyVaultBackendClient.create(
        keyVaultName, new HttpKeyVaultApi(keyVaultName, httpExecutor), tokenProvider, metrics);
  }
}
