package com.mesosphere.secretsmanager.backend.vault;

import com.mesosphere.secretsmanager.backend.BackendClient;
import com.mesosphere.secretsmanager.common.CycleDetectingLockUtils;
import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.common.PeriodicTask;
import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;
import com.mesosphere.secretsmanager.metrics.MetricsSink;

import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.lang3.StringUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.slf4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * {@link BackendClient} for Vault's KV engines, holding a token session which a background task
 * keeps alive.
 * <p>
 * The token is only replaced by the renewal task (or the initial login). Reads take a snapshot of
 * the current token and never trigger a renewal; no lock is held while talking to Vault.
 */
public class VaultBackendClient implements BackendClient {

  public static final String NAME = "vault";

  /**
   * Field read when a data source doesn't name a key.
   */
  static final String DEFAULT_KEY = "data";

  static final String LOOKUP_SELF_OPERATION = "lookup-self";
  static final String RENEW_SELF_OPERATION = "renew-self";
  static final String IS_RENEWABLE_OPERATION = "is-renewable";

  private static final Logger LOGGER = LoggingUtils.getLogger(VaultBackendClient.class);

  private final VaultApi api;
  private final VaultCredential credential;
  private final KvEngine engine;
  private final long maxTokenTtlSec;
  private final long renewTtlIncrementSec;
  private final Duration tokenPollingPeriod;
  private final MetricsSink metrics;

  private final Lock rlock;
  private final Lock rwlock;

  // Guarded by the lock above
  private String token;
  private SessionState state = SessionState.LOGGED_OUT;
  private Optional<SecretsManagerException> lastRenewalError = Optional.empty();

  private PeriodicTask renewalTask;

  private VaultBackendClient(Builder builder) {
    this.api = builder.api;
    this.credential = builder.credential;
    this.engine = builder.engine;
    this.maxTokenTtlSec = builder.maxTokenTtlSec;
    this.renewTtlIncrementSec = builder.renewTtlIncrementSec;
    this.tokenPollingPeriod = builder.tokenPollingPeriod;
    this.metrics = builder.metrics;
    ReadWriteLock lock = CycleDetectingLockUtils.newLock(builder.exitOnDeadlock, VaultBackendClient.class);
    this.rlock = lock.readLock();
    this.rwlock = lock.writeLock();
  }

  public static Builder newBuilder(VaultApi api, VaultCredential credential, MetricsSink metrics) {
    return new Builder(api, credential, metrics);
  }

  /**
   * Starts the background token renewal task. Has no effect if already started.
   *
   * @return this
   */
  public synchronized VaultBackendClient start() {
    if (renewalTask == null) {
      renewalTask = new PeriodicTask(
          "vault-token-renewal", this::renewalTick, tokenPollingPeriod, tokenPollingPeriod).start();
    }
    return this;
  }

  @Override
  public synchronized void close() {
    if (renewalTask != null) {
      renewalTask.close();
      LOGGER.info("Stopped Vault token renewal");
    }
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public String readSecret(String path, String key) throws SecretsManagerException {
    String field = StringUtils.isEmpty(key) ? DEFAULT_KEY : key;

    Optional<JSONObject> response;
    try {
      response = api.read(getToken(), path);
    } catch (IOException e) {
      metrics.incrementSecretReadErrors(NAME, ErrorType.UNKNOWN_BACKEND_ERROR);
      throw new SecretsManagerException(
          ErrorType.UNKNOWN_BACKEND_ERROR, String.format("Failed to read '%s' from Vault", path), e);
    }

    Optional<JSONObject> fields = response.flatMap(engine::unwrap);
    if (!fields.isPresent()) {
      response.ifPresent(VaultBackendClient::logWarnings);
      metrics.incrementSecretReadErrors(NAME, ErrorType.BACKEND_SECRET_NOT_FOUND);
      throw SecretsManagerException.backendSecretNotFound(path, field);
    }

    Object value = fields.get().opt(field);
    if (value == null || JSONObject.NULL.equals(value)) {
      metrics.incrementSecretReadErrors(NAME, ErrorType.BACKEND_SECRET_NOT_FOUND);
      throw SecretsManagerException.backendSecretNotFound(path, field);
    }
    if (!(value instanceof String)) {
      metrics.incrementSecretReadErrors(NAME, ErrorType.UNKNOWN_BACKEND_ERROR);
      throw new SecretsManagerException(ErrorType.UNKNOWN_BACKEND_ERROR, String.format(
          "Value of key '%s' at '%s' is a %s, expected a string", field, path, value.getClass().getSimpleName()));
    }
    return (String) value;
  }

  /**
   * One iteration of the renewal loop. Never throws: failures are logged, counted, and left for the
   * next tick to recover from.
   */
  @VisibleForTesting
  void renewalTick() {
    if (getSessionState() == SessionState.LOGGED_OUT) {
      LOGGER.info("No valid Vault token, trying to log in again");
      relogin();
      return;
    }

    setState(SessionState.CHECKING_TTL);
    Optional<TokenInfo> lookup;
    try {
      TokenInfo info = api.lookupSelf(getToken());
      metrics.recordTokenTtl(info.getTtlSeconds());
      lookup = Optional.of(info);
    } catch (IOException e) {
      LOGGER.error("Unable to look up Vault token", e);
      metrics.incrementTokenRenewalErrors(LOOKUP_SELF_OPERATION, ErrorType.UNKNOWN_BACKEND_ERROR);
      lookup = Optional.empty();
    }

    switch (RenewalPolicy.decide(lookup, maxTokenTtlSec)) {
      case NONE:
        setState(SessionState.ACTIVE);
        break;
      case RELOGIN:
        LOGGER.info("Trying to log in to Vault again");
        setState(SessionState.LOGGED_OUT);
        relogin();
        break;
      case REPORT_NOT_RENEWABLE:
        LOGGER.error("Vault token is close to expiry ({}) but is not renewable", lookup.get());
        metrics.incrementTokenRenewalErrors(IS_RENEWABLE_OPERATION, ErrorType.TOKEN_NOT_RENEWABLE);
        setRenewalResult(
            SessionState.ACTIVE,
            Optional.of(new SecretsManagerException(ErrorType.TOKEN_NOT_RENEWABLE, "Vault token is not renewable")));
        break;
      case RENEW:
        LOGGER.info("Vault token is close to expiry ({}), renewing", lookup.get());
        renew();
        break;
      default:
        throw new IllegalStateException("Unsupported renewal action");
    }
  }

  private void renew() {
    setState(SessionState.RENEWING);
    try {
      api.renewSelf(getToken(), renewTtlIncrementSec);
      LOGGER.info("Vault token renewed successfully");
      setRenewalResult(SessionState.ACTIVE, Optional.empty());
    } catch (IOException e) {
      LOGGER.error("Failed to renew Vault token", e);
      metrics.incrementTokenRenewalErrors(RENEW_SELF_OPERATION, ErrorType.UNKNOWN_BACKEND_ERROR);
      setRenewalResult(
          SessionState.LOGGED_OUT,
          Optional.of(new SecretsManagerException(ErrorType.UNKNOWN_BACKEND_ERROR, "Failed to renew Vault token", e)));
    }
  }

  private void relogin() {
    try {
      login();
      LOGGER.info("Login successful, got a new Vault token");
    } catch (SecretsManagerException e) {
      metrics.incrementLoginErrors(NAME);
      LOGGER.error("Login error, Vault token not obtained", e);
    }
  }

  /**
   * Performs a full login and stores the new token. On failure the session ends up
   * {@link SessionState#LOGGED_OUT} while the previous token, if any, stays in use for reads.
   */
  private void login() throws SecretsManagerException {
    setState(SessionState.LOGGING_IN);
    String newToken;
    try {
      newToken = api.login(credential);
    } catch (IOException e) {
      setState(SessionState.LOGGED_OUT);
      throw new SecretsManagerException(
          ErrorType.AUTHENTICATION_FAILED, String.format("Unable to log in to Vault with %s", credential), e);
    }
    rwlock.lock();
    try {
      token = newToken;
      state = SessionState.ACTIVE;
      lastRenewalError = Optional.empty();
    } finally {
      rwlock.unlock();
    }
  }

  private void probeHealth() throws SecretsManagerException {
    VaultHealth health;
    try {
      health = api.health();
    } catch (IOException e) {
      throw new SecretsManagerException(
          ErrorType.UNKNOWN_BACKEND_ERROR, "Could not get health information about the Vault cluster", e);
    }
    LOGGER.info("Successfully logged into Vault cluster: {} engine={}", health, engine.getName());
  }

  private String getToken() {
    rlock.lock();
    try {
      return token;
    } finally {
      rlock.unlock();
    }
  }

  public SessionState getSessionState() {
    rlock.lock();
    try {
      return state;
    } finally {
      rlock.unlock();
    }
  }

  /**
   * Returns the error raised by the most recent renewal attempt, or an empty Optional if the last
   * attempt (or login) succeeded.
   */
  public Optional<SecretsManagerException> getLastRenewalError() {
    rlock.lock();
    try {
      return lastRenewalError;
    } finally {
      rlock.unlock();
    }
  }

  private void setState(SessionState newState) {
    rwlock.lock();
    try {
      state = newState;
    } finally {
      rwlock.unlock();
    }
  }

  private void setRenewalResult(SessionState newState, Optional<SecretsManagerException> error) {
    rwlock.lock();
    try {
      state = newState;
      lastRenewalError = error;
    } finally {
      rwlock.unlock();
    }
  }

  private static void logWarnings(JSONObject response) {
    JSONArray warnings = response.optJSONArray("warnings");
    if (warnings == null) {
      return;
    }
    for (int i = 0; i < warnings.length(); ++i) {
      LOGGER.info("Secret contains warnings: {}", warnings.optString(i));
    }
  }

  /**
   * A {@link VaultBackendClient} builder. {@link #build()} performs the initial login.
   */
  public static final class Builder {
    private final VaultApi api;
    private final VaultCredential credential;
    private final MetricsSink metrics;
    private KvEngine engine = KvEngine.DEFAULT;
    private long maxTokenTtlSec = 300;
    private long renewTtlIncrementSec = 600;
    private Duration tokenPollingPeriod = Duration.ofSeconds(15);
    private boolean exitOnDeadlock = true;

    private Builder(VaultApi api, VaultCredential credential, MetricsSink metrics) {
      this.api = api;
      this.credential = credential;
      this.metrics = metrics;
    }

    public Builder setEngine(KvEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder setMaxTokenTtlSec(long maxTokenTtlSec) {
      this.maxTokenTtlSec = maxTokenTtlSec;
      return this;
    }

    public Builder setRenewTtlIncrementSec(long renewTtlIncrementSec) {
      this.renewTtlIncrementSec = renewTtlIncrementSec;
      return this;
    }

    public Builder setTokenPollingPeriod(Duration tokenPollingPeriod) {
      this.tokenPollingPeriod = tokenPollingPeriod;
      return this;
    }

    public Builder setExitOnDeadlock(boolean exitOnDeadlock) {
      this.exitOnDeadlock = exitOnDeadlock;
      return this;
    }

    /**
     * Logs in and probes cluster health. The renewal task is not started until
     * {@link VaultBackendClient#start()} is called.
     *
     * @throws SecretsManagerException with type {@code AUTHENTICATION_FAILED} if the login fails, or
     *                                 {@code UNKNOWN_BACKEND_ERROR} if the health probe fails
     */
    public VaultBackendClient build() throws SecretsManagerException {
      VaultBackendClient client = new VaultBackendClient(this);
      try {
        client.login();
      } catch (SecretsManagerException e) {
        metrics.incrementLoginErrors(NAME);
        throw e;
      }
      client.probeHealth();
      metrics.recordMaxTokenTtl(maxTokenTtlSec);
      return client;
    }
  }
}
