package com.mesosphere.secretsmanager.backend.azure.auth;

import com.mesosphere.secretsmanager.common.CycleDetectingLockUtils;

import com.auth0.jwt.interfaces.DecodedJWT;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/**
 * CachedTokenProvider retrieves a token from the underlying provider and caches it. The underlying
 * provider is only called again once the cached token is within {@code refreshThreshold} of its
 * expiry.
 */
public class CachedTokenProvider implements TokenProvider {

  private final TokenProvider provider;

  private final Duration refreshThreshold;

  private final Lock rlock;

  private final Lock rwlock;

  private Optional<DecodedJWT> token;

  public CachedTokenProvider(TokenProvider provider, Duration refreshThreshold, boolean exitOnDeadlock) {
    this.provider = provider;
    this.refreshThreshold = refreshThreshold;

    ReadWriteLock lock = CycleDetectingLockUtils.newLock(exitOnDeadlock, CachedTokenProvider.class);
    this.rlock = lock.readLock();
    this.rwlock = lock.writeLock();

    this.token = Optional.empty();
  }

  @Override
  public DecodedJWT getToken() throws IOException {
    rlock.lock();
    try {
      if (token.isPresent() && isFresh(token.get())) {
        return token.get();
      }
    } finally {
      rlock.unlock();
    }

    return refreshToken();
  }

  private boolean isFresh(DecodedJWT jwt) {
    if (jwt.getExpiresAt() == null) {
      // No expiry claim: keep using it until the backend rejects it.
      return true;
    }
    return jwt.getExpiresAt().toInstant().minus(refreshThreshold).isAfter(Instant.now());
  }

  private DecodedJWT refreshToken() throws IOException {
    rwlock.lock();
    try {
      // Another caller may have refreshed while we waited for the lock.
      if (token.isPresent() && isFresh(token.get())) {
        return token.get();
      }
      DecodedJWT newToken = provider.getToken();
      token = Optional.of(newToken);
      return newToken;
    } finally {
      rwlock.unlock();
    }
  }
}
