package com.mesosphere.secretsmanager.backend.vault;

import java.util.Optional;

/**
 * Decides what a renewal tick does, given the outcome of the token lookup.
 */
public final class RenewalPolicy {

  private RenewalPolicy() {
    // do not instantiate
  }

  /**
   * @param lookup         the looked up token, or an empty Optional if the lookup failed
   * @param maxTokenTtlSec renewal threshold: tokens with a lower TTL are renewed
   */
  public static RenewalAction decide(Optional<TokenInfo> lookup, long maxTokenTtlSec) {
    if (!lookup.isPresent()) {
      return RenewalAction.RELOGIN;
    }
    TokenInfo info = lookup.get();
    if (info.getTtlSeconds() >= maxTokenTtlSec) {
      return RenewalAction.NONE;
    }
    return info.isRenewable() ? RenewalAction.RENEW : RenewalAction.REPORT_NOT_RENEWABLE;
  }
}
