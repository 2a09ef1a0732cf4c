package com.mesosphere.secretsmanager.backend.vault;

/**
 * What a renewal tick should do with the current token.
 */
public enum RenewalAction {

  /**
   * Token is healthy and far enough from expiry.
   */
  NONE,

  /**
   * Token is close to expiry and renewable.
   */
  RENEW,

  /**
   * Token could not be looked up, so it is treated as lost.
   */
  RELOGIN,

  /**
   * Token is close to expiry but Vault won't renew it. Reported, and the token stays in use until
   * a later lookup fails.
   */
  REPORT_NOT_RENEWABLE
}
