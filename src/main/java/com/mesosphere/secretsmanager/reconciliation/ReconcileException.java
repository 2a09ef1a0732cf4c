package com.mesosphere.secretsmanager.reconciliation;

import com.mesosphere.secretsmanager.errors.ErrorType;
import com.mesosphere.secretsmanager.errors.SecretsManagerException;
import com.mesosphere.secretsmanager.record.RecordIdentity;

/**
 * A failed reconciliation, attributed to the record it was for and to the remote system which
 * caused it. Failures raised before either remote system is called, such as an unknown encoding or
 * KV engine, are attributed to {@link ErrorType.Source#CONFIGURATION} instead.
 */
public class ReconcileException extends Exception {

  private final RecordIdentity identity;

  public ReconcileException(RecordIdentity identity, SecretsManagerException cause) {
    super(String.format("Failed to reconcile %s: %s", identity, cause.getMessage()), cause);
    this.identity = identity;
  }

  public RecordIdentity getIdentity() {
    return identity;
  }

  public ErrorType getType() {
    return getCause().getType();
  }

  public ErrorType.Source getSource() {
    return getCause().getSource();
  }

  @Override
  public synchronized SecretsManagerException getCause() {
    return (SecretsManagerException) super.getCause();
  }
}
