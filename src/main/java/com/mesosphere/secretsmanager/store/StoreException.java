package com.mesosphere.secretsmanager.store;

import java.io.IOException;

/**
 * Exception that indicates an issue with reading or writing records or target secrets. The
 * underlying exception from the storage implementation, if any, is nested inside.
 */
public class StoreException extends IOException {

  /**
   * Machine-parseable indicator of the cause of a {@link StoreException}.
   */
  public enum Reason {

    /**
     * The requested object was not found.
     */
    NOT_FOUND,

    /**
     * An object with the same identity already exists.
     */
    ALREADY_EXISTS,

    /**
     * The underlying storage failed to store or retrieve the requested data.
     */
    STORAGE_ERROR,

    /**
     * The data could not be serialized or deserialized.
     */
    SERIALIZATION_ERROR
  }

  private final Reason reason;

  public StoreException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public StoreException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public static StoreException notFound(Object identity) {
    return new StoreException(Reason.NOT_FOUND, String.format("'%s' not found", identity));
  }

  public Reason getReason() {
    return reason;
  }

  @Override
  public String getMessage() {
    return String.format("%s (reason: %s)", super.getMessage(), reason);
  }
}
