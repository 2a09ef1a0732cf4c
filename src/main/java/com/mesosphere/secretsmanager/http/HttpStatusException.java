package com.mesosphere.secretsmanager.http;

import java.io.IOException;

/**
 * Thrown when a backend answered with an unexpected HTTP status code.
 */
public class HttpStatusException extends IOException {

  private final int statusCode;

  public HttpStatusException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
