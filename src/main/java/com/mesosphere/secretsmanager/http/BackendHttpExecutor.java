package com.mesosphere.secretsmanager.http;

import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.HttpClient;
import org.apache.http.client.fluent.Executor;
import org.apache.http.client.fluent.Request;
import org.apache.http.impl.client.HttpClientBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Wraps an {@link Executor} shared by the clients of one backend.
 */
public class BackendHttpExecutor {

  private final Executor executor;

  public BackendHttpExecutor(HttpClientBuilder clientBuilder) {
    this(clientBuilder.build());
  }

  @VisibleForTesting
  public BackendHttpExecutor(HttpClient httpClient) {
    this.executor = Executor.newInstance(httpClient);
  }

  /**
   * Runs the provided request and returns the fully buffered response, whatever its status code.
   */
  public HttpResponse execute(Request request) throws IOException {
    return executor.execute(request).returnResponse();
  }

  /**
   * Returns the body of the response as a UTF-8 string, or an empty string if there is none.
   */
  public static String getBody(HttpResponse response) throws IOException {
    HttpEntity entity = response.getEntity();
    if (entity == null) {
      return "";
    }
    try (InputStream content = entity.getContent()) {
      return IOUtils.toString(content, StandardCharsets.UTF_8);
    }
  }
}
