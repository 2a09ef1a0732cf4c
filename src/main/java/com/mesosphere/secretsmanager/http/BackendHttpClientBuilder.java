package com.mesosphere.secretsmanager.http;

import org.apache.http.HttpRequestInterceptor;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.HttpClientBuilder;

import java.time.Duration;

/**
 * A {@link BackendHttpClientBuilder} is a helper that simplifies common modifications of
 * {@link org.apache.http.client.HttpClient} for talking to secret backends.
 */
public class BackendHttpClientBuilder extends HttpClientBuilder {

  public BackendHttpClientBuilder() {
    super();
    useSystemProperties();
  }

  /**
   * Applies the same timeout to connection setup, connection pool checkout, and socket reads, so
   * that no backend call blocks for longer than {@code timeout}.
   *
   * @return this
   */
  public BackendHttpClientBuilder setTimeout(Duration timeout) {
    int millis = (int) timeout.toMillis();
    RequestConfig requestConfig = RequestConfig.custom()
        .setConnectTimeout(millis)
        .setConnectionRequestTimeout(millis)
        .setSocketTimeout(millis)
        .build();
    this.setDefaultRequestConfig(requestConfig);
    return this;
  }

  /**
   * Adds a fixed header to every request.
   *
   * @return this
   */
  public BackendHttpClientBuilder setDefaultHeader(String name, String value) {
    this.addInterceptorFirst((HttpRequestInterceptor) (request, context) -> request.addHeader(name, value));
    return this;
  }
}
