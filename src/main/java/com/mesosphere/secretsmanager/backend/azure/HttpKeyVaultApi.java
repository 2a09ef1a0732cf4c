package com.mesosphere.secretsmanager.backend.azure;

import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.http.BackendHttpExecutor;
import com.mesosphere.secretsmanager.http.HttpStatusException;

import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.StatusLine;
import org.apache.http.client.fluent.Request;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * {@link KeyVaultApi} implementation against {@code https://<name>.vault.azure.net}.
 *
 * @see <a href="https://learn.microsoft.com/en-us/rest/api/keyvault/secrets/get-secret/get-secret">
 * Get Secret API Reference
 * </a>
 */
public class HttpKeyVaultApi implements KeyVaultApi {

  static final String ENDPOINT_FORMAT = "https://%s.vault.azure.net";

  static final String API_VERSION = "7.4";

  private final Logger logger = LoggingUtils.getLogger(getClass());

  private final String baseUrl;

  private final BackendHttpExecutor httpExecutor;

  public HttpKeyVaultApi(String keyVaultName, BackendHttpExecutor httpExecutor) {
    this.baseUrl = String.format(ENDPOINT_FORMAT, keyVaultName);
    this.httpExecutor = httpExecutor;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  @Override
  public String getSecret(String accessToken, String name) throws IOException {
    String uri = String.format("%s/secrets/%s?api-version=%s",
        baseUrl, URLEncoder.encode(name, StandardCharsets.UTF_8.name()), API_VERSION);
    logger.debug("get secret {}", name);
    HttpResponse response = httpExecutor.execute(
        Request.Get(uri).addHeader("Authorization", "Bearer " + accessToken));
    StatusLine status = response.getStatusLine();
    if (status.getStatusCode() != HttpStatus.SC_OK) {
      throw new HttpStatusException(status.getStatusCode(), String.format(
          "Unable to get secret '%s': code=%s, reason='%s'",
          name, status.getStatusCode(), status.getReasonPhrase()));
    }
    try {
      return new JSONObject(BackendHttpExecutor.getBody(response)).getString("value");
    } catch (JSONException e) {
      throw new IOException(String.format("Unable to parse secret '%s' response", name), e);
    }
  }
}
