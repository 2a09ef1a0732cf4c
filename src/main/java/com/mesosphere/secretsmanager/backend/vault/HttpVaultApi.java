package com.mesosphere.secretsmanager.backend.vault;

import com.mesosphere.secretsmanager.common.LoggingUtils;
import com.mesosphere.secretsmanager.http.BackendHttpExecutor;

import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.StatusLine;
import org.apache.http.client.fluent.Request;
import org.apache.http.entity.ContentType;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;

import java.io.IOException;
import java.util.Optional;

/**
 * {@link VaultApi} implementation against the Vault HTTP API.
 *
 * @see <a href="https://developer.hashicorp.com/vault/api-docs">Vault API Reference</a>
 */
public class HttpVaultApi implements VaultApi {

  static final String TOKEN_HEADER = "X-Vault-Token";

  // Report every node state as healthy: a standby or sealed node is still worth logging.
  private static final String HEALTH_PATH = "sys/health?standbycode=299&sealedcode=299"
      + "&uninitcode=299&drsecondarycode=299&performancestandbycode=299";

  private final Logger logger = LoggingUtils.getLogger(getClass());

  private final String address;

  private final BackendHttpExecutor httpExecutor;

  public HttpVaultApi(String address, BackendHttpExecutor httpExecutor) {
    this.address = StringUtils.removeEnd(address, "/");
    this.httpExecutor = httpExecutor;
  }

  @Override
  public String login(VaultCredential credential) throws IOException {
    Request request = Request.Post(uriForPath(credential.getLoginPath()))
        .bodyString(credential.getLoginPayload().toString(), ContentType.APPLICATION_JSON);
    JSONObject body = parse("login", credential.getLoginPath(), query("login", credential.getLoginPath(), request));
    try {
      return body.getJSONObject("auth").getString("client_token");
    } catch (JSONException e) {
      throw new IOException("Login response did not contain a client token", e);
    }
  }

  @Override
  public Optional<JSONObject> read(String token, String path) throws IOException {
    Request request = Request.Get(uriForPath(path)).addHeader(TOKEN_HEADER, token);
    logger.debug("read {}", path);
    HttpResponse response = httpExecutor.execute(request);
    int code = response.getStatusLine().getStatusCode();
    if (code == HttpStatus.SC_NOT_FOUND) {
      // A missing path may still come with warnings or version metadata worth reporting.
      String content = BackendHttpExecutor.getBody(response);
      if (StringUtils.isBlank(content)) {
        return Optional.empty();
      }
      try {
        JSONObject body = new JSONObject(content);
        return body.has("data") || body.has("warnings") ? Optional.of(body) : Optional.empty();
      } catch (JSONException e) {
        return Optional.empty();
      }
    }
    checkStatus("read", path, request, response, HttpStatus.SC_OK);
    return Optional.of(parse("read", path, response));
  }

  @Override
  public TokenInfo lookupSelf(String token) throws IOException {
    Request request = Request.Get(uriForPath("auth/token/lookup-self")).addHeader(TOKEN_HEADER, token);
    JSONObject body = parse("lookup-self", "auth/token/lookup-self", query("lookup-self", "auth/token/lookup-self", request));
    JSONObject data = body.optJSONObject("data");
    if (data == null) {
      throw new IOException("Token lookup response had no data");
    }
    try {
      return new TokenInfo(data.getLong("ttl"), data.optBoolean("renewable", false));
    } catch (JSONException e) {
      throw new IOException(String.format("Unable to parse token TTL from '%s'", data.opt("ttl")), e);
    }
  }

  @Override
  public void renewSelf(String token, long incrementSeconds) throws IOException {
    JSONObject payload = new JSONObject();
    payload.put("increment", incrementSeconds);
    Request request = Request.Post(uriForPath("auth/token/renew-self"))
        .addHeader(TOKEN_HEADER, token)
        .bodyString(payload.toString(), ContentType.APPLICATION_JSON);
    query("renew-self", "auth/token/renew-self", request);
  }

  @Override
  public VaultHealth health() throws IOException {
    Request request = Request.Get(uriForPath(HEALTH_PATH));
    JSONObject body = parse("health", "sys/health", query("health", "sys/health", request));
    return new VaultHealth(
        body.optString("cluster_name"),
        body.optString("cluster_id"),
        body.optString("version"),
        body.optBoolean("sealed", false));
  }

  private String uriForPath(String path) {
    return String.format("%s/v1/%s", address, StringUtils.removeStart(path, "/"));
  }

  /**
   * Returns the resulting {@link HttpResponse} if the provided query resulted in a 2xx code, or
   * throws an {@link IOException} if it didn't.
   */
  private HttpResponse query(String operation, String path, Request request) throws IOException {
    logger.debug("{} {}", operation, path);
    HttpResponse response = httpExecutor.execute(request);
    int code = response.getStatusLine().getStatusCode();
    if (code < 200 || code >= 300) {
      checkStatus(operation, path, request, response, HttpStatus.SC_OK);
    }
    return response;
  }

  private static void checkStatus(
      String operation,
      String path,
      Request request,
      HttpResponse response,
      int okCode) throws IOException
  {
    StatusLine status = response.getStatusLine();
    if (status.getStatusCode() != okCode) {
      throw new IOException(String.format(
          "Unable to %s at '%s': query='%s', code=%s, reason='%s'",
          operation, path, request.toString(), status.getStatusCode(), status.getReasonPhrase()));
    }
  }

  private static JSONObject parse(String operation, String path, HttpResponse response) throws IOException {
    String content = BackendHttpExecutor.getBody(response);
    if (StringUtils.isBlank(content)) {
      return new JSONObject();
    }
    try {
      return new JSONObject(content);
    } catch (JSONException e) {
      throw new IOException(String.format("Unable to parse %s response for '%s'", operation, path), e);
    }
  }
}
