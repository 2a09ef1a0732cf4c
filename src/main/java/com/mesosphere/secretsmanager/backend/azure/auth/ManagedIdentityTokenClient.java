package com.mesosphere.secretsmanager.backend.azure.auth;

import com.mesosphere.secretsmanager.http.BackendHttpExecutor;
import com.mesosphere.secretsmanager.http.HttpStatusException;

import com.auth0.jwt.JWT;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.interfaces.DecodedJWT;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.client.fluent.Request;
import org.apache.http.client.utils.URIBuilder;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Obtains a token for a managed identity from the instance metadata service. The identity is
 * selected by client id, else by resource id, else the system-assigned identity is used.
 */
public class ManagedIdentityTokenClient implements TokenProvider {

  static final String IMDS_TOKEN_URL = "http://169.254.169.254/metadata/identity/oauth2/token";

  private final BackendHttpExecutor httpExecutor;
  private final String resource;
  private final String clientId;
  private final String resourceId;

  public ManagedIdentityTokenClient(
      BackendHttpExecutor httpExecutor, String resource, String clientId, String resourceId) {
    this.httpExecutor = httpExecutor;
    this.resource = resource;
    this.clientId = clientId;
    this.resourceId = resourceId;
  }

  @Override
  public DecodedJWT getToken() throws IOException {
    Request request = Request.Get(buildUri()).addHeader("Metadata", "true");
    HttpResponse response = httpExecutor.execute(request);
    int code = response.getStatusLine().getStatusCode();
    if (code != HttpStatus.SC_OK) {
      throw new HttpStatusException(code, String.format(
          "Managed identity token request failed: code=%s, reason='%s'",
          code, response.getStatusLine().getReasonPhrase()));
    }
    try {
      return JWT.decode(new JSONObject(BackendHttpExecutor.getBody(response)).getString("access_token"));
    } catch (JSONException | JWTDecodeException e) {
      throw new IOException("Unable to parse managed identity token response", e);
    }
  }

  private URI buildUri() throws IOException {
    try {
      URIBuilder builder = new URIBuilder(IMDS_TOKEN_URL)
          .addParameter("api-version", "2018-02-01")
          .addParameter("resource", resource);
      if (StringUtils.isNotEmpty(clientId)) {
        builder.addParameter("client_id", clientId);
      } else if (StringUtils.isNotEmpty(resourceId)) {
        builder.addParameter("msi_res_id", resourceId);
      }
      return builder.build();
    } catch (URISyntaxException e) {
      throw new IOException(e);
    }
  }

  @Override
  public String toString() {
    if (StringUtils.isNotEmpty(clientId)) {
      return String.format("managed-identity[client_id=%s]", clientId);
    } else if (StringUtils.isNotEmpty(resourceId)) {
      return String.format("managed-identity[resource_id=%s]", resourceId);
    }
    return "managed-identity[system]";
  }
}
