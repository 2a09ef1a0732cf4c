package com.mesosphere.secretsmanager.backend.azure.auth;

import com.mesosphere.secretsmanager.http.BackendHttpExecutor;
import com.mesosphere.secretsmanager.http.HttpStatusException;

import com.auth0.jwt.JWT;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.interfaces.DecodedJWT;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.client.fluent.Form;
import org.apache.http.client.fluent.Request;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;

/**
 * Obtains a token for a service principal through the OAuth2 client credentials grant.
 */
public class ClientSecretTokenClient implements TokenProvider {

  static final String LOGIN_URL_FORMAT = "https://login.microsoftonline.com/%s/oauth2/v2.0/token";

  private final BackendHttpExecutor httpExecutor;
  private final String tenantId;
  private final String clientId;
  private final String clientSecret;
  private final String scope;

  public ClientSecretTokenClient(
      BackendHttpExecutor httpExecutor, String tenantId, String clientId, String clientSecret, String scope) {
    this.httpExecutor = httpExecutor;
    this.tenantId = tenantId;
    this.clientId = clientId;
    this.clientSecret = clientSecret;
    this.scope = scope;
  }

  @Override
  public DecodedJWT getToken() throws IOException {
    Request request = Request.Post(String.format(LOGIN_URL_FORMAT, tenantId))
        .bodyForm(Form.form()
            .add("grant_type", "client_credentials")
            .add("client_id", clientId)
            .add("client_secret", clientSecret)
            .add("scope", scope)
            .build());
    HttpResponse response = httpExecutor.execute(request);
    int code = response.getStatusLine().getStatusCode();
    if (code != HttpStatus.SC_OK) {
      throw new HttpStatusException(code, String.format(
          "Client credentials token request for tenant %s failed: code=%s, reason='%s'",
          tenantId, code, response.getStatusLine().getReasonPhrase()));
    }
    try {
      return JWT.decode(new JSONObject(BackendHttpExecutor.getBody(response)).getString("access_token"));
    } catch (JSONException | JWTDecodeException e) {
      throw new IOException("Unable to parse client credentials token response", e);
    }
  }

  @Override
  public String toString() {
    return String.format("client-secret[tenant=%s, client_id=%s]", tenantId, clientId);
  }
}
