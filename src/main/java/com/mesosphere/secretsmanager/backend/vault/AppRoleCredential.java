package com.mesosphere.secretsmanager.backend.vault;

import org.json.JSONObject;

/**
 * AppRole login using a role id and secret id.
 */
public class AppRoleCredential implements VaultCredential {

  private final String mountPath;
  private final String roleId;
  private final String secretId;

  public AppRoleCredential(String mountPath, String roleId, String secretId) {
    this.mountPath = mountPath;
    this.roleId = roleId;
    this.secretId = secretId;
  }

  @Override
  public String getLoginPath() {
    return String.format("auth/%s/login", mountPath);
  }

  @Override
  public JSONObject getLoginPayload() {
    JSONObject payload = new JSONObject();
    payload.put("role_id", roleId);
    payload.put("secret_id", secretId);
    return payload;
  }

  @Override
  public String toString() {
    return String.format("approle[path=%s, role_id=%s]", mountPath, roleId);
  }
}
