package com.mesosphere.secretsmanager.backend.vault;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Kubernetes auth login, presenting the pod's service account token as the JWT. The token file is
 * re-read on every login since the kubelet rotates it.
 */
public class KubernetesCredential implements VaultCredential {

  private final String mountPath;
  private final String role;
  private final File tokenFile;

  public KubernetesCredential(String mountPath, String role, File tokenFile) {
    this.mountPath = mountPath;
    this.role = role;
    this.tokenFile = tokenFile;
  }

  @Override
  public String getLoginPath() {
    return String.format("auth/%s/login", mountPath);
  }

  @Override
  public JSONObject getLoginPayload() throws IOException {
    JSONObject payload = new JSONObject();
    payload.put("role", role);
    payload.put("jwt", FileUtils.readFileToString(tokenFile, StandardCharsets.UTF_8).trim());
    return payload;
  }

  @Override
  public String toString() {
    return String.format("kubernetes[path=%s, role=%s, token=%s]", mountPath, role, tokenFile);
  }
}
