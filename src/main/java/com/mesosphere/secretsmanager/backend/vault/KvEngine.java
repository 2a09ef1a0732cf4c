package com.mesosphere.secretsmanager.backend.vault;

import com.mesosphere.secretsmanager.errors.SecretsManagerException;

import org.apache.commons.lang3.StringUtils;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Versions of Vault's key/value secrets engine, each knowing where the stored fields sit inside a
 * read response.
 */
public enum KvEngine {

  /**
   * Version 1: fields live directly under {@code data}.
   */
  KV1("kv1") {
    @Override
    public Optional<JSONObject> unwrap(JSONObject response) {
      return Optional.ofNullable(response.optJSONObject("data"));
    }
  },

  /**
   * Version 2: fields live under {@code data.data}, next to the version {@code metadata}. A deleted
   * or destroyed version has a null {@code data.data}.
   */
  KV2("kv2") {
    @Override
    public Optional<JSONObject> unwrap(JSONObject response) {
      JSONObject envelope = response.optJSONObject("data");
      return envelope == null ? Optional.empty() : Optional.ofNullable(envelope.optJSONObject("data"));
    }
  };

  public static final KvEngine DEFAULT = KV2;

  private final String name;

  KvEngine(String name) {
    this.name = name;
  }

  /**
   * Returns the stored fields from a read response, or an empty Optional if it carries none.
   */
  public abstract Optional<JSONObject> unwrap(JSONObject response);

  public String getName() {
    return name;
  }

  /**
   * Returns the engine with the provided name. A null or empty name selects {@link #DEFAULT}.
   *
   * @throws SecretsManagerException with type {@code UNSUPPORTED_ENGINE} for unknown names
   */
  public static KvEngine fromName(String name) throws SecretsManagerException {
    if (StringUtils.isEmpty(name)) {
      return DEFAULT;
    }
    for (KvEngine engine : values()) {
      if (engine.name.equals(name)) {
        return engine;
      }
    }
    throw SecretsManagerException.unsupportedEngine(name);
  }
}
