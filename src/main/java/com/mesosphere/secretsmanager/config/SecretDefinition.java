package com.mesosphere.secretsmanager.config;

import com.mesosphere.secretsmanager.record.DataSource;
import com.mesosphere.secretsmanager.record.RecordIdentity;
import com.mesosphere.secretsmanager.record.SecretRecord;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One entry of the secret definitions file: a secret to create, under the same name, in each of the
 * listed namespaces.
 *
 * <pre>
 * - name: db-credentials
 *   type: Opaque
 *   namespaces: [payments, billing]
 *   data:
 *     password:
 *       path: secret/data/db
 *       key: password
 *       encoding: base64
 * </pre>
 */
public final class SecretDefinition {

  private final String name;
  private final List<String> namespaces;
  private final String type;
  private final Map<String, DataSource> data;

  @JsonCreator
  public SecretDefinition(
      @JsonProperty("name") String name,
      @JsonProperty("namespaces") List<String> namespaces,
      @JsonProperty("type") String type,
      @JsonProperty("data") Map<String, DataSource> data) {
    this.name = name;
    this.namespaces = namespaces == null ? ImmutableList.of() : ImmutableList.copyOf(namespaces);
    this.type = type;
    this.data = data == null ? ImmutableMap.of() : ImmutableMap.copyOf(data);
  }

  public String getName() {
    return name;
  }

  public List<String> getNamespaces() {
    return namespaces;
  }

  public String getType() {
    return type;
  }

  public Map<String, DataSource> getData() {
    return data;
  }

  /**
   * Expands this definition into one record per namespace.
   */
  public List<SecretRecord> toRecords() {
    List<SecretRecord> records = new ArrayList<>();
    for (String namespace : namespaces) {
      records.add(SecretRecord.newBuilder(RecordIdentity.of(namespace, name))
          .targetName(name)
          .targetType(type)
          .keysMap(data)
          .build());
    }
    return records;
  }

  @Override
  public String toString() {
    return String.format("%s%s type=%s keys=%s", name, namespaces, type, data.keySet());
  }
}
