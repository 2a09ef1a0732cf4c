package com.mesosphere.secretsmanager.store;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

/**
 * Secret object held by a {@link SecretStore}: the materialized projection of one record.
 */
public final class TargetSecret {

  private final String namespace;
  private final String name;
  private final String type;
  private final SecretData data;
  private final Map<String, String> labels;
  private final Map<String, String> annotations;

  private TargetSecret(Builder builder) {
    this.namespace = Objects.requireNonNull(builder.namespace, "namespace");
    this.name = Objects.requireNonNull(builder.name, "name");
    this.type = Objects.requireNonNull(builder.type, "type");
    this.data = builder.data;
    this.labels = ImmutableMap.copyOf(builder.labels);
    this.annotations = ImmutableMap.copyOf(builder.annotations);
  }

  public static Builder newBuilder(String namespace, String name) {
    return new Builder(namespace, name);
  }

  public String getNamespace() {
    return namespace;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public SecretData getData() {
    return data;
  }

  public Map<String, String> getLabels() {
    return labels;
  }

  public Map<String, String> getAnnotations() {
    return annotations;
  }

  public Builder toBuilder() {
    return new Builder(namespace, name)
        .type(type)
        .data(data)
        .labels(labels)
        .annotations(annotations);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TargetSecret)) {
      return false;
    }
    TargetSecret other = (TargetSecret) o;
    return namespace.equals(other.namespace)
        && name.equals(other.name)
        && type.equals(other.type)
        && data.equals(other.data)
        && labels.equals(other.labels)
        && annotations.equals(other.annotations);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, name, type, data, labels, annotations);
  }

  @Override
  public String toString() {
    return String.format("TargetSecret[%s/%s type=%s data=%s labels=%s]",
        namespace, name, type, data, labels);
  }

  /**
   * A {@link TargetSecret} builder.
   */
  public static final class Builder {
    private final String namespace;
    private final String name;
    private String type = "Opaque";
    private SecretData data = SecretData.empty();
    private Map<String, String> labels = ImmutableMap.of();
    private Map<String, String> annotations = ImmutableMap.of();

    private Builder(String namespace, String name) {
      this.namespace = namespace;
      this.name = name;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder data(SecretData data) {
      this.data = data;
      return this;
    }

    public Builder labels(Map<String, String> labels) {
      this.labels = labels;
      return this;
    }

    public Builder annotations(Map<String, String> annotations) {
      this.annotations = annotations;
      return this;
    }

    public TargetSecret build() {
      return new TargetSecret(this);
    }
  }
}
