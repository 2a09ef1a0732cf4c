package com.mesosphere.secretsmanager.record;

import java.util.Objects;

/**
 * Namespace and name of a {@link SecretRecord}. Also used to key the target secret, since a record
 * always projects into its own namespace.
 */
public final class RecordIdentity implements Comparable<RecordIdentity> {

  private final String namespace;
  private final String name;

  private RecordIdentity(String namespace, String name) {
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.name = Objects.requireNonNull(name, "name");
  }

  public static RecordIdentity of(String namespace, String name) {
    return new RecordIdentity(namespace, name);
  }

  public String getNamespace() {
    return namespace;
  }

  public String getName() {
    return name;
  }

  @Override
  public int compareTo(RecordIdentity o) {
    int result = namespace.compareTo(o.namespace);
    return result != 0 ? result : name.compareTo(o.name);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RecordIdentity)) {
      return false;
    }
    RecordIdentity other = (RecordIdentity) o;
    return namespace.equals(other.namespace) && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, name);
  }

  @Override
  public String toString() {
    return namespace + "/" + name;
  }
}
