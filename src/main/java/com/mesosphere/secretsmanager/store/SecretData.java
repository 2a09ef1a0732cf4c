package com.mesosphere.secretsmanager.store;

import com.google.common.collect.ImmutableSortedMap;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable map from logical key to raw bytes, compared structurally. Values are copied on the way
 * in and out so that callers can never mutate stored content.
 */
public final class SecretData {

  private static final SecretData EMPTY = new SecretData(ImmutableSortedMap.of());

  private final Map<String, byte[]> values;

  private SecretData(Map<String, byte[]> values) {
    this.values = values;
  }

  public static SecretData empty() {
    return EMPTY;
  }

  public static SecretData of(Map<String, byte[]> values) {
    ImmutableSortedMap.Builder<String, byte[]> builder = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<String, byte[]> entry : values.entrySet()) {
      builder.put(entry.getKey(), entry.getValue().clone());
    }
    return new SecretData(builder.build());
  }

  public Set<String> keySet() {
    return values.keySet();
  }

  /**
   * Returns a copy of the value for {@code key}, or {@code null} if the key is absent.
   */
  public byte[] get(String key) {
    byte[] value = values.get(key);
    return value == null ? null : value.clone();
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Map<String, byte[]> toMap() {
    return values.entrySet().stream()
        .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().clone()));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SecretData)) {
      return false;
    }
    Map<String, byte[]> other = ((SecretData) o).values;
    if (!values.keySet().equals(other.keySet())) {
      return false;
    }
    for (Map.Entry<String, byte[]> entry : values.entrySet()) {
      if (!Arrays.equals(entry.getValue(), other.get(entry.getKey()))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = 0;
    for (Map.Entry<String, byte[]> entry : values.entrySet()) {
      hash += entry.getKey().hashCode() ^ Arrays.hashCode(entry.getValue());
    }
    return hash;
  }

  /**
   * Prints keys and value sizes only.
   */
  @Override
  public String toString() {
    return values.entrySet().stream()
        .map(e -> String.format("%s=%d bytes", e.getKey(), e.getValue().length))
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
