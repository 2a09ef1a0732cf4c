package com.mesosphere.secretsmanager.record;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable ordered set of finalizer markers attached to a record. Persisted as a list; duplicates
 * in the persisted form collapse on load and insertion order is preserved.
 */
public final class Finalizers {

  private static final Finalizers EMPTY = new Finalizers(new LinkedHashSet<>());

  private final Set<String> values;

  private Finalizers(LinkedHashSet<String> values) {
    this.values = values;
  }

  public static Finalizers empty() {
    return EMPTY;
  }

  public static Finalizers of(Collection<String> values) {
    return new Finalizers(new LinkedHashSet<>(values));
  }

  public boolean has(String finalizer) {
    return values.contains(finalizer);
  }

  /**
   * Returns a copy with {@code finalizer} appended, or this instance if already present.
   */
  public Finalizers add(String finalizer) {
    if (has(finalizer)) {
      return this;
    }
    LinkedHashSet<String> copy = new LinkedHashSet<>(values);
    copy.add(finalizer);
    return new Finalizers(copy);
  }

  /**
   * Returns a copy without {@code finalizer}, or this instance if it was absent.
   */
  public Finalizers remove(String finalizer) {
    if (!has(finalizer)) {
      return this;
    }
    LinkedHashSet<String> copy = new LinkedHashSet<>(values);
    copy.remove(finalizer);
    return new Finalizers(copy);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public List<String> toList() {
    return ImmutableList.copyOf(values);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Finalizers && toList().equals(((Finalizers) o).toList());
  }

  @Override
  public int hashCode() {
    return toList().hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
