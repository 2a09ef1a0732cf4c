package com.mesosphere.secretsmanager.reconciliation;

import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Set;

/**
 * Which namespaces are managed at all (the watch list) and which are skipped when writing target
 * secrets (the exclusion list).
 */
public final class NamespaceFilter {

  private static final NamespaceFilter ALL = new NamespaceFilter(ImmutableSet.of(), ImmutableSet.of());

  private final Set<String> watched;
  private final Set<String> excluded;

  private NamespaceFilter(Set<String> watched, Set<String> excluded) {
    this.watched = watched;
    this.excluded = excluded;
  }

  public static NamespaceFilter all() {
    return ALL;
  }

  /**
   * @param watched  namespaces to manage, or empty to manage every namespace
   * @param excluded namespaces which never receive a target secret
   */
  public static NamespaceFilter of(Collection<String> watched, Collection<String> excluded) {
    return new NamespaceFilter(ImmutableSet.copyOf(watched), ImmutableSet.copyOf(excluded));
  }

  public boolean isWatched(String namespace) {
    return watched.isEmpty() || watched.contains(namespace);
  }

  public boolean isExcluded(String namespace) {
    return excluded.contains(namespace);
  }

  @Override
  public String toString() {
    return String.format("watched=%s excluded=%s", watched.isEmpty() ? "all" : watched, excluded);
  }
}
