package com.mesosphere.secretsmanager.record;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Declared intent for one target secret: which backend values to project, under which logical keys,
 * into which secret. Instances are immutable; finalizer and deletion changes produce copies which
 * are persisted through a {@link RecordStore}.
 */
public final class SecretRecord {

  /**
   * Secret type used when the record does not declare one.
   */
  public static final String DEFAULT_TYPE = "Opaque";

  private final RecordIdentity identity;
  private final String targetName;
  private final String targetType;
  private final Map<String, DataSource> keysMap;
  private final boolean deletionRequested;
  private final Finalizers finalizers;

  private SecretRecord(Builder builder) {
    this.identity = Objects.requireNonNull(builder.identity, "identity");
    this.targetName = StringUtils.isEmpty(builder.targetName) ? identity.getName() : builder.targetName;
    this.targetType = StringUtils.isEmpty(builder.targetType) ? DEFAULT_TYPE : builder.targetType;
    this.keysMap = ImmutableMap.copyOf(builder.keysMap);
    this.deletionRequested = builder.deletionRequested;
    this.finalizers = builder.finalizers;
  }

  public static Builder newBuilder(RecordIdentity identity) {
    return new Builder(identity);
  }

  public RecordIdentity getIdentity() {
    return identity;
  }

  /**
   * Identity of the target secret: the record's namespace and the declared target name.
   */
  public RecordIdentity getTargetIdentity() {
    return RecordIdentity.of(identity.getNamespace(), targetName);
  }

  public String getTargetName() {
    return targetName;
  }

  public String getTargetType() {
    return targetType;
  }

  public Map<String, DataSource> getKeysMap() {
    return keysMap;
  }

  public boolean isDeletionRequested() {
    return deletionRequested;
  }

  public Finalizers getFinalizers() {
    return finalizers;
  }

  public SecretRecord withFinalizers(Finalizers newFinalizers) {
    return toBuilder().finalizers(newFinalizers).build();
  }

  public SecretRecord withDeletionRequested() {
    return toBuilder().deletionRequested(true).build();
  }

  public Builder toBuilder() {
    return new Builder(identity)
        .targetName(targetName)
        .targetType(targetType)
        .keysMap(keysMap)
        .deletionRequested(deletionRequested)
        .finalizers(finalizers);
  }

  /**
   * Returns whether the declared target and key mapping of both records are the same, ignoring
   * finalizers and deletion state.
   */
  public boolean hasSameDeclaration(SecretRecord other) {
    return identity.equals(other.identity)
        && targetName.equals(other.targetName)
        && targetType.equals(other.targetType)
        && keysMap.equals(other.keysMap);
  }

  @Override
  public String toString() {
    return String.format("SecretRecord[%s target=%s type=%s keys=%s deleting=%s finalizers=%s]",
        identity, targetName, targetType, keysMap.keySet(), deletionRequested, finalizers);
  }

  /**
   * A {@link SecretRecord} builder.
   */
  public static final class Builder {
    private final RecordIdentity identity;
    private String targetName;
    private String targetType;
    private Map<String, DataSource> keysMap = ImmutableMap.of();
    private boolean deletionRequested;
    private Finalizers finalizers = Finalizers.empty();

    private Builder(RecordIdentity identity) {
      this.identity = identity;
    }

    public Builder targetName(String targetName) {
      this.targetName = targetName;
      return this;
    }

    public Builder targetType(String targetType) {
      this.targetType = targetType;
      return this;
    }

    public Builder keysMap(Map<String, DataSource> keysMap) {
      this.keysMap = keysMap;
      return this;
    }

    public Builder deletionRequested(boolean deletionRequested) {
      this.deletionRequested = deletionRequested;
      return this;
    }

    public Builder finalizers(Finalizers finalizers) {
      this.finalizers = finalizers;
      return this;
    }

    public Builder finalizers(Collection<String> finalizers) {
      this.finalizers = Finalizers.of(finalizers);
      return this;
    }

    public SecretRecord build() {
      return new SecretRecord(this);
    }
  }
}
