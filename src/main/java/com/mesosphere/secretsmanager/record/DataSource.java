package com.mesosphere.secretsmanager.record;

import com.mesosphere.secretsmanager.decoder.Decoders;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Location of one value in the backend: a path, a key within it, and the encoding of the stored
 * string.
 */
public final class DataSource {

  private final String path;
  private final String key;
  private final String encoding;

  @JsonCreator
  public DataSource(
      @JsonProperty("path") String path,
      @JsonProperty("key") String key,
      @JsonProperty("encoding") String encoding) {
    this.path = path;
    this.key = StringUtils.defaultString(key);
    this.encoding = StringUtils.isEmpty(encoding) ? Decoders.DEFAULT_ENCODING : encoding;
  }

  public static DataSource of(String path, String key) {
    return new DataSource(path, key, null);
  }

  @JsonProperty("path")
  public String getPath() {
    return path;
  }

  @JsonProperty("key")
  public String getKey() {
    return key;
  }

  @JsonProperty("encoding")
  public String getEncoding() {
    return encoding;
  }

  @Override
  public boolean equals(Object o) {
    return EqualsBuilder.reflectionEquals(this, o);
  }

  @Override
  public int hashCode() {
    return HashCodeBuilder.reflectionHashCode(this);
  }

  @Override
  public String toString() {
    return String.format("path='%s' key='%s' encoding='%s'", path, key, encoding);
  }
}
