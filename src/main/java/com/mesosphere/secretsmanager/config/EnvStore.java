package com.mesosphere.secretsmanager.config;

import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to a mapping of setting values (typically the process env).
 */
public class EnvStore {

  /**
   * Exception which is thrown when failing to retrieve or parse a given setting.
   */
  public static class ConfigException extends RuntimeException {

    /**
     * A machine-accessible error type.
     */
    public enum Type {
      NOT_FOUND,
      INVALID_VALUE
    }

    private final Type type;

    ConfigException(Type type, String message) {
      super(message);
      this.type = type;
    }

    static ConfigException notFound(String envKey) {
      return new ConfigException(
          Type.NOT_FOUND, String.format("Missing required environment variable: %s", envKey));
    }

    static ConfigException invalidValue(String envKey, String envVal, String expected) {
      return new ConfigException(Type.INVALID_VALUE, String.format(
          "Failed to parse configured environment variable '%s' as %s: %s", envKey, expected, envVal));
    }

    public Type getType() {
      return type;
    }

    @Override
    public String getMessage() {
      return String.format("%s (errtype: %s)", super.getMessage(), type);
    }
  }

  private final Map<String, String> envMap;

  EnvStore(Map<String, String> envMap) {
    this.envMap = new HashMap<>(envMap);
  }

  public static EnvStore fromEnv() {
    return new EnvStore(System.getenv());
  }

  public static EnvStore fromMap(Map<String, String> envMap) {
    return new EnvStore(envMap);
  }

  /**
   * Returns the requested value if set and non-blank, or {@code defaultValue} otherwise.
   */
  public String getOptional(String envKey, String defaultValue) {
    String value = envMap.get(envKey);
    return StringUtils.isBlank(value) ? defaultValue : value.trim();
  }

  /**
   * Returns the requested value, or throws if it is missing or blank.
   */
  public String getRequired(String envKey) {
    String value = envMap.get(envKey);
    if (StringUtils.isBlank(value)) {
      throw ConfigException.notFound(envKey);
    }
    return value.trim();
  }

  public long getOptionalLong(String envKey, long defaultValue) {
    String value = envMap.get(envKey);
    if (StringUtils.isBlank(value)) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw ConfigException.invalidValue(envKey, value, "a long integer");
    }
  }

  /**
   * Reads a whole number of seconds. Negative values are rejected.
   */
  public Duration getOptionalSeconds(String envKey, long defaultSeconds) {
    long seconds = getOptionalLong(envKey, defaultSeconds);
    if (seconds < 0) {
      throw ConfigException.invalidValue(envKey, String.valueOf(seconds), "a non-negative number of seconds");
    }
    return Duration.ofSeconds(seconds);
  }

  /**
   * List of comma-separated strings. Any whitespace is cleaned up automatically.
   */
  public List<String> getOptionalStringList(String envKey) {
    return Splitter.on(',')
        .trimResults()
        .omitEmptyStrings()
        .splitToList(StringUtils.defaultString(envMap.get(envKey)));
  }

  /**
   * Returns whether the setting is present at all, whatever its value.
   */
  public boolean isPresent(String envKey) {
    return envMap.containsKey(envKey);
  }
}
