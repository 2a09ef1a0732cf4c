package com.mesosphere.secretsmanager.common;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility methods around construction of loggers.
 */
public final class LoggingUtils {

  private LoggingUtils() {
  }

  /**
   * Creates a logger which is tagged with the provided class.
   *
   * @param clazz the class using this logger
   */
  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz.getSimpleName());
  }

  /**
   * Creates a logger which is tagged with the provided class and a label, typically the
   * {@code namespace/name} of the record being reconciled or the backend being talked to. Every line
   * logged through the returned logger can then be attributed without repeating the label in each
   * message.
   *
   * @param clazz the class using this logger
   * @param label the context label, ignored when blank
   */
  public static Logger getLogger(Class<?> clazz, String label) {
    if (StringUtils.isBlank(label)) {
      return getLogger(clazz);
    }
    return LoggerFactory.getLogger(String.format("(%s) %s", label, clazz.getSimpleName()));
  }
}
