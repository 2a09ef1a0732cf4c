package com.mesosphere.secretsmanager.common;

import com.codahale.metrics.jvm.ThreadDump;

import java.lang.management.ManagementFactory;

/**
 * Exits the secrets manager process after a fatal error, printing the thread state first so that
 * deadlocks and stuck reconciliations can be diagnosed from the container logs.
 */
public final class ProcessExit {

  public static final Code SUCCESS = new Code(0, "SUCCESS");
  public static final Code INITIALIZATION_FAILURE = new Code(1, "INITIALIZATION_FAILURE");
  public static final Code BACKEND_LOGIN_FAILURE = new Code(2, "BACKEND_LOGIN_FAILURE");
  public static final Code DEADLOCK_ENCOUNTERED = new Code(3, "DEADLOCK_ENCOUNTERED");

  private ProcessExit() {
    // do not instantiate
  }

  /**
   * Immediately exits the process with the value of the provided {@link Code}.
   */
  @SuppressWarnings("DM_EXIT")
  public static void exit(Code code) {
    String message = String.format("Process exiting immediately with code: %s[%d]", code, code.getValue());
    System.err.println(message);
    System.err.println("Printing final thread state...");
    new ThreadDump(ManagementFactory.getThreadMXBean()).dump(System.err);
    System.exit(code.getValue());
  }

  /**
   * Similar to {@link #exit(Code)}, except also prints the stack trace of the exception which caused
   * the exit.
   */
  public static void exit(Code code, Throwable e) {
    e.printStackTrace(System.err);
    exit(code);
  }

  /**
   * A reason for the process to exit.
   */
  public static final class Code {
    private final int value;
    private final String name;

    private Code(int value, String name) {
      this.value = value;
      this.name = name;
    }

    public int getValue() {
      return value;
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
