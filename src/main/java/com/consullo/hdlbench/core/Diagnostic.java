package com.consullo.hdlbench.core;

/**
 * A single finding produced while validating HDL text.
 *
 * @param severity finding severity
 * @param message human readable message (without the severity prefix)
 * @since 1.0
 */
public record Diagnostic(Severity severity, String message) {

  public Diagnostic {
    if (severity == null || message == null) {
      throw new IllegalArgumentException("severity/message must not be null.");
    }
  }

  public static Diagnostic error(String message) {
    return new Diagnostic(Severity.ERROR, message);
  }

  public static Diagnostic warning(String message) {
    return new Diagnostic(Severity.WARNING, message);
  }

  public static Diagnostic info(String message) {
    return new Diagnostic(Severity.INFO, message);
  }

  public boolean isError() {
    return severity.isBlocking();
  }

  @Override
  public String toString() {
    return severity.label() + ": " + message;
  }
}
