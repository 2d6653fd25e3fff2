package com.consullo.hdlbench.core;

/**
 * Severity of a {@link Diagnostic}.
 *
 * <p>Only {@link #ERROR} blocks testbench synthesis. Warnings and informational findings are shown to the caller
 * but never change the validity verdict.
 */
public enum Severity {
  ERROR("ERROR"),
  WARNING("WARNING"),
  INFO("INFO");

  private final String label;

  Severity(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public boolean isBlocking() {
    return this == ERROR;
  }
}
