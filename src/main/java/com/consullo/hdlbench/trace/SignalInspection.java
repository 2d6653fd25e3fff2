package com.consullo.hdlbench.trace;

/**
 * Value of one signal at an inspected time.
 *
 * @param name short name
 * @param fullName hierarchical name
 * @param width declared width
 * @param time inspected time
 * @param value value at {@code time}
 * @since 1.0
 */
public record SignalInspection(String name, String fullName, int width, long time, SignalValue value) {

  /**
   * E.g. {@code data [8 bits] @ 120: 0xA5 (165)}.
   */
  public String render() {
    return name + " [" + width + (width == 1 ? " bit" : " bits") + "] @ " + time + ": " + value.describe();
  }
}
