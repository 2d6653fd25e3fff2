package com.consullo.hdlbench.module;

/**
 * Module port.
 *
 * @param name port identifier
 * @param direction port direction
 * @param width bit width, at least 1
 * @param msb most significant bit index as declared ({@code 0} for scalars)
 * @param lsb least significant bit index as declared ({@code 0} for scalars)
 * @since 1.0
 */
public record Port(String name, PortDirection direction, int width, int msb, int lsb) {

  public Port {
    if (name == null || name.isEmpty() || direction == null) {
      throw new IllegalArgumentException("name/direction must not be blank.");
    }
    if (width < 1) {
      throw new IllegalArgumentException("width must be positive: " + width);
    }
  }

  public static Port scalar(String name, PortDirection direction) {
    return new Port(name, direction, 1, 0, 0);
  }

  public static Port ranged(String name, PortDirection direction, int msb, int lsb) {
    return new Port(name, direction, Math.abs(msb - lsb) + 1, msb, lsb);
  }

  public boolean isVector() {
    return width > 1;
  }

  /**
   * Returns the declared range, e.g. {@code [7:0]}, or an empty string for scalars.
   *
   * @return range text
   */
  public String rangeText() {
    return isVector() ? "[" + msb + ":" + lsb + "]" : "";
  }
}
