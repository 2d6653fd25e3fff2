package com.consullo.hdlbench.module;

/**
 * Internal signal declared inside a module body.
 *
 * @param name identifier
 * @param kind wire or reg
 * @param width bit width, at least 1
 */
public record Signal(String name, SignalKind kind, int width) {

  public Signal {
    if (name == null || name.isEmpty() || kind == null) {
      throw new IllegalArgumentException("name/kind must not be blank.");
    }
    if (width < 1) {
      throw new IllegalArgumentException("width must be positive: " + width);
    }
  }
}
