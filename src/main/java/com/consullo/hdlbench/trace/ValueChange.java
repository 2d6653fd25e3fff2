package com.consullo.hdlbench.trace;

/**
 * One recorded value change of a signal.
 *
 * @param time timestamp in trace time units
 * @param value new value
 */
public record ValueChange(long time, SignalValue value) {

  public ValueChange {
    if (value == null) {
      throw new IllegalArgumentException("value must not be null.");
    }
  }
}
