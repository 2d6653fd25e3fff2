package com.consullo.hdlbench.trace;

/**
 * Entry of the global {@link ChangeLog}.
 *
 * @param time timestamp in trace time units
 * @param identifier trace identifier of the signal
 * @param value new value
 */
public record TraceEvent(long time, String identifier, SignalValue value) {

  public TraceEvent {
    if (identifier == null || value == null) {
      throw new IllegalArgumentException("identifier/value must not be null.");
    }
  }
}
