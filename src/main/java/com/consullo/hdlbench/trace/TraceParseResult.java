package com.consullo.hdlbench.trace;

import java.util.List;

/**
 * Immutable outcome of one {@link TraceParser} run.
 *
 * @param timescale declared time unit, or {@link Timescale#DEFAULT}
 * @param signals declared signals with their changes
 * @param changes global change log in file order
 * @param anomalies skipped or repaired lines
 * @param finalState parser state at end of input
 * @since 1.0
 */
public record TraceParseResult(
    Timescale timescale,
    SignalTable signals,
    ChangeLog changes,
    List<TraceAnomaly> anomalies,
    TraceParser.State finalState) {

  public TraceParseResult {
    if (timescale == null || signals == null || changes == null || finalState == null) {
      throw new IllegalArgumentException("timescale/signals/changes/finalState must not be null.");
    }
    anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
  }

  /**
   * False when the trace declared no variables, which callers report as "no signals found".
   */
  public boolean hasSignals() {
    return !signals.isEmpty();
  }

  public boolean headerComplete() {
    return finalState == TraceParser.State.BODY;
  }
}
