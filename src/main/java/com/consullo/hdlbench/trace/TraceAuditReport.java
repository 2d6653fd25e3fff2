package com.consullo.hdlbench.trace;

import java.util.List;

/**
 * Result of {@link TraceAudit#audit(SignalTable)}.
 *
 * @param clockSignals names of likely clocks
 * @param resetSignals names of likely resets
 * @param activeSignals number of signals with more than one change
 * @param inactiveSignals number of signals with at most one change
 * @param unknownValueSignals names of signals that ever carry an {@code x} or {@code z} bit
 * @since 1.0
 */
public record TraceAuditReport(
    List<String> clockSignals,
    List<String> resetSignals,
    int activeSignals,
    int inactiveSignals,
    List<String> unknownValueSignals) {

  public TraceAuditReport {
    clockSignals = List.copyOf(clockSignals);
    resetSignals = List.copyOf(resetSignals);
    unknownValueSignals = List.copyOf(unknownValueSignals);
  }

  public boolean hasUnknownValues() {
    return !unknownValueSignals.isEmpty();
  }

  /**
   * Plain-text summary, one finding per line.
   *
   * @return report text
   */
  public String render() {
    StringBuilder sb = new StringBuilder(256);
    if (clockSignals.isEmpty()) {
      sb.append("No clock signals detected\n");
    } else {
      sb.append("Found ").append(clockSignals.size()).append(" clock signal(s): ")
          .append(String.join(", ", clockSignals)).append('\n');
    }
    if (resetSignals.isEmpty()) {
      sb.append("No reset signals detected\n");
    } else {
      sb.append("Found ").append(resetSignals.size()).append(" reset signal(s): ")
          .append(String.join(", ", resetSignals)).append('\n');
    }
    sb.append("Active signals: ").append(activeSignals).append('\n');
    sb.append("Inactive signals: ").append(inactiveSignals).append('\n');
    if (unknownValueSignals.isEmpty()) {
      sb.append("No X/Z values detected\n");
    } else {
      sb.append("Signals with X/Z values: ").append(unknownValueSignals.size()).append(" (")
          .append(String.join(", ", unknownValueSignals)).append(")\n");
    }
    return sb.toString();
  }
}
