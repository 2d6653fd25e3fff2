package com.consullo.hdlbench.trace;

import com.consullo.hdlbench.module.ControlSignals;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Name and activity based health check of a parsed trace.
 *
 * <p>A clock is a 1-bit signal whose name marks a clock and that changes more than twice. A reset is any signal
 * whose name marks a reset.
 *
 * @since 1.0
 */
public final class TraceAudit {

  private static final int MIN_CLOCK_CHANGES = 3;

  public TraceAuditReport audit(SignalTable table) {
    Validate.notNull(table, "table must not be null");
    List<String> clocks = new ArrayList<>();
    List<String> resets = new ArrayList<>();
    List<String> unknown = new ArrayList<>();
    int active = 0;
    for (SignalRecord r : table.records()) {
      if (r.isScalar() && ControlSignals.isClockName(r.name()) && r.changeCount() >= MIN_CLOCK_CHANGES) {
        clocks.add(r.name());
      }
      if (ControlSignals.isResetName(r.name())) {
        resets.add(r.name());
      }
      if (r.changeCount() > 1) {
        active++;
      }
      if (r.everUnknown()) {
        unknown.add(r.name());
      }
    }
    return new TraceAuditReport(clocks, resets, active, table.size() - active, unknown);
  }
}
