package com.consullo.hdlbench.trace;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Every value change of a trace in file order.
 *
 * @since 1.0
 */
public final class ChangeLog {

  private static final ChangeLog EMPTY = new ChangeLog(List.of());

  private final List<TraceEvent> events;

  public ChangeLog(List<TraceEvent> events) {
    this.events = List.copyOf(events);
  }

  public static ChangeLog empty() {
    return EMPTY;
  }

  public List<TraceEvent> events() {
    return events;
  }

  public int size() {
    return events.size();
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  /**
   * Distinct timestamps carrying at least one change, ascending.
   *
   * @return time points
   */
  public List<Long> timePoints() {
    TreeSet<Long> times = new TreeSet<>();
    for (TraceEvent e : events) {
      times.add(e.time());
    }
    return new ArrayList<>(times);
  }

  public long endTime() {
    long end = 0;
    for (TraceEvent e : events) {
      end = Math.max(end, e.time());
    }
    return end;
  }
}
