package com.consullo.hdlbench.trace;

import java.util.OptionalLong;
import org.apache.commons.lang3.Validate;

/**
 * Side-by-side summary of two signals.
 *
 * @param first first signal
 * @param second second signal
 * @since 1.0
 */
public record SignalComparison(SignalRecord first, SignalRecord second) {

  public SignalComparison {
    Validate.notNull(first, "first must not be null");
    Validate.notNull(second, "second must not be null");
  }

  public static SignalComparison of(SignalRecord first, SignalRecord second) {
    return new SignalComparison(first, second);
  }

  public boolean widthsMatch() {
    return first.width() == second.width();
  }

  public int changeCountDifference() {
    return first.changeCount() - second.changeCount();
  }

  public static OptionalLong firstChangeTime(SignalRecord record) {
    return record.firstChange().map(c -> OptionalLong.of(c.time())).orElse(OptionalLong.empty());
  }

  public static OptionalLong lastChangeTime(SignalRecord record) {
    return record.lastChange().map(c -> OptionalLong.of(c.time())).orElse(OptionalLong.empty());
  }

  /**
   * Plain-text comparison table.
   *
   * @return report text
   */
  public String render() {
    StringBuilder sb = new StringBuilder(256);
    row(sb, "Name", first.name(), second.name());
    row(sb, "Type", first.kind(), second.kind());
    row(sb, "Width", first.width() + " bit(s)", second.width() + " bit(s)");
    row(sb, "Changes", String.valueOf(first.changeCount()), String.valueOf(second.changeCount()));
    row(sb, "First change", time(firstChangeTime(first)), time(firstChangeTime(second)));
    row(sb, "Last change", time(lastChangeTime(first)), time(lastChangeTime(second)));
    sb.append("Width match: ").append(widthsMatch() ? "yes" : "no").append('\n');
    return sb.toString();
  }

  private static void row(StringBuilder sb, String label, String a, String b) {
    sb.append(String.format("%-14s %-20s %-20s%n", label + ":", a, b));
  }

  private static String time(OptionalLong t) {
    return t.isPresent() ? String.valueOf(t.getAsLong()) : "-";
  }
}
