package com.consullo.hdlbench.trace;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Time unit of a trace.
 *
 * @param magnitude integer multiplier, e.g. 10 in {@code 10ps}
 * @param unit unit text as written
 * @param secondsPerUnit {@code magnitude} times the unit in seconds
 * @since 1.0
 */
public record Timescale(long magnitude, String unit, double secondsPerUnit) {

  /** Used when a trace declares no timescale: 1 ns. */
  public static final Timescale DEFAULT = new Timescale(1, "ns", 1e-9);

  private static final double FALLBACK_UNIT_SECONDS = 1e-9;
  private static final Pattern DECLARATION = Pattern.compile("(\\d+)\\s*([A-Za-z]+)");
  private static final Map<String, Double> UNIT_SECONDS = Map.of(
      "s", 1e0,
      "ms", 1e-3,
      "us", 1e-6,
      "ns", 1e-9,
      "ps", 1e-12,
      "fs", 1e-15);

  /**
   * Parses the body of a {@code $timescale} declaration such as {@code 1ns}, {@code 10 ps} or
   * {@code $timescale 1ns $end}. An unrecognized unit is taken as nanoseconds.
   *
   * @param text declaration text
   * @return timescale, or {@link #DEFAULT} when no {@code <integer> <unit>} pair is present
   */
  public static Timescale parse(String text) {
    if (text == null) {
      return DEFAULT;
    }
    Matcher m = DECLARATION.matcher(text.replace("$timescale", " ").replace("$end", " "));
    if (!m.find()) {
      return DEFAULT;
    }
    long magnitude;
    try {
      magnitude = Long.parseLong(m.group(1));
    } catch (NumberFormatException e) {
      return DEFAULT;
    }
    String unit = m.group(2);
    double seconds = UNIT_SECONDS.getOrDefault(unit.toLowerCase(Locale.ROOT), FALLBACK_UNIT_SECONDS);
    return new Timescale(magnitude, unit, magnitude * seconds);
  }

  @Override
  public String toString() {
    return magnitude + unit;
  }
}
