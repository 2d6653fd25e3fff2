package com.consullo.hdlbench.module;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Name-based detection of clock and reset inputs.
 *
 * <p>A name containing {@code clk} or {@code clock} (case-insensitive) marks a clock; {@code rst} or {@code reset}
 * marks a reset. Only the first matching input of each role is used, and an input already chosen as the clock is
 * never also the reset.
 */
public final class ControlSignals {

  private ControlSignals() {
  }

  public static boolean isClockName(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return lower.contains("clk") || lower.contains("clock");
  }

  public static boolean isResetName(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return lower.contains("rst") || lower.contains("reset");
  }

  /**
   * Returns the first input whose name marks a clock.
   *
   * @param inputs inputs in declaration order
   * @return clock input, if any
   */
  public static Optional<Port> clock(List<Port> inputs) {
    return inputs.stream().filter(p -> isClockName(p.name())).findFirst();
  }

  /**
   * Returns the first input, other than the clock, whose name marks a reset.
   *
   * @param inputs inputs in declaration order
   * @return reset input, if any
   */
  public static Optional<Port> reset(List<Port> inputs) {
    Optional<Port> clock = clock(inputs);
    return inputs.stream()
        .filter(p -> isResetName(p.name()))
        .filter(p -> clock.isEmpty() || !clock.get().name().equals(p.name()))
        .findFirst();
  }
}
