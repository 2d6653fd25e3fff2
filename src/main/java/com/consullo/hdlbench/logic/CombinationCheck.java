package com.consullo.hdlbench.logic;

import com.consullo.hdlbench.trace.BitValue;
import java.util.List;
import java.util.Optional;

/**
 * Canonical versus observed output for one input combination.
 *
 * @param inputs input bits
 * @param expected canonical output
 * @param observed observed output, or null when the combination was never observed
 * @param status comparison outcome
 * @since 1.0
 */
public record CombinationCheck(List<BitValue> inputs, BitValue expected, BitValue observed, CombinationStatus status) {

  public CombinationCheck {
    inputs = List.copyOf(inputs);
    if (expected == null || status == null) {
      throw new IllegalArgumentException("expected/status must not be null.");
    }
  }

  public Optional<BitValue> observedOutput() {
    return Optional.ofNullable(observed);
  }
}
