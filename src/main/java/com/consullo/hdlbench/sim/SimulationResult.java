package com.consullo.hdlbench.sim;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a simulation attempt. A trace file always exists when a result is returned.
 *
 * @param finalState {@link SimulationState#SUCCEEDED} or {@link SimulationState#FELL_BACK_TO_SYNTHETIC}
 * @param traceFile trace written by the simulator or by the synthetic generator
 * @param log collected tool output
 * @param fallbackReason why the synthetic trace was used, or null
 * @param history visited states in order
 * @since 1.0
 */
public record SimulationResult(
    SimulationState finalState,
    Path traceFile,
    String log,
    String fallbackReason,
    List<SimulationState> history) {

  public SimulationResult {
    history = List.copyOf(history);
  }

  public boolean usedSyntheticTrace() {
    return finalState == SimulationState.FELL_BACK_TO_SYNTHETIC;
  }

  public Optional<String> fallback() {
    return Optional.ofNullable(fallbackReason);
  }
}
