package com.consullo.hdlbench.sim;

import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable progress of one simulation attempt. Rejects transitions {@link SimulationState} does not allow.
 *
 * @since 1.0
 */
public final class SimulationRun {

  private static final Logger LOGGER = LoggerFactory.getLogger(SimulationRun.class);

  private final List<SimulationState> history = new ArrayList<>();
  private final StringBuilder log = new StringBuilder();
  private SimulationState state = SimulationState.NOT_STARTED;
  private String fallbackReason;

  public SimulationRun() {
    history.add(state);
  }

  public SimulationState state() {
    return state;
  }

  public List<SimulationState> history() {
    return List.copyOf(history);
  }

  public String fallbackReason() {
    return fallbackReason;
  }

  public String log() {
    return log.toString();
  }

  /**
   * Moves to {@code next}.
   *
   * @param next next state
   * @throws IllegalStateException when the transition is not allowed
   */
  public void advance(SimulationState next) {
    Validate.notNull(next, "next must not be null");
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal simulation transition " + state + " -> " + next);
    }
    LOGGER.debug("Simulation {} -> {}", state, next);
    state = next;
    history.add(next);
  }

  /**
   * Moves to {@link SimulationState#FELL_BACK_TO_SYNTHETIC}, remembering why.
   *
   * @param reason fallback reason
   */
  public void fallBack(String reason) {
    advance(SimulationState.FELL_BACK_TO_SYNTHETIC);
    fallbackReason = reason;
  }

  public void appendLog(String heading, String text) {
    log.append("== ").append(heading).append(" ==\n");
    if (text != null && !text.isEmpty()) {
      log.append(text);
      if (!text.endsWith("\n")) {
        log.append('\n');
      }
    }
  }
}
