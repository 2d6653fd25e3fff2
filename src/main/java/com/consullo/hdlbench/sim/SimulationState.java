package com.consullo.hdlbench.sim;

/**
 * Stages of a simulation attempt.
 *
 * <pre>
 * NOT_STARTED -&gt; COMPILING -&gt; RUNNING -&gt; SUCCEEDED
 *      \______________\___________\______&gt; FELL_BACK_TO_SYNTHETIC
 * </pre>
 */
public enum SimulationState {
  NOT_STARTED,
  COMPILING,
  RUNNING,
  SUCCEEDED,
  FELL_BACK_TO_SYNTHETIC;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FELL_BACK_TO_SYNTHETIC;
  }

  public boolean canTransitionTo(SimulationState next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FELL_BACK_TO_SYNTHETIC) {
      return true;
    }
    switch (this) {
      case NOT_STARTED:
        return next == COMPILING;
      case COMPILING:
        return next == RUNNING;
      case RUNNING:
        return next == SUCCEEDED;
      default:
        return false;
    }
  }
}
