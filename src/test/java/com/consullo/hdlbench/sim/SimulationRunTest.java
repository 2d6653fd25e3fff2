package com.consullo.hdlbench.sim;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SimulationRunTest {

  @Test
  void advance_FollowsLifecycle() {
    SimulationRun run = new SimulationRun();

    run.advance(SimulationState.COMPILING);
    run.advance(SimulationState.RUNNING);
    run.advance(SimulationState.SUCCEEDED);

    assertThat(run.state().isTerminal()).isTrue();
    assertThat(run.history()).containsExactly(SimulationState.NOT_STARTED, SimulationState.COMPILING,
        SimulationState.RUNNING, SimulationState.SUCCEEDED);
    assertThat(run.fallbackReason()).isNull();
  }

  @Test
  void advance_SkippingAState_Throws() {
    SimulationRun run = new SimulationRun();

    assertThatThrownBy(() -> run.advance(SimulationState.RUNNING))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Illegal simulation transition NOT_STARTED -> RUNNING");
  }

  @Test
  void fallBack_FromAnyNonTerminalState() {
    for (SimulationState s : SimulationState.values()) {
      assertThat(s.canTransitionTo(SimulationState.FELL_BACK_TO_SYNTHETIC)).isEqualTo(!s.isTerminal());
    }
    SimulationRun run = new SimulationRun();
    run.advance(SimulationState.COMPILING);
    run.fallBack("compilation exit code 1");

    assertThat(run.state()).isEqualTo(SimulationState.FELL_BACK_TO_SYNTHETIC);
    assertThat(run.fallbackReason()).isEqualTo("compilation exit code 1");
    assertThatThrownBy(() -> run.fallBack("again")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void appendLog_HeadingsAndTrailingNewline() {
    SimulationRun run = new SimulationRun();

    run.appendLog("compile", "ok");
    run.appendLog("run", "");

    assertThat(run.log()).isEqualTo("== compile ==\nok\n== run ==\n");
  }
}
