package com.consullo.hdlbench.sim;

import com.consullo.hdlbench.module.ModuleInfo;
import com.consullo.hdlbench.module.Port;
import com.consullo.hdlbench.module.PortDirection;
import com.consullo.hdlbench.trace.SyntheticTraceGenerator;
import com.consullo.hdlbench.trace.TraceParser;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SimulationRunner} with a mocked simulator.
 */
public class SimulationRunnerTest {

  private static final String REAL_TRACE = "$timescale 1ns $end\n$var wire 1 ! a $end\n$enddefinitions $end\n"
      + "#0\n0!\n#10\n1!\n";

  @TempDir
  Path dir;

  private Simulator simulator;
  private SimulationRunner runner;
  private SimulationRequest request;

  @BeforeEach
  void setUp() {
    simulator = mock(Simulator.class);
    runner = new SimulationRunner(simulator, new SyntheticTraceGenerator(), SimulatorConfig.defaults());
    ModuleInfo.Builder b = ModuleInfo.builder().name("and_gate");
    b.addPort(Port.scalar("a", PortDirection.INPUT));
    b.addPort(Port.scalar("b", PortDirection.INPUT));
    b.addPort(Port.scalar("y", PortDirection.OUTPUT));
    request = new SimulationRequest(dir.resolve("and_gate.v"), dir.resolve("and_gate_tb.v"), b.build(), dir);
  }

  @Test
  @DisplayName("Should fall back to a synthetic trace when no simulator is installed")
  void run_SimulatorUnavailable_FallsBack() throws Exception {
    when(simulator.isAvailable()).thenReturn(false);

    SimulationResult result = runner.run(request);

    assertThat(result.usedSyntheticTrace()).isTrue();
    assertThat(result.fallback()).contains("simulator not available");
    assertThat(result.history()).containsExactly(SimulationState.NOT_STARTED, SimulationState.FELL_BACK_TO_SYNTHETIC);
    assertThat(result.traceFile()).isEqualTo(dir.resolve("wave.vcd"));
    assertThat(new TraceParser().parseFile(result.traceFile()).signals().names()).containsExactly("a", "b", "y");
    verify(simulator, never()).compile(any(), any(), any());
  }

  @Test
  void run_CompileFailure_FallsBackWithCompilerOutput() throws Exception {
    when(simulator.isAvailable()).thenReturn(true);
    when(simulator.compile(any(), any(), any())).thenReturn(ProcessOutcome.exited(2, "and_gate.v:3: syntax error"));

    SimulationResult result = runner.run(request);

    assertThat(result.finalState()).isEqualTo(SimulationState.FELL_BACK_TO_SYNTHETIC);
    assertThat(result.fallbackReason()).isEqualTo("compilation exit code 2");
    assertThat(result.history()).containsExactly(SimulationState.NOT_STARTED, SimulationState.COMPILING,
        SimulationState.FELL_BACK_TO_SYNTHETIC);
    assertThat(result.log()).contains("== compile ==").contains("syntax error").contains("== fallback ==");
    verify(simulator, never()).run(any(), any());
  }

  @Test
  void run_SimulationTimeout_FallsBack() throws Exception {
    when(simulator.isAvailable()).thenReturn(true);
    when(simulator.compile(any(), any(), any())).thenReturn(ProcessOutcome.exited(0, ""));
    when(simulator.run(any(), any())).thenReturn(ProcessOutcome.timedOut("partial"));

    SimulationResult result = runner.run(request);

    assertThat(result.fallback()).contains("simulation timed out");
    assertThat(result.history()).endsWith(SimulationState.RUNNING, SimulationState.FELL_BACK_TO_SYNTHETIC);
  }

  @Test
  @DisplayName("Should fall back when the simulator exits cleanly but writes no trace")
  void run_MissingTrace_FallsBack() throws Exception {
    when(simulator.isAvailable()).thenReturn(true);
    when(simulator.compile(any(), any(), any())).thenReturn(ProcessOutcome.exited(0, ""));
    when(simulator.run(any(), any())).thenReturn(ProcessOutcome.exited(0, "done"));

    SimulationResult result = runner.run(request);

    assertThat(result.fallback()).contains("simulation produced no trace file wave.vcd");
    assertThat(Files.exists(result.traceFile())).isTrue();
  }

  @Test
  @DisplayName("Should not mistake a trace left by an earlier run for fresh output")
  void run_StaleTrace_Deleted() throws Exception {
    Files.writeString(dir.resolve("wave.vcd"), REAL_TRACE, StandardCharsets.UTF_8);
    when(simulator.isAvailable()).thenReturn(true);
    when(simulator.compile(any(), any(), any())).thenReturn(ProcessOutcome.exited(0, ""));
    when(simulator.run(any(), any())).thenReturn(ProcessOutcome.exited(0, ""));

    SimulationResult result = runner.run(request);

    assertThat(result.usedSyntheticTrace()).isTrue();
  }

  @Test
  void run_Success_UsesSimulatorTrace() throws Exception {
    when(simulator.isAvailable()).thenReturn(true);
    when(simulator.compile(any(), any(), any())).thenReturn(ProcessOutcome.exited(0, ""));
    when(simulator.run(any(), any())).thenAnswer(invocation -> {
      Path workDir = invocation.getArgument(1);
      Files.writeString(workDir.resolve("wave.vcd"), REAL_TRACE, StandardCharsets.UTF_8);
      return ProcessOutcome.exited(0, "Simulation completed successfully\n");
    });

    SimulationResult result = runner.run(request);

    assertThat(result.finalState()).isEqualTo(SimulationState.SUCCEEDED);
    assertThat(result.usedSyntheticTrace()).isFalse();
    assertThat(result.fallback()).isEmpty();
    assertThat(result.history()).containsExactly(SimulationState.NOT_STARTED, SimulationState.COMPILING,
        SimulationState.RUNNING, SimulationState.SUCCEEDED);
    assertThat(result.log()).contains("Simulation completed successfully");
    assertThat(Files.readString(result.traceFile())).isEqualTo(REAL_TRACE);
    verify(simulator).compile(request.designFile(), request.testbenchFile(), dir.resolve("simulation.vvp"));
    verify(simulator).run(dir.resolve("simulation.vvp"), dir);
  }

  @Test
  void runAsync_CompletesOnWorkerThread() throws Exception {
    when(simulator.isAvailable()).thenReturn(false);

    SimulationResult result = runner.runAsync(request).get(10, TimeUnit.SECONDS);

    assertThat(result.usedSyntheticTrace()).isTrue();
  }
}
