package com.consullo.hdlbench.sim;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Command-line construction for the Icarus Verilog toolchain, checked against a mocked executor.
 *
 * @since 1.0
 */
public class IcarusVerilogSimulatorTest {

  private final ProcessExecutor executor = mock(ProcessExecutor.class);
  private final SimulatorConfig config = SimulatorConfig.defaults();
  private final IcarusVerilogSimulator simulator = new IcarusVerilogSimulator(config, executor);

  @Test
  void isAvailable_ChecksVersion() {
    when(executor.execute(eq(List.of("iverilog", "-V")), isNull(), eq(config.availabilityTimeout())))
        .thenReturn(ProcessOutcome.exited(0, "Icarus Verilog version 12.0"));

    assertThat(simulator.isAvailable()).isTrue();
  }

  @Test
  void isAvailable_MissingBinary_False() {
    when(executor.execute(any(), any(), any())).thenReturn(ProcessOutcome.failedToStart("No such file"));

    assertThat(simulator.isAvailable()).isFalse();
  }

  @Test
  void compile_BuildsIverilogCommand() {
    Path dir = Path.of("work");
    when(executor.execute(any(), any(), any())).thenReturn(ProcessOutcome.exited(0, ""));

    simulator.compile(dir.resolve("adder.v"), dir.resolve("adder_tb.v"), dir.resolve("simulation.vvp"));

    verify(executor).execute(List.of("iverilog", "-o", dir.resolve("simulation.vvp").toString(), "-g2012",
        dir.resolve("adder.v").toString(), dir.resolve("adder_tb.v").toString()), null, config.compileTimeout());
  }

  @Test
  void run_ArtifactInWorkDir_RelativePath() {
    Path dir = Path.of("work");
    when(executor.execute(any(), any(), any())).thenReturn(ProcessOutcome.exited(0, ""));

    simulator.run(dir.resolve("simulation.vvp"), dir);

    verify(executor).execute(List.of("vvp", "simulation.vvp"), dir, config.runTimeout());
  }

  @Test
  void outcome_DescribesFailures() {
    assertThat(ProcessOutcome.exited(0, null).succeeded()).isTrue();
    assertThat(ProcessOutcome.exited(3, "").describeFailure()).isEqualTo("exit code 3");
    assertThat(ProcessOutcome.timedOut("").describeFailure()).isEqualTo("timed out");
    assertThat(ProcessOutcome.failedToStart("boom").describeFailure()).isEqualTo("could not start: boom");
  }
}
