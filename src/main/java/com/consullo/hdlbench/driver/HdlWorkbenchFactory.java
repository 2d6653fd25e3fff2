package com.consullo.hdlbench.driver;

import com.consullo.hdlbench.logic.LogicInferenceEngine;
import com.consullo.hdlbench.logic.TieBreakPolicy;
import com.consullo.hdlbench.sim.IcarusVerilogSimulator;
import com.consullo.hdlbench.sim.SimulationRunner;
import com.consullo.hdlbench.sim.Simulator;
import com.consullo.hdlbench.sim.SimulatorConfig;
import com.consullo.hdlbench.testbench.TestbenchConfig;
import com.consullo.hdlbench.testbench.TestbenchSynthesizer;
import com.consullo.hdlbench.trace.SyntheticTraceConfig;
import com.consullo.hdlbench.trace.SyntheticTraceGenerator;
import java.util.Map;

/**
 * Factory for workbenches with sensible defaults.
 *
 * <p>
 * Centralizes:
 * <ul>
 * <li>simulator selection and its environment overrides</li>
 * <li>testbench timing and synthetic trace shape</li>
 * <li>the truth-table tie-break policy</li>
 * </ul>
 * </p>
 */
public final class HdlWorkbenchFactory {

  private HdlWorkbenchFactory() {
  }

  /**
   * Workbench using Icarus Verilog configured from the process environment.
   *
   * @return workbench
   */
  public static HdlWorkbench createDefault() {
    return createFromEnvironment(System.getenv());
  }

  /**
   * Workbench using Icarus Verilog configured from {@code env}; see {@link SimulatorConfig#fromEnvironment(Map)}.
   *
   * @param env environment variables
   * @return workbench
   */
  public static HdlWorkbench createFromEnvironment(Map<String, String> env) {
    SimulatorConfig simulatorConfig = SimulatorConfig.fromEnvironment(env);
    return create(new IcarusVerilogSimulator(simulatorConfig), simulatorConfig, TestbenchConfig.defaults(),
        SyntheticTraceConfig.defaults(), TieBreakPolicy.EARLIEST_OBSERVED);
  }

  /**
   * Workbench over an arbitrary simulator.
   *
   * @param simulator simulator collaborator
   * @param simulatorConfig artifact and trace naming, timeouts
   * @param testbenchConfig testbench timing
   * @param traceConfig synthetic fallback shape
   * @param tieBreakPolicy truth-table tie-break
   * @return workbench
   */
  public static HdlWorkbench create(
      Simulator simulator,
      SimulatorConfig simulatorConfig,
      TestbenchConfig testbenchConfig,
      SyntheticTraceConfig traceConfig,
      TieBreakPolicy tieBreakPolicy) {
    if (simulator == null || simulatorConfig == null || testbenchConfig == null || traceConfig == null
        || tieBreakPolicy == null) {
      throw new IllegalArgumentException("factory arguments must not be null.");
    }
    if (!testbenchConfig.dumpFile().equals(simulatorConfig.traceFileName())) {
      throw new IllegalArgumentException("testbench dump file '" + testbenchConfig.dumpFile()
          + "' differs from simulator trace file '" + simulatorConfig.traceFileName() + "'.");
    }
    SimulationRunner runner = new SimulationRunner(simulator, new SyntheticTraceGenerator(traceConfig),
        simulatorConfig);
    return HdlWorkbench.create(new TestbenchSynthesizer(testbenchConfig), runner,
        new LogicInferenceEngine(tieBreakPolicy));
  }
}
