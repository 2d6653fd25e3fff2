package com.consullo.hdlbench.demo;

import com.consullo.hdlbench.core.Diagnostic;
import com.consullo.hdlbench.driver.HdlWorkbench;
import com.consullo.hdlbench.driver.HdlWorkbenchFactory;
import com.consullo.hdlbench.driver.TestbenchOutcome;
import com.consullo.hdlbench.logic.LogicAnalysis;
import com.consullo.hdlbench.module.Port;
import com.consullo.hdlbench.sim.SimulationResult;
import com.consullo.hdlbench.syntax.SyntaxCheckResult;
import com.consullo.hdlbench.trace.SignalInspection;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * End-to-end demo: check a design, generate its testbench, simulate (or fall back to a synthetic trace), then
 * audit the trace and infer the gate of the first 1-bit output.
 *
 * <p>Usage: {@code WorkbenchDemo [design.v] [outputDir]}. Without a design file a two-input AND gate is used.
 *
 * @since 1.0
 */
public final class WorkbenchDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkbenchDemo.class);

  private static final String SAMPLE_DESIGN = String.join("\n",
      "// two-input AND gate",
      "module and_gate (",
      "    input a,",
      "    input b,",
      "    output y",
      ");",
      "    assign y = a & b;",
      "endmodule",
      "");

  private WorkbenchDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional design file and output directory
   * @throws Exception if the demo fails
   */
  public static void main(final String[] args) throws Exception {
    final Path outDir = Path.of(args.length > 1 ? args[1] : "hdlbench-out").toAbsolutePath().normalize();
    final HdlWorkbench workbench = HdlWorkbenchFactory.createDefault();

    final SyntaxCheckResult syntax = args.length > 0
        ? workbench.loadDesignFile(Path.of(args[0]))
        : workbench.loadDesign(SAMPLE_DESIGN);
    System.out.println("=== Syntax (" + syntax.version().displayName() + ") ===");
    for (Diagnostic d : syntax.diagnostics()) {
      System.out.println(d);
    }

    final TestbenchOutcome outcome = workbench.generateTestbench(20);
    if (!outcome.generated()) {
      System.out.println("Testbench not generated: design has structural errors.");
      return;
    }
    System.out.println("=== Testbench ===");
    System.out.print(outcome.testbench());

    final SimulationResult sim = workbench.simulate(outDir);
    LOGGER.info("Simulation finished in state {}", sim.finalState());
    System.out.println("=== Simulation: " + sim.finalState() + sim.fallback().map(r -> " (" + r + ")").orElse("")
        + " ===");
    System.out.print(workbench.audit().render());

    System.out.println("=== Values at t=100 ===");
    for (SignalInspection i : workbench.inspect(100, List.of())) {
      System.out.println(i.render());
    }

    final List<String> inputs = new ArrayList<>();
    for (Port p : workbench.moduleInfo().inputs()) {
      if (!p.isVector()) {
        inputs.add(p.name());
      }
    }
    final Port output = workbench.moduleInfo().outputs().stream()
        .filter(p -> !p.isVector()).findFirst().orElse(null);
    if (inputs.isEmpty() || output == null) {
      System.out.println("No 1-bit inputs and output to analyse.");
      return;
    }
    final LogicAnalysis analysis = workbench.inferLogic(inputs, output.name());
    System.out.println("=== Logic analysis ===");
    System.out.print(analysis.render());
    workbench.exportCsv(outDir.resolve("changes.csv"));
    workbench.exportJson(analysis, outDir.resolve("analysis.json"));
    LOGGER.info("Demo completed, results in {}", outDir);
  }
}
