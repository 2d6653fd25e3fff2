package com.consullo.hdlbench.testbench;

import com.consullo.hdlbench.module.ControlSignals;
import com.consullo.hdlbench.module.ModuleInfo;
import com.consullo.hdlbench.module.Parameter;
import com.consullo.hdlbench.module.Port;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates a self-stimulating testbench for a module.
 *
 * <p>
 * The output is a pure function of the {@link ModuleInfo}, the vector count and the {@link TestbenchConfig}:
 * <ul>
 * <li>a {@code timescale} directive and a wrapper module {@code <name>_tb};</li>
 * <li>one parameter per module parameter, a {@code reg} per input, a {@code wire} per output and inout;</li>
 * <li>the module under test instantiated with every parameter and port connected by name, in declaration
 * order;</li>
 * <li>a free-running clock on the first clock-named input and a one-shot pulse on the first reset-named input;</li>
 * <li>random vectors, masked to each remaining input's width, applied {@code vectorCount} times;</li>
 * <li>a {@code $monitor} over inputs and outputs and a {@code $dumpvars} over the whole testbench scope.</li>
 * </ul>
 * </p>
 *
 * <p>The timing constants are emitted as {@code localparam}s, which also marks the text as Verilog-2001.
 *
 * @since 1.0
 */
public final class TestbenchSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TestbenchSynthesizer.class);

  private static final String INDENT = "    ";
  private static final String TB_SUFFIX = "_tb";
  private static final String CLOCK_CONSTANT = "TB_CLK_HALF_PERIOD";
  private static final String STEP_CONSTANT = "TB_VECTOR_STEP";
  private static final String LOOP_VARIABLE = "tb_vector";
  private static final int RANDOM_BITS = 32;

  private final TestbenchConfig config;

  public TestbenchSynthesizer() {
    this(TestbenchConfig.defaults());
  }

  public TestbenchSynthesizer(TestbenchConfig config) {
    Validate.notNull(config, "config must not be null");
    this.config = config;
  }

  public TestbenchConfig config() {
    return config;
  }

  /**
   * Returns the name of the testbench module generated for {@code info}.
   *
   * @param info module info
   * @return testbench module name
   */
  public static String testbenchName(ModuleInfo info) {
    return info.name() + TB_SUFFIX;
  }

  /**
   * Synthesizes the testbench text.
   *
   * @param info module to test; must have a name
   * @param vectorCount number of random stimulus vectors, at least 1
   * @return testbench HDL text
   */
  public String synthesize(ModuleInfo info, int vectorCount) {
    Validate.notNull(info, "info must not be null");
    Validate.isTrue(info.hasModule(), "info must name a module");
    Validate.isTrue(vectorCount >= 1, "vectorCount must be at least 1: %d", vectorCount);

    String tbName = testbenchName(info);
    Optional<Port> clock = ControlSignals.clock(info.inputs());
    Optional<Port> reset = ControlSignals.reset(info.inputs());
    List<Port> stimulated = new ArrayList<>();
    for (Port in : info.inputs()) {
      if (isSame(clock, in) || isSame(reset, in)) {
        continue;
      }
      stimulated.add(in);
    }

    StringBuilder sb = new StringBuilder(2048);
    line(sb, 0, "// Automatic testbench for " + info.name());
    line(sb, 0, "// Compile together with the design, e.g.: iverilog -o sim " + info.name() + ".v " + tbName + ".v");
    line(sb, 0, "`timescale " + config.timescale());
    blank(sb);
    line(sb, 0, "module " + tbName + ";");
    blank(sb);
    line(sb, 1, "// Timing");
    line(sb, 1, "localparam " + CLOCK_CONSTANT + " = " + config.clockHalfPeriod() + ";");
    line(sb, 1, "localparam " + STEP_CONSTANT + " = " + config.vectorStep() + ";");

    if (!info.parameters().isEmpty()) {
      blank(sb);
      line(sb, 1, "// Parameters");
      for (Parameter p : info.parameters()) {
        line(sb, 1, "parameter " + p.name() + " = " + p.valueExpr() + ";");
      }
    }

    declare(sb, "// Inputs", "reg", info.inputs());
    declare(sb, "// Outputs", "wire", info.outputs());
    declare(sb, "// Inouts", "wire", info.inouts());

    blank(sb);
    instantiate(sb, info);

    clock.ifPresent(c -> {
      blank(sb);
      line(sb, 1, "// Clock generation");
      line(sb, 1, "initial begin");
      line(sb, 2, c.name() + " = 0;");
      line(sb, 2, "forever #" + CLOCK_CONSTANT + " " + c.name() + " = ~" + c.name() + ";");
      line(sb, 1, "end");
    });

    reset.ifPresent(r -> {
      blank(sb);
      line(sb, 1, "// Reset generation");
      line(sb, 1, "initial begin");
      line(sb, 2, r.name() + " = 1;");
      line(sb, 2, "#" + config.resetReleaseDelay() + " " + r.name() + " = 0;");
      line(sb, 2, "#" + config.resetReassertDelay() + " " + r.name() + " = 1;");
      line(sb, 1, "end");
    });

    blank(sb);
    line(sb, 1, "// Stimulus");
    line(sb, 1, "integer " + LOOP_VARIABLE + ";");
    line(sb, 1, "initial begin");
    for (Port in : stimulated) {
      line(sb, 2, in.name() + " = 0;");
    }
    line(sb, 2, "#" + config.settleDelay() + ";");
    line(sb, 2, "for (" + LOOP_VARIABLE + " = 0; " + LOOP_VARIABLE + " < " + vectorCount + "; "
        + LOOP_VARIABLE + " = " + LOOP_VARIABLE + " + 1) begin");
    for (Port in : stimulated) {
      line(sb, 3, in.name() + " = " + randomValue(in.width()) + ";");
    }
    line(sb, 3, "#" + STEP_CONSTANT + ";");
    line(sb, 2, "end");
    line(sb, 2, "#" + config.finishDelay() + ";");
    line(sb, 2, "$display(\"Simulation completed successfully\");");
    line(sb, 2, "$finish;");
    line(sb, 1, "end");

    blank(sb);
    line(sb, 1, "// Monitor");
    line(sb, 1, "initial begin");
    line(sb, 2, monitor(info));
    line(sb, 1, "end");

    blank(sb);
    line(sb, 1, "// Trace dump");
    line(sb, 1, "initial begin");
    line(sb, 2, "$dumpfile(\"" + config.dumpFile() + "\");");
    line(sb, 2, "$dumpvars(0, " + tbName + ");");
    line(sb, 1, "end");
    blank(sb);
    line(sb, 0, "endmodule");

    LOGGER.debug("synthesize: {} with {} port(s), clock={}, reset={}, vectors={}", tbName, info.ports().size(),
        clock.map(Port::name).orElse("-"), reset.map(Port::name).orElse("-"), vectorCount);
    return sb.toString();
  }

  private void declare(StringBuilder sb, String heading, String keyword, List<Port> ports) {
    if (ports.isEmpty()) {
      return;
    }
    blank(sb);
    line(sb, 1, heading);
    for (Port p : ports) {
      String range = p.isVector() ? p.rangeText() + " " : "";
      line(sb, 1, keyword + " " + range + p.name() + ";");
    }
  }

  private void instantiate(StringBuilder sb, ModuleInfo info) {
    line(sb, 1, "// Unit under test");
    if (info.parameters().isEmpty()) {
      line(sb, 1, info.name() + " " + config.instanceName() + " (");
    } else {
      line(sb, 1, info.name() + " #(");
      List<String> overrides = new ArrayList<>();
      for (Parameter p : info.parameters()) {
        overrides.add(connection(p.name()));
      }
      joined(sb, overrides);
      line(sb, 1, ") " + config.instanceName() + " (");
    }
    List<String> connections = new ArrayList<>();
    for (Port p : info.ports()) {
      connections.add(connection(p.name()));
    }
    joined(sb, connections);
    line(sb, 1, ");");
  }

  private static String connection(String name) {
    return "." + name + "(" + name + ")";
  }

  private static void joined(StringBuilder sb, List<String> items) {
    for (int i = 0; i < items.size(); i++) {
      line(sb, 2, items.get(i) + (i + 1 < items.size() ? "," : ""));
    }
  }

  private static String monitor(ModuleInfo info) {
    StringBuilder format = new StringBuilder("Time=%0t");
    StringBuilder args = new StringBuilder("$time");
    List<Port> shown = new ArrayList<>(info.inputs());
    shown.addAll(info.outputs());
    for (Port p : shown) {
      format.append(' ').append(p.name()).append("=%b");
      args.append(", ").append(p.name());
    }
    return "$monitor(\"" + format + "\", " + args + ");";
  }

  /**
   * Random value expression masked to {@code width} bits. Wider than 32 bits, several {@code $random} words are
   * concatenated and the assignment truncates to the register width.
   */
  static String randomValue(int width) {
    if (width > RANDOM_BITS) {
      int words = (width + RANDOM_BITS - 1) / RANDOM_BITS;
      List<String> parts = new ArrayList<>(words);
      for (int i = 0; i < words; i++) {
        parts.add("$random");
      }
      return "{" + String.join(", ", parts) + "}";
    }
    long mask = width == RANDOM_BITS ? 0xFFFF_FFFFL : (1L << width) - 1;
    return "$random & " + width + "'h" + Long.toHexString(mask);
  }

  private static boolean isSame(Optional<Port> role, Port port) {
    return role.isPresent() && role.get().name().equals(port.name());
  }

  private static void line(StringBuilder sb, int depth, String text) {
    sb.append(StringUtils.repeat(INDENT, depth)).append(text).append('\n');
  }

  private static void blank(StringBuilder sb) {
    sb.append('\n');
  }
}
