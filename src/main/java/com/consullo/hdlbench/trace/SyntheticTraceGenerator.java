package com.consullo.hdlbench.trace;

import com.consullo.hdlbench.module.ControlSignals;
import com.consullo.hdlbench.module.ModuleInfo;
import com.consullo.hdlbench.module.Port;
import com.consullo.hdlbench.testbench.TestbenchSynthesizer;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces a well-formed trace for a module without running a simulator.
 *
 * <p>
 * The trace declares the module's inputs followed by its outputs under {@code <name>_tb.uut}, all as {@code wire}
 * with their declared widths and identifiers assigned from {@code !} upwards. Values start at zero. The first clock
 * input toggles at every time marker, the first reset input is pulsed, and every other signal may take a random
 * value at each stimulus point. Output values are random as well: the trace exercises the viewer and the parser, it
 * says nothing about the design's behavior.
 * </p>
 *
 * <p>Generation depends only on the module and the {@link SyntheticTraceConfig}, seed included.
 *
 * @since 1.0
 */
public final class SyntheticTraceGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyntheticTraceGenerator.class);

  private static final String INSTANCE_SCOPE = "uut";
  private static final int FIRST_IDENTIFIER_CHAR = '!';
  private static final int IDENTIFIER_RADIX = '~' - '!' + 1;

  private final SyntheticTraceConfig config;

  public SyntheticTraceGenerator() {
    this(SyntheticTraceConfig.defaults());
  }

  public SyntheticTraceGenerator(SyntheticTraceConfig config) {
    Validate.notNull(config, "config must not be null");
    this.config = config;
  }

  public SyntheticTraceConfig config() {
    return config;
  }

  /**
   * Generates trace text.
   *
   * @param info module whose inputs and outputs are traced; must have a name
   * @return trace text
   */
  public String generate(ModuleInfo info) {
    Validate.notNull(info, "info must not be null");
    Validate.isTrue(info.hasModule(), "info must name a module");

    List<TracedSignal> traced = new ArrayList<>();
    for (Port p : info.inputs()) {
      traced.add(new TracedSignal(p.name(), p.width(), identifier(traced.size())));
    }
    for (Port p : info.outputs()) {
      traced.add(new TracedSignal(p.name(), p.width(), identifier(traced.size())));
    }
    Optional<String> clock = ControlSignals.clock(info.inputs()).map(Port::name);
    Optional<String> reset = ControlSignals.reset(info.inputs()).map(Port::name);

    StringBuilder sb = new StringBuilder(16 * 1024);
    sb.append("$version\n   hdl-bench synthetic trace generator\n$end\n");
    sb.append("$timescale 1ns $end\n");
    sb.append("$scope module ").append(TestbenchSynthesizer.testbenchName(info)).append(" $end\n");
    sb.append("$scope module ").append(INSTANCE_SCOPE).append(" $end\n");
    for (TracedSignal s : traced) {
      sb.append("$var wire ").append(s.width).append(' ').append(s.identifier).append(' ').append(s.name)
          .append(" $end\n");
    }
    sb.append("$upscope $end\n$upscope $end\n$enddefinitions $end\n");

    sb.append("#0\n$dumpvars\n");
    for (TracedSignal s : traced) {
      sb.append(valueLine(s, BigInteger.ZERO));
    }
    sb.append("$end\n");

    Random random = new Random(config.seed());
    BigInteger clockValue = BigInteger.ZERO;
    for (long t = 0; t < config.endTime(); t += config.timeStep()) {
      sb.append('#').append(t).append('\n');
      for (TracedSignal s : traced) {
        if (clock.isPresent() && clock.get().equals(s.name)) {
          clockValue = clockValue.signum() == 0 ? BigInteger.ONE : BigInteger.ZERO;
          sb.append(valueLine(s, clockValue));
        } else if (reset.isPresent() && reset.get().equals(s.name)) {
          if (t < config.resetDrivenUntil()) {
            sb.append(valueLine(s, t < config.resetAssertedUntil() ? BigInteger.ONE : BigInteger.ZERO));
          }
        } else if (t % config.stimulusInterval() == 0 && t > config.activityStart()
            && random.nextDouble() < config.changeProbability()) {
          sb.append(valueLine(s, new BigInteger(s.width, random)));
        }
      }
    }
    LOGGER.debug("generate: {} signal(s) for {}, clock={}, reset={}", traced.size(), info.name(),
        clock.orElse("-"), reset.orElse("-"));
    return sb.toString();
  }

  /**
   * Generates the trace and writes it to {@code directory/fileName}, creating the directory when needed.
   *
   * @param info module
   * @param directory output directory
   * @param fileName trace file name
   * @return written file
   * @throws IOException if writing fails
   */
  public Path writeTo(ModuleInfo info, Path directory, String fileName) throws IOException {
    Validate.notNull(directory, "directory must not be null");
    Validate.notBlank(fileName, "fileName must not be blank");
    String text = generate(info);
    Files.createDirectories(directory);
    Path file = directory.resolve(fileName);
    Files.writeString(file, text, StandardCharsets.UTF_8);
    LOGGER.info("Synthetic trace for {} written to {}", info.name(), file);
    return file;
  }

  /**
   * Short identifier for the {@code index}-th variable: {@code !} to {@code ~}, then two characters, and so on.
   */
  static String identifier(int index) {
    Validate.isTrue(index >= 0, "index must not be negative: %d", index);
    StringBuilder sb = new StringBuilder(2);
    int n = index;
    do {
      sb.append((char) (FIRST_IDENTIFIER_CHAR + n % IDENTIFIER_RADIX));
      n = n / IDENTIFIER_RADIX - 1;
    } while (n >= 0);
    return sb.toString();
  }

  private static String valueLine(TracedSignal s, BigInteger value) {
    if (s.width == 1) {
      return value.testBit(0) ? "1" + s.identifier + "\n" : "0" + s.identifier + "\n";
    }
    return "b" + StringUtils.leftPad(value.toString(2), s.width, '0') + " " + s.identifier + "\n";
  }

  private static final class TracedSignal {

    private final String name;
    private final int width;
    private final String identifier;

    TracedSignal(String name, int width, String identifier) {
      this.name = name;
      this.width = width;
      this.identifier = identifier;
    }
  }
}
