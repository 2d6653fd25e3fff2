package com.consullo.hdlbench.sim;

import java.time.Duration;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * External simulator settings.
 *
 * @param compilerCommand compiler executable, e.g. {@code iverilog}
 * @param runtimeCommand runtime executable, e.g. {@code vvp}
 * @param languageFlag language generation flag passed to the compiler
 * @param availabilityTimeout limit for the availability check
 * @param compileTimeout limit for compilation
 * @param runTimeout limit for execution
 * @param artifactName compiled artifact file name, inside the output directory
 * @param traceFileName trace file the testbench dumps to, inside the output directory
 * @since 1.0
 */
public record SimulatorConfig(
    String compilerCommand,
    String runtimeCommand,
    String languageFlag,
    Duration availabilityTimeout,
    Duration compileTimeout,
    Duration runTimeout,
    String artifactName,
    String traceFileName) {

  private static final Logger LOGGER = LoggerFactory.getLogger(SimulatorConfig.class);

  public static final String ENV_COMPILER = "HDLBENCH_IVERILOG";
  public static final String ENV_RUNTIME = "HDLBENCH_VVP";
  public static final String ENV_COMPILE_TIMEOUT = "HDLBENCH_COMPILE_TIMEOUT_SECONDS";
  public static final String ENV_RUN_TIMEOUT = "HDLBENCH_RUN_TIMEOUT_SECONDS";

  public SimulatorConfig {
    if (StringUtils.isAnyBlank(compilerCommand, runtimeCommand, artifactName, traceFileName)) {
      throw new IllegalArgumentException("compilerCommand/runtimeCommand/artifactName/traceFileName must not be blank.");
    }
    if (languageFlag == null) {
      languageFlag = "";
    }
    if (!isPositive(availabilityTimeout) || !isPositive(compileTimeout) || !isPositive(runTimeout)) {
      throw new IllegalArgumentException("timeouts must be positive.");
    }
  }

  /**
   * Icarus Verilog with SystemVerilog 2012 enabled: 5 s availability check, 30 s compile, 60 s run, {@code simulation.vvp},
   * {@code wave.vcd}.
   *
   * @return default configuration
   */
  public static SimulatorConfig defaults() {
    return new SimulatorConfig("iverilog", "vvp", "-g2012", Duration.ofSeconds(5), Duration.ofSeconds(30),
        Duration.ofSeconds(60), "simulation.vvp", "wave.vcd");
  }

  /**
   * Defaults overridden by {@value #ENV_COMPILER}, {@value #ENV_RUNTIME}, {@value #ENV_COMPILE_TIMEOUT} and
   * {@value #ENV_RUN_TIMEOUT}. Unparseable or non-positive timeouts are ignored with a warning.
   *
   * @param env environment variables, e.g. {@link System#getenv()}
   * @return configuration
   */
  public static SimulatorConfig fromEnvironment(Map<String, String> env) {
    SimulatorConfig d = defaults();
    if (env == null) {
      return d;
    }
    return new SimulatorConfig(
        StringUtils.defaultIfBlank(env.get(ENV_COMPILER), d.compilerCommand()),
        StringUtils.defaultIfBlank(env.get(ENV_RUNTIME), d.runtimeCommand()),
        d.languageFlag(),
        d.availabilityTimeout(),
        seconds(env, ENV_COMPILE_TIMEOUT, d.compileTimeout()),
        seconds(env, ENV_RUN_TIMEOUT, d.runTimeout()),
        d.artifactName(),
        d.traceFileName());
  }

  private static Duration seconds(Map<String, String> env, String key, Duration fallback) {
    String raw = StringUtils.trimToNull(env.get(key));
    if (raw == null) {
      return fallback;
    }
    try {
      long value = Long.parseLong(raw);
      if (value > 0) {
        return Duration.ofSeconds(value);
      }
    } catch (NumberFormatException e) {
      LOGGER.warn("{}='{}' is not a number of seconds", key, raw);
      return fallback;
    }
    LOGGER.warn("{}='{}' must be positive", key, raw);
    return fallback;
  }

  private static boolean isPositive(Duration d) {
    return d != null && !d.isZero() && !d.isNegative();
  }
}
