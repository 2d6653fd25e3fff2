package com.consullo.hdlbench.sim;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Simulator} backed by Icarus Verilog: {@code iverilog} compiles, {@code vvp} runs.
 *
 * @since 1.0
 */
public final class IcarusVerilogSimulator implements Simulator {

  private static final Logger LOGGER = LoggerFactory.getLogger(IcarusVerilogSimulator.class);

  private final SimulatorConfig config;
  private final ProcessExecutor executor;

  public IcarusVerilogSimulator(SimulatorConfig config) {
    this(config, new ProcessExecutor());
  }

  public IcarusVerilogSimulator(SimulatorConfig config, ProcessExecutor executor) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(executor, "executor must not be null");
    this.config = config;
    this.executor = executor;
  }

  @Override
  public boolean isAvailable() {
    ProcessOutcome versionCheck =
        executor.execute(List.of(config.compilerCommand(), "-V"), null, config.availabilityTimeout());
    if (!versionCheck.succeeded()) {
      LOGGER.info("{} not available: {}", config.compilerCommand(), versionCheck.describeFailure());
      return false;
    }
    return true;
  }

  @Override
  public ProcessOutcome compile(Path design, Path testbench, Path artifact) {
    Validate.notNull(design, "design must not be null");
    Validate.notNull(testbench, "testbench must not be null");
    Validate.notNull(artifact, "artifact must not be null");
    List<String> cmd = new ArrayList<>();
    cmd.add(config.compilerCommand());
    cmd.add("-o");
    cmd.add(artifact.toString());
    if (!config.languageFlag().isEmpty()) {
      cmd.add(config.languageFlag());
    }
    cmd.add(design.toString());
    cmd.add(testbench.toString());
    return executor.execute(cmd, null, config.compileTimeout());
  }

  @Override
  public ProcessOutcome run(Path artifact, Path workingDirectory) {
    Validate.notNull(artifact, "artifact must not be null");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Path relative = artifact.getParent() != null && artifact.getParent().equals(workingDirectory)
        ? artifact.getFileName()
        : artifact.toAbsolutePath();
    return executor.execute(List.of(config.runtimeCommand(), relative.toString()), workingDirectory,
        config.runTimeout());
  }
}
