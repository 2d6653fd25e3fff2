package com.consullo.hdlbench.sim;

import java.nio.file.Path;

/**
 * External HDL simulator.
 *
 * <p>Implementations never throw for tool failures; every failure is reported through {@link ProcessOutcome}.
 *
 * @since 1.0
 */
public interface Simulator {

  /**
   * Checks whether the simulator can be invoked at all.
   *
   * @return true when the compiler answers its version query
   */
  boolean isAvailable();

  /**
   * Compiles a design together with its testbench.
   *
   * @param design design source file
   * @param testbench testbench source file
   * @param artifact compiled output file to produce
   * @return outcome
   */
  ProcessOutcome compile(Path design, Path testbench, Path artifact);

  /**
   * Executes a compiled artifact. Relative dump files land in {@code workingDirectory}.
   *
   * @param artifact compiled file
   * @param workingDirectory working directory of the run
   * @return outcome
   */
  ProcessOutcome run(Path artifact, Path workingDirectory);
}
