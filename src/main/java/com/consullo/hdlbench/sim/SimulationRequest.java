package com.consullo.hdlbench.sim;

import com.consullo.hdlbench.module.ModuleInfo;
import java.nio.file.Path;

/**
 * Inputs of one simulation.
 *
 * @param designFile design source
 * @param testbenchFile testbench source
 * @param moduleInfo module under test, used by the synthetic fallback
 * @param outputDirectory directory for the artifact and the trace
 * @since 1.0
 */
public record SimulationRequest(Path designFile, Path testbenchFile, ModuleInfo moduleInfo, Path outputDirectory) {

  public SimulationRequest {
    if (designFile == null || testbenchFile == null || moduleInfo == null || outputDirectory == null) {
      throw new IllegalArgumentException("designFile/testbenchFile/moduleInfo/outputDirectory must not be null.");
    }
  }
}
