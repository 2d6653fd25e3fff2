package com.consullo.hdlbench.sim;

import com.consullo.hdlbench.trace.SyntheticTraceGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a simulation through {@link SimulationState} and falls back to a synthetic trace on any failure.
 *
 * <p>
 * The simulator availability is checked first. A failed check, a failed or timed-out compile, a failed or
 * timed-out run, or a successful run that left no trace file all end in
 * {@link SimulationState#FELL_BACK_TO_SYNTHETIC}, with the {@link SyntheticTraceGenerator} writing the trace in place
 * of the simulator. Tool failures never escape as exceptions.
 * </p>
 *
 * @since 1.0
 */
public final class SimulationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SimulationRunner.class);

  private final Simulator simulator;
  private final SyntheticTraceGenerator fallbackGenerator;
  private final SimulatorConfig config;

  public SimulationRunner(Simulator simulator, SyntheticTraceGenerator fallbackGenerator, SimulatorConfig config) {
    Validate.notNull(simulator, "simulator must not be null");
    Validate.notNull(fallbackGenerator, "fallbackGenerator must not be null");
    Validate.notNull(config, "config must not be null");
    this.simulator = simulator;
    this.fallbackGenerator = fallbackGenerator;
    this.config = config;
  }

  /**
   * Runs the simulation on the calling thread.
   *
   * @param request simulation inputs
   * @return result; its trace file exists
   * @throws IOException if the output directory or the synthetic trace cannot be written
   */
  public SimulationResult run(SimulationRequest request) throws IOException {
    Validate.notNull(request, "request must not be null");
    Path outDir = request.outputDirectory();
    Files.createDirectories(outDir);
    Path trace = outDir.resolve(config.traceFileName());
    Path artifact = outDir.resolve(config.artifactName());
    Files.deleteIfExists(trace);

    SimulationRun run = new SimulationRun();
    if (!simulator.isAvailable()) {
      return fallBack(run, request, trace, "simulator not available");
    }

    run.advance(SimulationState.COMPILING);
    ProcessOutcome compiled = simulator.compile(request.designFile(), request.testbenchFile(), artifact);
    run.appendLog("compile", compiled.output());
    if (!compiled.succeeded()) {
      return fallBack(run, request, trace, "compilation " + compiled.describeFailure());
    }

    run.advance(SimulationState.RUNNING);
    ProcessOutcome executed = simulator.run(artifact, outDir);
    run.appendLog("run", executed.output());
    if (!executed.succeeded()) {
      return fallBack(run, request, trace, "simulation " + executed.describeFailure());
    }
    if (!Files.isRegularFile(trace)) {
      return fallBack(run, request, trace, "simulation produced no trace file " + trace.getFileName());
    }

    run.advance(SimulationState.SUCCEEDED);
    LOGGER.info("Simulation of {} succeeded, trace at {}", request.moduleInfo().name(), trace);
    return new SimulationResult(run.state(), trace, run.log(), null, run.history());
  }

  /**
   * Runs the simulation on a daemon thread.
   *
   * @param request simulation inputs
   * @return future completed with the result, or exceptionally when the trace cannot be written
   */
  public CompletableFuture<SimulationResult> runAsync(SimulationRequest request) {
    Validate.notNull(request, "request must not be null");
    CompletableFuture<SimulationResult> future = new CompletableFuture<>();
    Thread worker = new Thread(() -> {
      try {
        future.complete(run(request));
      } catch (Exception e) {
        future.completeExceptionally(e);
      }
    }, "SimulationRunner");
    worker.setDaemon(true);
    worker.start();
    return future;
  }

  private SimulationResult fallBack(SimulationRun run, SimulationRequest request, Path trace, String reason)
      throws IOException {
    LOGGER.warn("Falling back to synthetic trace for {}: {}", request.moduleInfo().name(), reason);
    Path written = fallbackGenerator.writeTo(request.moduleInfo(), trace.getParent(), trace.getFileName().toString());
    run.fallBack(reason);
    run.appendLog("fallback", "Synthetic trace generated: " + reason);
    return new SimulationResult(run.state(), written, run.log(), reason, run.history());
  }
}
