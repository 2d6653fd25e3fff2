package com.consullo.hdlbench.driver;

import com.consullo.hdlbench.core.Diagnostic;
import com.consullo.hdlbench.logic.LogicAnalysis;
import com.consullo.hdlbench.logic.LogicInferenceEngine;
import com.consullo.hdlbench.module.ModuleExtractor;
import com.consullo.hdlbench.module.ModuleInfo;
import com.consullo.hdlbench.module.TestbenchModuleReader;
import com.consullo.hdlbench.sim.SimulationRequest;
import com.consullo.hdlbench.sim.SimulationResult;
import com.consullo.hdlbench.sim.SimulationRunner;
import com.consullo.hdlbench.syntax.SyntaxCheckResult;
import com.consullo.hdlbench.syntax.SyntaxChecker;
import com.consullo.hdlbench.testbench.TestbenchSynthesizer;
import com.consullo.hdlbench.trace.SignalComparison;
import com.consullo.hdlbench.trace.SignalInspection;
import com.consullo.hdlbench.trace.SignalRecord;
import com.consullo.hdlbench.trace.TraceAudit;
import com.consullo.hdlbench.trace.TraceAuditReport;
import com.consullo.hdlbench.trace.TraceCsvExporter;
import com.consullo.hdlbench.trace.TraceParseResult;
import com.consullo.hdlbench.trace.TraceParser;
import com.consullo.hdlbench.trace.TraceQuery;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One design under test, from source text to analysed trace.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the loaded design (or testbench) and its syntax check and module info;</li>
 * <li>the last generated testbench;</li>
 * <li>the last loaded trace.</li>
 * </ul>
 * A workbench is not thread-safe; use one per design. The analysis components it delegates to are stateless.
 * </p>
 */
public final class HdlWorkbench {

  private static final Logger LOGGER = LoggerFactory.getLogger(HdlWorkbench.class);

  private final SyntaxChecker syntaxChecker = new SyntaxChecker();
  private final ModuleExtractor moduleExtractor = new ModuleExtractor();
  private final TestbenchModuleReader testbenchReader = new TestbenchModuleReader();
  private final TraceParser traceParser = new TraceParser();
  private final TraceQuery traceQuery = new TraceQuery();
  private final TraceAudit traceAudit = new TraceAudit();
  private final TraceCsvExporter csvExporter = new TraceCsvExporter();
  private final ReportJsonExporter jsonExporter = new ReportJsonExporter();

  private final TestbenchSynthesizer synthesizer;
  private final SimulationRunner simulationRunner;
  private final LogicInferenceEngine inferenceEngine;

  private String designSource;
  private SyntaxCheckResult syntaxResult;
  private ModuleInfo moduleInfo = ModuleInfo.builder().build();
  private String testbench;
  private TraceParseResult trace;

  private HdlWorkbench(TestbenchSynthesizer synthesizer, SimulationRunner simulationRunner,
      LogicInferenceEngine inferenceEngine) {
    this.synthesizer = synthesizer;
    this.simulationRunner = simulationRunner;
    this.inferenceEngine = inferenceEngine;
  }

  public static HdlWorkbench create(TestbenchSynthesizer synthesizer, SimulationRunner simulationRunner,
      LogicInferenceEngine inferenceEngine) {
    if (synthesizer == null || simulationRunner == null || inferenceEngine == null) {
      throw new IllegalArgumentException("synthesizer/simulationRunner/inferenceEngine must not be null.");
    }
    return new HdlWorkbench(synthesizer, simulationRunner, inferenceEngine);
  }

  /**
   * Loads design source: checks its syntax and extracts the first module.
   *
   * @param source HDL text
   * @return syntax check result
   */
  public SyntaxCheckResult loadDesign(String source) {
    Validate.notNull(source, "source must not be null");
    designSource = source;
    testbench = null;
    syntaxResult = syntaxChecker.check(source);
    moduleInfo = moduleExtractor.extract(source);
    LOGGER.info("Design loaded: module '{}', {} error(s), {} warning(s), {}", moduleInfo.name(),
        syntaxResult.errors().size(), syntaxResult.warnings().size(), syntaxResult.version().displayName());
    return syntaxResult;
  }

  public SyntaxCheckResult loadDesignFile(Path file) throws IOException {
    Validate.notNull(file, "file must not be null");
    return loadDesign(Files.readString(file, StandardCharsets.UTF_8));
  }

  /**
   * Loads an existing testbench. Without a loaded design, the module interface is recovered from the
   * instantiation inside the testbench.
   *
   * @param source testbench text
   * @return module info now in effect
   */
  public ModuleInfo loadTestbench(String source) {
    Validate.notNull(source, "source must not be null");
    testbench = source;
    if (designSource == null) {
      moduleInfo = testbenchReader.read(source);
      LOGGER.info("Module '{}' recovered from testbench: {} input(s), {} output(s)", moduleInfo.name(),
          moduleInfo.inputs().size(), moduleInfo.outputs().size());
    }
    return moduleInfo;
  }

  public Optional<SyntaxCheckResult> syntaxResult() {
    return Optional.ofNullable(syntaxResult);
  }

  public ModuleInfo moduleInfo() {
    return moduleInfo;
  }

  /**
   * Returns the module info, insisting that a module was found.
   *
   * @return module info with a name
   * @throws IllegalStateException when no module name was extracted
   */
  public ModuleInfo requireModule() {
    if (!moduleInfo.hasModule()) {
      throw new IllegalStateException("No module loaded: load a design containing a module declaration first.");
    }
    return moduleInfo;
  }

  public Optional<String> testbench() {
    return Optional.ofNullable(testbench);
  }

  /**
   * Synthesizes a testbench, refusing while the design has structural errors.
   *
   * @param vectorCount random vectors to apply
   * @return outcome carrying either the testbench or the diagnostics
   */
  public TestbenchOutcome generateTestbench(int vectorCount) {
    List<Diagnostic> diagnostics = syntaxResult == null ? List.of() : syntaxResult.diagnostics();
    if (syntaxResult != null && !syntaxResult.valid()) {
      LOGGER.warn("Testbench generation refused: {} structural error(s)", syntaxResult.errors().size());
      return new TestbenchOutcome(null, diagnostics);
    }
    testbench = synthesizer.synthesize(requireModule(), vectorCount);
    return new TestbenchOutcome(testbench, diagnostics);
  }

  /**
   * Writes design and testbench to {@code outputDirectory}, simulates and loads the resulting trace. Falls back
   * to a synthetic trace when simulation is not possible.
   *
   * @param outputDirectory work directory
   * @return simulation result
   * @throws IOException if files cannot be written or the trace cannot be read
   */
  public SimulationResult simulate(Path outputDirectory) throws IOException {
    SimulationResult result = simulationRunner.run(prepare(outputDirectory));
    loadTrace(result.traceFile());
    return result;
  }

  private SimulationRequest prepare(Path outputDirectory) throws IOException {
    Validate.notNull(outputDirectory, "outputDirectory must not be null");
    ModuleInfo info = requireModule();
    if (testbench == null) {
      throw new IllegalStateException("No testbench: generate or load one before simulating.");
    }
    Files.createDirectories(outputDirectory);
    Path design = outputDirectory.resolve(info.name() + ".v");
    Path tb = outputDirectory.resolve(TestbenchSynthesizer.testbenchName(info) + ".v");
    Files.writeString(design, designSource == null ? "" : designSource, StandardCharsets.UTF_8);
    Files.writeString(tb, testbench, StandardCharsets.UTF_8);
    return new SimulationRequest(design, tb, info, outputDirectory);
  }

  public TraceParseResult loadTrace(Path file) throws IOException {
    trace = traceParser.parseFile(file);
    return trace;
  }

  public TraceParseResult loadTraceText(String text) {
    trace = traceParser.parse(text);
    return trace;
  }

  public Optional<TraceParseResult> trace() {
    return Optional.ofNullable(trace);
  }

  private TraceParseResult requireTrace() {
    if (trace == null) {
      throw new IllegalStateException("No trace loaded.");
    }
    return trace;
  }

  /**
   * Looks a signal of the loaded trace up by short or full name.
   *
   * @param name signal name
   * @return record
   * @throws IllegalArgumentException when no such signal exists
   */
  public SignalRecord signal(String name) {
    return requireTrace().signals().byName(name)
        .orElseThrow(() -> new IllegalArgumentException("Unknown signal: " + name));
  }

  public LogicAnalysis inferLogic(List<String> inputNames, String outputName) {
    Validate.notEmpty(inputNames, "inputNames must not be empty");
    List<SignalRecord> inputs = new ArrayList<>(inputNames.size());
    for (String name : inputNames) {
      inputs.add(signal(name));
    }
    return inferenceEngine.infer(inputs, signal(outputName));
  }

  public TraceAuditReport audit() {
    return traceAudit.audit(requireTrace().signals());
  }

  public SignalComparison compare(String first, String second) {
    return SignalComparison.of(signal(first), signal(second));
  }

  /**
   * Values at {@code time}: all signals when {@code names} is empty, otherwise the named ones.
   *
   * @param time inspected time
   * @param names signal names, may be empty
   * @return inspections
   */
  public List<SignalInspection> inspect(long time, List<String> names) {
    Validate.notNull(names, "names must not be null");
    TraceParseResult t = requireTrace();
    return names.isEmpty() ? traceQuery.inspect(t.signals(), time) : traceQuery.inspect(t.signals(), names, time);
  }

  public Path exportCsv(Path file) throws IOException {
    return csvExporter.writeTo(requireTrace().signals(), file);
  }

  public Path exportJson(LogicAnalysis analysis, Path file) throws IOException {
    return jsonExporter.write(jsonExporter.toJson(analysis), file);
  }

  public Path exportJson(TraceAuditReport report, Path file) throws IOException {
    return jsonExporter.write(jsonExporter.toJson(report), file);
  }
}
