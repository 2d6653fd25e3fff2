package com.consullo.hdlbench.driver;

import com.consullo.hdlbench.logic.CombinationCheck;
import com.consullo.hdlbench.logic.LogicAnalysis;
import com.consullo.hdlbench.logic.TruthTableRow;
import com.consullo.hdlbench.trace.TraceAuditReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.commons.lang3.Validate;

/**
 * JSON views of analysis results for display collaborators.
 *
 * @since 1.0
 */
public final class ReportJsonExporter {

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  public JsonNode toJson(LogicAnalysis analysis) {
    Validate.notNull(analysis, "analysis must not be null");
    ObjectNode root = JSON_MAPPER.createObjectNode();
    ArrayNode inputs = root.putArray("inputs");
    analysis.inputNames().forEach(inputs::add);
    root.put("output", analysis.outputName());
    root.put("gate", analysis.classification().label());
    root.put("gateType", analysis.classification().type().name());
    root.put("tieBreakPolicy", analysis.tieBreakPolicy().name());
    root.put("samplePoints", analysis.samplePoints());
    root.put("discardedSamples", analysis.discardedSamples());

    ArrayNode rows = root.putArray("truthTable");
    for (TruthTableRow r : analysis.table().rows()) {
      ObjectNode row = rows.addObject();
      row.put("inputs", r.inputText());
      row.put("output", String.valueOf(r.output().symbol()));
      row.put("zeros", r.zeroCount());
      row.put("ones", r.oneCount());
      row.put("tied", r.tied());
      row.put("firstSeen", r.firstSeen());
    }

    ObjectNode verification = root.putObject("verification");
    verification.put("applicable", analysis.verification().applicable());
    verification.put("pass", analysis.verification().passCount());
    verification.put("mismatch", analysis.verification().mismatchCount());
    verification.put("notExercised", analysis.verification().notExercisedCount());
    ArrayNode checks = verification.putArray("checks");
    for (CombinationCheck c : analysis.verification().checks()) {
      ObjectNode check = checks.addObject();
      StringBuilder in = new StringBuilder();
      c.inputs().forEach(b -> in.append(b.symbol()));
      check.put("inputs", in.toString());
      check.put("expected", String.valueOf(c.expected().symbol()));
      if (c.observed() == null) {
        check.putNull("observed");
      } else {
        check.put("observed", String.valueOf(c.observed().symbol()));
      }
      check.put("status", c.status().name());
    }
    return root;
  }

  public JsonNode toJson(TraceAuditReport report) {
    Validate.notNull(report, "report must not be null");
    ObjectNode root = JSON_MAPPER.createObjectNode();
    ArrayNode clocks = root.putArray("clockSignals");
    report.clockSignals().forEach(clocks::add);
    ArrayNode resets = root.putArray("resetSignals");
    report.resetSignals().forEach(resets::add);
    root.put("activeSignals", report.activeSignals());
    root.put("inactiveSignals", report.inactiveSignals());
    ArrayNode unknown = root.putArray("unknownValueSignals");
    report.unknownValueSignals().forEach(unknown::add);
    return root;
  }

  public String toPrettyString(JsonNode node) {
    try {
      return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialise JSON", e);
    }
  }

  public Path write(JsonNode node, Path file) throws IOException {
    Validate.notNull(node, "node must not be null");
    Validate.notNull(file, "file must not be null");
    JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), node);
    return file;
  }
}
