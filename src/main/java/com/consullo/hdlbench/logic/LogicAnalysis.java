package com.consullo.hdlbench.logic;

import java.util.List;

/**
 * Result of {@link LogicInferenceEngine#infer(List, com.consullo.hdlbench.trace.SignalRecord)}.
 *
 * @param inputNames input signal names, in table column order
 * @param outputName output signal name
 * @param table observed truth table
 * @param classification gate label
 * @param verification canonical replay
 * @param tieBreakPolicy policy used for evenly split combinations
 * @param samplePoints number of distinct sample times considered
 * @param discardedSamples samples dropped because a value was not 0 or 1
 * @since 1.0
 */
public record LogicAnalysis(
    List<String> inputNames,
    String outputName,
    TruthTable table,
    GateClassification classification,
    VerificationReport verification,
    TieBreakPolicy tieBreakPolicy,
    int samplePoints,
    int discardedSamples) {

  public LogicAnalysis {
    inputNames = List.copyOf(inputNames);
  }

  /**
   * Multi-line summary: gate label, table rows and verification counts.
   *
   * @return report text
   */
  public String render() {
    StringBuilder sb = new StringBuilder(256);
    sb.append("Inputs: ").append(String.join(", ", inputNames)).append('\n');
    sb.append("Output: ").append(outputName).append('\n');
    sb.append("Detected gate: ").append(classification.label()).append('\n');
    sb.append("Samples: ").append(samplePoints - discardedSamples).append(" used, ").append(discardedSamples)
        .append(" discarded\n");
    sb.append(table.render());
    if (verification.applicable()) {
      sb.append("Verification: ").append(verification.passCount()).append(" pass, ")
          .append(verification.mismatchCount()).append(" mismatch, ")
          .append(verification.notExercisedCount()).append(" not exercised\n");
    } else {
      sb.append("Verification: no canonical function for ").append(classification.label()).append('\n');
    }
    if (table.hasTies()) {
      sb.append("Ties resolved by ").append(tieBreakPolicy).append('\n');
    }
    return sb.toString();
  }
}
