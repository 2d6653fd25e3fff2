package com.consullo.hdlbench.logic;

import com.consullo.hdlbench.trace.BitValue;
import java.util.List;

/**
 * One observed input combination and its resolved output.
 *
 * @param inputs input bits in input order
 * @param output resolved output
 * @param zeroCount samples that showed output 0
 * @param oneCount samples that showed output 1
 * @param tied true when both counts were equal and the tie-break policy chose the output
 * @param firstSeen earliest sample time of this combination
 */
public record TruthTableRow(
    List<BitValue> inputs,
    BitValue output,
    int zeroCount,
    int oneCount,
    boolean tied,
    long firstSeen) {

  public TruthTableRow {
    inputs = List.copyOf(inputs);
    if (output == null || !output.isKnown()) {
      throw new IllegalArgumentException("output must be 0 or 1: " + output);
    }
  }

  public int samples() {
    return zeroCount + oneCount;
  }

  /**
   * Input bits as text, e.g. {@code 01}.
   */
  public String inputText() {
    StringBuilder sb = new StringBuilder(inputs.size());
    for (BitValue b : inputs) {
      sb.append(b.symbol());
    }
    return sb.toString();
  }
}
