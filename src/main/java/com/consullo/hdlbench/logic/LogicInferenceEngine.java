package com.consullo.hdlbench.logic;

import com.consullo.hdlbench.trace.BitValue;
import com.consullo.hdlbench.trace.SignalRecord;
import com.consullo.hdlbench.trace.SignalValue;
import com.consullo.hdlbench.trace.TraceQuery;
import com.consullo.hdlbench.trace.ValueChange;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers the combinational function relating 1-bit input signals to a 1-bit output signal.
 *
 * <p>
 * Every timestamp at which any of the signals changes is a sample point, visited in ascending order. A sample whose
 * input or output value is not 0 or 1 is discarded. The remaining samples are grouped by input combination and each
 * group is resolved by majority vote; an even split is resolved by the configured {@link TieBreakPolicy}. The
 * resulting table is classified by {@link GateClassifier} and replayed by {@link VerificationReport#replay}.
 * </p>
 *
 * @since 1.0
 */
public final class LogicInferenceEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(LogicInferenceEngine.class);

  private final TieBreakPolicy tieBreakPolicy;
  private final TraceQuery query = new TraceQuery();
  private final GateClassifier classifier = new GateClassifier();

  public LogicInferenceEngine() {
    this(TieBreakPolicy.EARLIEST_OBSERVED);
  }

  public LogicInferenceEngine(TieBreakPolicy tieBreakPolicy) {
    Validate.notNull(tieBreakPolicy, "tieBreakPolicy must not be null");
    this.tieBreakPolicy = tieBreakPolicy;
  }

  public TieBreakPolicy tieBreakPolicy() {
    return tieBreakPolicy;
  }

  /**
   * Builds, classifies and verifies the observed truth table.
   *
   * @param inputs input signals in column order, each 1 bit wide
   * @param output output signal, 1 bit wide
   * @return analysis
   */
  public LogicAnalysis infer(List<SignalRecord> inputs, SignalRecord output) {
    Validate.notEmpty(inputs, "inputs must not be empty");
    Validate.noNullElements(inputs, "inputs must not contain null");
    Validate.notNull(output, "output must not be null");
    for (SignalRecord in : inputs) {
      Validate.isTrue(in.isScalar(), "input %s is %d bits wide", in.name(), in.width());
    }
    Validate.isTrue(output.isScalar(), "output %s is %d bits wide", output.name(), output.width());

    TreeSet<Long> samplePoints = new TreeSet<>();
    for (SignalRecord in : inputs) {
      addTimes(in, samplePoints);
    }
    addTimes(output, samplePoints);

    Map<List<BitValue>, Votes> votes = new LinkedHashMap<>();
    int discarded = 0;
    for (long t : samplePoints) {
      List<BitValue> combination = new ArrayList<>(inputs.size());
      boolean known = true;
      for (SignalRecord in : inputs) {
        SignalValue v = query.valueAt(in, t);
        known &= v.isKnown();
        combination.add(v.bits().get(0));
      }
      SignalValue out = query.valueAt(output, t);
      if (!known || !out.isKnown()) {
        discarded++;
        continue;
      }
      votes.computeIfAbsent(List.copyOf(combination), k -> new Votes(t)).add(out.scalarBit());
    }

    List<TruthTableRow> rows = new ArrayList<>(votes.size());
    for (Map.Entry<List<BitValue>, Votes> e : votes.entrySet()) {
      rows.add(e.getValue().resolve(e.getKey(), tieBreakPolicy));
    }
    TruthTable table = new TruthTable(inputs.size(), rows);
    GateClassification classification = classifier.classify(table);
    VerificationReport verification = VerificationReport.replay(classification, table);

    List<String> names = new ArrayList<>(inputs.size());
    for (SignalRecord in : inputs) {
      names.add(in.name());
    }
    LOGGER.debug("infer: {} -> {} classified as {} from {} sample(s), {} discarded, {} combination(s)", names,
        output.name(), classification.label(), samplePoints.size(), discarded, table.size());
    return new LogicAnalysis(names, output.name(), table, classification, verification, tieBreakPolicy,
        samplePoints.size(), discarded);
  }

  private static void addTimes(SignalRecord record, TreeSet<Long> times) {
    for (ValueChange c : record.changes()) {
      times.add(c.time());
    }
  }

  /**
   * Output votes of one input combination.
   */
  private static final class Votes {

    private final long firstSeen;
    private int zeros;
    private int ones;
    private BitValue earliest;
    private BitValue latest;

    Votes(long firstSeen) {
      this.firstSeen = firstSeen;
    }

    void add(BitValue output) {
      if (output == BitValue.ONE) {
        ones++;
      } else {
        zeros++;
      }
      if (earliest == null) {
        earliest = output;
      }
      latest = output;
    }

    TruthTableRow resolve(List<BitValue> inputs, TieBreakPolicy policy) {
      if (zeros != ones) {
        BitValue majority = ones > zeros ? BitValue.ONE : BitValue.ZERO;
        return new TruthTableRow(inputs, majority, zeros, ones, false, firstSeen);
      }
      BitValue chosen;
      switch (policy) {
        case LATEST_OBSERVED:
          chosen = latest;
          break;
        case PREFER_ZERO:
          chosen = BitValue.ZERO;
          break;
        case PREFER_ONE:
          chosen = BitValue.ONE;
          break;
        default:
          chosen = earliest;
          break;
      }
      return new TruthTableRow(inputs, chosen, zeros, ones, true, firstSeen);
    }
  }
}
