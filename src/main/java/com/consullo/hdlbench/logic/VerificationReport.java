package com.consullo.hdlbench.logic;

import com.consullo.hdlbench.trace.BitValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replay of a gate's canonical truth table against an observed table.
 *
 * <p>When the gate has no canonical function the report is not {@link #applicable()} and holds no checks.
 *
 * @param classification classified gate
 * @param applicable whether a canonical function existed
 * @param checks one check per combination of the gate's inputs
 * @since 1.0
 */
public record VerificationReport(GateClassification classification, boolean applicable, List<CombinationCheck> checks) {

  public VerificationReport {
    checks = List.copyOf(checks);
  }

  /**
   * Replays {@code classification} against {@code table}.
   *
   * @param classification gate to replay
   * @param table observed table
   * @return report
   */
  public static VerificationReport replay(GateClassification classification, TruthTable table) {
    GateType type = classification.type();
    if (!type.hasCanonicalFunction()) {
      return new VerificationReport(classification, false, List.of());
    }
    List<CombinationCheck> checks = new ArrayList<>();
    for (List<BitValue> combination : TruthTable.allCombinations(table.arity())) {
      BitValue expected = type.evaluate(combination);
      Optional<BitValue> observed = table.output(combination);
      CombinationStatus status;
      if (observed.isEmpty()) {
        status = CombinationStatus.NOT_EXERCISED;
      } else if (observed.get() == expected) {
        status = CombinationStatus.PASS;
      } else {
        status = CombinationStatus.MISMATCH;
      }
      checks.add(new CombinationCheck(combination, expected, observed.orElse(null), status));
    }
    return new VerificationReport(classification, true, checks);
  }

  public long count(CombinationStatus status) {
    return checks.stream().filter(c -> c.status() == status).count();
  }

  public long passCount() {
    return count(CombinationStatus.PASS);
  }

  public long mismatchCount() {
    return count(CombinationStatus.MISMATCH);
  }

  public long notExercisedCount() {
    return count(CombinationStatus.NOT_EXERCISED);
  }

  /**
   * True when a canonical function existed and no observed combination contradicts it.
   */
  public boolean consistent() {
    return applicable && mismatchCount() == 0;
  }
}
