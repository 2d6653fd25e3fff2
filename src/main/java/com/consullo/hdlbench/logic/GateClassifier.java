package com.consullo.hdlbench.logic;

import com.consullo.hdlbench.trace.BitValue;
import java.util.List;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Names the combinational function of an observed {@link TruthTable}.
 *
 * <p>
 * One and two input tables must match a canonical gate exactly; a combination that was never observed is unknown,
 * so a partial table never matches. Three input tables use a count of {@code 1} outputs. Wider tables are not
 * classified.
 * </p>
 *
 * @since 1.0
 */
public final class GateClassifier {

  private static final List<GateType> TWO_INPUT_ORDER = List.of(
      GateType.AND, GateType.OR, GateType.XOR, GateType.NAND, GateType.NOR, GateType.XNOR);

  public GateClassification classify(TruthTable table) {
    Validate.notNull(table, "table must not be null");
    int arity = table.arity();
    switch (arity) {
      case 1:
        return new GateClassification(classifySingle(table), arity);
      case 2:
        return new GateClassification(classifyPair(table), arity);
      case 3:
        return new GateClassification(classifyTriple(table), arity);
      default:
        return new GateClassification(GateType.MULTI_INPUT, arity);
    }
  }

  private static GateType classifySingle(TruthTable table) {
    if (matches(table, GateType.NOT)) {
      return GateType.NOT;
    }
    if (matches(table, GateType.BUFFER)) {
      return GateType.BUFFER;
    }
    return GateType.UNKNOWN;
  }

  private static GateType classifyPair(TruthTable table) {
    for (GateType candidate : TWO_INPUT_ORDER) {
      if (matches(table, candidate)) {
        return candidate;
      }
    }
    return GateType.CUSTOM;
  }

  private static GateType classifyTriple(TruthTable table) {
    long ones = table.countOutputs(BitValue.ONE);
    Optional<BitValue> allOnes = table.output(List.of(BitValue.ONE, BitValue.ONE, BitValue.ONE));
    Optional<BitValue> allZeros = table.output(List.of(BitValue.ZERO, BitValue.ZERO, BitValue.ZERO));
    if (ones == 1 && allOnes.isPresent() && allOnes.get() == BitValue.ONE) {
      return GateType.AND3;
    }
    if (ones == 7 && allZeros.isPresent() && allZeros.get() == BitValue.ZERO) {
      return GateType.OR3;
    }
    if (ones == 4) {
      return GateType.XOR_COMPLEX3;
    }
    return GateType.LOGIC3;
  }

  /**
   * True when every combination is observed and equals the canonical output.
   */
  private static boolean matches(TruthTable table, GateType type) {
    for (List<BitValue> combination : TruthTable.allCombinations(table.arity())) {
      Optional<BitValue> observed = table.output(combination);
      if (observed.isEmpty() || observed.get() != type.evaluate(combination)) {
        return false;
      }
    }
    return true;
  }
}
