package com.consullo.hdlbench.logic;

import com.consullo.hdlbench.trace.BitValue;
import java.util.List;

/**
 * Gate labels produced by {@link GateClassifier}.
 *
 * <p>Types with a canonical function can be replayed against an observed table; the heuristic and fallback labels
 * cannot.
 */
public enum GateType {
  NOT("NOT"),
  BUFFER("BUFFER"),
  AND("AND"),
  OR("OR"),
  XOR("XOR"),
  NAND("NAND"),
  NOR("NOR"),
  XNOR("XNOR"),
  AND3("3-input AND"),
  OR3("3-input OR"),
  XOR_COMPLEX3("3-input XOR/Complex"),
  LOGIC3("3-input Logic"),
  CUSTOM("Custom Logic"),
  UNKNOWN("Unknown"),
  MULTI_INPUT("%d-input Logic");

  private final String label;

  GateType(String label) {
    this.label = label;
  }

  /**
   * Display label for a gate with {@code arity} inputs.
   *
   * @param arity input count
   * @return label
   */
  public String label(int arity) {
    return this == MULTI_INPUT ? String.format(label, arity) : label;
  }

  public boolean hasCanonicalFunction() {
    switch (this) {
      case NOT:
      case BUFFER:
      case AND:
      case OR:
      case XOR:
      case NAND:
      case NOR:
      case XNOR:
      case AND3:
      case OR3:
        return true;
      default:
        return false;
    }
  }

  /**
   * Evaluates the canonical function on known input bits.
   *
   * @param inputs input bits, each 0 or 1
   * @return output bit
   * @throws UnsupportedOperationException when this type has no canonical function
   */
  public BitValue evaluate(List<BitValue> inputs) {
    int ones = 0;
    for (BitValue b : inputs) {
      if (b == BitValue.ONE) {
        ones++;
      }
    }
    boolean all = ones == inputs.size();
    boolean any = ones > 0;
    boolean odd = ones % 2 == 1;
    switch (this) {
      case NOT:
        return bit(!any);
      case BUFFER:
        return bit(any);
      case AND:
      case AND3:
        return bit(all);
      case OR:
      case OR3:
        return bit(any);
      case XOR:
        return bit(odd);
      case NAND:
        return bit(!all);
      case NOR:
        return bit(!any);
      case XNOR:
        return bit(!odd);
      default:
        throw new UnsupportedOperationException("No canonical function for " + name());
    }
  }

  private static BitValue bit(boolean value) {
    return value ? BitValue.ONE : BitValue.ZERO;
  }
}
