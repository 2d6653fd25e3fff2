package com.consullo.hdlbench.logic;

/**
 * Gate type together with the input count it was classified for.
 *
 * @param type gate type
 * @param arity input count
 * @since 1.0
 */
public record GateClassification(GateType type, int arity) {

  public String label() {
    return type.label(arity);
  }

  @Override
  public String toString() {
    return label();
  }
}
