package com.consullo.hdlbench.module;

/**
 * Module parameter with its default value kept as raw, unevaluated expression text.
 *
 * @param name parameter identifier
 * @param valueExpr trimmed default-value expression
 */
public record Parameter(String name, String valueExpr) {

  public Parameter {
    if (name == null || name.isEmpty() || valueExpr == null) {
      throw new IllegalArgumentException("name/valueExpr must not be blank.");
    }
  }
}
