package com.consullo.hdlbench.module;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Evaluates the integer expressions found in range declarations such as {@code [WIDTH-1:0]}.
 *
 * <p>
 * Supported: decimal literals, based literals ({@code 8'hFF}, {@code 'd3}), parameter names resolved through their
 * default expressions, unary {@code +}/{@code -}, binary {@code + - * / %}, parentheses and {@code $clog2(...)}.
 * Anything else makes the evaluation fail rather than guess.
 * </p>
 *
 * @since 1.0
 */
public final class RangeExpressionEvaluator {

  private final Map<String, String> definitions;

  /**
   * Creates an evaluator over a set of parameter definitions.
   *
   * @param parameters parameters whose default expressions may be referenced
   */
  public RangeExpressionEvaluator(List<Parameter> parameters) {
    if (parameters == null) {
      throw new IllegalArgumentException("parameters must not be null.");
    }
    Map<String, String> defs = new LinkedHashMap<>();
    for (Parameter p : parameters) {
      defs.putIfAbsent(p.name(), p.valueExpr());
    }
    this.definitions = defs;
  }

  /**
   * Evaluates an expression.
   *
   * @param expression expression text
   * @return value, or empty if the expression is unsupported or references an unknown name
   */
  public OptionalLong evaluate(String expression) {
    if (expression == null) {
      return OptionalLong.empty();
    }
    return evaluate(expression, new HashSet<>());
  }

  private OptionalLong evaluate(String expression, Set<String> resolving) {
    Parser p = new Parser(expression, resolving);
    try {
      long value = p.expression();
      p.skipSpaces();
      if (!p.atEnd()) {
        return OptionalLong.empty();
      }
      return OptionalLong.of(value);
    } catch (IllegalArgumentException | ArithmeticException e) {
      return OptionalLong.empty();
    }
  }

  /**
   * Recursive-descent parser over one expression. Failures surface as {@link IllegalArgumentException}.
   */
  private final class Parser {

    private final String text;
    private final Set<String> resolving;
    private int pos;

    Parser(String text, Set<String> resolving) {
      this.text = text;
      this.resolving = resolving;
    }

    long expression() {
      long value = term();
      while (true) {
        skipSpaces();
        if (accept('+')) {
          value = Math.addExact(value, term());
        } else if (accept('-')) {
          value = Math.subtractExact(value, term());
        } else {
          return value;
        }
      }
    }

    long term() {
      long value = factor();
      while (true) {
        skipSpaces();
        if (accept('*')) {
          value = Math.multiplyExact(value, factor());
        } else if (accept('/')) {
          value = value / factor();
        } else if (accept('%')) {
          value = value % factor();
        } else {
          return value;
        }
      }
    }

    long factor() {
      skipSpaces();
      if (accept('-')) {
        return Math.negateExact(factor());
      }
      if (accept('+')) {
        return factor();
      }
      if (accept('(')) {
        long value = expression();
        expect(')');
        return value;
      }
      if (atEnd()) {
        throw new IllegalArgumentException("unexpected end of expression");
      }
      char c = text.charAt(pos);
      if (c == '$') {
        return systemFunction();
      }
      if (Character.isDigit(c) || c == '\'') {
        return number();
      }
      if (Character.isLetter(c) || c == '_') {
        return identifier();
      }
      throw new IllegalArgumentException("unexpected character '" + c + "'");
    }

    private long systemFunction() {
      int start = pos;
      pos++;
      while (!atEnd() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
        pos++;
      }
      String fn = text.substring(start, pos);
      if (!"$clog2".equals(fn)) {
        throw new IllegalArgumentException("unsupported function " + fn);
      }
      skipSpaces();
      expect('(');
      long arg = expression();
      expect(')');
      if (arg <= 1) {
        return 0;
      }
      return 64 - Long.numberOfLeadingZeros(arg - 1);
    }

    private long number() {
      int start = pos;
      while (!atEnd() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
        pos++;
      }
      String size = text.substring(start, pos).replace("_", "");
      if (atEnd() || text.charAt(pos) != '\'') {
        return Long.parseLong(size);
      }
      pos++;
      if (!atEnd() && (text.charAt(pos) == 's' || text.charAt(pos) == 'S')) {
        pos++;
      }
      if (atEnd()) {
        throw new IllegalArgumentException("missing base");
      }
      int radix;
      switch (Character.toLowerCase(text.charAt(pos))) {
        case 'd':
          radix = 10;
          break;
        case 'h':
          radix = 16;
          break;
        case 'o':
          radix = 8;
          break;
        case 'b':
          radix = 2;
          break;
        default:
          throw new IllegalArgumentException("bad base");
      }
      pos++;
      int digitsStart = pos;
      while (!atEnd() && (Character.digit(text.charAt(pos), radix) >= 0 || text.charAt(pos) == '_')) {
        pos++;
      }
      String digits = text.substring(digitsStart, pos).replace("_", "");
      return Long.parseLong(digits.toLowerCase(Locale.ROOT), radix);
    }

    private long identifier() {
      int start = pos;
      while (!atEnd() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
        pos++;
      }
      String name = text.substring(start, pos);
      String definition = definitions.get(name);
      if (definition == null || !resolving.add(name)) {
        throw new IllegalArgumentException("unresolved name " + name);
      }
      try {
        OptionalLong value = evaluate(definition, resolving);
        if (value.isEmpty()) {
          throw new IllegalArgumentException("unresolved name " + name);
        }
        return value.getAsLong();
      } finally {
        resolving.remove(name);
      }
    }

    void skipSpaces() {
      while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    boolean atEnd() {
      return pos >= text.length();
    }

    private boolean accept(char c) {
      skipSpaces();
      if (!atEnd() && text.charAt(pos) == c) {
        pos++;
        return true;
      }
      return false;
    }

    private void expect(char c) {
      if (!accept(c)) {
        throw new IllegalArgumentException("expected '" + c + "'");
      }
    }
  }
}
