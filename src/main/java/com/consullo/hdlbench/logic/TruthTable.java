package com.consullo.hdlbench.logic;

import com.consullo.hdlbench.trace.BitValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Observed truth table: only combinations seen in the trace are present, ordered as binary numbers with the first
 * input most significant.
 *
 * @since 1.0
 */
public final class TruthTable {

  private final int arity;
  private final Map<List<BitValue>, TruthTableRow> rows;

  public TruthTable(int arity, Collection<TruthTableRow> rows) {
    Validate.isTrue(arity >= 1, "arity must be at least 1: %d", arity);
    Validate.notNull(rows, "rows must not be null");
    List<TruthTableRow> sorted = new ArrayList<>(rows);
    sorted.sort(Comparator.comparingLong(r -> index(r.inputs())));
    Map<List<BitValue>, TruthTableRow> map = new LinkedHashMap<>();
    for (TruthTableRow row : sorted) {
      Validate.isTrue(row.inputs().size() == arity, "row %s does not have %d input(s)", row.inputText(), arity);
      Validate.isTrue(map.put(row.inputs(), row) == null, "duplicate row %s", row.inputText());
    }
    this.arity = arity;
    this.rows = map;
  }

  public int arity() {
    return arity;
  }

  public List<TruthTableRow> rows() {
    return List.copyOf(rows.values());
  }

  public int size() {
    return rows.size();
  }

  public Optional<TruthTableRow> row(List<BitValue> inputs) {
    return Optional.ofNullable(rows.get(inputs));
  }

  /**
   * Output for a combination, empty when the combination was never observed.
   *
   * @param inputs input bits
   * @return output bit, if observed
   */
  public Optional<BitValue> output(List<BitValue> inputs) {
    return row(inputs).map(TruthTableRow::output);
  }

  public boolean isComplete() {
    return arity < Long.SIZE - 1 && rows.size() == 1L << arity;
  }

  public boolean hasTies() {
    for (TruthTableRow r : rows.values()) {
      if (r.tied()) {
        return true;
      }
    }
    return false;
  }

  public long countOutputs(BitValue value) {
    return rows.values().stream().filter(r -> r.output() == value).count();
  }

  /**
   * All {@code 2^arity} combinations in table order.
   *
   * @param arity input count, at most 20
   * @return combinations
   */
  public static List<List<BitValue>> allCombinations(int arity) {
    Validate.inclusiveBetween(1, 20, arity, "arity out of range: %d", arity);
    List<List<BitValue>> out = new ArrayList<>(1 << arity);
    for (int n = 0; n < 1 << arity; n++) {
      List<BitValue> combination = new ArrayList<>(arity);
      for (int bit = arity - 1; bit >= 0; bit--) {
        combination.add((n >> bit & 1) == 1 ? BitValue.ONE : BitValue.ZERO);
      }
      out.add(List.copyOf(combination));
    }
    return out;
  }

  private static long index(List<BitValue> inputs) {
    long n = 0;
    for (BitValue b : inputs) {
      n = n << 1 | (b == BitValue.ONE ? 1 : 0);
    }
    return n;
  }

  /**
   * Rows as {@code inputs -> output} lines.
   */
  public String render() {
    StringBuilder sb = new StringBuilder();
    for (TruthTableRow r : rows.values()) {
      sb.append(r.inputText()).append(" -> ").append(r.output().symbol());
      if (r.tied()) {
        sb.append(" (tie)");
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "TruthTable{arity=" + arity + ", rows=" + rows.size() + "}";
  }
}
