package com.consullo.hdlbench.logic;

import com.consullo.hdlbench.trace.BitValue;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class GateClassifierTest {

  private final GateClassifier classifier = new GateClassifier();

  /**
   * Full table whose outputs, in binary input order, are the characters of {@code outputs}.
   */
  private static TruthTable table(int arity, String outputs) {
    List<List<BitValue>> combinations = TruthTable.allCombinations(arity);
    List<TruthTableRow> rows = new ArrayList<>();
    for (int i = 0; i < outputs.length(); i++) {
      BitValue out = BitValue.fromSymbol(outputs.charAt(i));
      rows.add(new TruthTableRow(combinations.get(i), out, out == BitValue.ZERO ? 1 : 0, out == BitValue.ONE ? 1 : 0,
          false, i));
    }
    return new TruthTable(arity, rows);
  }

  @Test
  void classify_SingleInput() {
    assertThat(classifier.classify(table(1, "10")).type()).isEqualTo(GateType.NOT);
    assertThat(classifier.classify(table(1, "01")).type()).isEqualTo(GateType.BUFFER);
    assertThat(classifier.classify(table(1, "11")).type()).isEqualTo(GateType.UNKNOWN);
  }

  @Test
  void classify_TwoInputGates() {
    assertThat(classifier.classify(table(2, "0001")).type()).isEqualTo(GateType.AND);
    assertThat(classifier.classify(table(2, "0111")).type()).isEqualTo(GateType.OR);
    assertThat(classifier.classify(table(2, "0110")).type()).isEqualTo(GateType.XOR);
    assertThat(classifier.classify(table(2, "1110")).type()).isEqualTo(GateType.NAND);
    assertThat(classifier.classify(table(2, "1000")).type()).isEqualTo(GateType.NOR);
    assertThat(classifier.classify(table(2, "1001")).type()).isEqualTo(GateType.XNOR);
    assertThat(classifier.classify(table(2, "0010")).type()).isEqualTo(GateType.CUSTOM);
    assertThat(classifier.classify(table(2, "000")).type()).isEqualTo(GateType.CUSTOM);
  }

  @Test
  void classify_ThreeInputHeuristics() {
    assertThat(classifier.classify(table(3, "00000001")).label()).isEqualTo("3-input AND");
    assertThat(classifier.classify(table(3, "01111111")).label()).isEqualTo("3-input OR");
    assertThat(classifier.classify(table(3, "01101001")).label()).isEqualTo("3-input XOR/Complex");
    assertThat(classifier.classify(table(3, "00010111")).label()).isEqualTo("3-input XOR/Complex");
    assertThat(classifier.classify(table(3, "00000011")).label()).isEqualTo("3-input Logic");
  }

  @Test
  void classify_WideTables_MultiInput() {
    GateClassification c = classifier.classify(table(5, "0"));

    assertThat(c.type()).isEqualTo(GateType.MULTI_INPUT);
    assertThat(c.label()).isEqualTo("5-input Logic");
    assertThat(VerificationReport.replay(c, table(5, "0")).applicable()).isFalse();
  }

  @Test
  void evaluate_CanonicalFunctionsOnly() {
    List<BitValue> in = List.of(BitValue.ONE, BitValue.ONE, BitValue.ZERO);

    assertThat(GateType.AND3.evaluate(in)).isEqualTo(BitValue.ZERO);
    assertThat(GateType.OR3.evaluate(in)).isEqualTo(BitValue.ONE);
    assertThat(GateType.XOR_COMPLEX3.hasCanonicalFunction()).isFalse();
    assertThatThrownBy(() -> GateType.CUSTOM.evaluate(in)).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void truthTable_RejectsDuplicatesAndSortsRows() {
    TruthTableRow one = new TruthTableRow(List.of(BitValue.ONE), BitValue.ONE, 0, 1, false, 5);
    TruthTableRow zero = new TruthTableRow(List.of(BitValue.ZERO), BitValue.ONE, 0, 1, false, 9);

    TruthTable sorted = new TruthTable(1, List.of(one, zero));

    assertThat(sorted.rows()).containsExactly(zero, one);
    assertThatThrownBy(() -> new TruthTable(1, List.of(one, one))).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TruthTableRow(List.of(BitValue.ONE), BitValue.X, 0, 0, false, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
