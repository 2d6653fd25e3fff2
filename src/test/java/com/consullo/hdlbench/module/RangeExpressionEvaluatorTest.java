package com.consullo.hdlbench.module;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class RangeExpressionEvaluatorTest {

  private final RangeExpressionEvaluator evaluator = new RangeExpressionEvaluator(List.of(
      new Parameter("WIDTH", "8"),
      new Parameter("DEPTH", "WIDTH * 2"),
      new Parameter("LOOP", "LOOP + 1")));

  @Test
  void evaluate_Literals() {
    assertThat(evaluator.evaluate("7").getAsLong()).isEqualTo(7);
    assertThat(evaluator.evaluate("8'hFF").getAsLong()).isEqualTo(255);
    assertThat(evaluator.evaluate("'d12").getAsLong()).isEqualTo(12);
    assertThat(evaluator.evaluate("4'b1_010").getAsLong()).isEqualTo(10);
  }

  @Test
  void evaluate_ParametersAndArithmetic() {
    assertThat(evaluator.evaluate("WIDTH-1").getAsLong()).isEqualTo(7);
    assertThat(evaluator.evaluate("DEPTH - 1").getAsLong()).isEqualTo(15);
    assertThat(evaluator.evaluate("(WIDTH + 2) * 3 % 7").getAsLong()).isEqualTo(2);
    assertThat(evaluator.evaluate("-WIDTH + 10").getAsLong()).isEqualTo(2);
    assertThat(evaluator.evaluate("$clog2(DEPTH)").getAsLong()).isEqualTo(4);
    assertThat(evaluator.evaluate("$clog2(1)").getAsLong()).isEqualTo(0);
  }

  @Test
  void evaluate_Unsupported_IsEmpty() {
    assertThat(evaluator.evaluate("UNKNOWN - 1")).isEmpty();
    assertThat(evaluator.evaluate("LOOP")).isEmpty();
    assertThat(evaluator.evaluate("WIDTH / 0")).isEmpty();
    assertThat(evaluator.evaluate("a ? b : c")).isEmpty();
    assertThat(evaluator.evaluate("$bits(x)")).isEmpty();
    assertThat(evaluator.evaluate(null)).isEmpty();
  }
}
