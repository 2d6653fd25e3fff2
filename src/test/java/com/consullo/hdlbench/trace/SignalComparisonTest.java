package com.consullo.hdlbench.trace;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SignalComparisonTest {

  private static SignalRecord record(String id, String name, int width, long... times) {
    List<ValueChange> changes = new ArrayList<>();
    for (long t : times) {
      changes.add(new ValueChange(t, SignalValue.unknown(width)));
    }
    return new SignalRecord(id, name, "tb." + name, "wire", width, changes);
  }

  @Test
  void compare_DifferentWidths() {
    SignalComparison c = SignalComparison.of(record("!", "a", 1, 0, 10, 20), record("\"", "bus", 4, 5));

    assertThat(c.widthsMatch()).isFalse();
    assertThat(c.changeCountDifference()).isEqualTo(2);
    assertThat(SignalComparison.firstChangeTime(c.first()).getAsLong()).isZero();
    assertThat(SignalComparison.lastChangeTime(c.first()).getAsLong()).isEqualTo(20L);
    assertThat(c.render()).contains("Width match: no").contains("4 bit(s)").contains("bus");
  }

  @Test
  void compare_SilentSignals() {
    SignalComparison c = SignalComparison.of(record("!", "a", 1), record("\"", "b", 1));

    assertThat(c.widthsMatch()).isTrue();
    assertThat(c.changeCountDifference()).isZero();
    assertThat(SignalComparison.firstChangeTime(c.second())).isEmpty();
    assertThat(c.render()).contains("Width match: yes");
  }
}
