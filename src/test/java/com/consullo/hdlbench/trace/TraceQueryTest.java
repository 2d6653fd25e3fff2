package com.consullo.hdlbench.trace;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for point-in-time value lookups.
 */
public class TraceQueryTest {

  private final TraceQuery query = new TraceQuery();

  private static SignalRecord record(String name, int width, ValueChange... changes) {
    return new SignalRecord(name.substring(0, 1), name, "top." + name, "wire", width, List.of(changes));
  }

  private static ValueChange change(long time, String bits) {
    return new ValueChange(time, SignalValue.parse(bits));
  }

  @Test
  @DisplayName("Should return the last value at or before the queried time")
  void valueAt_BetweenChanges_HoldsPreviousValue() {
    SignalRecord a = record("a", 1, change(0, "0"), change(10, "1"));

    assertThat(query.valueAt(a, 0).text()).isEqualTo("0");
    assertThat(query.valueAt(a, 5).text()).isEqualTo("0");
    assertThat(query.valueAt(a, 10).text()).isEqualTo("1");
    assertThat(query.valueAt(a, 20).text()).isEqualTo("1");
  }

  @Test
  @DisplayName("Should return all-x of the signal width before the first change")
  void valueAt_BeforeFirstChange_Unknown() {
    SignalRecord a = record("a", 1, change(0, "0"), change(10, "1"));
    SignalRecord bus = record("bus", 4, change(7, "1010"));
    SignalRecord silent = record("silent", 3);

    assertThat(query.valueAt(a, -1).text()).isEqualTo("x");
    assertThat(query.valueAt(bus, 6).text()).isEqualTo("xxxx");
    assertThat(query.valueAt(silent, 100).text()).isEqualTo("xxx");
    assertThat(query.lastChangeAtOrBefore(silent, 100)).isEmpty();
  }

  @Test
  void valueAt_EqualTimestamps_LastWins() {
    SignalRecord a = record("a", 1, change(5, "0"), change(5, "z"), change(5, "1"), change(9, "0"));

    assertThat(query.valueAt(a, 5).text()).isEqualTo("1");
    assertThat(query.lastChangeAtOrBefore(a, 8).orElseThrow().time()).isEqualTo(5L);
  }

  @Test
  void valueAt_UnsortedInput_SortedByRecord() {
    SignalRecord a = record("a", 1, change(30, "1"), change(10, "0"), change(20, "x"));

    assertThat(query.valueAt(a, 15).text()).isEqualTo("0");
    assertThat(query.valueAt(a, 25).text()).isEqualTo("x");
    assertThat(query.valueAt(a, 35).text()).isEqualTo("1");
  }

  @Test
  void inspect_AllOrNamedSignals() {
    SignalTable table = SignalTable.of(List.of(
        record("a", 1, change(0, "1")),
        record("bus", 8, change(0, "00001010")),
        record("z", 1, change(0, "z"))));

    List<SignalInspection> all = query.inspect(table, 3);
    List<SignalInspection> named = query.inspect(table, List.of("top.bus", "nope"), 3);

    assertThat(all).extracting(SignalInspection::render).containsExactly(
        "a [1 bit] @ 3: 1 (HIGH)",
        "bus [8 bits] @ 3: 0xA (10)",
        "z [1 bit] @ 3: Z (HIGH-IMPEDANCE)");
    assertThat(named).hasSize(1);
    assertThat(named.get(0).name()).isEqualTo("bus");
  }
}
