package com.consullo.hdlbench.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for trace auditing.
 *
 * @since 1.0
 */
public class TraceAuditTest {

  private final TraceAudit audit = new TraceAudit();

  @Test
  @DisplayName("Should find clocks, resets, activity and unknown values in a simulator dump")
  void audit_CounterFixture() throws Exception {
    SignalTable table = new TraceParser().parse(TraceParserTest.loadTextResource("fixtures/counter.vcd")).signals();

    TraceAuditReport report = audit.audit(table);

    assertThat(report.clockSignals()).containsExactly("clk", "clk");
    assertThat(report.resetSignals()).containsExactly("rst_n");
    assertThat(report.activeSignals()).isEqualTo(5);
    assertThat(report.inactiveSignals()).isZero();
    assertThat(report.unknownValueSignals()).containsExactly("rst_n", "q", "q");
    assertThat(report.hasUnknownValues()).isTrue();
    assertThat(report.render()).contains("Found 2 clock signal(s): clk, clk")
        .contains("Found 1 reset signal(s): rst_n")
        .contains("Active signals: 5")
        .contains("Inactive signals: 0")
        .contains("Signals with X/Z values: 3 (rst_n, q, q)");
  }

  @Test
  @DisplayName("Should not call a clock-named signal a clock unless it toggles")
  void audit_QuietSignals() {
    String text = "$var wire 1 ! clk $end\n$var wire 2 \" bus $end\n$var wire 1 # idle $end\n$enddefinitions $end\n"
        + "#0\n0!\nb00 \"\n0#\n#5\n1!\nb01 \"\n";

    TraceAuditReport report = audit.audit(new TraceParser().parse(text).signals());

    assertThat(report.clockSignals()).isEmpty();
    assertThat(report.resetSignals()).isEmpty();
    assertThat(report.activeSignals()).isEqualTo(2);
    assertThat(report.inactiveSignals()).isEqualTo(1);
    assertThat(report.render()).contains("No clock signals detected").contains("No reset signals detected")
        .contains("No X/Z values detected");
  }

  @Test
  void audit_EmptyTable() {
    TraceAuditReport report = audit.audit(SignalTable.empty());

    assertThat(report.activeSignals()).isZero();
    assertThat(report.inactiveSignals()).isZero();
  }
}
