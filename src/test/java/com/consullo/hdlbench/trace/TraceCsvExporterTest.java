package com.consullo.hdlbench.trace;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for CSV export of value changes.
 */
public class TraceCsvExporterTest {

  private final TraceCsvExporter exporter = new TraceCsvExporter();

  @Test
  @DisplayName("Should list every change ordered by time, keeping signal order within a time")
  void toCsv_OrdersByTimeThenSignal() {
    String text = "$var wire 1 a clk $end\n$var wire 4 b count $end\n$enddefinitions $end\n"
        + "#0\n0a\nb0 b\n#5\n1a\n#10\n0a\nb1010 b\n";

    String csv = exporter.toCsv(new TraceParser().parse(text).signals());

    assertThat(csv.split("\n")).containsExactly(
        "Time (ns),Signal,Value",
        "0,clk,0",
        "0,count,0000",
        "5,clk,1",
        "10,clk,0",
        "10,count,1010");
  }

  @Test
  void toCsv_QuotesAwkwardNames() {
    SignalRecord odd = new SignalRecord("!", "data[3,0]", "tb.data[3,0]", "wire", 1,
        List.of(new ValueChange(2, SignalValue.parse("1"))));

    String csv = exporter.toCsv(SignalTable.of(List.of(odd)));

    assertThat(csv).endsWith("2,\"data[3,0]\",1\n");
  }

  @Test
  void toCsv_EmptyTable_HeaderOnly() {
    assertThat(exporter.toCsv(SignalTable.empty())).isEqualTo(TraceCsvExporter.HEADER + "\n");
  }

  @Test
  void writeTo_WritesFile(@TempDir Path dir) throws Exception {
    SignalTable table = new TraceParser().parse(TraceParserTest.loadTextResource("fixtures/counter.vcd")).signals();

    Path file = exporter.writeTo(table, dir.resolve("changes.csv"));

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertThat(lines.get(0)).isEqualTo(TraceCsvExporter.HEADER);
    assertThat(lines).hasSize(20);
    assertThat(lines.subList(17, 20)).containsExactly("20,clk,0", "20,rst_n,1", "20,clk,0");
  }
}
