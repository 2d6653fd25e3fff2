package com.consullo.hdlbench.trace;

import com.consullo.hdlbench.module.ModuleInfo;
import com.consullo.hdlbench.module.Port;
import com.consullo.hdlbench.module.PortDirection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for synthetic trace generation.
 */
public class SyntheticTraceGeneratorTest {

  private final TraceParser parser = new TraceParser();
  private final TraceQuery query = new TraceQuery();

  private static ModuleInfo counter() {
    ModuleInfo.Builder b = ModuleInfo.builder().name("counter");
    b.addPort(Port.scalar("clk", PortDirection.INPUT));
    b.addPort(Port.scalar("rst_n", PortDirection.INPUT));
    b.addPort(Port.scalar("en", PortDirection.INPUT));
    b.addPort(Port.ranged("q", PortDirection.OUTPUT, 7, 0));
    return b.build();
  }

  @Test
  @DisplayName("Should declare inputs then outputs under the testbench instance scope")
  void generate_ParsesBackToModuleInterface() {
    TraceParseResult result = parser.parse(new SyntheticTraceGenerator().generate(counter()));

    assertThat(result.anomalies()).isEmpty();
    assertThat(result.headerComplete()).isTrue();
    assertThat(result.timescale()).isEqualTo(Timescale.DEFAULT);
    assertThat(result.signals().names()).containsExactly("clk", "rst_n", "en", "q");
    assertThat(result.signals().byName("q").orElseThrow().width()).isEqualTo(8);
    assertThat(result.signals().byName("q").orElseThrow().fullName()).isEqualTo("counter_tb.uut.q");
  }

  @Test
  @DisplayName("Should toggle the clock every step and pulse the reset")
  void generate_ClockAndReset_Driven() {
    TraceParseResult result = parser.parse(new SyntheticTraceGenerator().generate(counter()));
    SignalRecord clk = result.signals().byName("clk").orElseThrow();
    SignalRecord rst = result.signals().byName("rst_n").orElseThrow();

    // initial dump plus one toggle per step over [0, 1000)
    assertThat(clk.changeCount()).isEqualTo(201);
    assertThat(query.valueAt(clk, 0).text()).isEqualTo("1");
    assertThat(query.valueAt(clk, 5).text()).isEqualTo("0");
    assertThat(query.valueAt(clk, 995).text()).isEqualTo("0");

    assertThat(query.valueAt(rst, 0).text()).isEqualTo("1");
    assertThat(query.valueAt(rst, 15).text()).isEqualTo("1");
    assertThat(query.valueAt(rst, 20).text()).isEqualTo("0");
    assertThat(rst.lastChange().orElseThrow().time()).isEqualTo(45L);

    for (ValueChange c : result.signals().byName("en").orElseThrow().changes()) {
      assertThat(c.time() == 0 || (c.time() > 50 && c.time() % 20 == 0)).isTrue();
    }
    assertThat(new TraceAudit().audit(result.signals()).clockSignals()).containsExactly("clk");
  }

  @Test
  void generate_SameSeed_SameText() {
    SyntheticTraceConfig config = SyntheticTraceConfig.defaults().withSeed(42);

    String first = new SyntheticTraceGenerator(config).generate(counter());
    String second = new SyntheticTraceGenerator(config).generate(counter());
    String other = new SyntheticTraceGenerator(config.withSeed(7)).generate(counter());

    assertThat(second).isEqualTo(first);
    assertThat(other).isNotEqualTo(first);
  }

  @Test
  void generate_NoClockOrReset_OnlyRandomActivity() {
    ModuleInfo.Builder b = ModuleInfo.builder().name("and_gate");
    b.addPort(Port.scalar("a", PortDirection.INPUT));
    b.addPort(Port.scalar("b", PortDirection.INPUT));
    b.addPort(Port.scalar("y", PortDirection.OUTPUT));

    TraceParseResult result = parser.parse(new SyntheticTraceGenerator().generate(b.build()));

    assertThat(result.signals().names()).containsExactly("a", "b", "y");
    for (SignalRecord r : result.signals().records()) {
      assertThat(r.firstChange().orElseThrow().time()).isZero();
      assertThat(r.firstChange().orElseThrow().value().text()).isEqualTo("0");
    }
    assertThat(new TraceAudit().audit(result.signals()).clockSignals()).isEmpty();
  }

  @Test
  void writeTo_CreatesDirectoryAndFile(@TempDir Path dir) throws Exception {
    Path file = new SyntheticTraceGenerator().writeTo(counter(), dir.resolve("out"), "wave.vcd");

    assertThat(file).exists();
    assertThat(parser.parseFile(file).signals().size()).isEqualTo(4);
    assertThat(Files.readString(file)).startsWith("$version");
  }

  @Test
  void identifier_BijectiveShortCodes() {
    assertThat(SyntheticTraceGenerator.identifier(0)).isEqualTo("!");
    assertThat(SyntheticTraceGenerator.identifier(93)).isEqualTo("~");
    assertThat(SyntheticTraceGenerator.identifier(94)).isEqualTo("!!");
    assertThat(SyntheticTraceGenerator.identifier(95)).isEqualTo("\"!");

    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 20_000; i++) {
      assertThat(seen.add(SyntheticTraceGenerator.identifier(i))).isTrue();
    }
  }

  @Test
  void generate_UnnamedModule_Throws() {
    assertThatThrownBy(() -> new SyntheticTraceGenerator().generate(ModuleInfo.builder().build()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void config_RejectsBadProbability() {
    assertThatThrownBy(() -> new SyntheticTraceConfig(1, 100, 5, 20, 50, 20, 50, 1.5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(SyntheticTraceConfig.defaults().seed()).isEqualTo(1L);
  }
}
