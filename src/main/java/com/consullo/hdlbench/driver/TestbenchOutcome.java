package com.consullo.hdlbench.driver;

import com.consullo.hdlbench.core.Diagnostic;
import java.util.List;
import java.util.Optional;

/**
 * Result of asking the workbench for a testbench: the text, or the blocking diagnostics that prevented it.
 *
 * @param testbench generated text, or null when generation was refused
 * @param diagnostics syntax diagnostics of the design
 * @since 1.0
 */
public record TestbenchOutcome(String testbench, List<Diagnostic> diagnostics) {

  public TestbenchOutcome {
    diagnostics = List.copyOf(diagnostics);
  }

  public boolean generated() {
    return testbench != null;
  }

  public Optional<String> text() {
    return Optional.ofNullable(testbench);
  }
}
