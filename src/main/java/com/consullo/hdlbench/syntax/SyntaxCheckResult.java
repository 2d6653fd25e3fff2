package com.consullo.hdlbench.syntax;

import com.consullo.hdlbench.core.Diagnostic;
import com.consullo.hdlbench.core.Severity;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a structural syntax check.
 *
 * @param valid true when no {@link Severity#ERROR} diagnostic is present
 * @param diagnostics ordered findings: errors first, then warnings and informational findings
 * @param version language generation detected for the same source
 * @since 1.0
 */
public record SyntaxCheckResult(boolean valid, List<Diagnostic> diagnostics, HdlVersion version) {

  public SyntaxCheckResult {
    diagnostics = List.copyOf(diagnostics);
  }

  public List<Diagnostic> errors() {
    return withSeverity(Severity.ERROR);
  }

  public List<Diagnostic> warnings() {
    return withSeverity(Severity.WARNING);
  }

  public List<Diagnostic> infos() {
    return withSeverity(Severity.INFO);
  }

  private List<Diagnostic> withSeverity(Severity severity) {
    return diagnostics.stream()
        .filter(d -> d.severity() == severity)
        .collect(Collectors.toUnmodifiableList());
  }
}
