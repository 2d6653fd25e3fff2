package com.consullo.hdlbench.syntax;

import com.consullo.hdlbench.core.Diagnostic;
import com.consullo.hdlbench.core.HdlSource;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural validation of HDL source text.
 *
 * <p>
 * The checker never parses the language. It runs a fixed list of independent keyword-count and character-balance
 * checks over comment-stripped text and classifies each finding:
 * <ul>
 * <li>Errors: missing module, module/endmodule, case/endcase, function/endfunction and task/endtask count
 * mismatches, unbalanced parentheses or brackets.</li>
 * <li>Warnings: begin/end count mismatch (lossy, see below), suspicious port declarations, empty module, lines that
 * look like they lack a semicolon.</li>
 * <li>Info: more than one module in the source.</li>
 * </ul>
 * </p>
 *
 * <p>
 * The begin/end check only compares whole-word keyword counts, so it cannot tell which {@code end} closes which
 * block. It is reported as a warning.
 * </p>
 *
 * <p>Instances hold no state; {@link #check(String)} may be called concurrently.
 *
 * @since 1.0
 */
public final class SyntaxChecker {

  private static final Logger LOGGER = LoggerFactory.getLogger(SyntaxChecker.class);

  private static final Pattern MODULE_DECL = Pattern.compile("\\bmodule\\s+\\w+");
  private static final Pattern MODULE_KW = Pattern.compile("\\bmodule\\s+");
  private static final Pattern ENDMODULE_KW = Pattern.compile("\\bendmodule\\b");
  private static final Pattern BEGIN_KW = Pattern.compile("\\bbegin\\b");
  private static final Pattern END_KW = Pattern.compile("\\bend\\b");
  private static final Pattern CASE_KW = Pattern.compile("\\bcase[xz]?\\b");
  private static final Pattern ENDCASE_KW = Pattern.compile("\\bendcase\\b");
  private static final Pattern FUNCTION_KW = Pattern.compile("\\bfunction\\b");
  private static final Pattern ENDFUNCTION_KW = Pattern.compile("\\bendfunction\\b");
  private static final Pattern TASK_KW = Pattern.compile("\\btask\\b");
  private static final Pattern ENDTASK_KW = Pattern.compile("\\bendtask\\b");

  private static final Pattern INVALID_PORT = Pattern.compile("\\b(?:input|output|inout)\\s+[^\\w\\s\\[\\]]+");
  private static final Pattern PORT_KW = Pattern.compile("\\b(?:input|output|inout)\\b");
  private static final Pattern LOGIC_KW = Pattern.compile("\\b(?:always|assign|initial)\\b|\\w+\\s+\\w+\\s*\\(");
  private static final Pattern DECLARATION_LINE =
      Pattern.compile("^(?:input|output|inout|wire|reg|parameter|assign|integer|real)\\s+");
  private static final String[] STATEMENT_ENDINGS = {";", ",", ")", "(", "begin", "end"};
  private static final int QUOTED_LINE_LIMIT = 50;

  private static final Pattern SYSTEM_VERILOG_MARKERS =
      Pattern.compile("\\b(?:logic|always_ff|always_comb|always_latch|interface|class|package)\\b");
  private static final Pattern VERILOG_2001_MARKERS = Pattern.compile("\\b(?:localparam|generate|signed|unsigned)\\b");
  private static final Pattern STAR_SENSITIVITY = Pattern.compile("@\\s*\\(\\s*\\*\\s*\\)");

  /**
   * Checks HDL text for structural problems.
   *
   * @param source HDL text (may contain comments)
   * @return validity verdict, ordered diagnostics and detected version
   */
  public SyntaxCheckResult check(String source) {
    if (source == null) {
      throw new IllegalArgumentException("source must not be null.");
    }
    String code = HdlSource.stripComments(source);

    List<Diagnostic> errors = new ArrayList<>();
    List<Diagnostic> findings = new ArrayList<>();

    if (!MODULE_DECL.matcher(code).find()) {
      errors.add(Diagnostic.error("No module declaration found"));
    }

    int modules = HdlSource.count(MODULE_KW, code);
    int endmodules = HdlSource.count(ENDMODULE_KW, code);
    if (modules != endmodules) {
      errors.add(Diagnostic.error(String.format(
          "Module/endmodule mismatch (found %d module(s) but %d endmodule(s))", modules, endmodules)));
    }

    int begins = HdlSource.count(BEGIN_KW, code);
    int ends = HdlSource.count(END_KW, code);
    if (begins != ends) {
      findings.add(Diagnostic.warning(String.format(
          "Begin/end mismatch (found %d begin(s) but %d end(s))", begins, ends)));
    }

    int cases = HdlSource.count(CASE_KW, code);
    int endcases = HdlSource.count(ENDCASE_KW, code);
    if (cases != endcases) {
      errors.add(Diagnostic.error(String.format(
          "Case/endcase mismatch (found %d case(s) but %d endcase(s))", cases, endcases)));
    }

    checkPair(code, FUNCTION_KW, ENDFUNCTION_KW, "Function/endfunction", errors);
    checkPair(code, TASK_KW, ENDTASK_KW, "Task/endtask", errors);

    checkBalance(code, '(', ')', "parenthesis", "parenthesis/parentheses", errors);
    checkBalance(code, '[', ']', "bracket", "bracket(s)", errors);

    if (INVALID_PORT.matcher(code).find()) {
      findings.add(Diagnostic.warning("Potentially invalid port declarations found"));
    }

    if (modules > 1) {
      findings.add(Diagnostic.info(String.format(
          "Multiple modules found (%d). Only the first will be used for testbench generation.", modules)));
    }

    checkEmptyModule(code, findings);
    checkMissingSemicolons(code, findings);

    List<Diagnostic> all = new ArrayList<>(errors.size() + findings.size());
    all.addAll(errors);
    all.addAll(findings);
    boolean valid = errors.isEmpty();
    LOGGER.debug("check: valid={} errors={} other={}", valid, errors.size(), findings.size());
    return new SyntaxCheckResult(valid, all, detectVersion(source));
  }

  /**
   * Detects the language generation from the constructs used.
   *
   * <p>SystemVerilog keywords take precedence over Verilog-2001 markers; anything else is Verilog-95. Comments are
   * ignored. The verdict is independent of structural validity.
   *
   * @param source HDL text
   * @return detected version
   */
  public HdlVersion detectVersion(String source) {
    if (source == null) {
      throw new IllegalArgumentException("source must not be null.");
    }
    String code = HdlSource.stripComments(source);
    if (SYSTEM_VERILOG_MARKERS.matcher(code).find()) {
      return HdlVersion.SYSTEM_VERILOG;
    }
    if (VERILOG_2001_MARKERS.matcher(code).find() || STAR_SENSITIVITY.matcher(code).find()) {
      return HdlVersion.VERILOG_2001;
    }
    return HdlVersion.VERILOG_95;
  }

  private static void checkPair(String code, Pattern open, Pattern close, String label, List<Diagnostic> errors) {
    int opens = HdlSource.count(open, code);
    int closes = HdlSource.count(close, code);
    if (opens != closes) {
      errors.add(Diagnostic.error(String.format(
          "%s mismatch (found %d and %d)", label, opens, closes)));
    }
  }

  /**
   * Running-balance scan. An unmatched close is reported with its 1-based line and the balance restarts at zero so
   * later problems are still located; unclosed openers are reported once at the end.
   */
  private static void checkBalance(String code, char open, char close, String singular, String plural,
      List<Diagnostic> errors) {
    int balance = 0;
    int line = 1;
    boolean inString = false;
    for (int i = 0; i < code.length(); i++) {
      char c = code.charAt(i);
      if (c == '\n') {
        line++;
        inString = false;
      } else if (inString) {
        if (c == '\\') {
          i++;
        } else if (c == '"') {
          inString = false;
        }
      } else if (c == '"') {
        inString = true;
      } else if (c == open) {
        balance++;
      } else if (c == close) {
        balance--;
        if (balance < 0) {
          errors.add(Diagnostic.error(String.format("Unmatched closing %s at line %d", singular, line)));
          balance = 0;
        }
      }
    }
    if (balance > 0) {
      errors.add(Diagnostic.error(String.format("%d unclosed %s", balance, plural)));
    }
  }

  private static void checkEmptyModule(String code, List<Diagnostic> findings) {
    String module = HdlSource.firstModule(code);
    if (module.isEmpty()) {
      return;
    }
    int headerEnd = module.indexOf(';');
    String body = headerEnd < 0 ? "" : module.substring(headerEnd + 1);
    boolean hasPorts = PORT_KW.matcher(module).find();
    boolean hasLogic = LOGIC_KW.matcher(body).find();
    if (!hasPorts && !hasLogic) {
      findings.add(Diagnostic.warning("Module is possibly empty (no ports or logic found)"));
    }
  }

  private static void checkMissingSemicolons(String code, List<Diagnostic> findings) {
    List<String> lines = HdlSource.lines(code);
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).strip();
      if (line.isEmpty() || !DECLARATION_LINE.matcher(line).find()) {
        continue;
      }
      if (StringUtils.endsWithAny(line, STATEMENT_ENDINGS)) {
        continue;
      }
      if (i + 1 >= lines.size()) {
        continue;
      }
      String next = lines.get(i + 1).strip();
      if (next.startsWith(")") || next.startsWith(",")) {
        continue;
      }
      findings.add(Diagnostic.warning(String.format(
          "Line %d is possibly missing semicolon: %s", i + 1, StringUtils.truncate(line, QUOTED_LINE_LIMIT))));
    }
  }
}
