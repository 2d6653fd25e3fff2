package com.consullo.hdlbench.syntax;

import com.consullo.hdlbench.core.Diagnostic;
import com.consullo.hdlbench.core.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the structural checker.
 */
public class SyntaxCheckerTest {

  private static final String COUNTER = String.join("\n",
      "module counter (",
      "    input clk,",
      "    input rst,",
      "    output reg [3:0] count",
      ");",
      "    always @(posedge clk) begin",
      "        if (rst) begin",
      "            count <= 4'd0;",
      "        end else begin",
      "            case (count)",
      "                4'd15: count <= 4'd0;",
      "                default: count <= count + 1;",
      "            endcase",
      "        end",
      "    end",
      "endmodule",
      "");

  private final SyntaxChecker checker = new SyntaxChecker();

  @Test
  @DisplayName("Should accept a well-formed module with no errors")
  void check_WellFormedModule_IsValid() {
    SyntaxCheckResult result = checker.check(COUNTER);

    assertThat(result.valid()).isTrue();
    assertThat(result.errors()).isEmpty();
    assertThat(result.warnings()).isEmpty();
    assertThat(result.version()).isEqualTo(HdlVersion.VERILOG_95);
  }

  @Test
  @DisplayName("Should report a module/endmodule mismatch as an error")
  void check_TwoModulesOneEndmodule_ReportsMismatch() {
    SyntaxCheckResult result = checker.check("module a(input x);\nendmodule\nmodule b(input y);\n");

    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).extracting(Diagnostic::message)
        .anyMatch(m -> m.contains("mismatch"))
        .contains("Module/endmodule mismatch (found 2 module(s) but 1 endmodule(s))");
    assertThat(result.infos()).extracting(Diagnostic::message)
        .containsExactly("Multiple modules found (2). Only the first will be used for testbench generation.");
  }

  @Test
  @DisplayName("Should report missing module declaration")
  void check_NoModule_ReportsError() {
    SyntaxCheckResult result = checker.check("wire a;\nassign a = 1'b0;\n");

    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).extracting(Diagnostic::message).contains("No module declaration found");
  }

  @Test
  @DisplayName("Should treat begin/end mismatch as a non-blocking warning")
  void check_BeginEndMismatch_IsWarningOnly() {
    String src = "module m(input a, output reg y);\n  always @(a) begin\n    y = a;\nendmodule\n";

    SyntaxCheckResult result = checker.check(src);

    assertThat(result.valid()).isTrue();
    assertThat(result.warnings()).extracting(Diagnostic::message)
        .containsExactly("Begin/end mismatch (found 1 begin(s) but 0 end(s))");
  }

  @Test
  @DisplayName("Should locate an unmatched closing parenthesis by line")
  void check_UnmatchedParen_ReportsLine() {
    String src = "module m(input a);\n  wire b = (a));\nendmodule\n";

    SyntaxCheckResult result = checker.check(src);

    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).extracting(Diagnostic::message)
        .containsExactly("Unmatched closing parenthesis at line 2");
  }

  @Test
  void check_UnclosedBracket_ReportsCount() {
    SyntaxCheckResult result = checker.check("module m(input [3:0 a);\nendmodule\n");

    assertThat(result.errors()).extracting(Diagnostic::message).containsExactly("1 unclosed bracket(s)");
  }

  @Test
  void check_CaseFunctionTaskMismatches_AreErrors() {
    String src = String.join("\n",
        "module m(input a);",
        "  function f; input x; begin f = x; end",
        "  task t; begin end",
        "  always @(a) case (a) 1'b0: ;",
        "endmodule");

    SyntaxCheckResult result = checker.check(src);

    assertThat(result.errors()).extracting(Diagnostic::message).containsExactly(
        "Case/endcase mismatch (found 1 case(s) but 0 endcase(s))",
        "Function/endfunction mismatch (found 1 and 0)",
        "Task/endtask mismatch (found 1 and 0)");
  }

  @Test
  @DisplayName("Should warn when a declaration line looks unterminated")
  void check_MissingSemicolon_Warns() {
    String src = "module m(a, y);\n  input a\n  output y;\n  assign y = a;\nendmodule\n";

    SyntaxCheckResult result = checker.check(src);

    assertThat(result.valid()).isTrue();
    assertThat(result.warnings()).extracting(Diagnostic::message)
        .containsExactly("Line 2 is possibly missing semicolon: input a");
  }

  @Test
  void check_EmptyModule_Warns() {
    SyntaxCheckResult result = checker.check("module nothing;\nendmodule\n");

    assertThat(result.warnings()).extracting(Diagnostic::message)
        .containsExactly("Module is possibly empty (no ports or logic found)");
  }

  @Test
  void check_InvalidPortDeclaration_Warns() {
    SyntaxCheckResult result = checker.check("module m(input @a, output y);\n  assign y = 1'b0;\nendmodule\n");

    assertThat(result.warnings()).extracting(Diagnostic::message)
        .contains("Potentially invalid port declarations found");
  }

  @Test
  @DisplayName("Should ignore keywords inside comments")
  void check_KeywordsInComments_Ignored() {
    String src = "// module ghost begin\nmodule m(input a, output y);\n  /* case ( */ assign y = a;\nendmodule\n";

    SyntaxCheckResult result = checker.check(src);

    assertThat(result.valid()).isTrue();
    assertThat(result.diagnostics()).isEmpty();
  }

  @Test
  @DisplayName("Should not count brackets inside string literals")
  void check_BracketsInsideStrings_Balanced() {
    String src = "module t;\n  initial $display(\"(\");\n  initial $display(\"a]\\\" ) [\");\nendmodule\n";

    SyntaxCheckResult result = checker.check(src);

    assertThat(result.valid()).isTrue();
    assertThat(result.diagnostics()).extracting(Diagnostic::message)
        .noneMatch(message -> message.contains("parenthes") || message.contains("bracket"));
  }

  @Test
  void check_ErrorsPrecedeOtherFindings() {
    SyntaxCheckResult result = checker.check("module a(input x);\n  always @(x) begin\nmodule b;\n");

    assertThat(result.diagnostics()).isNotEmpty();
    assertThat(result.diagnostics().get(0).severity()).isEqualTo(Severity.ERROR);
  }

  @Test
  @DisplayName("Should detect language generation from constructs used")
  void detectVersion_Markers() {
    assertThat(checker.detectVersion("module m(input logic a); endmodule")).isEqualTo(HdlVersion.SYSTEM_VERILOG);
    assertThat(checker.detectVersion("module m; always_ff @(posedge c) x <= 1; endmodule"))
        .isEqualTo(HdlVersion.SYSTEM_VERILOG);
    assertThat(checker.detectVersion("module m; localparam N = 2; endmodule")).isEqualTo(HdlVersion.VERILOG_2001);
    assertThat(checker.detectVersion("module m; always @(*) y = a; endmodule")).isEqualTo(HdlVersion.VERILOG_2001);
    assertThat(checker.detectVersion("module m; // logic\nendmodule")).isEqualTo(HdlVersion.VERILOG_95);
  }
}
