package com.consullo.hdlbench.module;

import com.consullo.hdlbench.core.HdlSource;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers the interface of a module under test from an existing testbench.
 *
 * <p>
 * Used when the caller loads a testbench without the design source. The reader locates the first module
 * instantiation ({@code Type [#( ... )] instance ( ... );}) and classifies each named connection
 * {@code .port(signal)} by how the testbench declares {@code signal}:
 * <ul>
 * <li>{@code reg} - driven by the testbench, so an input of the module.</li>
 * <li>{@code wire} - driven by the module, so an output.</li>
 * <li>undeclared - assumed to be a 1-bit input.</li>
 * </ul>
 * Parameter overrides in the {@code #( ... )} list become parameters, resolved through the testbench's own
 * {@code parameter} declarations where possible.
 * </p>
 *
 * @since 1.0
 */
public final class TestbenchModuleReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(TestbenchModuleReader.class);

  private static final Pattern INSTANCE_HEAD = Pattern.compile("\\b([A-Za-z_]\\w*)\\s*(#\\s*\\()?");
  private static final Pattern INSTANCE_NAME = Pattern.compile("\\s*([A-Za-z_]\\w*)\\s*\\(");
  private static final Pattern NAMED_CONNECTION = Pattern.compile("\\.\\s*(\\w+)\\s*\\(\\s*([^()]*?)\\s*\\)");
  private static final Pattern TB_PARAMETER = Pattern.compile(
      "\\b(?:parameter|localparam)\\s+(?:\\[[^\\]]*\\]\\s*)?(\\w+)\\s*=\\s*([^;,]+)");
  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

  private static final Set<String> NOT_A_MODULE = Set.of(
      "module", "endmodule", "initial", "always", "assign", "reg", "wire", "integer", "begin", "end", "for",
      "if", "else", "while", "repeat", "forever", "case", "parameter", "localparam", "input", "output", "inout",
      "function", "task", "real", "time", "genvar", "generate");

  /**
   * Reads the interface of the first module instantiated by a testbench.
   *
   * @param testbenchSource testbench HDL text
   * @return module info; its name is empty when no instantiation was found
   */
  public ModuleInfo read(String testbenchSource) {
    if (testbenchSource == null) {
      throw new IllegalArgumentException("testbenchSource must not be null.");
    }
    String code = HdlSource.stripComments(testbenchSource);
    List<Parameter> tbParameters = testbenchParameters(code);
    RangeExpressionEvaluator evaluator = new RangeExpressionEvaluator(tbParameters);

    Matcher head = INSTANCE_HEAD.matcher(code);
    int from = 0;
    while (from < code.length() && head.find(from)) {
      from = head.end();
      String type = head.group(1);
      if (NOT_A_MODULE.contains(type) || isPrecededByDollarOrDot(code, head.start())) {
        continue;
      }
      int cursor = head.end();
      String overrides = "";
      if (head.group(2) != null) {
        int close = matchingParen(code, cursor - 1);
        if (close < 0) {
          continue;
        }
        overrides = code.substring(cursor, close);
        cursor = close + 1;
      } else if (cursor == head.start() + type.length()) {
        continue;
      }

      Matcher instance = INSTANCE_NAME.matcher(code);
      instance.region(cursor, code.length());
      if (!instance.lookingAt() || NOT_A_MODULE.contains(instance.group(1))) {
        continue;
      }
      int open = instance.end() - 1;
      int close = matchingParen(code, open);
      if (close < 0) {
        continue;
      }
      String connections = code.substring(open + 1, close);
      if (!NAMED_CONNECTION.matcher(connections).find()) {
        continue;
      }
      ModuleInfo info = build(type, overrides, connections, code, tbParameters, evaluator);
      LOGGER.debug("read: found instantiation {} {} -> {}", type, instance.group(1), info);
      return info;
    }
    LOGGER.debug("read: no module instantiation found");
    return ModuleInfo.builder().build();
  }

  private ModuleInfo build(String type, String overrides, String connections, String code,
      List<Parameter> tbParameters, RangeExpressionEvaluator evaluator) {
    ModuleInfo.Builder builder = ModuleInfo.builder().name(type);

    Matcher param = NAMED_CONNECTION.matcher(overrides);
    while (param.find()) {
      String value = param.group(2);
      for (Parameter p : tbParameters) {
        if (p.name().equals(value)) {
          value = p.valueExpr();
          break;
        }
      }
      if (!value.isEmpty()) {
        builder.addParameter(new Parameter(param.group(1), value));
      }
    }

    Matcher port = NAMED_CONNECTION.matcher(connections);
    while (port.find()) {
      String portName = port.group(1);
      String signal = port.group(2);
      if (!IDENTIFIER.matcher(signal).matches()) {
        builder.addPort(Port.scalar(portName, PortDirection.INPUT));
        continue;
      }
      PortDirection direction;
      if (declares(code, "reg", signal)) {
        direction = PortDirection.INPUT;
      } else if (declares(code, "wire", signal)) {
        direction = PortDirection.OUTPUT;
      } else {
        builder.addPort(Port.scalar(portName, PortDirection.INPUT));
        continue;
      }
      int[] range = declaredRange(code, signal, evaluator);
      if (range == null) {
        builder.addPort(Port.scalar(portName, direction));
      } else {
        builder.addPort(Port.ranged(portName, direction, range[0], range[1]));
      }
    }
    return builder.build();
  }

  private static List<Parameter> testbenchParameters(String code) {
    List<Parameter> out = new ArrayList<>();
    Matcher m = TB_PARAMETER.matcher(code);
    while (m.find()) {
      out.add(new Parameter(m.group(1), m.group(2).trim()));
    }
    return out;
  }

  private static boolean declares(String code, String keyword, String signal) {
    Pattern p = Pattern.compile("\\b" + keyword + "\\b[^;]*\\b" + Pattern.quote(signal) + "\\b");
    return p.matcher(code).find();
  }

  /**
   * Returns {@code {msb, lsb}} of the signal's declared range, or null for a scalar or unevaluable range. A single
   * index {@code [N]} is read as {@code [N:0]}.
   */
  private static int[] declaredRange(String code, String signal, RangeExpressionEvaluator evaluator) {
    Pattern p = Pattern.compile(
        "\\b(?:reg|wire)\\s*(?:signed\\s+)?\\[([^\\]]+)\\]\\s*" + Pattern.quote(signal) + "\\b");
    Matcher m = p.matcher(code);
    if (!m.find()) {
      return null;
    }
    String range = m.group(1);
    int colon = range.indexOf(':');
    OptionalLong msb = evaluator.evaluate(colon < 0 ? range : range.substring(0, colon));
    OptionalLong lsb = colon < 0 ? OptionalLong.of(0) : evaluator.evaluate(range.substring(colon + 1));
    if (msb.isEmpty() || lsb.isEmpty()) {
      LOGGER.warn("read: cannot evaluate range [{}] of {}, treating it as 1 bit", range, signal);
      return null;
    }
    return new int[] {(int) msb.getAsLong(), (int) lsb.getAsLong()};
  }

  private static boolean isPrecededByDollarOrDot(String code, int index) {
    int i = index - 1;
    while (i >= 0 && Character.isWhitespace(code.charAt(i))) {
      i--;
    }
    if (i < 0) {
      return false;
    }
    char c = code.charAt(i);
    return c == '$' || c == '.' || c == '`';
  }

  /**
   * Returns the index of the parenthesis closing the one at {@code openIndex}, or -1.
   */
  private static int matchingParen(String code, int openIndex) {
    int depth = 0;
    for (int i = openIndex; i < code.length(); i++) {
      char c = code.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }
}
