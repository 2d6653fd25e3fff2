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
 * Extracts a {@link ModuleInfo} from HDL source text.
 *
 * <p>
 * Only the first module in the text is examined. Each step is pattern based and runs on comment-stripped text:
 * <ol>
 * <li>Name: the first {@code module <identifier>}.</li>
 * <li>Parameters: {@code parameter [range] NAME = expr}, including the comma-continued form inside a
 * {@code #( ... )} list. Values are kept as raw text.</li>
 * <li>Ports: {@code input|output|inout} with an optional {@code wire/reg} qualifier and optional range, in
 * declaration order. A name already declared is skipped.</li>
 * <li>Internal signals: {@code wire} then {@code reg} declarations whose names are not ports.</li>
 * </ol>
 * </p>
 *
 * <p>
 * When no module is present the returned info has an empty name; this class never throws for malformed input.
 * Instances are stateless.
 * </p>
 *
 * @since 1.0
 */
public final class ModuleExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModuleExtractor.class);

  private static final String RANGE = "(?:\\[([^\\]:]+):([^\\]]+)\\]\\s*)?";

  private static final Pattern MODULE_NAME = Pattern.compile("\\bmodule\\s+(\\w+)");
  private static final Pattern PARAMETER = Pattern.compile(
      "\\bparameter\\s+(?:(?:integer|real|time|signed|unsigned)\\s+)?(?:\\[[^\\]]*\\]\\s*)?(\\w+)\\s*=");
  private static final Pattern PARAMETER_CONTINUATION = Pattern.compile("\\s*,\\s*(\\w+)\\s*=(?!=)");
  private static final Pattern PORT = Pattern.compile(
      "\\b(input|output|inout)\\b\\s*(?:(?:wire|reg|logic|tri)\\s+)?(?:(?:signed|unsigned)\\s+)?"
          + RANGE + "(\\w+)\\s*(?=[,;)=])");
  private static final Pattern INTERNAL_SIGNAL = Pattern.compile(
      "\\b(wire|reg)\\b\\s*(?:(?:signed|unsigned)\\s+)?" + RANGE + "(\\w+)\\s*(?=[,;=])");
  private static final Pattern LIST_CONTINUATION = Pattern.compile("\\s*,\\s*(\\w+)\\s*(?=[,;)=])");

  private static final Set<String> KEYWORDS = Set.of(
      "input", "output", "inout", "wire", "reg", "logic", "tri", "signed", "unsigned", "parameter", "localparam",
      "integer", "real", "time", "module", "endmodule", "assign", "always", "initial");

  /**
   * Extracts module metadata.
   *
   * @param source HDL text
   * @return module info (empty name when no module is declared)
   */
  public ModuleInfo extract(String source) {
    if (source == null) {
      throw new IllegalArgumentException("source must not be null.");
    }
    String module = HdlSource.withoutSubroutines(HdlSource.firstModule(HdlSource.stripComments(source)));
    ModuleInfo.Builder builder = ModuleInfo.builder();

    Matcher name = MODULE_NAME.matcher(module);
    if (!name.find()) {
      LOGGER.debug("extract: no module declaration");
      return builder.build();
    }
    builder.name(name.group(1));

    extractParameters(module, builder);
    RangeExpressionEvaluator evaluator = new RangeExpressionEvaluator(builder.parameters());
    extractPorts(module, builder, evaluator);
    extractInternalSignals(module, SignalKind.WIRE, builder, evaluator);
    extractInternalSignals(module, SignalKind.REG, builder, evaluator);

    ModuleInfo info = builder.build();
    LOGGER.debug("extract: {}", info);
    return info;
  }

  private static void extractParameters(String module, ModuleInfo.Builder builder) {
    Matcher m = PARAMETER.matcher(module);
    int from = 0;
    while (m.find(from)) {
      int end = addParameter(module, m.group(1), m.end(), builder);
      Matcher cont = PARAMETER_CONTINUATION.matcher(module);
      while (end < module.length() && module.charAt(end) == ',') {
        cont.region(end, module.length());
        if (!cont.lookingAt() || KEYWORDS.contains(cont.group(1))) {
          break;
        }
        end = addParameter(module, cont.group(1), cont.end(), builder);
      }
      from = Math.max(end, m.end());
    }
  }

  /**
   * Adds one parameter whose value starts at {@code valueStart} and returns the index of the terminator.
   */
  private static int addParameter(String module, String paramName, int valueStart, ModuleInfo.Builder builder) {
    int end = scanExpressionEnd(module, valueStart);
    String value = module.substring(valueStart, end).trim();
    if (!value.isEmpty()) {
      builder.addParameter(new Parameter(paramName, value));
    }
    return end;
  }

  /**
   * Returns the index of the first {@code ,} or {@code ;} at nesting depth zero, or of an unbalanced closing
   * {@code )}, starting at {@code start}. String literals are skipped whole.
   */
  static int scanExpressionEnd(String text, int start) {
    int depth = 0;
    boolean inString = false;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (c == '\\') {
          i++;
        } else if (c == '"') {
          inString = false;
        }
      } else if (c == '"') {
        inString = true;
      } else if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        if (depth == 0) {
          return i;
        }
        depth--;
      } else if ((c == ',' || c == ';') && depth == 0) {
        return i;
      }
    }
    return text.length();
  }

  /**
   * Steps over a {@code = value} initializer at {@code index}, if any, to the terminator that follows it.
   */
  private static int skipInitializer(String module, int index) {
    if (index + 1 < module.length() && module.charAt(index) == '=' && module.charAt(index + 1) != '=') {
      return scanExpressionEnd(module, index + 1);
    }
    return index;
  }

  private static void extractPorts(String module, ModuleInfo.Builder builder, RangeExpressionEvaluator evaluator) {
    List<Port> found = new ArrayList<>();
    Matcher m = PORT.matcher(module);
    Matcher cont = LIST_CONTINUATION.matcher(module);
    while (m.find()) {
      PortDirection direction = PortDirection.fromKeyword(m.group(1));
      int[] range = resolveRange(m.group(2), m.group(3), m.group(4), evaluator);
      found.add(toPort(m.group(4), direction, range));

      int end = skipInitializer(module, m.end());
      while (true) {
        cont.region(end, module.length());
        if (!cont.lookingAt() || KEYWORDS.contains(cont.group(1))) {
          break;
        }
        found.add(toPort(cont.group(1), direction, range));
        end = skipInitializer(module, cont.end());
      }
    }
    for (Port port : found) {
      if (!builder.addPort(port)) {
        LOGGER.debug("extract: skipping repeated port {}", port.name());
      }
    }
  }

  private static void extractInternalSignals(String module, SignalKind kind, ModuleInfo.Builder builder,
      RangeExpressionEvaluator evaluator) {
    String keyword = kind == SignalKind.WIRE ? "wire" : "reg";
    Matcher m = INTERNAL_SIGNAL.matcher(module);
    Matcher cont = LIST_CONTINUATION.matcher(module);
    while (m.find()) {
      if (!keyword.equals(m.group(1))) {
        continue;
      }
      int[] range = resolveRange(m.group(2), m.group(3), m.group(4), evaluator);
      int width = Math.abs(range[0] - range[1]) + 1;
      addInternal(builder, new Signal(m.group(4), kind, width));

      int end = skipInitializer(module, m.end());
      while (end < module.length() && module.charAt(end) == ',') {
        cont.region(end, module.length());
        if (!cont.lookingAt() || KEYWORDS.contains(cont.group(1))) {
          break;
        }
        addInternal(builder, new Signal(cont.group(1), kind, width));
        end = skipInitializer(module, cont.end());
      }
    }
  }

  /**
   * Ports take precedence over internal declarations, and the first internal declaration of a name wins.
   */
  private static void addInternal(ModuleInfo.Builder builder, Signal signal) {
    if (builder.isDeclared(signal.name())) {
      return;
    }
    builder.addSignal(signal);
  }

  private static Port toPort(String portName, PortDirection direction, int[] range) {
    if (range[0] == 0 && range[1] == 0) {
      return Port.scalar(portName, direction);
    }
    return Port.ranged(portName, direction, range[0], range[1]);
  }

  /**
   * Returns {@code {msb, lsb}}. A missing or unevaluable range yields {@code {0, 0}}.
   */
  private static int[] resolveRange(String msbText, String lsbText, String signalName,
      RangeExpressionEvaluator evaluator) {
    if (msbText == null || lsbText == null) {
      return new int[] {0, 0};
    }
    OptionalLong msb = evaluator.evaluate(msbText);
    OptionalLong lsb = evaluator.evaluate(lsbText);
    if (msb.isEmpty() || lsb.isEmpty() || !fitsInt(msb.getAsLong()) || !fitsInt(lsb.getAsLong())) {
      LOGGER.warn("extract: cannot evaluate range [{}:{}] of {}, treating it as 1 bit", msbText.trim(),
          lsbText.trim(), signalName);
      return new int[] {0, 0};
    }
    return new int[] {(int) msb.getAsLong(), (int) lsb.getAsLong()};
  }

  private static boolean fitsInt(long value) {
    return value >= 0 && value < Integer.MAX_VALUE;
  }
}
