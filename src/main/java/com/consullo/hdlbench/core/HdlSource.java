package com.consullo.hdlbench.core;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text utilities shared by the HDL checker and extractor.
 *
 * <p>All analysis in this library runs on comment-stripped text so that commented-out code never produces findings
 * or declarations. Stripping keeps the line structure intact: a block comment spanning several lines is replaced by
 * the same number of newlines, so 1-based line numbers reported against stripped text match the original source.
 *
 * @since 1.0
 */
public final class HdlSource {

  private static final Pattern MODULE_HEAD = Pattern.compile("\\bmodule\\s+(\\w+)");
  private static final Pattern ENDMODULE = Pattern.compile("\\bendmodule\\b");
  private static final Pattern SUBROUTINE = Pattern.compile(
      "\\bfunction\\b.*?(?:\\bendfunction\\b|\\z)|\\btask\\b.*?(?:\\bendtask\\b|\\z)", Pattern.DOTALL);

  private HdlSource() {
  }

  /**
   * Removes {@code //} line comments and slash-star block comments.
   *
   * <p>Comment markers inside string literals are left alone. An unterminated block comment runs to the end of the
   * text.
   *
   * @param source HDL text
   * @return text without comments, same number of lines as the input
   */
  public static String stripComments(String source) {
    if (source == null) {
      throw new IllegalArgumentException("source must not be null.");
    }
    StringBuilder out = new StringBuilder(source.length());
    int n = source.length();
    int i = 0;
    boolean inString = false;
    while (i < n) {
      char c = source.charAt(i);
      char next = i + 1 < n ? source.charAt(i + 1) : '\0';

      if (inString) {
        out.append(c);
        if (c == '\\' && i + 1 < n) {
          out.append(next);
          i += 2;
          continue;
        }
        if (c == '"' || c == '\n') {
          inString = false;
        }
        i++;
        continue;
      }

      if (c == '"') {
        inString = true;
        out.append(c);
        i++;
      } else if (c == '/' && next == '/') {
        while (i < n && source.charAt(i) != '\n') {
          i++;
        }
      } else if (c == '/' && next == '*') {
        i += 2;
        while (i < n && !(source.charAt(i) == '*' && i + 1 < n && source.charAt(i + 1) == '/')) {
          if (source.charAt(i) == '\n') {
            out.append('\n');
          }
          i++;
        }
        i += 2;
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  /**
   * Splits text into lines, keeping trailing empty lines.
   *
   * @param text text
   * @return lines without terminators
   */
  public static List<String> lines(String text) {
    List<String> out = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        out.add(trimCarriageReturn(text.substring(start, i)));
        start = i + 1;
      }
    }
    out.add(trimCarriageReturn(text.substring(start)));
    return out;
  }

  /**
   * Returns the text of the first module, from its {@code module} keyword through the first following
   * {@code endmodule} (or the end of the text when none follows).
   *
   * @param strippedText comment-stripped HDL text
   * @return first module text, or empty string when no module is declared
   */
  public static String firstModule(String strippedText) {
    Matcher head = MODULE_HEAD.matcher(strippedText);
    if (!head.find()) {
      return "";
    }
    Matcher end = ENDMODULE.matcher(strippedText);
    if (end.find(head.end())) {
      return strippedText.substring(head.start(), end.end());
    }
    return strippedText.substring(head.start());
  }

  /**
   * Blanks out {@code function ... endfunction} and {@code task ... endtask} bodies.
   *
   * <p>Declarations local to a subroutine (its {@code input}s, {@code reg}s) do not belong to the enclosing module.
   * Every blanked character becomes a space except newlines, so offsets and line numbers are preserved.
   *
   * @param strippedText comment-stripped HDL text
   * @return text with subroutine bodies blanked
   */
  public static String withoutSubroutines(String strippedText) {
    Matcher m = SUBROUTINE.matcher(strippedText);
    StringBuilder out = new StringBuilder(strippedText);
    while (m.find()) {
      for (int i = m.start(); i < m.end(); i++) {
        if (out.charAt(i) != '\n') {
          out.setCharAt(i, ' ');
        }
      }
    }
    return out.toString();
  }

  /**
   * Counts non-overlapping regex matches.
   *
   * @param pattern pattern
   * @param text text
   * @return match count
   */
  public static int count(Pattern pattern, CharSequence text) {
    Matcher m = pattern.matcher(text);
    int n = 0;
    while (m.find()) {
      n++;
    }
    return n;
  }

  private static String trimCarriageReturn(String line) {
    if (!line.isEmpty() && line.charAt(line.length() - 1) == '\r') {
      return line.substring(0, line.length() - 1);
    }
    return line;
  }
}
