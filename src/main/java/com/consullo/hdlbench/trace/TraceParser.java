package com.consullo.hdlbench.trace;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses value change dump text into a {@link SignalTable} and a {@link ChangeLog}.
 *
 * <p>
 * The parser has two states. In {@link State#HEADER} it reads declarations, each running from a {@code $keyword}
 * token to the next {@code $end} token, so a declaration may span lines or share a line with another. The
 * {@code $enddefinitions} declaration moves it to {@link State#BODY}, where each line holds time markers
 * ({@code #n}), scalar changes ({@code 1!}) and vector changes ({@code b0101 !}). Lines inside a {@code $dumpvars}
 * block are ordinary value lines at the current time (0 until a marker is seen).
 * </p>
 *
 * <p>
 * Malformed lines never abort a parse. They are skipped (or repaired, for over-wide vectors) and reported as
 * {@link TraceAnomaly} entries. All mutable state lives in a per-call object, so one parser may be shared across
 * threads.
 * </p>
 *
 * @since 1.0
 */
public final class TraceParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(TraceParser.class);

  private static final String END = "$end";

  /**
   * Parser states. The only transition is {@code HEADER -> BODY}.
   */
  public enum State {
    HEADER,
    BODY
  }

  /**
   * Parses trace text.
   *
   * @param text trace text
   * @return parse result
   */
  public TraceParseResult parse(String text) {
    Validate.notNull(text, "text must not be null");
    try {
      return parse(new StringReader(text));
    } catch (IOException e) {
      throw new UncheckedIOException("StringReader failed", e);
    }
  }

  /**
   * Parses a trace file.
   *
   * @param file trace file
   * @return parse result
   * @throws IOException if the file cannot be read
   */
  public TraceParseResult parseFile(Path file) throws IOException {
    Validate.notNull(file, "file must not be null");
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      TraceParseResult result = parse(reader);
      LOGGER.info("Parsed {}: {} signal(s), {} change(s), {} anomaly(ies)", file, result.signals().size(),
          result.changes().size(), result.anomalies().size());
      return result;
    }
  }

  /**
   * Parses trace text from a reader. The reader is not closed.
   *
   * @param reader source
   * @return parse result
   * @throws IOException if reading fails
   */
  public TraceParseResult parse(Reader reader) throws IOException {
    Validate.notNull(reader, "reader must not be null");
    BufferedReader buffered = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    ParseRun run = new ParseRun();
    String line;
    while ((line = buffered.readLine()) != null) {
      run.accept(line);
    }
    return run.finish();
  }

  /**
   * Mutable state of a single parse.
   */
  private static final class ParseRun {

    private State state = State.HEADER;
    private Timescale timescale = Timescale.DEFAULT;
    private final Deque<String> scopes = new ArrayDeque<>();
    private final Map<String, SignalAccumulator> signals = new LinkedHashMap<>();
    private final List<TraceEvent> events = new ArrayList<>();
    private final List<TraceAnomaly> anomalies = new ArrayList<>();

    private List<String> declaration;
    private int declarationLine;
    private boolean inComment;
    private long currentTime;
    private int lineNumber;

    void accept(String rawLine) {
      lineNumber++;
      String line = rawLine.trim();
      if (line.isEmpty()) {
        return;
      }
      String[] tokens = StringUtils.split(line);
      int i = 0;
      while (i < tokens.length && state == State.HEADER) {
        headerToken(tokens[i]);
        i++;
      }
      if (i < tokens.length) {
        bodyTokens(tokens, i, line);
      }
    }

    private void headerToken(String token) {
      if (declaration == null) {
        if (token.startsWith("$") && !token.equals(END)) {
          declaration = new ArrayList<>();
          declaration.add(token);
          declarationLine = lineNumber;
        }
        return;
      }
      if (token.equals(END)) {
        List<String> complete = declaration;
        declaration = null;
        declare(complete);
        return;
      }
      declaration.add(token);
    }

    private void declare(List<String> tokens) {
      if (tokens.isEmpty()) {
        return;
      }
      switch (tokens.get(0)) {
        case "$timescale":
          timescale = Timescale.parse(String.join(" ", tokens.subList(1, tokens.size())));
          break;
        case "$scope":
          if (tokens.size() >= 3) {
            scopes.addLast(tokens.get(2));
          }
          break;
        case "$upscope":
          if (!scopes.isEmpty()) {
            scopes.removeLast();
          }
          break;
        case "$var":
          declareVariable(tokens);
          break;
        case "$enddefinitions":
          state = State.BODY;
          LOGGER.debug("Header complete at line {}: {} variable(s), timescale {}", lineNumber, signals.size(),
              timescale);
          break;
        default:
          break;
      }
    }

    private void declareVariable(List<String> tokens) {
      String text = String.join(" ", tokens);
      if (tokens.size() < 5) {
        anomaly(declarationLine, TraceAnomaly.Kind.MALFORMED_DECLARATION, text);
        return;
      }
      int width;
      try {
        width = Integer.parseInt(tokens.get(2));
      } catch (NumberFormatException e) {
        width = 0;
      }
      if (width < 1) {
        anomaly(declarationLine, TraceAnomaly.Kind.MALFORMED_DECLARATION, text);
        return;
      }
      String identifier = tokens.get(3);
      String name = tokens.get(4);
      List<String> path = new ArrayList<>(scopes);
      path.add(name);
      SignalAccumulator previous = signals.put(identifier,
          new SignalAccumulator(identifier, name, String.join(".", path), tokens.get(1), width));
      if (previous != null) {
        LOGGER.debug("Identifier {} re-declared as {}, replacing {}", identifier, name, previous.fullName);
      }
    }

    private void bodyTokens(String[] tokens, int start, String line) {
      int i = start;
      while (i < tokens.length) {
        String token = tokens[i];
        if (inComment) {
          inComment = !token.equals(END);
          i++;
          continue;
        }
        char first = token.charAt(0);
        if (first == '$') {
          inComment = token.equals("$comment");
          i++;
        } else if (first == '#') {
          time(token.substring(1), line);
          i++;
        } else if (BitValue.isSymbol(first)) {
          String identifier = token.substring(1);
          if (identifier.isEmpty()) {
            anomaly(lineNumber, TraceAnomaly.Kind.MALFORMED_VALUE, line);
          } else {
            change(identifier, String.valueOf(first), line);
          }
          i++;
        } else if (first == 'b' || first == 'B' || first == 'r' || first == 'R') {
          if (i + 1 >= tokens.length) {
            anomaly(lineNumber, TraceAnomaly.Kind.MALFORMED_VALUE, line);
            i++;
            continue;
          }
          String identifier = tokens[i + 1];
          if (first == 'r' || first == 'R') {
            anomaly(lineNumber, TraceAnomaly.Kind.UNSUPPORTED_VALUE, line);
          } else if (!SignalValue.isValid(token.substring(1))) {
            anomaly(lineNumber, TraceAnomaly.Kind.MALFORMED_VALUE, line);
          } else {
            change(identifier, token.substring(1), line);
          }
          i += 2;
        } else {
          i++;
        }
      }
    }

    private void time(String digits, String line) {
      long parsed;
      try {
        parsed = Long.parseLong(digits);
      } catch (NumberFormatException e) {
        anomaly(lineNumber, TraceAnomaly.Kind.MALFORMED_TIME, line);
        return;
      }
      if (parsed < 0) {
        anomaly(lineNumber, TraceAnomaly.Kind.MALFORMED_TIME, line);
        return;
      }
      if (parsed < currentTime) {
        anomaly(lineNumber, TraceAnomaly.Kind.TIME_REGRESSION, line);
      }
      currentTime = parsed;
    }

    private void change(String identifier, String bits, String line) {
      SignalAccumulator target = signals.get(identifier);
      if (target == null) {
        anomaly(lineNumber, TraceAnomaly.Kind.UNKNOWN_IDENTIFIER, line);
        return;
      }
      SignalValue value = SignalValue.parse(bits);
      if (value.width() > target.width) {
        anomaly(lineNumber, TraceAnomaly.Kind.VALUE_TOO_WIDE, line);
        value = value.truncateTo(target.width);
      } else {
        value = value.extendTo(target.width);
      }
      target.changes.add(new ValueChange(currentTime, value));
      events.add(new TraceEvent(currentTime, identifier, value));
    }

    private void anomaly(int at, TraceAnomaly.Kind kind, String line) {
      LOGGER.debug("Trace anomaly at line {}: {} '{}'", at, kind, line);
      anomalies.add(new TraceAnomaly(at, kind, line));
    }

    TraceParseResult finish() {
      List<SignalRecord> records = new ArrayList<>(signals.size());
      for (SignalAccumulator s : signals.values()) {
        records.add(new SignalRecord(s.identifier, s.name, s.fullName, s.kind, s.width, s.changes));
      }
      if (records.isEmpty()) {
        LOGGER.warn("No signals found in trace ({} line(s))", lineNumber);
      }
      return new TraceParseResult(timescale, SignalTable.of(records), new ChangeLog(events), anomalies, state);
    }
  }

  private static final class SignalAccumulator {

    private final String identifier;
    private final String name;
    private final String fullName;
    private final String kind;
    private final int width;
    private final List<ValueChange> changes = new ArrayList<>();

    SignalAccumulator(String identifier, String name, String fullName, String kind, int width) {
      this.identifier = identifier;
      this.name = name;
      this.fullName = fullName;
      this.kind = kind;
      this.width = width;
    }
  }
}
