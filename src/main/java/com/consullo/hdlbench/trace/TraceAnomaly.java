package com.consullo.hdlbench.trace;

/**
 * A trace line that was skipped or repaired during parsing.
 *
 * @param lineNumber 1-based line number
 * @param kind anomaly kind
 * @param line offending line, trimmed
 * @since 1.0
 */
public record TraceAnomaly(int lineNumber, Kind kind, String line) {

  /**
   * Anomaly kinds.
   */
  public enum Kind {
    /** Value line naming an identifier no {@code $var} declared. */
    UNKNOWN_IDENTIFIER,
    /** Value line whose value or identifier cannot be read. */
    MALFORMED_VALUE,
    /** Vector value wider than its declaration; the low bits were kept. */
    VALUE_TOO_WIDE,
    /** Real-valued change, which is not supported. */
    UNSUPPORTED_VALUE,
    /** {@code #} marker without a valid integer. */
    MALFORMED_TIME,
    /** Time marker smaller than the previous one. */
    TIME_REGRESSION,
    /** {@code $var} declaration with missing fields or a bad width. */
    MALFORMED_DECLARATION
  }

  @Override
  public String toString() {
    return "line " + lineNumber + ": " + kind + " '" + line + "'";
  }
}
