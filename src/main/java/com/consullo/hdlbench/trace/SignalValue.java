package com.consullo.hdlbench.trace;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Immutable four-state value of a signal: a single bit, or a vector of bits written most significant first.
 *
 * <p>
 * The textual form used by traces ({@code "1"}, {@code "x"}, {@code "0101"}) is available through {@link #text()};
 * consumers should use {@link #isKnown()}, {@link #isScalar()} and {@link #scalarBit()} instead of inspecting the
 * characters.
 * </p>
 *
 * @since 1.0
 */
public final class SignalValue {

  private final List<BitValue> bits;
  private final String text;

  private SignalValue(List<BitValue> bits) {
    this.bits = Collections.unmodifiableList(bits);
    StringBuilder sb = new StringBuilder(bits.size());
    for (BitValue b : bits) {
      sb.append(b.symbol());
    }
    this.text = sb.toString();
  }

  public static SignalValue of(BitValue bit) {
    Validate.notNull(bit, "bit must not be null");
    List<BitValue> one = new ArrayList<>(1);
    one.add(bit);
    return new SignalValue(one);
  }

  /**
   * Creates a vector value.
   *
   * @param bits bits, most significant first; at least one
   * @return value
   */
  public static SignalValue of(List<BitValue> bits) {
    Validate.notEmpty(bits, "bits must not be empty");
    Validate.noNullElements(bits, "bits must not contain null");
    return new SignalValue(new ArrayList<>(bits));
  }

  /**
   * Parses trace text such as {@code "1"}, {@code "X"} or {@code "10zx"}.
   *
   * @param text four-state symbols, most significant first
   * @return value
   * @throws IllegalArgumentException when the text is empty or contains another character
   */
  public static SignalValue parse(CharSequence text) {
    Validate.isTrue(isValid(text), "Not a four-state value: '%s'", text);
    List<BitValue> parsed = new ArrayList<>(text.length());
    for (int i = 0; i < text.length(); i++) {
      parsed.add(BitValue.fromSymbol(text.charAt(i)));
    }
    return new SignalValue(parsed);
  }

  public static boolean isValid(CharSequence text) {
    if (text == null || text.length() == 0) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      if (!BitValue.isSymbol(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the all-{@code x} value of the given width.
   *
   * @param width bit count, at least 1
   * @return unknown value
   */
  public static SignalValue unknown(int width) {
    Validate.isTrue(width >= 1, "width must be at least 1: %d", width);
    return new SignalValue(new ArrayList<>(Collections.nCopies(width, BitValue.X)));
  }

  /**
   * Left-extends this value to {@code width} bits: a leading {@code x} or {@code z} is repeated, a leading
   * {@code 0} or {@code 1} is padded with {@code 0}. A value already at least as wide is returned unchanged.
   *
   * @param width target width
   * @return extended value
   */
  public SignalValue extendTo(int width) {
    if (bits.size() >= width) {
      return this;
    }
    BitValue lead = bits.get(0);
    BitValue pad = lead.isKnown() ? BitValue.ZERO : lead;
    List<BitValue> out = new ArrayList<>(width);
    out.addAll(Collections.nCopies(width - bits.size(), pad));
    out.addAll(bits);
    return new SignalValue(out);
  }

  /**
   * Keeps the {@code width} least significant bits.
   *
   * @param width target width
   * @return truncated value, or this value when it is not wider
   */
  public SignalValue truncateTo(int width) {
    Validate.isTrue(width >= 1, "width must be at least 1: %d", width);
    if (bits.size() <= width) {
      return this;
    }
    return new SignalValue(new ArrayList<>(bits.subList(bits.size() - width, bits.size())));
  }

  public int width() {
    return bits.size();
  }

  public List<BitValue> bits() {
    return bits;
  }

  public boolean isScalar() {
    return bits.size() == 1;
  }

  /**
   * Returns the single bit of a scalar value.
   *
   * @return bit
   * @throws IllegalStateException when this is a vector
   */
  public BitValue scalarBit() {
    if (!isScalar()) {
      throw new IllegalStateException("Not a scalar value: " + text);
    }
    return bits.get(0);
  }

  /**
   * True when every bit is 0 or 1.
   */
  public boolean isKnown() {
    for (BitValue b : bits) {
      if (!b.isKnown()) {
        return false;
      }
    }
    return true;
  }

  public boolean hasUnknownBits() {
    return !isKnown();
  }

  public String text() {
    return text;
  }

  public String toBinary() {
    return text;
  }

  public Optional<BigInteger> toDecimal() {
    if (!isKnown()) {
      return Optional.empty();
    }
    return Optional.of(new BigInteger(text, 2));
  }

  /**
   * Upper-case hexadecimal with a {@code 0x} prefix, when every bit is known.
   */
  public Optional<String> toHex() {
    return toDecimal().map(v -> "0x" + v.toString(16).toUpperCase(Locale.ROOT));
  }

  /**
   * Human-readable description, e.g. {@code 1 (HIGH)}, {@code Z (HIGH-IMPEDANCE)}, {@code 0xA (10)} or
   * {@code 1x01 (contains X/Z)}.
   *
   * @return description
   */
  public String describe() {
    if (isScalar()) {
      switch (bits.get(0)) {
        case ONE:
          return "1 (HIGH)";
        case ZERO:
          return "0 (LOW)";
        case X:
          return "X (UNKNOWN)";
        default:
          return "Z (HIGH-IMPEDANCE)";
      }
    }
    Optional<BigInteger> decimal = toDecimal();
    if (decimal.isEmpty()) {
      return text + " (contains X/Z)";
    }
    return toHex().orElseThrow() + " (" + decimal.get() + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SignalValue)) {
      return false;
    }
    return text.equals(((SignalValue) o).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }
}
