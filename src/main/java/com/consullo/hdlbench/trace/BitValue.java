package com.consullo.hdlbench.trace;

/**
 * Four-state logic value of a single bit.
 */
public enum BitValue {
  ZERO('0'),
  ONE('1'),
  X('x'),
  Z('z');

  private final char symbol;

  BitValue(char symbol) {
    this.symbol = symbol;
  }

  /**
   * Returns the lower-case trace symbol.
   *
   * @return one of {@code 0 1 x z}
   */
  public char symbol() {
    return symbol;
  }

  public boolean isKnown() {
    return this == ZERO || this == ONE;
  }

  public static boolean isSymbol(char c) {
    switch (c) {
      case '0':
      case '1':
      case 'x':
      case 'X':
      case 'z':
      case 'Z':
        return true;
      default:
        return false;
    }
  }

  /**
   * Maps a trace symbol (case-insensitive for x and z) to a bit value.
   *
   * @param c symbol
   * @return bit value
   * @throws IllegalArgumentException when {@code c} is not a four-state symbol
   */
  public static BitValue fromSymbol(char c) {
    switch (c) {
      case '0':
        return ZERO;
      case '1':
        return ONE;
      case 'x':
      case 'X':
        return X;
      case 'z':
      case 'Z':
        return Z;
      default:
        throw new IllegalArgumentException("Not a four-state symbol: '" + c + "'");
    }
  }
}
