package com.consullo.hdlbench.trace;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SignalValueTest {

  @Test
  void parse_AcceptsFourStateSymbolsInEitherCase() {
    SignalValue v = SignalValue.parse("10XZ");

    assertThat(v.text()).isEqualTo("10xz");
    assertThat(v.bits()).containsExactly(BitValue.ONE, BitValue.ZERO, BitValue.X, BitValue.Z);
    assertThat(v.isKnown()).isFalse();
    assertThat(v.hasUnknownBits()).isTrue();
  }

  @Test
  void parse_RejectsOtherCharacters() {
    assertThat(SignalValue.isValid("102")).isFalse();
    assertThat(SignalValue.isValid("")).isFalse();
    assertThat(SignalValue.isValid(null)).isFalse();
    assertThatThrownBy(() -> SignalValue.parse("1.5")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void describe_ScalarAndVectorForms() {
    assertThat(SignalValue.of(BitValue.ONE).describe()).isEqualTo("1 (HIGH)");
    assertThat(SignalValue.of(BitValue.ZERO).describe()).isEqualTo("0 (LOW)");
    assertThat(SignalValue.of(BitValue.X).describe()).isEqualTo("X (UNKNOWN)");
    assertThat(SignalValue.of(BitValue.Z).describe()).isEqualTo("Z (HIGH-IMPEDANCE)");
    assertThat(SignalValue.parse("11111111").describe()).isEqualTo("0xFF (255)");
    assertThat(SignalValue.parse("1x01").describe()).isEqualTo("1x01 (contains X/Z)");
  }

  @Test
  void numericConversions_OnlyWhenKnown() {
    SignalValue known = SignalValue.parse("0110");

    assertThat(known.toDecimal()).contains(BigInteger.valueOf(6));
    assertThat(known.toHex()).contains("0x6");
    assertThat(known.toBinary()).isEqualTo("0110");
    assertThat(SignalValue.parse("z110").toDecimal()).isEmpty();
    assertThat(SignalValue.parse("z110").toHex()).isEmpty();
  }

  @Test
  void extendAndTruncate() {
    assertThat(SignalValue.parse("1").extendTo(4).text()).isEqualTo("0001");
    assertThat(SignalValue.parse("x0").extendTo(4).text()).isEqualTo("xxx0");
    assertThat(SignalValue.parse("z").extendTo(3).text()).isEqualTo("zzz");
    assertThat(SignalValue.parse("101").extendTo(2).text()).isEqualTo("101");
    assertThat(SignalValue.parse("10110").truncateTo(3).text()).isEqualTo("110");
    assertThat(SignalValue.unknown(2).text()).isEqualTo("xx");
  }

  @Test
  void scalarBit_OnVector_Throws() {
    assertThat(SignalValue.parse("z").scalarBit()).isEqualTo(BitValue.Z);
    assertThatThrownBy(() -> SignalValue.parse("01").scalarBit()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void equality_ByBits() {
    assertThat(SignalValue.of(List.of(BitValue.ONE, BitValue.X))).isEqualTo(SignalValue.parse("1X"));
    assertThat(SignalValue.parse("1x").hashCode()).isEqualTo(SignalValue.parse("1X").hashCode());
    assertThat(SignalValue.parse("1")).isNotEqualTo(SignalValue.parse("01"));
  }
}
