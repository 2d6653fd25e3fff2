package com.consullo.hdlbench.syntax;

/**
 * HDL language generation inferred from the constructs a source uses.
 *
 * <p>Constants are declared oldest first, so {@link #isAtLeast(HdlVersion)} can compare ordinals.
 *
 * @since 1.0
 */
public enum HdlVersion {
  VERILOG_95("Verilog-95"),
  VERILOG_2001("Verilog-2001"),
  SYSTEM_VERILOG("SystemVerilog");

  private final String displayName;

  HdlVersion(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  public boolean isAtLeast(HdlVersion other) {
    return ordinal() >= other.ordinal();
  }
}
