package com.consullo.hdlbench.module;

/**
 * Direction of a module port.
 */
public enum PortDirection {
  INPUT("input"),
  OUTPUT("output"),
  INOUT("inout");

  private final String keyword;

  PortDirection(String keyword) {
    this.keyword = keyword;
  }

  /**
   * Returns the HDL keyword for this direction.
   *
   * @return keyword
   */
  public String keyword() {
    return keyword;
  }

  /**
   * Resolves an HDL direction keyword.
   *
   * @param keyword {@code input}, {@code output} or {@code inout}
   * @return direction
   */
  public static PortDirection fromKeyword(String keyword) {
    if (keyword == null || keyword.isEmpty()) {
      throw new IllegalArgumentException("keyword must not be blank.");
    }
    for (PortDirection dir : values()) {
      if (dir.keyword.equals(keyword)) {
        return dir;
      }
    }
    throw new IllegalArgumentException("Unknown direction: " + keyword);
  }
}
