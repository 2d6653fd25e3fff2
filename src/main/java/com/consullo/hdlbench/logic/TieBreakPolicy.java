package com.consullo.hdlbench.logic;

/**
 * Resolves an input combination whose observed outputs are split evenly between 0 and 1.
 */
public enum TieBreakPolicy {
  /** The output seen at the earliest sample time wins. */
  EARLIEST_OBSERVED,
  /** The output seen at the latest sample time wins. */
  LATEST_OBSERVED,
  PREFER_ZERO,
  PREFER_ONE
}
