package com.consullo.hdlbench.logic;

/**
 * Outcome of replaying one input combination.
 */
public enum CombinationStatus {
  PASS,
  MISMATCH,
  NOT_EXERCISED
}
