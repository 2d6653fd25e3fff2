package com.consullo.hdlbench.module;

/**
 * Kind of an internal (non-port) signal declaration.
 */
public enum SignalKind {
  WIRE,
  REG
}
