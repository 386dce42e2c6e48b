package com.mk.fx.qa.consistency.model;

/** Lifecycle of one consistency probe: WRITING, then POLLING, then one terminal state. */
public enum ProbeState {
  WRITING,
  POLLING,
  CONSISTENT,
  TIMED_OUT,
  WRITE_FAILED;

  public boolean isTerminal() {
    return this == CONSISTENT || this == TIMED_OUT || this == WRITE_FAILED;
  }
}
