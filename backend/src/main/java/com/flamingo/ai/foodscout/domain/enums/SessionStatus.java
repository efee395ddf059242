package com.flamingo.ai.foodscout.domain.enums;

/** Lifecycle of the in-memory session record. */
public enum SessionStatus {
  IDLE,
  LOADING,
  COMPLETED,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }
}
