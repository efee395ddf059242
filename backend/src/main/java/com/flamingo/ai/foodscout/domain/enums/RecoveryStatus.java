package com.flamingo.ai.foodscout.domain.enums;

/** Outcome of a recovery lookup. */
public enum RecoveryStatus {
  LOADING,
  COMPLETED,
  ERROR,
  INTERRUPTED,
  NOT_FOUND
}
