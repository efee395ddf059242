package com.flamingo.ai.foodscout.domain.enums;

/** Persisted status of a submitted turn. */
public enum RequestStatus {
  LOADING,
  COMPLETED,
  ERROR
}
