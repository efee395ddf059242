package com.flamingo.ai.foodscout.domain.enums;

/** Types of events in a turn's event log. */
public enum SearchEventType {
  STEP_STARTED("step_start"),
  STEP_FINISHED("step_done"),
  STEP_FAILED("step_error"),
  PROGRESS("progress"),
  RECOMMENDATION_ITEM("restaurant"),
  FINAL_RESULT("result"),
  ERROR("error"),
  STREAM_DONE("done"),
  HEARTBEAT("heartbeat");

  private final String wireName;

  SearchEventType(String wireName) {
    this.wireName = wireName;
  }

  /** SSE event name. */
  public String getWireName() {
    return wireName;
  }

  /** A subscription ends after delivering one of these. */
  public boolean isTerminal() {
    return this == STREAM_DONE || this == ERROR;
  }
}
