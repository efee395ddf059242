package com.flamingo.ai.foodscout.exception;

import java.util.UUID;

/** Exception thrown when a turn is submitted while the previous one is still loading. */
public class SessionBusyException extends RuntimeException {

  private final UUID sessionId;
  private final int runningTurnId;

  public SessionBusyException(UUID sessionId, int runningTurnId) {
    super("Session " + sessionId + " is still processing turn " + runningTurnId);
    this.sessionId = sessionId;
    this.runningTurnId = runningTurnId;
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public int getRunningTurnId() {
    return runningTurnId;
  }
}
