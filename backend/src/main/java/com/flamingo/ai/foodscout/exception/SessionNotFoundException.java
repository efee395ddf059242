package com.flamingo.ai.foodscout.exception;

import java.util.UUID;

/** Exception thrown when a session has no in-memory record to stream from. */
public class SessionNotFoundException extends RuntimeException {

  private final UUID sessionId;

  public SessionNotFoundException(UUID sessionId) {
    super("Session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
