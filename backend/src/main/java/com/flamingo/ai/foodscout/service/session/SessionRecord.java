package com.flamingo.ai.foodscout.service.session;

import com.flamingo.ai.foodscout.domain.enums.SessionStatus;
import com.flamingo.ai.foodscout.domain.model.ConversationContext;
import com.flamingo.ai.foodscout.domain.model.RecommendationSet;
import com.flamingo.ai.foodscout.service.stream.SessionEventLog;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.Future;

/**
 * In-memory state of one session: its conversation, the running or last turn and that turn's
 * event log. State transitions are synchronized on the record; the context is only touched by the
 * turn task that owns the session while it is loading.
 */
public class SessionRecord {

  private final UUID sessionId;
  private final ConversationContext context;

  private SessionStatus status = SessionStatus.IDLE;
  private int lastTurnId;
  private int currentTurnId;
  private SessionEventLog eventLog;
  private Future<?> task;
  private RecommendationSet lastResult;
  private String errorDetail;
  private boolean cancelled;
  private Instant lastActivity = Instant.now();

  public SessionRecord(UUID sessionId, ConversationContext context, int lastTurnId) {
    this.sessionId = sessionId;
    this.context = context;
    this.lastTurnId = lastTurnId;
  }

  public UUID getSessionId() {
    return sessionId;
  }

  public ConversationContext getContext() {
    return context;
  }

  /**
   * Moves to LOADING with the next turn id and a fresh event log.
   *
   * @return the new turn id, or -1 when a turn is already loading
   */
  public synchronized int startTurn(SessionEventLog log) {
    if (status == SessionStatus.LOADING) {
      return -1;
    }
    lastTurnId++;
    currentTurnId = lastTurnId;
    eventLog = log;
    status = SessionStatus.LOADING;
    lastResult = null;
    errorDetail = null;
    lastActivity = Instant.now();
    return currentTurnId;
  }

  public synchronized void attachTask(Future<?> future) {
    this.task = future;
  }

  public synchronized void complete(RecommendationSet result) {
    status = SessionStatus.COMPLETED;
    lastResult = result;
    task = null;
    lastActivity = Instant.now();
  }

  public synchronized void fail(String detail) {
    status = SessionStatus.ERROR;
    errorDetail = detail;
    task = null;
    lastActivity = Instant.now();
  }

  /** Cancels a running turn. The record is discarded afterwards. */
  public synchronized void cancel() {
    cancelled = true;
    if (task != null) {
      task.cancel(true);
      task = null;
    }
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  public synchronized SessionStatus getStatus() {
    return status;
  }

  public synchronized int getLastTurnId() {
    return lastTurnId;
  }

  public synchronized int getCurrentTurnId() {
    return currentTurnId;
  }

  public synchronized SessionEventLog getEventLog() {
    return eventLog;
  }

  public synchronized RecommendationSet getLastResult() {
    return lastResult;
  }

  public synchronized String getErrorDetail() {
    return errorDetail;
  }

  public synchronized Instant getLastActivity() {
    return lastActivity;
  }

  public synchronized void touch() {
    lastActivity = Instant.now();
  }
}
