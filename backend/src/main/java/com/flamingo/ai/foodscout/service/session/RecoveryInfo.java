package com.flamingo.ai.foodscout.service.session;

import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import com.flamingo.ai.foodscout.domain.enums.RecoveryStatus;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import java.util.List;
import java.util.UUID;

/**
 * What a reconnecting client needs to resume a turn.
 *
 * @param subscribeUrl set only while the turn is still loading
 * @param lastEventIndex index of the last event emitted so far, -1 when none or not in memory
 * @param source which tier answered: {@code memory}, {@code durable}, {@code request} or
 *     {@code none}
 */
public record RecoveryInfo(
    UUID sessionId,
    Integer turnId,
    RecoveryStatus status,
    String subscribeUrl,
    int lastEventIndex,
    FollowUpType action,
    List<RestaurantRecommendation> recommendations,
    int filteredCount,
    String summary,
    String errorDetail,
    String source) {

  public RecoveryInfo {
    recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
  }

  public static RecoveryInfo loading(
      UUID sessionId, int turnId, String subscribeUrl, int lastEventIndex) {
    return new RecoveryInfo(
        sessionId,
        turnId,
        RecoveryStatus.LOADING,
        subscribeUrl,
        lastEventIndex,
        null,
        List.of(),
        0,
        null,
        null,
        "memory");
  }

  public static RecoveryInfo failed(
      UUID sessionId, Integer turnId, RecoveryStatus status, String detail, String source) {
    return new RecoveryInfo(
        sessionId, turnId, status, null, -1, null, List.of(), 0, null, detail, source);
  }

  public static RecoveryInfo notFound(UUID sessionId, Integer turnId) {
    return failed(sessionId, turnId, RecoveryStatus.NOT_FOUND, null, "none");
  }
}
