package com.flamingo.ai.foodscout.service.followup;

import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import java.util.List;

/**
 * Classified turn.
 *
 * @param target text captured by the matching rule (shop name, category or area), may be null
 * @param selectedShops shops picked by the collaborator, empty for rule matches
 * @param response collaborator's reply to show alongside the result, may be null
 * @param tier which tier decided: {@code initial}, {@code rule}, {@code name} or {@code
 *     collaborator}
 */
public record FollowUpDecision(
    FollowUpType type, String target, List<String> selectedShops, String response, String tier) {

  public FollowUpDecision {
    selectedShops = selectedShops == null ? List.of() : List.copyOf(selectedShops);
  }

  public static FollowUpDecision newSearch(String tier) {
    return new FollowUpDecision(FollowUpType.NEW_SEARCH, null, List.of(), null, tier);
  }

  public static FollowUpDecision rule(FollowUpType type, String target) {
    return new FollowUpDecision(type, target, List.of(), null, "rule");
  }

  public boolean hasTarget() {
    return target != null && !target.isBlank();
  }
}
