package com.flamingo.ai.foodscout.domain.model;

import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import java.util.List;

/**
 * Outcome of one turn.
 *
 * @param recommendations shops to show, best first
 * @param filtered shops dropped this turn, each with a filter reason
 * @param clarificationQuestions non-empty only when the request lacked a location
 * @param documentCount documents gathered by the search, zero for follow-ups that did not search
 */
public record RecommendationSet(
    FollowUpType action,
    List<RestaurantRecommendation> recommendations,
    List<RestaurantRecommendation> filtered,
    String summary,
    List<String> clarificationQuestions,
    int documentCount) {

  public RecommendationSet {
    recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    filtered = filtered == null ? List.of() : List.copyOf(filtered);
    clarificationQuestions =
        clarificationQuestions == null ? List.of() : List.copyOf(clarificationQuestions);
  }

  public static RecommendationSet clarification(String summary, List<String> questions) {
    return new RecommendationSet(
        FollowUpType.NEW_SEARCH, List.of(), List.of(), summary, questions, 0);
  }

  public int filteredCount() {
    return filtered.size();
  }

  public boolean needsClarification() {
    return !clarificationQuestions.isEmpty();
  }
}
