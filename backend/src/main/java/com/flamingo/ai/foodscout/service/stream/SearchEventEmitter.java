package com.flamingo.ai.foodscout.service.stream;

import com.flamingo.ai.foodscout.domain.enums.SearchEventType;
import com.flamingo.ai.foodscout.domain.enums.SearchStep;
import com.flamingo.ai.foodscout.domain.model.RecommendationSet;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Typed event helpers for one turn. Nothing is written after the turn's terminal event. */
public class SearchEventEmitter {

  private final SessionEventLog eventLog;
  private final int turnId;

  public SearchEventEmitter(SessionEventLog eventLog, int turnId) {
    this.eventLog = eventLog;
    this.turnId = turnId;
  }

  public void stepStarted(SearchStep step) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("step", step.getId());
    data.put("title", step.getTitle());
    eventLog.appendIfOpen(SearchEventType.STEP_STARTED, data);
  }

  /** Marks a step done and reports the progress reached. */
  public void stepFinished(SearchStep step, String message) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("step", step.getId());
    data.put("message", message);
    eventLog.appendIfOpen(SearchEventType.STEP_FINISHED, data);
    progress(step.getProgress(), step.getTitle());
  }

  public void stepFailed(SearchStep step, String message) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("step", step.getId());
    data.put("message", message);
    eventLog.appendIfOpen(SearchEventType.STEP_FAILED, data);
  }

  public void progress(int percent, String message) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("percent", percent);
    data.put("message", message);
    eventLog.appendIfOpen(SearchEventType.PROGRESS, data);
  }

  public void recommendationItem(RestaurantRecommendation recommendation) {
    eventLog.appendIfOpen(
        SearchEventType.RECOMMENDATION_ITEM, Map.of("restaurant", recommendation.copy()));
  }

  public void finalResult(RecommendationSet result) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("turnId", turnId);
    data.put("action", result.action().name());
    data.put("recommendations", copies(result.recommendations()));
    data.put("filteredCount", result.filteredCount());
    data.put("summary", result.summary());
    data.put("clarificationQuestions", result.clarificationQuestions());
    data.put("documentCount", result.documentCount());
    eventLog.appendIfOpen(SearchEventType.FINAL_RESULT, data);
  }

  public void error(String message) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("turnId", turnId);
    data.put("message", message);
    eventLog.appendIfOpen(SearchEventType.ERROR, data);
  }

  public void done() {
    eventLog.appendIfOpen(SearchEventType.STREAM_DONE, Map.of("turnId", turnId));
  }

  private static List<RestaurantRecommendation> copies(List<RestaurantRecommendation> source) {
    return source.stream().map(RestaurantRecommendation::copy).toList();
  }
}
