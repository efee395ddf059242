package com.flamingo.ai.foodscout.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed search intent. Regenerated for every fresh search and reused as-is when a follow-up asks
 * for more places.
 */
public record SearchIntent(
    String location, String foodType, List<String> requirements, List<String> excludeKeywords) {

  public SearchIntent {
    if (location == null || location.isBlank()) {
      throw new IllegalArgumentException("location is required");
    }
    location = location.trim();
    foodType = foodType == null ? "" : foodType.trim();
    requirements = requirements == null ? List.of() : List.copyOf(requirements);
    excludeKeywords = excludeKeywords == null ? List.of() : List.copyOf(excludeKeywords);
  }

  public static SearchIntent of(String location, String foodType) {
    return new SearchIntent(location, foodType, List.of(), List.of());
  }

  public boolean hasFoodType() {
    return !foodType.isEmpty();
  }

  /** Returns a copy whose exclude keywords also contain the given shop names. */
  public SearchIntent withExcluded(List<String> shopNames) {
    List<String> merged = new ArrayList<>(excludeKeywords);
    for (String name : shopNames) {
      if (name != null && !name.isBlank() && !merged.contains(name)) {
        merged.add(name);
      }
    }
    return new SearchIntent(location, foodType, requirements, merged);
  }
}
