package com.flamingo.ai.foodscout.service.search;

import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import java.util.ArrayList;
import java.util.List;

/** Merged candidates split into shown and filtered shops. */
public record MergeResult(
    List<RestaurantRecommendation> recommended, List<RestaurantRecommendation> filtered) {

  /** Recommended shops first, then filtered ones. */
  public List<RestaurantRecommendation> all() {
    List<RestaurantRecommendation> all = new ArrayList<>(recommended);
    all.addAll(filtered);
    return all;
  }
}
