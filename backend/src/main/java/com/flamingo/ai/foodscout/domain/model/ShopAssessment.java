package com.flamingo.ai.foodscout.domain.model;

import com.flamingo.ai.foodscout.domain.enums.ShopVerdict;
import java.util.List;

/** Genuine-versus-promoted judgement backing a recommendation. */
public record ShopAssessment(
    ShopVerdict verdict, double confidence, List<String> reasons, boolean localMentions) {

  public ShopAssessment {
    verdict = verdict == null ? ShopVerdict.UNKNOWN : verdict;
    reasons = reasons == null ? List.of() : List.copyOf(reasons);
  }
}
