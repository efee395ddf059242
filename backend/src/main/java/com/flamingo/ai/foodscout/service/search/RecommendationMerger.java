package com.flamingo.ai.foodscout.service.search;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.domain.model.ShopAssessment;
import com.flamingo.ai.foodscout.domain.model.ShopNames;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Merges per-document candidates into one list per shop and cross-validates them.
 *
 * <p>Same-name candidates merge their documents and features and keep the most confident
 * assessment. Confidence is then adjusted for corroboration: fewer than two backing documents
 * lowers it, three or more with a local mention raises it, capped at 1.0. Promoted shops, excluded
 * shops and shops matching an exclude keyword are filtered with a reason.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecommendationMerger {

  private static final Set<String> PLACEHOLDER_NAMES = Set.of("unknown", "未知");

  private final ScoutConfig scoutConfig;

  public MergeResult merge(
      List<RestaurantRecommendation> candidates,
      Collection<String> excludedShops,
      Collection<String> excludeKeywords) {
    Map<String, RestaurantRecommendation> merged = new LinkedHashMap<>();
    for (RestaurantRecommendation candidate : candidates) {
      String key = ShopNames.normalize(candidate.getName());
      if (key.isEmpty() || PLACEHOLDER_NAMES.contains(key)) {
        continue;
      }
      RestaurantRecommendation existing = merged.get(key);
      if (existing == null) {
        merged.put(key, candidate);
      } else {
        absorb(existing, candidate);
      }
    }

    List<RestaurantRecommendation> recommended = new ArrayList<>();
    List<RestaurantRecommendation> filtered = new ArrayList<>();
    for (RestaurantRecommendation recommendation : merged.values()) {
      adjustConfidence(recommendation);
      if (recommendation.isRecommended()) {
        applyExclusions(recommendation, excludedShops, excludeKeywords);
      }
      if (recommendation.isRecommended()) {
        recommended.add(recommendation);
      } else {
        filtered.add(recommendation);
      }
    }

    recommended.sort(
        Comparator.comparingDouble(RestaurantRecommendation::getConfidence)
            .thenComparingInt(RestaurantRecommendation::sourceCount)
            .reversed());

    log.debug(
        "Merged {} candidates into {} shops ({} filtered)",
        candidates.size(),
        merged.size(),
        filtered.size());
    return new MergeResult(recommended, filtered);
  }

  private void absorb(RestaurantRecommendation existing, RestaurantRecommendation other) {
    for (String documentId : other.getSourceDocumentIds()) {
      if (!existing.getSourceDocumentIds().contains(documentId)) {
        existing.getSourceDocumentIds().add(documentId);
      }
    }
    for (String feature : other.getFeatures()) {
      if (!existing.getFeatures().contains(feature)) {
        existing.getFeatures().add(feature);
      }
    }
    if (other.getConfidence() > existing.getConfidence()) {
      existing.setConfidence(other.getConfidence());
      existing.setAssessment(other.getAssessment());
    }
  }

  private void adjustConfidence(RestaurantRecommendation recommendation) {
    ScoutConfig.Merge policy = scoutConfig.getMerge();
    ShopAssessment assessment = recommendation.getAssessment();
    int sources = recommendation.sourceCount();

    if (assessment != null && assessment.verdict().isPromoted()) {
      List<String> reasons = assessment.reasons();
      String detail =
          reasons.isEmpty()
              ? ""
              : ": " + String.join(", ", reasons.subList(0, Math.min(2, reasons.size())));
      recommendation.markFiltered("Judged as promoted" + detail);
    } else if (sources < policy.getLowCorroborationSources()) {
      recommendation.setConfidence(
          recommendation.getConfidence() * policy.getLowCorroborationFactor());
    } else if (sources >= policy.getStrongCorroborationSources()
        && assessment != null
        && assessment.localMentions()) {
      recommendation.setConfidence(
          Math.min(recommendation.getConfidence() * policy.getStrongCorroborationFactor(), 1.0));
    }
  }

  private void applyExclusions(
      RestaurantRecommendation recommendation,
      Collection<String> excludedShops,
      Collection<String> excludeKeywords) {
    for (String excluded : excludedShops) {
      if (ShopNames.looselyMatches(recommendation.getName(), excluded)) {
        recommendation.markFiltered("Excluded by user: " + excluded);
        return;
      }
    }
    for (String keyword : excludeKeywords) {
      if (keyword != null && !keyword.isBlank() && mentions(recommendation, keyword)) {
        recommendation.markFiltered("Matches excluded keyword: " + keyword.strip());
        return;
      }
    }
  }

  private static boolean mentions(RestaurantRecommendation recommendation, String keyword) {
    String needle = keyword.strip().toLowerCase(Locale.ROOT);
    if (recommendation.getName().toLowerCase(Locale.ROOT).contains(needle)) {
      return true;
    }
    for (String feature : recommendation.getFeatures()) {
      if (feature != null && feature.toLowerCase(Locale.ROOT).contains(needle)) {
        return true;
      }
    }
    return false;
  }
}
