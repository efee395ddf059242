package com.flamingo.ai.foodscout.service.scoring;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.enums.IdentityStrength;
import com.flamingo.ai.foodscout.domain.enums.Sentiment;
import com.flamingo.ai.foodscout.domain.enums.ShopVerdict;
import com.flamingo.ai.foodscout.domain.model.NormalizedCommentUnit;
import com.flamingo.ai.foodscout.domain.model.SemanticTag;
import com.flamingo.ai.foodscout.domain.model.ShopAssessment;
import com.flamingo.ai.foodscout.domain.model.ShopNames;
import com.flamingo.ai.foodscout.domain.model.ShopScore;
import com.flamingo.ai.foodscout.domain.model.UnitScore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Deterministic comment scoring. Every number a shop's ranking depends on is computed here; the
 * semantic tagger only supplies labels.
 */
@Component
@RequiredArgsConstructor
public class ScoringEngine {

  private final ScoutConfig scoutConfig;

  /**
   * Weight of one unit: engagement coefficient times identity coefficient times content
   * coefficient, with no intermediate rounding.
   */
  public UnitScore score(NormalizedCommentUnit unit, SemanticTag tag) {
    double engagement = unit.engagementCoefficient();
    double identity = identityCoefficient(tag.identity());
    double content = contentCoefficient(tag.correction(), tag.sentiment());
    return new UnitScore(
        unit.id(),
        unit.text(),
        engagement,
        identity,
        content,
        engagement * identity * content,
        tag.identity(),
        tag.sentiment(),
        tag.correction(),
        tag.mentionedShops());
  }

  public static double identityCoefficient(IdentityStrength identity) {
    return switch (identity) {
      case STRONG -> 3.0;
      case MEDIUM -> 2.0;
      case NONE -> 1.0;
    };
  }

  /** A correction outweighs tone: 3.0 for corrections, else 1.5 for negative, else 1.0. */
  public static double contentCoefficient(boolean correction, Sentiment sentiment) {
    if (correction) {
      return 3.0;
    }
    if (sentiment == Sentiment.NEGATIVE) {
      return 1.5;
    }
    return 1.0;
  }

  /**
   * Folds unit scores into per-shop scores keyed by normalized shop name. A unit mentioning several
   * shops contributes its full weight to each; a unit naming the same shop twice counts once.
   *
   * @return shop scores ordered by total weight, heaviest first
   */
  public Map<String, ShopScore> aggregate(List<UnitScore> unitScores) {
    Map<String, ShopAccumulator> accumulators = new LinkedHashMap<>();
    for (UnitScore unitScore : unitScores) {
      Set<String> seenKeys = new LinkedHashSet<>();
      for (String shop : unitScore.mentionedShops()) {
        String key = ShopNames.normalize(shop);
        if (key.isEmpty() || !seenKeys.add(key)) {
          continue;
        }
        accumulators
            .computeIfAbsent(key, k -> new ShopAccumulator(shop.strip().replaceAll("\\s+", " ")))
            .add(unitScore);
      }
    }

    int topUnits = scoutConfig.getScoring().getTopUnits();
    List<Map.Entry<String, ShopScore>> entries = new ArrayList<>();
    for (Map.Entry<String, ShopAccumulator> entry : accumulators.entrySet()) {
      entries.add(Map.entry(entry.getKey(), entry.getValue().toShopScore(topUnits)));
    }
    entries.sort(
        Comparator.comparingDouble((Map.Entry<String, ShopScore> e) -> e.getValue().totalWeight())
            .reversed());

    Map<String, ShopScore> result = new LinkedHashMap<>();
    for (Map.Entry<String, ShopScore> entry : entries) {
      result.put(entry.getKey(), entry.getValue());
    }
    return result;
  }

  /** Scores every tagged unit and aggregates in one step. */
  public Map<String, ShopScore> scoreAll(
      List<NormalizedCommentUnit> units, Map<String, SemanticTag> tags) {
    List<UnitScore> scores = new ArrayList<>();
    for (NormalizedCommentUnit unit : units) {
      SemanticTag tag = tags.getOrDefault(unit.id(), SemanticTag.empty(unit.id()));
      scores.add(score(unit, tag));
    }
    return aggregate(scores);
  }

  /** Applies the configured thresholds to decide genuine versus promoted. */
  public ShopAssessment classify(ShopScore shopScore) {
    ScoutConfig.Scoring policy = scoutConfig.getScoring();
    boolean localMentions = shopScore.localSignalCount() > 0;

    if (shopScore.strongIdentityCount() >= policy.getGenuineStrongCount()
        && shopScore.totalWeight() > policy.getGenuineTotal()) {
      return new ShopAssessment(
          ShopVerdict.GENUINE, policy.getGenuineConfidence(), shopScore.reasons(), localMentions);
    }
    if (shopScore.strongIdentityCount() >= policy.getLikelyGenuineStrongCount()
        && shopScore.totalWeight() > policy.getLikelyGenuineTotal()) {
      return new ShopAssessment(
          ShopVerdict.LIKELY_GENUINE,
          policy.getLikelyGenuineConfidence(),
          shopScore.reasons(),
          localMentions);
    }
    if (shopScore.negativeCount() > shopScore.positiveCount()) {
      return new ShopAssessment(
          ShopVerdict.LIKELY_PROMOTED,
          policy.getLikelyPromotedConfidence(),
          shopScore.reasons(),
          localMentions);
    }
    return new ShopAssessment(
        ShopVerdict.UNKNOWN, policy.getUnknownConfidence(), shopScore.reasons(), localMentions);
  }

  private static final class ShopAccumulator {

    private final String name;
    private final List<UnitScore> units = new ArrayList<>();
    private double total;
    private int strong;
    private int corrections;
    private int positive;
    private int negative;
    private int localSignals;

    private ShopAccumulator(String name) {
      this.name = name;
    }

    private void add(UnitScore unitScore) {
      units.add(unitScore);
      total += unitScore.weight();
      if (unitScore.identity() == IdentityStrength.STRONG) {
        strong++;
      }
      if (unitScore.identity() != IdentityStrength.NONE) {
        localSignals++;
      }
      if (unitScore.correction()) {
        corrections++;
      }
      if (unitScore.sentiment() == Sentiment.POSITIVE) {
        positive++;
      } else if (unitScore.sentiment() == Sentiment.NEGATIVE) {
        negative++;
      }
    }

    private ShopScore toShopScore(int topUnits) {
      List<UnitScore> sorted = new ArrayList<>(units);
      sorted.sort(Comparator.comparingDouble(UnitScore::weight).reversed());

      List<String> reasons = new ArrayList<>();
      if (localSignals > 0) {
        reasons.add(localSignals + " local comments");
      }
      if (corrections > 0) {
        reasons.add(corrections + " correction comments");
      }
      if (units.size() >= 2) {
        reasons.add("mentioned in " + units.size() + " comments");
      }

      return new ShopScore(
          name,
          total,
          units.size(),
          strong,
          corrections,
          positive,
          negative,
          localSignals,
          List.copyOf(sorted.subList(0, Math.min(topUnits, sorted.size()))),
          List.copyOf(reasons));
    }
  }
}
