package com.flamingo.ai.foodscout.domain.model;

import java.util.List;

/**
 * Evidence for one shop folded from the unit scores that mention it.
 *
 * @param name display name as first mentioned
 * @param topUnits contributing units, heaviest first
 * @param localSignalCount mentions with at least medium identity strength
 */
public record ShopScore(
    String name,
    double totalWeight,
    int mentionCount,
    int strongIdentityCount,
    int correctionCount,
    int positiveCount,
    int negativeCount,
    int localSignalCount,
    List<UnitScore> topUnits,
    List<String> reasons) {}
