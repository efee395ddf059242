package com.flamingo.ai.foodscout.domain.model;

import com.flamingo.ai.foodscout.domain.enums.IdentityStrength;
import com.flamingo.ai.foodscout.domain.enums.Sentiment;
import java.util.List;

/**
 * Weight of one comment unit with the three factors that produced it.
 *
 * <p>{@code weight == engagementCoefficient * identityCoefficient * contentCoefficient}, unrounded.
 */
public record UnitScore(
    String unitId,
    String text,
    double engagementCoefficient,
    double identityCoefficient,
    double contentCoefficient,
    double weight,
    IdentityStrength identity,
    Sentiment sentiment,
    boolean correction,
    List<String> mentionedShops) {}
