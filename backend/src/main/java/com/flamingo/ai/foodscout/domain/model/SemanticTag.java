package com.flamingo.ai.foodscout.domain.model;

import com.flamingo.ai.foodscout.domain.enums.IdentityStrength;
import com.flamingo.ai.foodscout.domain.enums.Sentiment;
import java.util.List;

/** Validated labels for one comment unit. */
public record SemanticTag(
    String unitId,
    IdentityStrength identity,
    Sentiment sentiment,
    boolean correction,
    List<String> mentionedShops) {

  public SemanticTag {
    identity = identity == null ? IdentityStrength.NONE : identity;
    sentiment = sentiment == null ? Sentiment.NEUTRAL : sentiment;
    mentionedShops = mentionedShops == null ? List.of() : List.copyOf(mentionedShops);
  }

  /** Tag for a unit the collaborator did not label; it contributes to no shop. */
  public static SemanticTag empty(String unitId) {
    return new SemanticTag(unitId, IdentityStrength.NONE, Sentiment.NEUTRAL, false, List.of());
  }
}
