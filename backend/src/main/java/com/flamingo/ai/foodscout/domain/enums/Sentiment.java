package com.flamingo.ai.foodscout.domain.enums;

import java.util.Locale;

/** Tone of a comment toward the shops it mentions. */
public enum Sentiment {
  NEUTRAL,
  POSITIVE,
  NEGATIVE;

  /** Parses a collaborator label; anything unrecognised is {@link #NEUTRAL}. */
  public static Sentiment fromLabel(String label) {
    if (label == null) {
      return NEUTRAL;
    }
    return switch (label.trim().toLowerCase(Locale.ROOT)) {
      case "positive" -> POSITIVE;
      case "negative" -> NEGATIVE;
      default -> NEUTRAL;
    };
  }
}
