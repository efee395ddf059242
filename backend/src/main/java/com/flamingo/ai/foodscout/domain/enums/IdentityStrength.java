package com.flamingo.ai.foodscout.domain.enums;

import java.util.Locale;

/** How strongly a comment's author reads as a local resident. */
public enum IdentityStrength {
  NONE,
  MEDIUM,
  STRONG;

  /** Parses a collaborator label; anything unrecognised is {@link #NONE}. */
  public static IdentityStrength fromLabel(String label) {
    if (label == null) {
      return NONE;
    }
    return switch (label.trim().toLowerCase(Locale.ROOT)) {
      case "strong" -> STRONG;
      case "medium" -> MEDIUM;
      default -> NONE;
    };
  }
}
