package com.flamingo.ai.foodscout.domain.enums;

import java.util.Locale;

/** Whether a shop is a genuine local favourite or a promoted venue. */
public enum ShopVerdict {
  GENUINE(5),
  LIKELY_GENUINE(4),
  UNKNOWN(2),
  LIKELY_PROMOTED(1),
  PROMOTED(0);

  private final int confirmWeight;

  ShopVerdict(int confirmWeight) {
    this.confirmWeight = confirmWeight;
  }

  /** Weight used when the user asks for a single pick. */
  public int getConfirmWeight() {
    return confirmWeight;
  }

  public boolean isPromoted() {
    return this == PROMOTED || this == LIKELY_PROMOTED;
  }

  /** Parses a collaborator label; anything unrecognised is {@link #UNKNOWN}. */
  public static ShopVerdict fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return UNKNOWN;
    }
    String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    for (ShopVerdict verdict : values()) {
      if (verdict.name().equals(normalized)) {
        return verdict;
      }
    }
    return UNKNOWN;
  }
}
