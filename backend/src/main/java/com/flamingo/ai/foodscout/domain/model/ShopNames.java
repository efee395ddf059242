package com.flamingo.ai.foodscout.domain.model;

import java.util.Collection;
import java.util.Locale;

/** Shop-name normalization shared by scoring, merging and follow-up filters. */
public final class ShopNames {

  private ShopNames() {}

  /**
   * Merge key for a shop name: trimmed, inner whitespace collapsed, lower-cased. Deliberately not
   * fuzzy, so "Old Store" and "Old Store Branch 2" stay apart.
   */
  public static String normalize(String name) {
    if (name == null) {
      return "";
    }
    return name.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  /** Loose match used for user-supplied names: either normalized form contains the other. */
  public static boolean looselyMatches(String name, String candidate) {
    String a = normalize(name);
    String b = normalize(candidate);
    if (a.isEmpty() || b.isEmpty()) {
      return false;
    }
    return a.contains(b) || b.contains(a);
  }

  public static boolean matchesAny(String name, Collection<String> candidates) {
    for (String candidate : candidates) {
      if (looselyMatches(name, candidate)) {
        return true;
      }
    }
    return false;
  }
}
