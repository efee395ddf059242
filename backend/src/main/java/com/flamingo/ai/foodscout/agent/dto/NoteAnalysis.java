package com.flamingo.ai.foodscout.agent.dto;

import java.util.List;

/** Structured output from LegacyNoteAnalyzerAgent. */
public record NoteAnalysis(List<AnalyzedShop> restaurants) {

  /** A single shop judged from the whole document in one pass. */
  public record AnalyzedShop(
      String name,
      String location,
      List<String> features,
      /** genuine, likely_genuine, unknown, likely_promoted or promoted. */
      String verdict,
      Double confidence,
      List<String> reasons,
      Boolean hasLocalMentions) {}
}
