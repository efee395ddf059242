package com.flamingo.ai.foodscout.agent.dto;

import java.util.List;

/** Structured output from IntentParserAgent. */
public record ParsedIntent(
    boolean needClarify,
    List<String> questions,
    String location,
    String foodType,
    List<String> requirements,
    List<String> excludeKeywords) {}
