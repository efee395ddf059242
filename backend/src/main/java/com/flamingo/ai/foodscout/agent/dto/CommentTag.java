package com.flamingo.ai.foodscout.agent.dto;

import java.util.List;

/**
 * One raw tag as returned by the semantic tagger. Every field is untrusted: labels may be unknown,
 * the id may not match any submitted unit and the shop list may be missing.
 */
public record CommentTag(
    String id,
    /** Expected: strong, medium or none. */
    String identity,
    /** Expected: positive, neutral or negative. */
    String sentiment,
    Boolean isCorrection,
    List<String> shops) {}
