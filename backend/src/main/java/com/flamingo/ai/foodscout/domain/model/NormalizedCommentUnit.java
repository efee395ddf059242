package com.flamingo.ai.foodscout.domain.model;

/**
 * A cleaned comment with its deterministic engagement coefficient.
 *
 * @param id stable within one document, e.g. {@code c0}
 * @param text text with engagement markup stripped
 */
public record NormalizedCommentUnit(
    String id, String text, int likes, int subCommentCount, double engagementCoefficient) {}
