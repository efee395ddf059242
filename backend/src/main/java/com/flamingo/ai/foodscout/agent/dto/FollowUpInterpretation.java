package com.flamingo.ai.foodscout.agent.dto;

import java.util.List;

/** Structured output from FollowUpInterpretationAgent. */
public record FollowUpInterpretation(
    /** True when the user wants a fresh search rather than working on the current list. */
    boolean newSearch,
    /** Names picked from the current shop list, in the order the user should see them. */
    List<String> shops,
    String response) {}
