package com.flamingo.ai.foodscout.agent.dto;

import java.util.List;

/** Structured output from SemanticTaggerAgent. */
public record CommentTagBatch(List<CommentTag> tags) {}
