package com.flamingo.ai.foodscout.domain.model;

import com.flamingo.ai.foodscout.domain.enums.MessageRole;

/** One line of the conversation log. */
public record MessageEntry(MessageRole role, String content) {}
