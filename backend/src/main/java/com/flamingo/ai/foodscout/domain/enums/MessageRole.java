package com.flamingo.ai.foodscout.domain.enums;

/** Role of a message in the conversation log. */
public enum MessageRole {
  USER,
  ASSISTANT
}
