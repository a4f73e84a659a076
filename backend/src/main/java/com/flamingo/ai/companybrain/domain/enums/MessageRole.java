package com.flamingo.ai.companybrain.domain.enums;

/** Enum representing the role of a message sender in a conversation. */
public enum MessageRole {
  USER("User"),
  ASSISTANT("Assistant");

  private final String label;

  MessageRole(String label) {
    this.label = label;
  }

  /** Label used when the turn is rendered into a prompt. */
  public String getLabel() {
    return label;
  }
}
