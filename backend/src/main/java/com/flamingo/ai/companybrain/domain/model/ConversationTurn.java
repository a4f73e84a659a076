package com.flamingo.ai.companybrain.domain.model;

import com.flamingo.ai.companybrain.domain.enums.MessageRole;

/** One prior message of the conversation, supplied by the client with the question. */
public record ConversationTurn(MessageRole role, String content) {}
