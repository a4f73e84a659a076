package com.flamingo.ai.companybrain.agent;

import dev.langchain4j.service.UserMessage;

/**
 * AI agent answering a question from an assembled grounding prompt. The prompt already carries the
 * instructions, the retrieved documents and the conversation history, so it is sent as-is.
 */
public interface GroundedAnswerAgent {

  String answer(@UserMessage String prompt);
}
