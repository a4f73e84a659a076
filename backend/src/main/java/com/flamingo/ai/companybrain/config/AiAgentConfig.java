package com.flamingo.ai.companybrain.config;

import com.flamingo.ai.companybrain.agent.GroundedAnswerAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: agent interfaces declare the message templates, {@code AiServices.builder()} builds
 * the concrete implementation.
 */
@Configuration
public class AiAgentConfig {

  /** Answer agent for grounded question answering over the assembled document context. */
  @Bean
  public GroundedAnswerAgent groundedAnswerAgent(ChatModel chatModel) {
    return AiServices.builder(GroundedAnswerAgent.class).chatModel(chatModel).build();
  }
}
