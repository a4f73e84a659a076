package com.flamingo.ai.companybrain.service.answer;

import com.flamingo.ai.companybrain.agent.GroundedAnswerAgent;
import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.service.support.BoundedCallExecutor;
import com.flamingo.ai.companybrain.service.support.QueryDeadline;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Client for the language model. Throws on any failure; callers decide how to degrade. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LanguageModelService {

  private final GroundedAnswerAgent groundedAnswerAgent;
  private final BoundedCallExecutor boundedCallExecutor;
  private final RagConfig ragConfig;

  @Timed(value = "llm.generate", description = "Time for one answer generation call")
  @CircuitBreaker(name = "llm")
  public String generate(String prompt, QueryDeadline deadline) {
    log.debug("Generating answer, prompt length: {} chars", prompt.length());
    String answer =
        boundedCallExecutor.call(
            "generation",
            ragConfig.getTimeouts().getGeneration(),
            deadline,
            () -> groundedAnswerAgent.answer(prompt));
    if (answer == null || answer.isBlank()) {
      throw new IllegalStateException("Language model returned an empty answer");
    }
    return answer;
  }
}
