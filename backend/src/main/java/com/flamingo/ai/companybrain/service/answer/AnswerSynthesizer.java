package com.flamingo.ai.companybrain.service.answer;

import com.flamingo.ai.companybrain.service.support.QueryDeadline;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates the answer for an assembled prompt. Any failure of the language model, including an
 * open circuit or a timeout, is replaced by a fixed apology; this method never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerSynthesizer {

  public static final String APOLOGY =
      "I apologize, but I'm having trouble processing your question right now. "
          + "Please try again later.";

  private final LanguageModelService languageModelService;
  private final MeterRegistry meterRegistry;

  public String synthesize(String prompt, QueryDeadline deadline) {
    try {
      String answer = languageModelService.generate(prompt, deadline);
      meterRegistry.counter("answer.synthesis", "outcome", "success").increment();
      log.info("Answer generated: {} chars", answer.length());
      return answer;
    } catch (Exception e) {
      log.warn("Answer generation failed, returning apology: {}", e.getMessage());
      meterRegistry.counter("answer.synthesis", "outcome", "apology").increment();
      return APOLOGY;
    }
  }
}
