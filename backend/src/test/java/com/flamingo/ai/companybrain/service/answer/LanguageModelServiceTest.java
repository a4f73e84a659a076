package com.flamingo.ai.companybrain.service.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.flamingo.ai.companybrain.agent.GroundedAnswerAgent;
import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.exception.CollaboratorCallException;
import com.flamingo.ai.companybrain.service.support.BoundedCallExecutor;
import com.flamingo.ai.companybrain.service.support.QueryDeadline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("LanguageModelService Tests")
class LanguageModelServiceTest {

  @Mock private GroundedAnswerAgent groundedAnswerAgent;

  private ThreadPoolTaskExecutor callExecutor;
  private RagConfig ragConfig;
  private LanguageModelService languageModelService;

  @BeforeEach
  void setUp() {
    callExecutor = new ThreadPoolTaskExecutor();
    callExecutor.setCorePoolSize(2);
    callExecutor.initialize();
    ragConfig = new RagConfig();
    languageModelService =
        new LanguageModelService(
            groundedAnswerAgent,
            new BoundedCallExecutor(callExecutor, new SimpleMeterRegistry()),
            ragConfig);
  }

  @AfterEach
  void tearDown() {
    callExecutor.shutdown();
  }

  @Test
  @DisplayName("Should return the agent's answer")
  void shouldReturnAnswer() {
    when(groundedAnswerAgent.answer("prompt")).thenReturn("The answer.");

    String answer =
        languageModelService.generate("prompt", QueryDeadline.after(Duration.ofSeconds(5)));

    assertThat(answer).isEqualTo("The answer.");
  }

  @Test
  @DisplayName("Should reject a blank answer")
  void shouldRejectBlankAnswer() {
    when(groundedAnswerAgent.answer("prompt")).thenReturn("   ");

    assertThatThrownBy(
            () ->
                languageModelService.generate(
                    "prompt", QueryDeadline.after(Duration.ofSeconds(5))))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Should time out a slow model call")
  void shouldTimeOutSlowCall() {
    ragConfig.getTimeouts().setGeneration(Duration.ofMillis(100));
    when(groundedAnswerAgent.answer("prompt"))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return "too late";
            });

    assertThatThrownBy(
            () ->
                languageModelService.generate(
                    "prompt", QueryDeadline.after(Duration.ofSeconds(5))))
        .isInstanceOfSatisfying(
            CollaboratorCallException.class, e -> assertThat(e.isTimedOut()).isTrue());
  }
}
