package com.flamingo.ai.companybrain.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.service.support.BoundedCallExecutor;
import com.flamingo.ai.companybrain.service.support.QueryDeadline;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private ThreadPoolTaskExecutor callExecutor;
  private SimpleMeterRegistry meterRegistry;
  private RagConfig ragConfig;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    callExecutor = new ThreadPoolTaskExecutor();
    callExecutor.setCorePoolSize(2);
    callExecutor.initialize();
    meterRegistry = new SimpleMeterRegistry();
    ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimensions(3);
    embeddingService =
        new EmbeddingService(
            embeddingModel,
            new BoundedCallExecutor(callExecutor, meterRegistry),
            ragConfig,
            meterRegistry);
  }

  @AfterEach
  void tearDown() {
    callExecutor.shutdown();
  }

  private QueryDeadline deadline() {
    return QueryDeadline.after(Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("Should return the model's vector")
  void shouldReturnVector() {
    when(embeddingModel.embed(anyString())).thenReturn(response(0.1f, 0.2f, 0.3f));

    float[] vector = embeddingService.embed("revenue 2021", deadline());

    assertThat(vector).containsExactly(0.1f, 0.2f, 0.3f);
    assertThat(EmbeddingService.isZeroVector(vector)).isFalse();
    assertThat(meterRegistry.get("embedding.requests.success").counter().count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should degrade to a zero vector when the model throws")
  void shouldReturnZeroVectorOnFailure() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("401 Unauthorized"));

    float[] vector = embeddingService.embed("revenue", deadline());

    assertThat(vector).hasSize(3);
    assertThat(EmbeddingService.isZeroVector(vector)).isTrue();
  }

  @Test
  @DisplayName("Should degrade to a zero vector when the model is too slow")
  void shouldReturnZeroVectorOnTimeout() {
    ragConfig.getTimeouts().setEmbedding(Duration.ofMillis(100));
    when(embeddingModel.embed(anyString()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(5_000);
              return response(1f, 1f, 1f);
            });

    float[] vector = embeddingService.embed("revenue", deadline());

    assertThat(EmbeddingService.isZeroVector(vector)).isTrue();
  }

  @Test
  @DisplayName("Should degrade to a zero vector when the dimension does not match the index")
  void shouldRejectWrongDimension() {
    when(embeddingModel.embed(anyString())).thenReturn(response(0.5f, 0.5f));

    float[] vector = embeddingService.embed("revenue", deadline());

    assertThat(vector).containsExactly(0f, 0f, 0f);
  }

  @Test
  @DisplayName("Should truncate very long input before embedding")
  void shouldTruncateLongInput() {
    when(embeddingModel.embed(anyString())).thenReturn(response(0.1f, 0.2f, 0.3f));

    embeddingService.embed("a".repeat(6000), deadline());

    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(5000);
  }

  private static Response<Embedding> response(float... vector) {
    return Response.from(Embedding.from(vector));
  }
}
