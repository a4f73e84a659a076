package com.flamingo.ai.companybrain.service.embedding;

import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.service.support.BoundedCallExecutor;
import com.flamingo.ai.companybrain.service.support.QueryDeadline;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for generating query embeddings using the configured embedding model.
 *
 * <p>Never throws: any failure or timeout yields an all-zero vector of the configured dimension,
 * which callers read as "no usable semantic signal".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // Below the model's 8192-token input limit.
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final BoundedCallExecutor boundedCallExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public float[] embed(String text, QueryDeadline deadline) {
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }
    final String embeddingInput = input;
    int dimensions = ragConfig.getEmbedding().getDimensions();

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      float[] vector =
          boundedCallExecutor.call(
              "embedding",
              ragConfig.getTimeouts().getEmbedding(),
              deadline,
              () -> embeddingModel.embed(embeddingInput).content().vector());
      if (vector == null || vector.length != dimensions) {
        log.warn(
            "Embedding has {} dimensions, index expects {}; using zero vector",
            vector == null ? 0 : vector.length,
            dimensions);
        meterRegistry.counter("embedding.requests.failure", "reason", "dimensions").increment();
        return zeroVector();
      }
      meterRegistry.counter("embedding.requests.success").increment();
      log.debug("Embedding generated, vector dimension: {}", vector.length);
      return vector;
    } catch (RuntimeException e) {
      log.warn("Embedding failed, using zero vector: {}", e.getMessage());
      meterRegistry.counter("embedding.requests.failure", "reason", "error").increment();
      return zeroVector();
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /** True when the vector carries no signal, i.e. every component is zero. */
  public static boolean isZeroVector(float[] vector) {
    for (float f : vector) {
      if (f != 0.0f) {
        return false;
      }
    }
    return true;
  }

  private float[] zeroVector() {
    return new float[ragConfig.getEmbedding().getDimensions()];
  }
}
