package com.flamingo.ai.companybrain.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the query orchestration pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Planning planning = new Planning();
  private Retrieval retrieval = new Retrieval();
  private Context context = new Context();
  private Timeouts timeouts = new Timeouts();
  private Embedding embedding = new Embedding();

  @Getter
  @Setter
  public static class Planning {
    /** Metric searched for when the question names none. */
    private String defaultMetric = "revenue";
  }

  @Getter
  @Setter
  public static class Retrieval {
    /** Sub-queries executed per question; derived queries past this cap are dropped. */
    private int maxQueries = 6;

    /** Floor for the per-query result count, which is otherwise maxResults / 2. */
    private int minPerQueryResults = 3;

    /** kNN k is the per-query result count times this multiplier. */
    private int knnMultiplier = 2;

    private int knnCandidates = 100;
    private int defaultMaxResults = 10;
    private int maxResultsLimit = 50;

    /** Concurrent sub-query calls per question. */
    private int fanoutParallelism = 6;
  }

  @Getter
  @Setter
  public static class Context {
    private int maxHits = 5;
    private int contentChars = 300;
    private int historyTurns = 6;
    private int historyChars = 200;
    private int excerptChars = 200;
    private int labelChars = 100;
  }

  /**
   * Per-call timeouts for collaborator calls plus the overall request deadline. A call never waits
   * longer than the time left before the deadline.
   */
  @Getter
  @Setter
  public static class Timeouts {
    private Duration embedding = Duration.ofSeconds(10);
    private Duration search = Duration.ofSeconds(10);
    private Duration generation = Duration.ofSeconds(60);
    private Duration request = Duration.ofSeconds(90);
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Must match the dense_vector mapping of the document index. */
    private int dimensions = 768;
  }
}
