package com.flamingo.ai.companybrain.service.search;

import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import com.flamingo.ai.companybrain.domain.model.SearchFilter;
import com.flamingo.ai.companybrain.elasticsearch.DocumentIndexOperations;
import com.flamingo.ai.companybrain.service.embedding.EmbeddingService;
import com.flamingo.ai.companybrain.service.support.BoundedCallExecutor;
import com.flamingo.ai.companybrain.service.support.QueryDeadline;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Fans the planned queries of one question out to the document index.
 *
 * <p>At most {@code rag.retrieval.max-queries} queries run, taken from the front of the list.
 * Sub-queries execute concurrently but their results are collected in query order, so the output
 * is the same whatever order the calls complete in. A sub-query that fails on both the hybrid and
 * the lexical path, or that the shared fan-out pool rejects, is skipped.
 *
 * <p>One question keeps at most {@code rag.retrieval.fanout-parallelism} sub-queries in flight: the
 * next query is submitted as each result is collected.
 */
@Service
@Slf4j
public class MultiSearchExecutor {

  private final DocumentIndexOperations documentIndex;
  private final EmbeddingService embeddingService;
  private final BoundedCallExecutor boundedCallExecutor;
  private final AsyncTaskExecutor searchFanoutExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public MultiSearchExecutor(
      DocumentIndexOperations documentIndex,
      EmbeddingService embeddingService,
      BoundedCallExecutor boundedCallExecutor,
      @Qualifier("searchFanoutExecutor") AsyncTaskExecutor searchFanoutExecutor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.documentIndex = documentIndex;
    this.embeddingService = embeddingService;
    this.boundedCallExecutor = boundedCallExecutor;
    this.searchFanoutExecutor = searchFanoutExecutor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Executes the queries and returns every hit, tagged with its query position and rank.
   *
   * @param queries queries in priority order, verbatim question first
   * @param filter structured filter applied to every sub-query
   * @param useVectorSearch whether to run hybrid search before falling back to lexical
   * @param maxResults final result bound of the request; the per-query size derives from it
   * @param deadline request deadline; sub-queries still running when it passes are cancelled
   * @return hits ordered by query position, then rank; not deduplicated
   */
  @Timed(value = "search.multi", description = "Time to execute all sub-queries of a question")
  public List<RankedHit> execute(
      List<String> queries,
      SearchFilter filter,
      boolean useVectorSearch,
      int maxResults,
      QueryDeadline deadline) {
    List<String> executed =
        queries.stream().limit(ragConfig.getRetrieval().getMaxQueries()).toList();
    int topK = perQueryResultCount(maxResults);
    if (executed.size() < queries.size()) {
      log.debug("Dropping {} low-priority queries over the cap", queries.size() - executed.size());
    }

    int parallelism = Math.max(1, ragConfig.getRetrieval().getFanoutParallelism());
    List<Future<List<DocumentHit>>> futures = new ArrayList<>(executed.size());
    List<RankedHit> results = new ArrayList<>();
    int failed = 0;
    try {
      for (int i = 0; i < Math.min(parallelism, executed.size()); i++) {
        futures.add(submit(executed.get(i), filter, useVectorSearch, topK, deadline));
      }
      for (int i = 0; i < executed.size(); i++) {
        Future<List<DocumentHit>> future = futures.get(i);
        if (future == null) {
          failed++;
        } else {
          try {
            List<DocumentHit> hits =
                future.get(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
            for (int rank = 0; rank < hits.size(); rank++) {
              results.add(new RankedHit(hits.get(rank), i, rank));
            }
          } catch (ExecutionException e) {
            failed++;
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn(
                "Sub-query {} '{}' failed, skipping: {}", i, executed.get(i), cause.getMessage());
            meterRegistry.counter("search.subquery.skipped", "reason", "error").increment();
          } catch (TimeoutException e) {
            int abandoned = executed.size() - i;
            failed += abandoned;
            log.warn("Request deadline reached, abandoning {} unfinished sub-queries", abandoned);
            meterRegistry
                .counter("search.subquery.skipped", "reason", "deadline")
                .increment(abandoned);
            break;
          } catch (InterruptedException e) {
            int abandoned = executed.size() - i;
            failed += abandoned;
            Thread.currentThread().interrupt();
            log.warn("Search interrupted, cancelling {} in-flight sub-queries", abandoned);
            break;
          }
        }
        int next = futures.size();
        if (next < executed.size()) {
          futures.add(submit(executed.get(next), filter, useVectorSearch, topK, deadline));
        }
      }
    } finally {
      cancelUnfinished(futures);
    }

    log.info(
        "Executed {} sub-queries (topK={}, vector={}): {} hits, {} failed",
        executed.size(),
        topK,
        useVectorSearch,
        results.size(),
        failed);
    return results;
  }

  /** Per-query result count: half the final bound, but never below the configured floor. */
  @VisibleForTesting
  int perQueryResultCount(int maxResults) {
    return Math.max(ragConfig.getRetrieval().getMinPerQueryResults(), maxResults / 2);
  }

  @VisibleForTesting
  List<DocumentHit> searchOne(
      String query,
      SearchFilter filter,
      boolean useVectorSearch,
      int topK,
      QueryDeadline deadline) {
    if (!useVectorSearch) {
      return lexical(query, filter, topK, deadline);
    }

    float[] embedding = embeddingService.embed(query, deadline);
    if (EmbeddingService.isZeroVector(embedding)) {
      log.warn("No usable embedding for '{}', using lexical search", query);
      meterRegistry.counter("search.fallback.lexical", "reason", "no_embedding").increment();
      return lexical(query, filter, topK, deadline);
    }

    try {
      List<DocumentHit> hits =
          boundedCallExecutor.call(
              "hybrid_search",
              ragConfig.getTimeouts().getSearch(),
              deadline,
              () -> documentIndex.hybridSearch(query, embedding, filter, topK));
      if (!hits.isEmpty()) {
        log.debug("Hybrid search for '{}' returned {} hits", query, hits.size());
        return hits;
      }
      log.debug("Hybrid search for '{}' returned no hits, retrying lexically", query);
      meterRegistry.counter("search.fallback.lexical", "reason", "empty").increment();
    } catch (RuntimeException e) {
      log.warn("Hybrid search for '{}' failed, retrying lexically: {}", query, e.getMessage());
      meterRegistry.counter("search.fallback.lexical", "reason", "error").increment();
    }
    return lexical(query, filter, topK, deadline);
  }

  private List<DocumentHit> lexical(
      String query, SearchFilter filter, int topK, QueryDeadline deadline) {
    List<DocumentHit> hits =
        boundedCallExecutor.call(
            "lexical_search",
            ragConfig.getTimeouts().getSearch(),
            deadline,
            () -> documentIndex.lexicalSearch(query, filter, topK));
    log.debug("Lexical search for '{}' returned {} hits", query, hits.size());
    return hits;
  }

  /** Submits one sub-query; a saturated pool counts as a failed sub-query and yields null. */
  private Future<List<DocumentHit>> submit(
      String query,
      SearchFilter filter,
      boolean useVectorSearch,
      int topK,
      QueryDeadline deadline) {
    try {
      return searchFanoutExecutor.submit(
          () -> searchOne(query, filter, useVectorSearch, topK, deadline));
    } catch (TaskRejectedException e) {
      log.warn("Sub-query '{}' rejected, fan-out pool is saturated", query);
      meterRegistry.counter("search.subquery.skipped", "reason", "rejected").increment();
      return null;
    }
  }

  private static void cancelUnfinished(List<Future<List<DocumentHit>>> futures) {
    for (Future<List<DocumentHit>> future : futures) {
      if (future != null && !future.isDone()) {
        future.cancel(true);
      }
    }
  }
}
