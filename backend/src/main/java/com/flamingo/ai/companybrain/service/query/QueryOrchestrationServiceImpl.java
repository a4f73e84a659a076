package com.flamingo.ai.companybrain.service.query;

import com.flamingo.ai.companybrain.api.dto.request.ChatHistoryMessage;
import com.flamingo.ai.companybrain.api.dto.request.QueryRequest;
import com.flamingo.ai.companybrain.api.dto.response.DocumentSourceSummary;
import com.flamingo.ai.companybrain.api.dto.response.QueryAnswerResponse;
import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.domain.model.ConversationTurn;
import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import com.flamingo.ai.companybrain.domain.model.GroundingContext;
import com.flamingo.ai.companybrain.domain.model.MetricFact;
import com.flamingo.ai.companybrain.domain.model.QueryPlan;
import com.flamingo.ai.companybrain.domain.model.SearchFilter;
import com.flamingo.ai.companybrain.elasticsearch.DocumentIndexOperations;
import com.flamingo.ai.companybrain.exception.QueryValidationException;
import com.flamingo.ai.companybrain.exception.SearchUnavailableException;
import com.flamingo.ai.companybrain.service.answer.AnswerSynthesizer;
import com.flamingo.ai.companybrain.service.answer.ContextAssembler;
import com.flamingo.ai.companybrain.service.facts.FactExtractor;
import com.flamingo.ai.companybrain.service.facts.RevenueByYearExtractor;
import com.flamingo.ai.companybrain.service.search.MultiSearchExecutor;
import com.flamingo.ai.companybrain.service.search.RankedHit;
import com.flamingo.ai.companybrain.service.search.ResultMerger;
import com.flamingo.ai.companybrain.service.support.QueryDeadline;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Query pipeline: sanitize, check the index, plan, fan out, merge, extract facts, assemble the
 * prompt and generate the answer.
 *
 * <p>Only validation errors and an unreachable index are reported as errors. Failures after that
 * point degrade the answer instead: a failed generation yields the synthesizer's apology, and an
 * unexpected failure while searching yields a search apology with whatever sources were merged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryOrchestrationServiceImpl implements QueryOrchestrationService {

  static final int MAX_QUERY_LENGTH = 1000;

  static final String SEARCH_APOLOGY =
      "I apologize, but I'm having trouble searching your company knowledge base right now. "
          + "Please try again later.";

  private final QueryInputSanitizer sanitizer;
  private final QueryPlanner queryPlanner;
  private final QueryHintExpander hintExpander;
  private final DocumentIndexOperations documentIndex;
  private final MultiSearchExecutor multiSearchExecutor;
  private final ResultMerger resultMerger;
  private final FactExtractor factExtractor;
  private final RevenueByYearExtractor revenueByYearExtractor;
  private final ContextAssembler contextAssembler;
  private final AnswerSynthesizer answerSynthesizer;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "query.answer", description = "Time to answer one question end to end")
  public QueryAnswerResponse answer(QueryRequest request) {
    String question = sanitizer.sanitize(request.getQuery());
    if (question.isEmpty()) {
      throw new QueryValidationException("Query is required");
    }
    if (question.length() > MAX_QUERY_LENGTH) {
      throw new QueryValidationException(
          "Query must not exceed " + MAX_QUERY_LENGTH + " characters");
    }
    int maxResults = resolveMaxResults(request.getMaxResults());
    boolean useVectorSearch = !Boolean.FALSE.equals(request.getUseVectorSearch());
    SearchFilter filter =
        request.getFilters() == null ? SearchFilter.none() : request.getFilters().toSearchFilter();
    List<ConversationTurn> history = toTurns(request.getChatHistory());

    if (!documentIndex.healthCheck()) {
      meterRegistry.counter("query.rejected", "reason", "index_unavailable").increment();
      throw new SearchUnavailableException(
          "Document index " + documentIndex.getIndexName() + " failed its health check");
    }

    long startTime = System.currentTimeMillis();
    QueryDeadline deadline = QueryDeadline.after(ragConfig.getTimeouts().getRequest());
    log.info(
        "Processing query: length={}, maxResults={}, vector={}, filtered={}, history={}",
        question.length(),
        maxResults,
        useVectorSearch,
        !filter.isEmpty(),
        history.size());

    List<DocumentHit> merged = List.of();
    String answer;
    try {
      QueryPlan plan = queryPlanner.plan(question);
      List<String> queries = new ArrayList<>();
      queries.add(question);
      queries.addAll(plan.searchQueries());
      List<String> orderedQueries = List.copyOf(new LinkedHashSet<>(queries));

      List<RankedHit> rankedHits =
          multiSearchExecutor.execute(
              orderedQueries, filter, useVectorSearch, maxResults, deadline);
      merged = resultMerger.merge(rankedHits, maxResults);
      log.info("Search complete: {} unique hits", merged.size());

      recordFacts(factExtractor.extract(merged));
      Map<String, Double> revenueByYear = revenueByYearExtractor.extract(merged);

      GroundingContext context = contextAssembler.assemble(merged, revenueByYear, history);
      String prompt = contextAssembler.renderPrompt(question, context);
      answer = answerSynthesizer.synthesize(prompt, deadline);
    } catch (RuntimeException e) {
      log.error("Search or answer processing failed: {}", e.getMessage(), e);
      meterRegistry.counter("query.degraded", "reason", "search_failure").increment();
      answer = SEARCH_APOLOGY;
    }

    long queryTime = System.currentTimeMillis() - startTime;
    int excerptChars = ragConfig.getContext().getExcerptChars();
    List<DocumentSourceSummary> sources =
        merged.stream().map(hit -> DocumentSourceSummary.fromHit(hit, excerptChars)).toList();
    log.info("Query answered in {} ms with {} sources", queryTime, sources.size());

    return QueryAnswerResponse.builder()
        .answer(answer)
        .sources(sources)
        .totalHits(merged.size())
        .queryTime(queryTime)
        .expandedQuery(hintExpander.expand(question))
        .build();
  }

  private int resolveMaxResults(Integer requested) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    if (requested == null) {
      return retrieval.getDefaultMaxResults();
    }
    if (requested < 1 || requested > retrieval.getMaxResultsLimit()) {
      throw new QueryValidationException(
          "maxResults must be between 1 and " + retrieval.getMaxResultsLimit());
    }
    return requested;
  }

  private static List<ConversationTurn> toTurns(List<ChatHistoryMessage> chatHistory) {
    if (chatHistory == null) {
      return List.of();
    }
    return chatHistory.stream().filter(m -> m != null).map(ChatHistoryMessage::toTurn).toList();
  }

  private void recordFacts(List<MetricFact> facts) {
    if (facts.isEmpty()) {
      return;
    }
    Map<String, Map<String, Double>> totals = factExtractor.sumByMetricAndYear(facts);
    meterRegistry.counter("facts.extracted").increment(facts.size());
    log.info("Extracted {} metric facts: {}", facts.size(), totals);
  }
}
