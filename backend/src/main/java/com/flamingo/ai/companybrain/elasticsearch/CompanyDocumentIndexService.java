package com.flamingo.ai.companybrain.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.query_dsl.Operator;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import com.flamingo.ai.companybrain.domain.model.SearchFilter;
import com.flamingo.ai.companybrain.exception.CollaboratorCallException;
import com.flamingo.ai.companybrain.exception.IndexSearchException;
import com.flamingo.ai.companybrain.service.support.BoundedCallExecutor;
import com.flamingo.ai.companybrain.service.support.QueryDeadline;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed search over the company document index.
 *
 * <p>The index itself (mapping, uploads, deletes) is owned by the upload pipeline; this service
 * only reads. Transport failures are rethrown so callers can fall back; nothing is retried here.
 */
@Service
@Slf4j
public class CompanyDocumentIndexService implements DocumentIndexOperations {

  /** Lexical fields with boosts: filename highest, then title, then content and summary. */
  static final List<String> LEXICAL_FIELDS =
      List.of("title^3", "content^2", "text", "metadata.summary^2", "metadata.fileName^4");

  static final double LEXICAL_TIE_BREAKER = 0.2;

  private final ElasticsearchClient elasticsearchClient;
  private final DocumentHitMapper hitMapper;
  private final BoundedCallExecutor boundedCallExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Value("${app.elasticsearch.index-name:company-memory}")
  private String indexName;

  @Autowired
  public CompanyDocumentIndexService(
      ElasticsearchClient elasticsearchClient,
      DocumentHitMapper hitMapper,
      BoundedCallExecutor boundedCallExecutor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.hitMapper = hitMapper;
    this.boundedCallExecutor = boundedCallExecutor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /** Constructor for testing - allows setting the index name. */
  @VisibleForTesting
  public CompanyDocumentIndexService(
      ElasticsearchClient elasticsearchClient,
      DocumentHitMapper hitMapper,
      BoundedCallExecutor boundedCallExecutor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      String indexName) {
    this(elasticsearchClient, hitMapper, boundedCallExecutor, ragConfig, meterRegistry);
    this.indexName = indexName;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  @Timed(value = "elasticsearch.hybrid_search", description = "Time for hybrid search")
  @CircuitBreaker(name = "elasticsearch")
  public List<DocumentHit> hybridSearch(
      String query, float[] embedding, SearchFilter filter, int size) {
    SearchRequest request = buildHybridSearchRequest(query, embedding, filter, size);
    List<DocumentHit> hits = execute("hybridSearch", query, request);
    meterRegistry.counter("document_index.hybrid_search").increment();
    return hits;
  }

  @Override
  @Timed(value = "elasticsearch.lexical_search", description = "Time for lexical search")
  @CircuitBreaker(name = "elasticsearch")
  public List<DocumentHit> lexicalSearch(String query, SearchFilter filter, int size) {
    SearchRequest request = buildLexicalSearchRequest(query, filter, size);
    List<DocumentHit> hits = execute("lexicalSearch", query, request);
    meterRegistry.counter("document_index.lexical_search").increment();
    return hits;
  }

  /** Counts the index documents, bounded by the search timeout. */
  @Override
  public boolean healthCheck() {
    Duration timeout = ragConfig.getTimeouts().getSearch();
    try {
      long count =
          boundedCallExecutor.call(
              "health_check",
              timeout,
              QueryDeadline.after(timeout),
              () -> elasticsearchClient.count(c -> c.index(indexName)).count());
      log.debug("Health check: index {} holds {} documents", indexName, count);
      return true;
    } catch (CollaboratorCallException e) {
      log.warn("Elasticsearch health check failed for index {}: {}", indexName, e.getMessage());
      meterRegistry.counter("document_index.health_check.failure").increment();
      return false;
    }
  }

  @VisibleForTesting
  SearchRequest buildHybridSearchRequest(
      String query, float[] embedding, SearchFilter filter, int size) {
    int k = size * ragConfig.getRetrieval().getKnnMultiplier();
    int candidates = Math.max(k, ragConfig.getRetrieval().getKnnCandidates());
    List<Float> vector = toFloatList(embedding);

    Query knn =
        Query.of(
            q ->
                q.knn(
                    kn ->
                        kn.field("embedding")
                            .queryVector(vector)
                            .k(k)
                            .numCandidates(candidates)));
    Query lexical = fuzzyMultiMatch(query);
    List<Query> filters = buildFilterClauses(filter);

    log.debug(
        "hybridSearch index={} query='{}' size={} k={} candidates={} filters={}",
        indexName,
        query,
        size,
        k,
        candidates,
        filters.size());

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .size(size)
                .query(
                    q ->
                        q.bool(
                            b ->
                                b.should(knn)
                                    .should(lexical)
                                    .minimumShouldMatch("1")
                                    .filter(filters))));
  }

  @VisibleForTesting
  SearchRequest buildLexicalSearchRequest(String query, SearchFilter filter, int size) {
    Query bestOf =
        Query.of(
            q ->
                q.disMax(
                    d ->
                        d.tieBreaker(LEXICAL_TIE_BREAKER)
                            .queries(
                                fuzzyMultiMatch(query),
                                Query.of(
                                    qs ->
                                        qs.queryString(
                                            s ->
                                                s.query(query)
                                                    .fields(LEXICAL_FIELDS)
                                                    .defaultOperator(Operator.And)
                                                    .lenient(true)
                                                    .analyzeWildcard(true))))));
    List<Query> filters = buildFilterClauses(filter);

    log.debug(
        "lexicalSearch index={} query='{}' size={} filters={}",
        indexName,
        query,
        size,
        filters.size());

    Query effective =
        filters.isEmpty()
            ? bestOf
            : Query.of(q -> q.bool(b -> b.must(bestOf).filter(filters)));
    return SearchRequest.of(s -> s.index(indexName).size(size).query(effective));
  }

  /** Translates the structured filter into Elasticsearch filter clauses, one per present clause. */
  @VisibleForTesting
  List<Query> buildFilterClauses(SearchFilter filter) {
    List<Query> clauses = new ArrayList<>();
    if (filter == null || filter.isEmpty()) {
      return clauses;
    }
    addTerms(clauses, "type", filter.documentTypes());
    addTerms(clauses, "metadata.category", filter.categories());
    addTerms(clauses, "metadata.department", filter.departments());
    addTerms(clauses, "metadata.tags", filter.tags());
    SearchFilter.DateRange range = filter.dateRange();
    if (range != null) {
      clauses.add(
          Query.of(
              q ->
                  q.range(
                      r ->
                          r.date(
                              d -> {
                                d.field("createdAt");
                                if (range.start() != null && !range.start().isBlank()) {
                                  d.gte(range.start());
                                }
                                if (range.end() != null && !range.end().isBlank()) {
                                  d.lte(range.end());
                                }
                                return d;
                              }))));
    }
    return clauses;
  }

  private static void addTerms(List<Query> clauses, String field, List<String> values) {
    if (values.isEmpty()) {
      return;
    }
    List<FieldValue> fieldValues = values.stream().map(FieldValue::of).toList();
    clauses.add(Query.of(q -> q.terms(t -> t.field(field).terms(tf -> tf.value(fieldValues)))));
  }

  private static Query fuzzyMultiMatch(String query) {
    return Query.of(
        q ->
            q.multiMatch(
                m ->
                    m.query(query)
                        .fields(LEXICAL_FIELDS)
                        .type(TextQueryType.BestFields)
                        .fuzziness("AUTO")));
  }

  private List<DocumentHit> execute(String searchType, String query, SearchRequest request) {
    SearchResponse<Map> response;
    try {
      response = elasticsearchClient.search(request, Map.class);
    } catch (IOException e) {
      log.error("{} failed for index {}: {}", searchType, indexName, e.getMessage(), e);
      meterRegistry.counter("document_index." + searchType + ".errors").increment();
      throw new IndexSearchException(searchType + " failed", e);
    }

    List<Hit<Map>> rawHits = response.hits().hits();
    List<DocumentHit> hits = new ArrayList<>(rawHits.size());
    for (Hit<Map> hit : rawHits) {
      hitMapper.map(hit.id(), hit.score(), (Map<String, Object>) hit.source()).ifPresent(hits::add);
    }
    log.info(
        "[{}] index={} query='{}' returned={} accepted={}",
        searchType,
        indexName,
        query,
        rawHits.size(),
        hits.size());
    return hits;
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
