package com.flamingo.ai.companybrain.elasticsearch;

import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import com.flamingo.ai.companybrain.domain.model.SearchFilter;
import java.util.List;

/** Read-side operations the query pipeline needs from the company document index. */
public interface DocumentIndexOperations {

  /**
   * Disjunctive search over a kNN clause on the embedding field and a fuzzy multi-field lexical
   * match. At least one clause must match.
   *
   * @param query the query text
   * @param embedding the query embedding
   * @param filter structured predicates, may be empty
   * @param size maximum number of hits
   * @return hits in relevance order
   */
  List<DocumentHit> hybridSearch(String query, float[] embedding, SearchFilter filter, int size);

  /**
   * Keyword-only search: the best of a fuzzy multi-match and a lenient query-string parse.
   *
   * @param query the query text
   * @param filter structured predicates, may be empty
   * @param size maximum number of hits
   * @return hits in relevance order
   */
  List<DocumentHit> lexicalSearch(String query, SearchFilter filter, int size);

  /**
   * Lightweight reachability check against the index.
   *
   * @return true when the index answered
   */
  boolean healthCheck();

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
