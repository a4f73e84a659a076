package com.flamingo.ai.companybrain.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Search intent derived from a question: the metrics and years it asks about and the ordered,
 * duplicate-free list of queries to run. The verbatim question is always the first query.
 */
public record QueryPlan(
    Set<String> metrics, Set<String> years, Set<String> entities, List<String> searchQueries) {

  public QueryPlan {
    metrics = Collections.unmodifiableSet(new LinkedHashSet<>(metrics));
    years = Collections.unmodifiableSet(new LinkedHashSet<>(years));
    entities = Collections.unmodifiableSet(new LinkedHashSet<>(entities));
    searchQueries = List.copyOf(new LinkedHashSet<>(searchQueries));
  }
}
