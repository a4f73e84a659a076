package com.flamingo.ai.companybrain.service.search;

import com.flamingo.ai.companybrain.domain.model.DocumentHit;

/**
 * A hit tagged with where it came from: the position of its sub-query in the executed query list
 * and its rank within that sub-query's results.
 */
public record RankedHit(DocumentHit hit, int queryIndex, int rank) {}
