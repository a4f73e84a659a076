package com.flamingo.ai.companybrain.domain.model;

import java.util.List;
import java.util.Map;

/**
 * The bounded evidence handed to the language model for one question.
 *
 * @param hits documents to cite, in merge order
 * @param retrievedCount number of documents retrieved before the prompt limit was applied
 * @param revenueByYear summed revenue per year from tabular documents
 * @param history trimmed conversation history, oldest first
 */
public record GroundingContext(
    List<DocumentHit> hits,
    int retrievedCount,
    Map<String, Double> revenueByYear,
    List<ConversationTurn> history) {

  public GroundingContext {
    hits = List.copyOf(hits);
    revenueByYear = Map.copyOf(revenueByYear);
    history = List.copyOf(history);
  }
}
