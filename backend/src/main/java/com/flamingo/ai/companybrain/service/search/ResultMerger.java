package com.flamingo.ai.companybrain.service.search;

import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Merges fan-out results into one bounded list. Hits are visited in query order, then rank; the
 * first occurrence of each document identity wins.
 */
@Component
@Slf4j
public class ResultMerger {

  private static final Comparator<RankedHit> PRIORITY_ORDER =
      Comparator.comparingInt(RankedHit::queryIndex).thenComparingInt(RankedHit::rank);

  public List<DocumentHit> merge(List<RankedHit> rankedHits, int maxResults) {
    if (maxResults <= 0 || rankedHits.isEmpty()) {
      return List.of();
    }
    List<RankedHit> ordered = new ArrayList<>(rankedHits);
    ordered.sort(PRIORITY_ORDER);

    Set<String> seen = new HashSet<>();
    List<DocumentHit> merged = new ArrayList<>(Math.min(maxResults, ordered.size()));
    for (RankedHit rankedHit : ordered) {
      if (merged.size() >= maxResults) {
        break;
      }
      DocumentHit hit = rankedHit.hit();
      if (seen.add(hit.identityKey())) {
        merged.add(hit);
      }
    }
    log.debug(
        "Merged {} hits into {} unique (limit {})", rankedHits.size(), merged.size(), maxResults);
    return List.copyOf(merged);
  }
}
