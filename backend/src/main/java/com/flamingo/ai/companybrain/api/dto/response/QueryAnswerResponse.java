package com.flamingo.ai.companybrain.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryAnswerResponse {

  private String answer;
  private List<DocumentSourceSummary> sources;
  private int totalHits;

  /** Processing time in milliseconds. */
  private long queryTime;

  private String expandedQuery;
}
