package com.flamingo.ai.companybrain.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking the knowledge base a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 1000, message = "Query must not exceed 1000 characters")
  private String query;

  @Valid private QueryFilters filters;

  /** Prior messages of the conversation, oldest first. */
  private List<ChatHistoryMessage> chatHistory;

  /** Run hybrid (vector + keyword) search; defaults to true when omitted. */
  private Boolean useVectorSearch;

  @Min(value = 1, message = "maxResults must be at least 1")
  @Max(value = 50, message = "maxResults must not exceed 50")
  private Integer maxResults;
}
