package com.flamingo.ai.companybrain.service.query;

import com.flamingo.ai.companybrain.api.dto.request.QueryRequest;
import com.flamingo.ai.companybrain.api.dto.response.QueryAnswerResponse;

/** Service answering natural-language questions from the company document index. */
public interface QueryOrchestrationService {

  /**
   * Plans, searches, extracts facts and generates a grounded answer.
   *
   * @param request the question with its filters, history and search options
   * @return the answer with its sources; degraded answers are still returned normally
   * @throws com.flamingo.ai.companybrain.exception.QueryValidationException if the question is
   *     empty after sanitization, too long, or asks for an invalid result count
   * @throws com.flamingo.ai.companybrain.exception.SearchUnavailableException if the document
   *     index is unreachable
   */
  QueryAnswerResponse answer(QueryRequest request);
}
