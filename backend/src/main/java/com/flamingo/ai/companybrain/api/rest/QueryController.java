package com.flamingo.ai.companybrain.api.rest;

import com.flamingo.ai.companybrain.api.dto.request.QueryRequest;
import com.flamingo.ai.companybrain.api.dto.response.ApiResponse;
import com.flamingo.ai.companybrain.api.dto.response.QueryAnswerResponse;
import com.flamingo.ai.companybrain.service.query.QueryOrchestrationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for asking questions of the company knowledge base. */
@RestController
@RequestMapping("/api/query")
@RequiredArgsConstructor
public class QueryController {

  private final QueryOrchestrationService queryOrchestrationService;

  /** Answers a question from the indexed company documents. */
  @PostMapping
  public ResponseEntity<ApiResponse<QueryAnswerResponse>> query(
      @Valid @RequestBody QueryRequest request) {
    return ResponseEntity.ok(ApiResponse.ok(queryOrchestrationService.answer(request)));
  }
}
