package com.flamingo.ai.companybrain.exception;

import com.flamingo.ai.companybrain.api.dto.response.ApiResponse;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;
  private final boolean exposeDetails;

  public GlobalExceptionHandler(
      MeterRegistry meterRegistry,
      @Value("${app.errors.expose-details:false}") boolean exposeDetails) {
    this.meterRegistry = meterRegistry;
    this.exposeDetails = exposeDetails;
  }

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<ApiResponse<Void>> handleQueryValidation(QueryValidationException ex) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Query rejected [{}]: {}", errorId, ex.getMessage());
    return failure(
        HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, ex.getMessage(), errorId, null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);
    return failure(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, message, errorId, null);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());
    return failure(
        HttpStatus.BAD_REQUEST,
        ErrorCode.VALIDATION_ERROR,
        "Malformed request body",
        errorId,
        ex.getMessage());
  }

  @ExceptionHandler(SearchUnavailableException.class)
  public ResponseEntity<ApiResponse<Void>> handleSearchUnavailable(SearchUnavailableException ex) {
    incrementErrorCounter("search_unavailable");
    String errorId = generateErrorId();
    log.error("Search unavailable [{}]: {}", errorId, ex.getMessage());
    return failure(
        HttpStatus.SERVICE_UNAVAILABLE,
        ErrorCode.SEARCH_UNAVAILABLE,
        ex.getUserMessage(),
        errorId,
        ex.getMessage());
  }

  @ExceptionHandler({
    NoResourceFoundException.class,
    HttpRequestMethodNotSupportedException.class,
    HttpMediaTypeNotSupportedException.class
  })
  public ResponseEntity<ApiResponse<Void>> handleUnsupportedRequest(Exception ex) {
    incrementErrorCounter("unsupported_request");
    String errorId = generateErrorId();
    HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
    log.warn("Unsupported request [{}]: {}", errorId, ex.getMessage());
    return failure(status, ErrorCode.REQUEST_ERROR, ex.getMessage(), errorId, null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return failure(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ErrorCode.INTERNAL_ERROR,
        "Internal server error during query processing",
        errorId,
        ex.toString());
  }

  private ResponseEntity<ApiResponse<Void>> failure(
      HttpStatusCode status, String code, String message, String errorId, String details) {
    return ResponseEntity.status(status)
        .body(
            ApiResponse.<Void>builder()
                .success(false)
                .error(message)
                .code(code)
                .errorId(errorId)
                .details(exposeDetails ? details : null)
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
