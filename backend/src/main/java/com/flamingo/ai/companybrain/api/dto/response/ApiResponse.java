package com.flamingo.ai.companybrain.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope for every API response. Successful calls carry {@code data}; failed calls carry {@code
 * error}, an error code and an error id for log correlation.
 *
 * @param <T> the payload type
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

  private final boolean success;
  private final T data;

  /** User-friendly error message. */
  private final String error;

  private final String code;
  private final String errorId;

  /** Technical details (only when error details are exposed). */
  private final String details;

  private final Instant timestamp;

  public static <T> ApiResponse<T> ok(T data) {
    return ApiResponse.<T>builder().success(true).data(data).timestamp(Instant.now()).build();
  }
}
