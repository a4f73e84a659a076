package com.flamingo.ai.companybrain.exception;

/** Machine-readable error codes returned in failed API responses. */
public final class ErrorCode {

  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String SEARCH_UNAVAILABLE = "SEARCH_001";
  public static final String REQUEST_ERROR = "REQUEST_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  private ErrorCode() {}
}
