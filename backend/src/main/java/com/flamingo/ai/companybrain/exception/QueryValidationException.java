package com.flamingo.ai.companybrain.exception;

/** Exception thrown when a question is rejected before any downstream call is made. */
public class QueryValidationException extends RuntimeException {

  public QueryValidationException(String message) {
    super(message);
  }
}
