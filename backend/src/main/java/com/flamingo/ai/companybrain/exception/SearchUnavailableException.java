package com.flamingo.ai.companybrain.exception;

/** Exception thrown when the document index fails its health check. */
public class SearchUnavailableException extends RuntimeException {

  private final String userMessage;

  public SearchUnavailableException(String message) {
    super(message);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
