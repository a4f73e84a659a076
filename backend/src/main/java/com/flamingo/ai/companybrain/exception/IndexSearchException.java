package com.flamingo.ai.companybrain.exception;

/** Exception thrown when a request to the document index fails at the transport level. */
public class IndexSearchException extends RuntimeException {

  public IndexSearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
