package com.flamingo.ai.companybrain.exception;

/** Exception thrown when a call to an external collaborator fails or does not finish in time. */
public class CollaboratorCallException extends RuntimeException {

  private final String operation;
  private final boolean timedOut;

  public CollaboratorCallException(String operation, String message, Throwable cause) {
    this(operation, message, cause, false);
  }

  private CollaboratorCallException(
      String operation, String message, Throwable cause, boolean timedOut) {
    super(message, cause);
    this.operation = operation;
    this.timedOut = timedOut;
  }

  public static CollaboratorCallException timeout(String operation, Throwable cause) {
    return new CollaboratorCallException(operation, operation + " timed out", cause, true);
  }

  public String getOperation() {
    return operation;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
