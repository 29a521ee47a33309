package com.flamingo.ai.ragindex.exception;

/** Exception thrown when a request is malformed (query shape, filter, ids or metadata). */
public class InvalidQueryException extends RagServiceException {

  public InvalidQueryException(String message) {
    super(message, message);
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
