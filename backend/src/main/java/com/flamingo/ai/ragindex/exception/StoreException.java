package com.flamingo.ai.ragindex.exception;

/** Exception thrown when a vector store operation fails. */
public class StoreException extends RagServiceException {

  public StoreException(String message) {
    super(message, "Vector store is temporarily unavailable. Please try again.");
  }

  public StoreException(String message, Throwable cause) {
    super(message, "Vector store is temporarily unavailable. Please try again.", cause);
  }

  protected StoreException(String message, String userMessage, Throwable cause) {
    super(message, userMessage, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
