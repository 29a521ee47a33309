package com.flamingo.ai.ragindex.exception;

/**
 * Base class of every error raised by the indexing and retrieval core.
 *
 * <p>{@link #isRetryable()} separates bad input, which fails again on retry, from upstream
 * failures of the embedding provider or the vector store, which may succeed later.
 */
public abstract class RagServiceException extends RuntimeException {

  private final String userMessage;

  protected RagServiceException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  protected RagServiceException(String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage;
  }

  /** Whether the same request may succeed when repeated later. */
  public abstract boolean isRetryable();

  public String getUserMessage() {
    return userMessage;
  }
}
