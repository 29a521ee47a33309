package com.flamingo.ai.ragindex.exception;

/** Exception thrown when the embedding provider fails or returns an unusable response. */
public class ProviderException extends RagServiceException {

  public ProviderException(String message) {
    super(message, "Embedding service is temporarily unavailable. Please try again later.");
  }

  public ProviderException(String message, Throwable cause) {
    super(
        message, "Embedding service is temporarily unavailable. Please try again later.", cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
