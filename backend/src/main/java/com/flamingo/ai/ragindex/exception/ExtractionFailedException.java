package com.flamingo.ai.ragindex.exception;

import com.flamingo.ai.ragindex.service.rag.parsing.DocumentKind;

/** Exception thrown when the bytes of a supported document kind cannot be parsed. */
public class ExtractionFailedException extends RagServiceException {

  private final DocumentKind kind;

  public ExtractionFailedException(DocumentKind kind, String diagnostic, Throwable cause) {
    super(
        "Failed to extract text from " + kind + " document: " + diagnostic,
        "The document could not be read. It may be corrupt or password protected.",
        cause);
    this.kind = kind;
  }

  public DocumentKind getKind() {
    return kind;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
