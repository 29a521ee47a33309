package com.flamingo.ai.ragindex.exception;

/** Exception thrown when a document is neither PDF, DOCX nor plain text. */
public class UnsupportedDocumentKindException extends RagServiceException {

  private final String detectedType;

  public UnsupportedDocumentKindException(String detectedType) {
    super(
        "Unsupported document kind: " + detectedType,
        "Supported formats: PDF, DOCX, TXT");
    this.detectedType = detectedType;
  }

  public String getDetectedType() {
    return detectedType;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
