package com.flamingo.ai.ragindex.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String UNSUPPORTED_DOCUMENT_KIND = "DOCUMENT_001";
  public static final String EXTRACTION_FAILED = "DOCUMENT_002";
  public static final String DIMENSION_MISMATCH = "VECTOR_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INVALID_REQUEST = "VALIDATION_002";
  public static final String EMBEDDING_PROVIDER_ERROR = "EMBEDDING_001";
  public static final String VECTOR_STORE_ERROR = "STORE_001";
  public static final String PARTIAL_DELETE = "STORE_002";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, such as the parser diagnostic. */
  private final String details;

  /** Whether the same request may succeed if retried unchanged. */
  private final Boolean retryable;

  /** Chunks removed before an interrupted delete failed. */
  private final Long deletedCount;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
