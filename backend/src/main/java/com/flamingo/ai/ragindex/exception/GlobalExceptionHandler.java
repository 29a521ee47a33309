package com.flamingo.ai.ragindex.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Bad input maps to 4xx and is never retryable. Upstream failures map to 502/503 and carry
 * {@code retryable=true} so clients can tell the two apart.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(UnsupportedDocumentKindException.class)
  public ResponseEntity<ApiError> handleUnsupportedKind(
      UnsupportedDocumentKindException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_document_kind");
    String errorId = generateErrorId();
    log.warn("Unsupported document kind [{}]: {}", errorId, ex.getDetectedType());

    return respond(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE,
        ApiError.UNSUPPORTED_DOCUMENT_KIND,
        ex,
        errorId,
        request);
  }

  @ExceptionHandler(ExtractionFailedException.class)
  public ResponseEntity<ApiError> handleExtractionFailed(
      ExtractionFailedException ex, HttpServletRequest request) {

    incrementErrorCounter("extraction_failed");
    String errorId = generateErrorId();
    log.warn("Text extraction failed [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.EXTRACTION_FAILED)
                .message(ex.getUserMessage())
                .details(ex.getMessage())
                .retryable(ex.isRetryable())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DimensionMismatchException.class)
  public ResponseEntity<ApiError> handleDimensionMismatch(
      DimensionMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("dimension_mismatch");
    String errorId = generateErrorId();
    log.warn(
        "Dimension mismatch [{}]: expected={}, actual={}",
        errorId,
        ex.getExpected(),
        ex.getActual());

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY, ApiError.DIMENSION_MISMATCH, ex, errorId, request);
  }

  @ExceptionHandler(InvalidQueryException.class)
  public ResponseEntity<ApiError> handleInvalidQuery(
      InvalidQueryException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_request");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return respond(HttpStatus.BAD_REQUEST, ApiError.INVALID_REQUEST, ex, errorId, request);
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ApiError> handleProvider(ProviderException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_provider_error");
    String errorId = generateErrorId();
    log.error("Embedding provider error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(HttpStatus.BAD_GATEWAY, ApiError.EMBEDDING_PROVIDER_ERROR, ex, errorId, request);
  }

  @ExceptionHandler(PartialDeleteException.class)
  public ResponseEntity<ApiError> handlePartialDelete(
      PartialDeleteException ex, HttpServletRequest request) {

    incrementErrorCounter("partial_delete");
    String errorId = generateErrorId();
    log.error(
        "Delete interrupted [{}]: namespace={}, documentId={}, deleted={}",
        errorId,
        ex.getNamespace(),
        ex.getDocumentId(),
        ex.getDeletedCount(),
        ex);

    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.PARTIAL_DELETE)
                .message(ex.getUserMessage())
                .retryable(ex.isRetryable())
                .deletedCount(ex.getDeletedCount())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<ApiError> handleStore(StoreException ex, HttpServletRequest request) {

    incrementErrorCounter("vector_store_error");
    String errorId = generateErrorId();
    log.error("Vector store error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE, ApiError.VECTOR_STORE_ERROR, ex, errorId, request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return badRequest(ApiError.VALIDATION_ERROR, message, errorId, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return badRequest(ApiError.INVALID_REQUEST, "Malformed request body", errorId, request);
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiError> handleMissingInput(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Missing request input [{}]: {}", errorId, ex.getMessage());

    return badRequest(ApiError.VALIDATION_ERROR, ex.getMessage(), errorId, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String code,
      RagServiceException ex,
      String errorId,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(ex.getUserMessage())
                .retryable(ex.isRetryable())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private ResponseEntity<ApiError> badRequest(
      String code, String message, String errorId, HttpServletRequest request) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .retryable(false)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
