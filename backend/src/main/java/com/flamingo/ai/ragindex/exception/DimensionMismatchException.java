package com.flamingo.ai.ragindex.exception;

/**
 * Exception thrown when a vector's length differs from the configured embedding dimension.
 *
 * <p>Writing such a vector would corrupt similarity scores for the whole namespace, so the request
 * is rejected before anything reaches the store.
 */
public class DimensionMismatchException extends RagServiceException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual, String subject) {
    super(
        String.format(
            "Dimension mismatch for %s: expected %d but got %d", subject, expected, actual),
        String.format("Vectors must have exactly %d dimensions, got %d", expected, actual));
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
