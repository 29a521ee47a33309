package com.flamingo.ai.ragindex.exception;

/**
 * Exception thrown when the store fails while a document's chunks are being deleted page by page.
 *
 * <p>Deletion is idempotent per id, so repeating the request removes whatever is left.
 */
public class PartialDeleteException extends StoreException {

  private final String namespace;
  private final String documentId;
  private final long deletedCount;

  public PartialDeleteException(
      String namespace, String documentId, long deletedCount, Throwable cause) {
    super(
        String.format(
            "Delete of document %s in namespace %s interrupted after %d chunks: %s",
            documentId, namespace, deletedCount, cause.getMessage()),
        String.format(
            "Deletion stopped after removing %d chunks. Repeat the request to finish.",
            deletedCount),
        cause);
    this.namespace = namespace;
    this.documentId = documentId;
    this.deletedCount = deletedCount;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getDocumentId() {
    return documentId;
  }

  public long getDeletedCount() {
    return deletedCount;
  }
}
