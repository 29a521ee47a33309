package com.flamingo.ai.ragindex.service.rag.model;

import com.flamingo.ai.ragindex.service.rag.parsing.DocumentKind;
import java.util.List;

/**
 * Outcome of ingesting one document.
 *
 * @param namespace namespace written to
 * @param documentId the document
 * @param kind the kind the document was read as
 * @param chunkIds ids of the chunks written, in order
 * @param characters length of the normalized text
 */
public record IngestionReport(
    String namespace, String documentId, DocumentKind kind, List<String> chunkIds, int characters) {

  public int chunkCount() {
    return chunkIds.size();
  }
}
