package com.flamingo.ai.ragindex.service.rag.model;

import com.flamingo.ai.ragindex.vectorstore.VectorRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An embedded segment of a document, before it is written to the vector store.
 *
 * @param documentId id of the owning document
 * @param index position of the segment within the document (0-based)
 * @param text the segment text
 * @param vector its embedding
 * @param metadata caller-supplied metadata
 */
public record Chunk(
    String documentId,
    int index,
    String text,
    List<Float> vector,
    Map<String, Object> metadata) {

  public static final String DOCUMENT_ID_KEY = "document_id";
  public static final String CHUNK_INDEX_KEY = "chunk_index";
  public static final String TEXT_KEY = "text";

  /** Chunk id, unique within a namespace: {@code <documentId>#<index>}. */
  public String id() {
    return idFor(documentId, index);
  }

  public static String idFor(String documentId, int index) {
    return documentId + "#" + index;
  }

  /**
   * Converts the chunk to a store record. Caller metadata is copied first, then {@code
   * document_id}, {@code chunk_index} and {@code text} are stamped over it.
   */
  public VectorRecord toRecord() {
    Map<String, Object> recordMetadata = new LinkedHashMap<>();
    if (metadata != null) {
      recordMetadata.putAll(metadata);
    }
    recordMetadata.put(DOCUMENT_ID_KEY, documentId);
    recordMetadata.put(CHUNK_INDEX_KEY, index);
    recordMetadata.put(TEXT_KEY, text);
    return new VectorRecord(id(), vector, recordMetadata);
  }
}
