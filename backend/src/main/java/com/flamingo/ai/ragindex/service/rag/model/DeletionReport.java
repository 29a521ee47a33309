package com.flamingo.ai.ragindex.service.rag.model;

/**
 * Outcome of deleting a document's chunks.
 *
 * @param namespace namespace deleted from
 * @param documentId the document
 * @param deletedCount chunks removed by this call
 * @param pages id pages visited
 */
public record DeletionReport(String namespace, String documentId, long deletedCount, int pages) {}
