package com.flamingo.ai.ragindex.service.rag;

import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.exception.InvalidQueryException;
import com.flamingo.ai.ragindex.exception.PartialDeleteException;
import com.flamingo.ai.ragindex.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.ragindex.service.rag.embedding.DimensionContract;
import com.flamingo.ai.ragindex.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.ragindex.service.rag.model.Chunk;
import com.flamingo.ai.ragindex.service.rag.model.DeletionReport;
import com.flamingo.ai.ragindex.service.rag.model.IngestionReport;
import com.flamingo.ai.ragindex.service.rag.parsing.DocumentKind;
import com.flamingo.ai.ragindex.service.rag.parsing.DocumentSource;
import com.flamingo.ai.ragindex.service.rag.parsing.NormalizedText;
import com.flamingo.ai.ragindex.service.rag.parsing.TextNormalizer;
import com.flamingo.ai.ragindex.vectorstore.IdPage;
import com.flamingo.ai.ragindex.vectorstore.MetadataFilter;
import com.flamingo.ai.ragindex.vectorstore.VectorRecord;
import com.flamingo.ai.ragindex.vectorstore.VectorStore;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes documents into the vector store and removes them again.
 *
 * <p>Ingestion runs normalize, chunk, embed, validate and upsert. Every vector of a request is
 * checked against the embedding dimension before the first write, so a mismatch leaves the store
 * untouched. Chunk ids are deterministic ({@code <documentId>#<index>}), which makes re-ingesting
 * a document overwrite its chunks in place.
 *
 * <p>Deletion pages through the ids tagged with the document and deletes each page until the store
 * reports no further ids.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexingOrchestrator {

  private final TextNormalizer textNormalizer;
  private final DocumentChunker documentChunker;
  private final EmbeddingService embeddingService;
  private final DimensionContract dimensionContract;
  private final VectorStore vectorStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts, chunks, embeds and stores a document.
   *
   * @param documentId caller-supplied document id
   * @param source document bytes and declared type
   * @param metadata metadata copied onto every chunk, may be null
   * @param namespace target namespace; blank means the default namespace
   * @return ids of the chunks written
   */
  @Timed(value = "ingest.document", description = "Time to ingest a document")
  public IngestionReport ingest(
      String documentId, DocumentSource source, Map<String, Object> metadata, String namespace) {
    requireDocumentId(documentId);
    validateMetadata(metadata);
    String ns = ragConfig.resolveNamespace(namespace);

    NormalizedText normalized = textNormalizer.normalize(source);
    log.info(
        "Ingesting {} document '{}' ({}) into namespace '{}': {} chars",
        normalized.kind(),
        documentId,
        source.fileName(),
        ns,
        normalized.text().length());
    return index(ns, documentId, normalized.kind(), normalized.text(), metadata);
  }

  /**
   * Chunks, embeds and stores text that is already extracted.
   *
   * @param documentId caller-supplied document id
   * @param text raw text; whitespace is normalized before chunking
   * @param metadata metadata copied onto every chunk, may be null
   * @param namespace target namespace; blank means the default namespace
   * @return ids of the chunks written
   */
  @Timed(value = "ingest.text", description = "Time to ingest raw text")
  public IngestionReport ingestText(
      String documentId, String text, Map<String, Object> metadata, String namespace) {
    requireDocumentId(documentId);
    validateMetadata(metadata);
    String ns = ragConfig.resolveNamespace(namespace);

    String normalized = textNormalizer.normalizeText(text);
    log.info(
        "Ingesting text document '{}' into namespace '{}': {} chars",
        documentId,
        ns,
        normalized.length());
    return index(ns, documentId, DocumentKind.PLAIN_TEXT, normalized, metadata);
  }

  /**
   * Writes precomputed records as they are.
   *
   * <p>Records without a {@code document_id} metadata entry are written too, but {@link
   * #deleteByDocument} can never reach them. They are counted and logged.
   *
   * @param namespace target namespace; blank means the default namespace
   * @param records records with unique, non-blank ids
   * @return number of records written
   */
  @Timed(value = "ingest.upsert", description = "Time to upsert precomputed vectors")
  public int upsert(String namespace, List<VectorRecord> records) {
    String ns = ragConfig.resolveNamespace(namespace);
    if (records == null || records.isEmpty()) {
      return 0;
    }

    Set<String> seen = new HashSet<>();
    int untracked = 0;
    for (VectorRecord record : records) {
      if (record.id() == null || record.id().isBlank()) {
        throw new InvalidQueryException("Every point needs a non-blank id");
      }
      if (!seen.add(record.id())) {
        throw new InvalidQueryException("Duplicate point id in request: " + record.id());
      }
      validateMetadata(record.metadata());
      if (!record.metadata().containsKey(Chunk.DOCUMENT_ID_KEY)) {
        untracked++;
      }
    }
    dimensionContract.requireDimensions(records);

    write(ns, records);
    if (untracked > 0) {
      meterRegistry.counter("ingest.upsert.untracked").increment(untracked);
      log.warn(
          "{} of {} points upserted into namespace '{}' have no {}; delete_by_document cannot"
              + " remove them",
          untracked,
          records.size(),
          ns,
          Chunk.DOCUMENT_ID_KEY);
    }
    log.info("Upserted {} points into namespace '{}'", records.size(), ns);
    return records.size();
  }

  /**
   * Deletes every chunk of a document, one id page at a time.
   *
   * @param documentId the document
   * @param namespace namespace to delete from; blank means the default namespace
   * @return number of chunks removed and pages visited
   * @throws PartialDeleteException if the store fails part way; it carries the count removed so far
   */
  @Timed(value = "ingest.delete_document", description = "Time to delete a document's chunks")
  public DeletionReport deleteByDocument(String documentId, String namespace) {
    requireDocumentId(documentId);
    String ns = ragConfig.resolveNamespace(namespace);
    int pageSize = Math.max(1, ragConfig.getVectorStore().getPageSize());
    MetadataFilter filter = MetadataFilter.equalTo(Chunk.DOCUMENT_ID_KEY, documentId);

    long deleted = 0;
    int pages = 0;
    String pageToken = null;
    try {
      while (true) {
        IdPage page = vectorStore.listIdsByMetadata(ns, filter, pageToken, pageSize);
        pages++;
        if (!page.ids().isEmpty()) {
          deleted += vectorStore.deleteByIds(ns, page.ids());
        }
        if (page.ids().size() < pageSize || !page.hasNext()) {
          break;
        }
        pageToken = page.nextPageToken();
      }
    } catch (RuntimeException e) {
      meterRegistry.counter("ingest.delete.partial").increment();
      log.error(
          "Delete of document '{}' in namespace '{}' stopped after {} chunks on page {}: {}",
          documentId,
          ns,
          deleted,
          pages,
          e.getMessage());
      throw new PartialDeleteException(ns, documentId, deleted, e);
    }

    log.info(
        "Deleted {} chunks of document '{}' from namespace '{}' in {} pages",
        deleted,
        documentId,
        ns,
        pages);
    return new DeletionReport(ns, documentId, deleted, pages);
  }

  private IngestionReport index(
      String namespace,
      String documentId,
      DocumentKind kind,
      String text,
      Map<String, Object> metadata) {
    List<String> segments = documentChunker.chunk(text, ragConfig.getChunking());
    if (segments.isEmpty()) {
      log.info("Document '{}' produced no chunks, nothing written", documentId);
      return new IngestionReport(namespace, documentId, kind, List.of(), text.length());
    }

    List<List<Float>> vectors = embeddingService.embedAll(segments);

    List<VectorRecord> records = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      records.add(new Chunk(documentId, i, segments.get(i), vectors.get(i), metadata).toRecord());
    }
    dimensionContract.requireDimensions(records);

    if (ragConfig.getIndexing().isReplaceOnIngest()) {
      deleteByDocument(documentId, namespace);
    }
    write(namespace, records);

    meterRegistry.counter("ingest.documents", "kind", kind.name()).increment();
    meterRegistry.counter("ingest.chunks").increment(records.size());
    log.info(
        "Ingested document '{}' into namespace '{}': {} chunks",
        documentId,
        namespace,
        records.size());
    List<String> chunkIds = records.stream().map(VectorRecord::id).toList();
    return new IngestionReport(namespace, documentId, kind, chunkIds, text.length());
  }

  private void write(String namespace, List<VectorRecord> records) {
    int batchSize = Math.max(1, ragConfig.getVectorStore().getUpsertBatchSize());
    for (List<VectorRecord> batch : Lists.partition(records, batchSize)) {
      vectorStore.upsert(namespace, batch);
    }
  }

  private static void requireDocumentId(String documentId) {
    if (documentId == null || documentId.isBlank()) {
      throw new InvalidQueryException("document_id is required");
    }
  }

  private static void validateMetadata(Map<String, Object> metadata) {
    if (metadata == null) {
      return;
    }
    for (Map.Entry<String, Object> entry : metadata.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new InvalidQueryException("Metadata keys must not be blank");
      }
      if (!isScalar(entry.getValue()) && !isStringList(entry.getValue())) {
        throw new InvalidQueryException(
            "Metadata value for '"
                + key
                + "' must be a string, number, boolean or list of strings");
      }
    }
  }

  private static boolean isScalar(Object value) {
    return value instanceof String || value instanceof Number || value instanceof Boolean;
  }

  private static boolean isStringList(Object value) {
    if (!(value instanceof Collection<?> collection)) {
      return false;
    }
    for (Object element : collection) {
      if (!(element instanceof String)) {
        return false;
      }
    }
    return true;
  }
}
