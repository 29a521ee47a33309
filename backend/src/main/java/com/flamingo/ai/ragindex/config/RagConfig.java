package com.flamingo.ai.ragindex.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the indexing and retrieval pipeline.
 *
 * <p>Orchestrators receive this object through their constructors instead of reading ambient
 * state, so tests can build one directly and several indices can run in the same process.
 */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  /** Namespace used when a request does not name one. */
  private String defaultNamespace = "default";

  /** Name of the index in the vector store. */
  private String indexName = "rag-main";

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Indexing indexing = new Indexing();
  private VectorStore vectorStore = new VectorStore();

  /**
   * Returns the trimmed namespace, or the default namespace when it is null or blank.
   *
   * @param namespace the requested namespace
   * @return the effective namespace
   */
  public String resolveNamespace(String namespace) {
    if (namespace == null || namespace.isBlank()) {
      return defaultNamespace;
    }
    return namespace.trim();
  }

  /** Unit in which {@link Chunking#getSize()} is measured. */
  public enum SizeUnit {
    CHARACTERS,
    TOKENS
  }

  @Getter
  @Setter
  public static class Chunking {
    /** Rough characters-per-token ratio used when sizing by tokens. */
    public static final int CHARS_PER_TOKEN = 4;

    private int size = 1000;
    private SizeUnit unit = SizeUnit.CHARACTERS;
    private int overlap = 0;

    /** How far back from the size limit a sentence boundary is searched for, in characters. */
    private int lookBack = 200;

    /** Maximum segment length in characters. */
    public int maxChars() {
      return unit == SizeUnit.TOKENS ? size * CHARS_PER_TOKEN : size;
    }

    /** Overlap between consecutive segments in characters. */
    public int overlapChars() {
      return unit == SizeUnit.TOKENS ? overlap * CHARS_PER_TOKEN : overlap;
    }
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Service-wide embedding dimension; every stored and queried vector must have this length. */
    private int dimension = 512;

    /** Largest number of texts sent to the embedding provider in one call. */
    private int batchSize = 96;
  }

  @Getter
  @Setter
  public static class Retrieval {
    /** Used when a query has no topK or a non-positive one. */
    private int defaultTopK = 24;
  }

  @Getter
  @Setter
  public static class Indexing {
    /**
     * Deletes every chunk of a document before re-ingesting it. Off by default: re-ingestion only
     * overwrites chunk ids that still exist, so a document that shrinks keeps its old tail chunks.
     */
    private boolean replaceOnIngest = false;
  }

  @Getter
  @Setter
  public static class VectorStore {
    /** Page size used when enumerating chunk ids for deletion. */
    private int pageSize = 100;

    /** Largest number of records written to the store in one call. */
    private int upsertBatchSize = 100;
  }
}
