package com.flamingo.ai.ragindex.service.rag.embedding;

import java.util.List;

/** Turns texts into fixed-length vectors. */
public interface EmbeddingProvider {

  /**
   * Embeds a batch of texts.
   *
   * @param texts texts to embed, at most {@link #maxBatchSize()} of them
   * @param dimension required vector length
   * @return one vector per text, in input order
   * @throws com.flamingo.ai.ragindex.exception.ProviderException if the upstream call fails
   * @throws com.flamingo.ai.ragindex.exception.DimensionMismatchException if the provider cannot
   *     produce vectors of {@code dimension}
   */
  List<List<Float>> embed(List<String> texts, int dimension);

  /** Largest number of texts accepted by one {@link #embed} call. */
  default int maxBatchSize() {
    return Integer.MAX_VALUE;
  }

  /** Short name of the provider, reported by the health endpoint. */
  String name();
}
