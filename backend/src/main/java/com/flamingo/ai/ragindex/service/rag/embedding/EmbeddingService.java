package com.flamingo.ai.ragindex.service.rag.embedding;

import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.exception.InvalidQueryException;
import com.flamingo.ai.ragindex.exception.ProviderException;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds texts with the configured {@link EmbeddingProvider}.
 *
 * <p>Inputs larger than the batch limit are split and the results concatenated in input order.
 * Every returned vector is checked against the embedding dimension.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingProvider embeddingProvider;
  private final DimensionContract dimensionContract;
  private final RagConfig ragConfig;

  /**
   * Embeds texts, one vector per text.
   *
   * @param texts texts to embed
   * @return vectors in input order
   * @throws InvalidQueryException if any text is null
   * @throws ProviderException if the provider fails or returns the wrong number of vectors
   */
  @Timed(value = "embedding.embedAll", description = "Time to embed a list of texts")
  public List<List<Float>> embedAll(List<String> texts) {
    if (texts == null || texts.isEmpty()) {
      return List.of();
    }
    for (int i = 0; i < texts.size(); i++) {
      if (texts.get(i) == null) {
        throw new InvalidQueryException("texts must not contain null (index " + i + ")");
      }
    }

    int dimension = dimensionContract.dimension();
    int batchSize =
        Math.max(
            1, Math.min(ragConfig.getEmbedding().getBatchSize(), embeddingProvider.maxBatchSize()));

    List<List<Float>> vectors = new ArrayList<>(texts.size());
    for (List<String> batch : Lists.partition(texts, batchSize)) {
      List<List<Float>> batchVectors = embeddingProvider.embed(batch, dimension);
      if (batchVectors == null || batchVectors.size() != batch.size()) {
        throw new ProviderException(
            String.format(
                "Embedding provider returned %d vectors for %d texts",
                batchVectors == null ? 0 : batchVectors.size(), batch.size()));
      }
      for (List<Float> vector : batchVectors) {
        dimensionContract.requireDimension(vector, "embedding from " + embeddingProvider.name());
        if (DimensionContract.firstInvalidComponent(vector) >= 0) {
          throw new ProviderException(
              "Embedding provider " + embeddingProvider.name() + " returned a non-finite vector");
        }
      }
      vectors.addAll(batchVectors);
    }

    log.debug(
        "Embedded {} texts in {} batches",
        texts.size(),
        (texts.size() + batchSize - 1) / batchSize);
    return vectors;
  }

  /**
   * Embeds a single text.
   *
   * @param text the text
   * @return its vector
   */
  public List<Float> embed(String text) {
    return embedAll(Collections.singletonList(text)).get(0);
  }

  /** Name of the active provider. */
  public String providerName() {
    return embeddingProvider.name();
  }
}
