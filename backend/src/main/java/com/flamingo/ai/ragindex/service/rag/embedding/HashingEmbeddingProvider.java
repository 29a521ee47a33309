package com.flamingo.ai.ragindex.service.rag.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Offline {@link EmbeddingProvider} that hashes lower-cased word tokens into buckets and
 * L2-normalizes the counts.
 *
 * <p>Texts sharing words get similar vectors, which is enough for local runs and tests without an
 * API key. Text without word characters maps to the zero vector.
 */
@Component
@ConditionalOnProperty(name = "app.embedding.provider", havingValue = "hashing")
@Slf4j
public class HashingEmbeddingProvider implements EmbeddingProvider {

  @Override
  public List<List<Float>> embed(List<String> texts, int dimension) {
    List<List<Float>> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(embed(text, dimension));
    }
    return vectors;
  }

  @Override
  public String name() {
    return "hashing";
  }

  private List<Float> embed(String text, int dimension) {
    float[] vector = new float[dimension];
    if (text != null && !text.isBlank()) {
      for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
        if (!token.isBlank()) {
          vector[Math.floorMod(token.hashCode(), dimension)] += 1f;
        }
      }
    }

    float norm = 0f;
    for (float v : vector) {
      norm += v * v;
    }
    norm = (float) Math.sqrt(norm);

    List<Float> result = new ArrayList<>(dimension);
    for (float v : vector) {
      result.add(norm > 0f ? v / norm : 0f);
    }
    return result;
  }
}
