package com.flamingo.ai.ragindex.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HashingEmbeddingProvider Tests")
class HashingEmbeddingProviderTest {

  private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider();

  @Test
  @DisplayName("should produce unit vectors of the requested dimension")
  void shouldProduceUnitVectors() {
    List<Float> vector = provider.embed(List.of("The quick brown fox"), 64).get(0);

    assertThat(vector).hasSize(64);
    double norm = vector.stream().mapToDouble(v -> v * v).sum();
    assertThat(norm).isCloseTo(1.0, within(1e-5));
  }

  @Test
  @DisplayName("should be deterministic and case-insensitive")
  void shouldBeDeterministic() {
    List<List<Float>> vectors = provider.embed(List.of("Hello World", "hello world"), 32);

    assertThat(vectors.get(0)).isEqualTo(vectors.get(1));
  }

  @Test
  @DisplayName("should map text without words to the zero vector")
  void shouldMapBlankToZeroVector() {
    List<Float> vector = provider.embed(List.of("  ...  "), 8).get(0);

    assertThat(vector).hasSize(8).containsOnly(0f);
  }
}
