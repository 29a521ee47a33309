package com.flamingo.ai.ragindex.service.rag.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * A similarity query. Exactly one of {@code text} and {@code vector} must be given.
 *
 * @param namespace namespace to search; blank means the default namespace
 * @param text query text, embedded before searching
 * @param vector precomputed query vector
 * @param topK maximum number of matches; null or non-positive means the configured default
 * @param filter metadata filter in map form, may be null
 * @param includeValues return stored vectors (default false)
 * @param includeMetadata return stored metadata (default true)
 */
@Builder
public record QueryRequest(
    String namespace,
    String text,
    List<Float> vector,
    Integer topK,
    Map<String, Object> filter,
    Boolean includeValues,
    Boolean includeMetadata) {

  public boolean hasText() {
    return text != null && !text.isBlank();
  }

  public boolean hasVector() {
    return vector != null && !vector.isEmpty();
  }

  public boolean wantsValues() {
    return Boolean.TRUE.equals(includeValues);
  }

  public boolean wantsMetadata() {
    return !Boolean.FALSE.equals(includeMetadata);
  }
}
