package com.flamingo.ai.ragindex.vectorstore;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

/**
 * One result of a similarity query.
 *
 * @param id record id
 * @param score similarity in [0, 1], higher is closer
 * @param values the stored vector, or null when not requested
 * @param metadata the stored metadata, or null when not requested
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryMatch(
    String id, double score, List<Float> values, Map<String, Object> metadata) {

  /** Returns a copy without the parts the caller did not ask for. */
  public QueryMatch project(boolean includeValues, boolean includeMetadata) {
    return new QueryMatch(
        id, score, includeValues ? values : null, includeMetadata ? metadata : null);
  }
}
