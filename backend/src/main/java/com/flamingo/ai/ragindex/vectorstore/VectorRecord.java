package com.flamingo.ai.ragindex.vectorstore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A point in the vector store.
 *
 * @param id unique id within the namespace
 * @param values the embedding vector
 * @param metadata scalar (or string list) metadata, used for filtering
 */
public record VectorRecord(String id, List<Float> values, Map<String, Object> metadata) {

  public VectorRecord {
    // Null components are kept so that validation can reject them as bad input.
    values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
