package com.flamingo.ai.ragindex.api.dto.request;

import com.flamingo.ai.ragindex.service.rag.model.QueryRequest;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a similarity query. Whether exactly one of {@code text} and {@code vector} is
 * present is checked by the retrieval service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryVectorsRequest {

  private String namespace;
  private String text;
  private List<Float> vector;
  private Integer topK;
  private Map<String, Object> filter;

  @Builder.Default private Boolean includeValues = false;

  @Builder.Default private Boolean includeMetadata = true;

  /** Converts to the service-level query. */
  public QueryRequest toQueryRequest() {
    return QueryRequest.builder()
        .namespace(namespace)
        .text(text)
        .vector(vector)
        .topK(topK)
        .filter(filter)
        .includeValues(includeValues)
        .includeMetadata(includeMetadata)
        .build();
  }
}
