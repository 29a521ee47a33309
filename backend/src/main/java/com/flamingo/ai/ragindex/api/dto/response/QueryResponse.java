package com.flamingo.ai.ragindex.api.dto.response;

import com.flamingo.ai.ragindex.service.rag.model.QueryResult;
import com.flamingo.ai.ragindex.vectorstore.QueryMatch;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a similarity query. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

  @Builder.Default private boolean ok = true;
  private String namespace;
  private List<QueryMatch> matches;

  public static QueryResponse fromResult(QueryResult result) {
    return QueryResponse.builder()
        .namespace(result.namespace())
        .matches(result.matches())
        .build();
  }
}
