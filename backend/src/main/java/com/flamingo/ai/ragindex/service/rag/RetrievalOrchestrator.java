package com.flamingo.ai.ragindex.service.rag;

import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.exception.InvalidQueryException;
import com.flamingo.ai.ragindex.service.rag.embedding.DimensionContract;
import com.flamingo.ai.ragindex.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.ragindex.service.rag.model.QueryRequest;
import com.flamingo.ai.ragindex.service.rag.model.QueryResult;
import com.flamingo.ai.ragindex.vectorstore.MetadataFilter;
import com.flamingo.ai.ragindex.vectorstore.QueryMatch;
import com.flamingo.ai.ragindex.vectorstore.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Answers similarity queries given either query text or a query vector. */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalOrchestrator {

  private final EmbeddingService embeddingService;
  private final DimensionContract dimensionContract;
  private final VectorStore vectorStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs a similarity query.
   *
   * <p>The request shape and filter are validated before any upstream call. Matches are returned
   * in the store's order.
   *
   * @param request the query
   * @return matches, best first
   * @throws InvalidQueryException if both or neither of text and vector are given, or the filter
   *     is malformed, or the query vector has a null or non-finite component
   */
  @Timed(value = "retrieval.query", description = "Time to answer a similarity query")
  public QueryResult query(QueryRequest request) {
    boolean hasText = request.hasText();
    boolean hasVector = request.hasVector();
    if (hasText == hasVector) {
      throw new InvalidQueryException(
          hasText
              ? "Provide either text or vector, not both"
              : "Provide either text or vector");
    }

    MetadataFilter filter = MetadataFilter.parse(request.filter());
    String namespace = ragConfig.resolveNamespace(request.namespace());
    int topK =
        request.topK() == null || request.topK() <= 0
            ? ragConfig.getRetrieval().getDefaultTopK()
            : request.topK();

    List<Float> vector;
    if (hasText) {
      vector = embeddingService.embed(request.text());
    } else {
      vector = request.vector();
      dimensionContract.requireValidVector(vector, "query vector");
    }

    List<QueryMatch> matches = vectorStore.query(namespace, vector, topK, filter);
    meterRegistry.counter("retrieval.queries", "mode", hasText ? "text" : "vector").increment();
    log.debug(
        "Query in namespace '{}' ({}, topK={}, filter={}) returned {} matches",
        namespace,
        hasText ? "text" : "vector",
        topK,
        filter,
        matches.size());

    boolean includeValues = request.wantsValues();
    boolean includeMetadata = request.wantsMetadata();
    return new QueryResult(
        namespace,
        matches.stream().map(match -> match.project(includeValues, includeMetadata)).toList());
  }
}
