package com.flamingo.ai.ragindex.service.rag.embedding;

import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.exception.DimensionMismatchException;
import com.flamingo.ai.ragindex.exception.ProviderException;
import com.flamingo.ai.ragindex.exception.RagServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel} (OpenAI). */
@Component
@ConditionalOnProperty(
    name = "app.embedding.provider",
    havingValue = "openai",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  // OpenAI accepts at most 2048 inputs per embeddings request
  private static final int MAX_INPUTS_PER_REQUEST = 2048;

  private final EmbeddingModel embeddingModel;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  public List<List<Float>> embed(List<String> texts, int dimension) {
    int modelDimension = ragConfig.getEmbedding().getDimension();
    if (dimension != modelDimension) {
      throw new DimensionMismatchException(modelDimension, dimension, "embedding request");
    }

    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
    Response<List<Embedding>> response;
    try {
      log.debug("Calling OpenAI embedding API for {} texts", texts.size());
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      throw new ProviderException("Embedding request failed: " + e.getMessage(), e);
    }
    if (response == null || response.content() == null) {
      throw new ProviderException("Embedding provider returned no content");
    }

    List<List<Float>> vectors = new ArrayList<>(response.content().size());
    for (Embedding embedding : response.content()) {
      vectors.add(embedding.vectorAsList());
    }
    meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
    return vectors;
  }

  @Override
  public int maxBatchSize() {
    return MAX_INPUTS_PER_REQUEST;
  }

  @Override
  public String name() {
    return "openai";
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedFallback(List<String> texts, int dimension, Throwable t) {
    if (t instanceof RagServiceException ragException && !ragException.isRetryable()) {
      throw ragException;
    }
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
    if (t instanceof ProviderException providerException) {
      throw providerException;
    }
    throw new ProviderException("Embedding provider unavailable: " + t.getMessage(), t);
  }
}
