package com.flamingo.ai.ragindex.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j embedding model. */
@Configuration
@ConditionalOnProperty(
    name = "app.embedding.provider",
    havingValue = "openai",
    matchIfMissing = true)
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.timeout-seconds:30}")
  private int timeoutSeconds;

  @Value("${langchain4j.openai.embedding-model.max-retries:0}")
  private int maxRetries;

  /**
   * The model is asked for vectors of the configured index dimension so that the provider and the
   * index never disagree.
   */
  @Bean
  public EmbeddingModel embeddingModel(RagConfig ragConfig) {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(ragConfig.getEmbedding().getDimension())
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .maxRetries(maxRetries)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
