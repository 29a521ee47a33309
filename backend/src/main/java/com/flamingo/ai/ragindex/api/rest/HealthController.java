package com.flamingo.ai.ragindex.api.rest;

import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.ragindex.vectorstore.VectorStore;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and service configuration. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final RagConfig ragConfig;
  private final VectorStore vectorStore;
  private final EmbeddingService embeddingService;

  /** Returns a simple health check response with the active index settings. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("ok", true);
    health.put("index", ragConfig.getIndexName());
    health.put("store", vectorStore.name());
    health.put("provider", embeddingService.providerName());
    health.put("namespace_default", ragConfig.getDefaultNamespace());
    health.put("embed_dim", ragConfig.getEmbedding().getDimension());
    health.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(health);
  }
}
