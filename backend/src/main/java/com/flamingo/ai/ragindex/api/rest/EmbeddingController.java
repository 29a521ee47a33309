package com.flamingo.ai.ragindex.api.rest;

import com.flamingo.ai.ragindex.api.dto.request.EmbedRequest;
import com.flamingo.ai.ragindex.api.dto.response.EmbedResponse;
import com.flamingo.ai.ragindex.service.rag.embedding.EmbeddingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing the embedding provider. */
@RestController
@RequestMapping("/embed")
@RequiredArgsConstructor
public class EmbeddingController {

  private final EmbeddingService embeddingService;

  /** Embeds texts with the configured dimension, one vector per text. */
  @PostMapping
  public ResponseEntity<EmbedResponse> embed(@Valid @RequestBody EmbedRequest request) {
    return ResponseEntity.ok(new EmbedResponse(embeddingService.embedAll(request.getTexts())));
  }
}
