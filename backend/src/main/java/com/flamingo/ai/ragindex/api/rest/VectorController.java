package com.flamingo.ai.ragindex.api.rest;

import com.flamingo.ai.ragindex.api.dto.request.DeleteByDocumentRequest;
import com.flamingo.ai.ragindex.api.dto.request.QueryVectorsRequest;
import com.flamingo.ai.ragindex.api.dto.request.UpsertPointsRequest;
import com.flamingo.ai.ragindex.api.dto.response.DeletionResponse;
import com.flamingo.ai.ragindex.api.dto.response.QueryResponse;
import com.flamingo.ai.ragindex.api.dto.response.UpsertResponse;
import com.flamingo.ai.ragindex.config.RagConfig;
import com.flamingo.ai.ragindex.service.rag.IndexingOrchestrator;
import com.flamingo.ai.ragindex.service.rag.RetrievalOrchestrator;
import com.flamingo.ai.ragindex.vectorstore.VectorRecord;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for raw vector operations: upsert, delete by document and query. */
@RestController
@RequestMapping("/vectors")
@RequiredArgsConstructor
public class VectorController {

  private final IndexingOrchestrator indexingOrchestrator;
  private final RetrievalOrchestrator retrievalOrchestrator;
  private final RagConfig ragConfig;

  /**
   * Writes precomputed points. Only points whose metadata carries {@code document_id} can later be
   * removed through {@code /vectors/delete_by_document}.
   */
  @PostMapping("/upsert")
  public ResponseEntity<UpsertResponse> upsert(@Valid @RequestBody UpsertPointsRequest request) {
    List<VectorRecord> records =
        request.getPoints().stream()
            .map(p -> new VectorRecord(p.getId(), p.getValues(), p.getMetadata()))
            .toList();
    int count = indexingOrchestrator.upsert(request.getNamespace(), records);
    return ResponseEntity.ok(
        UpsertResponse.builder()
            .namespace(ragConfig.resolveNamespace(request.getNamespace()))
            .count(count)
            .build());
  }

  /** Deletes every chunk tagged with a document id. */
  @PostMapping("/delete_by_document")
  public ResponseEntity<DeletionResponse> deleteByDocument(
      @Valid @RequestBody DeleteByDocumentRequest request) {
    return ResponseEntity.ok(
        DeletionResponse.fromReport(
            indexingOrchestrator.deleteByDocument(
                request.getDocumentId(), request.getNamespace())));
  }

  /** Runs a similarity query by text or by vector. */
  @PostMapping("/query")
  public ResponseEntity<QueryResponse> query(@RequestBody QueryVectorsRequest request) {
    return ResponseEntity.ok(
        QueryResponse.fromResult(retrievalOrchestrator.query(request.toQueryRequest())));
  }
}
