package com.flamingo.ai.ragindex.api.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.ragindex.api.dto.request.IngestTextRequest;
import com.flamingo.ai.ragindex.api.dto.response.ExtractResponse;
import com.flamingo.ai.ragindex.api.dto.response.IngestionResponse;
import com.flamingo.ai.ragindex.exception.InvalidQueryException;
import com.flamingo.ai.ragindex.service.rag.IndexingOrchestrator;
import com.flamingo.ai.ragindex.service.rag.model.IngestionReport;
import com.flamingo.ai.ragindex.service.rag.parsing.DocumentSource;
import com.flamingo.ai.ragindex.service.rag.parsing.TextNormalizer;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for text extraction and document ingestion. */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class DocumentController {

  private static final TypeReference<Map<String, Object>> METADATA_TYPE =
      new TypeReference<>() {};

  private final TextNormalizer textNormalizer;
  private final IndexingOrchestrator indexingOrchestrator;
  private final ObjectMapper objectMapper;

  /** Extracts normalized text from an uploaded file without indexing it. */
  @PostMapping(value = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ExtractResponse> extract(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "mime", required = false) String mime)
      throws IOException {
    return ResponseEntity.ok(ExtractResponse.from(textNormalizer.normalize(toSource(file, mime))));
  }

  /** Uploads a document and indexes its chunks. */
  @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IngestionResponse> ingestDocument(
      @RequestParam("file") MultipartFile file,
      @RequestParam("documentId") String documentId,
      @RequestParam(value = "namespace", required = false) String namespace,
      @RequestParam(value = "metadata", required = false) String metadata,
      @RequestParam(value = "mime", required = false) String mime)
      throws IOException {
    IngestionReport report =
        indexingOrchestrator.ingest(
            documentId, toSource(file, mime), parseMetadata(metadata), namespace);
    return ResponseEntity.status(HttpStatus.CREATED).body(IngestionResponse.fromReport(report));
  }

  /** Indexes already extracted text. */
  @PostMapping("/documents/text")
  public ResponseEntity<IngestionResponse> ingestText(
      @Valid @RequestBody IngestTextRequest request) {
    IngestionReport report =
        indexingOrchestrator.ingestText(
            request.getDocumentId(),
            request.getText(),
            request.getMetadata(),
            request.getNamespace());
    return ResponseEntity.status(HttpStatus.CREATED).body(IngestionResponse.fromReport(report));
  }

  private static DocumentSource toSource(MultipartFile file, String mime) throws IOException {
    String mimeType = mime != null && !mime.isBlank() ? mime : file.getContentType();
    return new DocumentSource(file.getBytes(), mimeType, file.getOriginalFilename());
  }

  private Map<String, Object> parseMetadata(String metadata) {
    if (metadata == null || metadata.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(metadata, METADATA_TYPE);
    } catch (JsonProcessingException e) {
      throw new InvalidQueryException("metadata must be a JSON object");
    }
  }
}
