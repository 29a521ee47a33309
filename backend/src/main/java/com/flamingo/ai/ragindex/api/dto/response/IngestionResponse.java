package com.flamingo.ai.ragindex.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.ragindex.service.rag.model.IngestionReport;
import com.flamingo.ai.ragindex.service.rag.parsing.DocumentKind;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document ingestion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

  @Builder.Default private boolean ok = true;
  private String namespace;

  @JsonProperty("document_id")
  private String documentId;

  private DocumentKind kind;
  private int count;
  private List<String> ids;
  private int characters;

  /** Creates an IngestionResponse from an ingestion report. */
  public static IngestionResponse fromReport(IngestionReport report) {
    return IngestionResponse.builder()
        .namespace(report.namespace())
        .documentId(report.documentId())
        .kind(report.kind())
        .count(report.chunkCount())
        .ids(report.chunkIds())
        .characters(report.characters())
        .build();
  }
}
