package com.flamingo.ai.ragindex.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.ragindex.service.rag.model.DeletionReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for deleting a document's chunks. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletionResponse {

  @Builder.Default private boolean ok = true;
  private String namespace;

  @JsonProperty("document_id")
  private String documentId;

  private long deleted;
  private int pages;

  /** Creates a DeletionResponse from a deletion report. */
  public static DeletionResponse fromReport(DeletionReport report) {
    return DeletionResponse.builder()
        .namespace(report.namespace())
        .documentId(report.documentId())
        .deleted(report.deletedCount())
        .pages(report.pages())
        .build();
  }
}
