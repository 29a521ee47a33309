package com.flamingo.ai.ragindex.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for deleting all chunks of a document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteByDocumentRequest {

  private String namespace;

  @NotBlank(message = "document_id is required")
  @JsonProperty("document_id")
  @JsonAlias("documentId")
  private String documentId;
}
