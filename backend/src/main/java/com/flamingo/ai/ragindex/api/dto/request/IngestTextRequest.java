package com.flamingo.ai.ragindex.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting already extracted text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestTextRequest {

  @NotBlank(message = "documentId is required")
  @JsonAlias("document_id")
  private String documentId;

  @NotNull(message = "text is required")
  private String text;

  private String namespace;

  private Map<String, Object> metadata;
}
