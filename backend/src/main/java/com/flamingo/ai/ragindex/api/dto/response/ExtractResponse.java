package com.flamingo.ai.ragindex.api.dto.response;

import com.flamingo.ai.ragindex.service.rag.parsing.DocumentKind;
import com.flamingo.ai.ragindex.service.rag.parsing.NormalizedText;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for text extraction. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractResponse {

  private DocumentKind kind;
  private String text;

  public static ExtractResponse from(NormalizedText normalized) {
    return new ExtractResponse(normalized.kind(), normalized.text());
  }
}
