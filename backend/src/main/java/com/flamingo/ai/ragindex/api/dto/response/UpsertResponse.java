package com.flamingo.ai.ragindex.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a raw upsert. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpsertResponse {

  @Builder.Default private boolean ok = true;
  private String namespace;
  private int count;
}
