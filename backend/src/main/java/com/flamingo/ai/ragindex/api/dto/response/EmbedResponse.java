package com.flamingo.ai.ragindex.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for embeddings, one vector per input text. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbedResponse {

  private List<List<Float>> vectors;
}
