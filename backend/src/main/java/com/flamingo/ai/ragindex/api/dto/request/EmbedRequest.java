package com.flamingo.ai.ragindex.api.dto.request;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for embedding a list of texts. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbedRequest {

  @NotEmpty(message = "texts must not be empty")
  private List<String> texts;
}
