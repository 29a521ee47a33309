package com.flamingo.ai.ragindex.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for writing precomputed vectors. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpsertPointsRequest {

  private String namespace;

  @NotEmpty(message = "points must not be empty")
  private List<@Valid Point> points;

  /** A point to upsert. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Point {

    @NotBlank(message = "id is required")
    private String id;

    @NotEmpty(message = "values must not be empty")
    private List<Float> values;

    private Map<String, Object> metadata;
  }
}
