package com.flamingo.ai.webarchive.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for searching a user's archives. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveSearchRequest {

  @NotBlank(message = "Query is required")
  private String query;

  @NotNull(message = "User id is required")
  private UUID userId;

  @Min(value = 1, message = "Limit must be at least 1")
  @Max(value = 100, message = "Limit must be at most 100")
  private Integer limit;
}
