package com.flamingo.ai.webarchive.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for starting an import. Unset pacing options use the configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartImportRequest {

  @NotBlank(message = "CSV content is required")
  private String csvContent;

  @NotNull(message = "User id is required")
  private UUID userId;

  @Max(value = 100, message = "Batch size must not exceed 100")
  private Integer batchSize;
  private Long delayBetweenBatchesMs;
  private Long delayBetweenRequestsMs;
  private Integer maxRetries;
}
