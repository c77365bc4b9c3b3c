package com.flamingo.ai.webarchive.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for previewing an import list. Without a user id no duplicate check is done. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidateImportRequest {

  @NotBlank(message = "CSV content is required")
  private String csvContent;

  private UUID userId;
}
