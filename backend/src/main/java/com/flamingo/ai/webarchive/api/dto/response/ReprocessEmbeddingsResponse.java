package com.flamingo.ai.webarchive.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an embedding reprocessing run. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReprocessEmbeddingsResponse {

  private String message;
  private int processedCount;
}
