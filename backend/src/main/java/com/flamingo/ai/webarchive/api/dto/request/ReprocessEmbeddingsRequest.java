package com.flamingo.ai.webarchive.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for re-embedding a user's archives. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReprocessEmbeddingsRequest {

  @NotNull(message = "User id is required")
  private UUID userId;
}
