package com.flamingo.ai.webarchive.api.rest;

import com.flamingo.ai.webarchive.api.dto.request.ReprocessEmbeddingsRequest;
import com.flamingo.ai.webarchive.api.dto.response.ReprocessEmbeddingsResponse;
import com.flamingo.ai.webarchive.service.archive.ArchiveService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for maintenance operations. */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

  private final ArchiveService archiveService;

  /** Re-runs the shared embedding pipeline over every archive of a user. */
  @PostMapping("/reprocess-embeddings")
  public ResponseEntity<ReprocessEmbeddingsResponse> reprocessEmbeddings(
      @Valid @RequestBody ReprocessEmbeddingsRequest request) {
    int processed = archiveService.reprocessEmbeddings(request.getUserId());
    return ResponseEntity.ok(
        new ReprocessEmbeddingsResponse("Embeddings reprocessed successfully", processed));
  }
}
