package com.flamingo.ai.webarchive.api.rest;

import com.flamingo.ai.webarchive.api.dto.response.ArchiveResponse;
import com.flamingo.ai.webarchive.service.archive.ArchiveService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for archive management. */
@RestController
@RequestMapping("/api/archives")
@RequiredArgsConstructor
public class ArchiveController {

  private final ArchiveService archiveService;

  /** Gets all archives of a user, newest first. */
  @GetMapping("/user/{userId}")
  public ResponseEntity<List<ArchiveResponse>> getArchivesByUser(@PathVariable UUID userId) {
    return ResponseEntity.ok(
        archiveService.listForUser(userId).stream().map(ArchiveResponse::summaryOf).toList());
  }

  @GetMapping("/{archiveId}")
  public ResponseEntity<ArchiveResponse> getArchive(@PathVariable UUID archiveId) {
    return ResponseEntity.ok(ArchiveResponse.fromEntity(archiveService.get(archiveId)));
  }

  @DeleteMapping("/{archiveId}")
  public ResponseEntity<Void> deleteArchive(@PathVariable UUID archiveId) {
    archiveService.delete(archiveId);
    return ResponseEntity.noContent().build();
  }
}
