package com.flamingo.ai.webarchive.api.rest;

import com.flamingo.ai.webarchive.api.dto.request.StartImportRequest;
import com.flamingo.ai.webarchive.api.dto.request.ValidateImportRequest;
import com.flamingo.ai.webarchive.api.dto.response.ArchiveResponse;
import com.flamingo.ai.webarchive.api.dto.response.ImportJobResponse;
import com.flamingo.ai.webarchive.api.dto.response.ImportPreviewResponse;
import com.flamingo.ai.webarchive.api.dto.response.ImportStatusResponse;
import com.flamingo.ai.webarchive.config.ArchiveConfig;
import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import com.flamingo.ai.webarchive.service.importing.ImportJob;
import com.flamingo.ai.webarchive.service.importing.ImportJobService;
import com.flamingo.ai.webarchive.service.importing.ImportOptions;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for bookmark list imports. */
@RestController
@RequestMapping("/api/imports")
@RequiredArgsConstructor
public class ImportController {

  private final ImportJobService importJobService;
  private final ArchiveConfig archiveConfig;

  /** Validates an import list and previews new and duplicate urls. */
  @PostMapping("/validate")
  public ResponseEntity<ImportPreviewResponse> validate(
      @Valid @RequestBody ValidateImportRequest request) {
    return ResponseEntity.ok(
        ImportPreviewResponse.from(
            importJobService.preview(request.getCsvContent(), request.getUserId())));
  }

  /** Starts a background import. */
  @PostMapping
  public ResponseEntity<ImportJobResponse> start(@Valid @RequestBody StartImportRequest request) {
    ImportOptions options =
        ImportOptions.resolve(
            request.getBatchSize(),
            request.getDelayBetweenBatchesMs(),
            request.getDelayBetweenRequestsMs(),
            request.getMaxRetries(),
            archiveConfig.getImporting());
    ImportJob job = importJobService.start(request.getCsvContent(), request.getUserId(), options);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(ImportJobResponse.fromJob(job));
  }

  @GetMapping("/{jobId}")
  public ResponseEntity<ImportJobResponse> getJob(@PathVariable UUID jobId) {
    return ResponseEntity.ok(ImportJobResponse.fromJob(importJobService.get(jobId)));
  }

  /** Requests cancellation of a running import. */
  @DeleteMapping("/{jobId}")
  public ResponseEntity<ImportJobResponse> cancelJob(@PathVariable UUID jobId) {
    return ResponseEntity.ok(ImportJobResponse.fromJob(importJobService.cancel(jobId)));
  }

  /** Lists archives the user created recently. */
  @GetMapping("/status/{userId}")
  public ResponseEntity<ImportStatusResponse> status(@PathVariable UUID userId) {
    List<ArchiveRecord> recent = importJobService.recentImports(userId);
    return ResponseEntity.ok(
        new ImportStatusResponse(
            recent.size(), recent.stream().map(ArchiveResponse::summaryOf).toList()));
  }
}
