package com.flamingo.ai.webarchive.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.webarchive.service.importing.ImportJob;
import com.flamingo.ai.webarchive.service.importing.ImportJobService;
import com.flamingo.ai.webarchive.service.importing.ImportJobStatus;
import com.flamingo.ai.webarchive.service.importing.ImportProgress;
import com.flamingo.ai.webarchive.service.importing.ImportSummary;
import java.time.Instant;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/** Response DTO for an import job. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportJobResponse {

  UUID jobId;
  UUID userId;
  ImportJobStatus status;
  int totalUrls;
  int estimatedTimeMinutes;
  Instant startedAt;
  Instant finishedAt;
  ImportProgress progress;
  ImportSummary summary;
  String error;

  public static ImportJobResponse fromJob(ImportJob job) {
    return ImportJobResponse.builder()
        .jobId(job.getId())
        .userId(job.getUserId())
        .status(job.getStatus())
        .totalUrls(job.getTotalUrls())
        .estimatedTimeMinutes(ImportJobService.estimatedMinutes(job.getTotalUrls()))
        .startedAt(job.getStartedAt())
        .finishedAt(job.getFinishedAt())
        .progress(job.getLastProgress())
        .summary(job.getSummary())
        .error(job.getError())
        .build();
  }
}
