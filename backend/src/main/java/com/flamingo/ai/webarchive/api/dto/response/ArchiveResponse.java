package com.flamingo.ai.webarchive.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.webarchive.domain.entity.ArchiveRecord;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for archive data. Content fields are only set on single-archive reads. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArchiveResponse {

  private UUID id;
  private UUID userId;
  private String url;
  private String title;
  private String description;
  private List<String> tags;
  private Integer wordCount;
  private Integer readingTime;
  private String extractionMethod;
  private Integer chunkCount;
  private Instant timeAdded;
  private LocalDateTime createdAt;
  private String textContent;
  private String markdownContent;

  /** Metadata only, for listings. */
  public static ArchiveResponse summaryOf(ArchiveRecord archive) {
    return base(archive).build();
  }

  /** Metadata plus extracted content. */
  public static ArchiveResponse fromEntity(ArchiveRecord archive) {
    return base(archive)
        .textContent(archive.getTextContent())
        .markdownContent(archive.getMarkdownContent())
        .build();
  }

  private static ArchiveResponseBuilder base(ArchiveRecord archive) {
    return ArchiveResponse.builder()
        .id(archive.getId())
        .userId(archive.getUserId())
        .url(archive.getUrl())
        .title(archive.getTitle())
        .description(archive.getDescription())
        .tags(archive.getTags())
        .wordCount(archive.getWordCount())
        .readingTime(archive.getReadingTime())
        .extractionMethod(archive.getExtractionMethod())
        .chunkCount(archive.getChunkCount())
        .timeAdded(archive.getTimeAdded())
        .createdAt(archive.getCreatedAt());
  }
}
