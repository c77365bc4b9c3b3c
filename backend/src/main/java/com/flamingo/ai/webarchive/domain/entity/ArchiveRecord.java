package com.flamingo.ai.webarchive.domain.entity;

import com.flamingo.ai.webarchive.domain.converter.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A user's captured copy of a web page.
 *
 * <p>At most one record exists per (user, normalized url); the unique constraint backs up the
 * best-effort existence checks done during import.
 */
@Entity
@Table(
    name = "archives",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_archives_user_url",
            columnNames = {"user_id", "url"}),
    indexes = @Index(name = "idx_archives_user_created", columnList = "user_id, created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ArchiveRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false, length = 2048)
  private String url;

  @Column(columnDefinition = "TEXT")
  private String title;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Column(columnDefinition = "TEXT")
  private String textContent;

  @Column(columnDefinition = "TEXT")
  private String markdownContent;

  private Integer wordCount;

  /** Estimated reading time in minutes. */
  private Integer readingTime;

  /** Which extraction strategy produced the content, e.g. "fetch" or "firecrawl". */
  private String extractionMethod;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> tags = new ArrayList<>();

  /** When the page was saved in the source list, if the import carried it. */
  private Instant timeAdded;

  /** Number of chunks the content was split into. */
  private Integer chunkCount;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }
}
