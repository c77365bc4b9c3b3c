package com.flamingo.ai.webarchive.domain.entity;

import com.flamingo.ai.webarchive.domain.converter.FloatListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A chunk of archived content shared by every user who archived the same page content.
 *
 * <p>Identity is (contentHash, chunkIndex). The embedding is null when no provider was available
 * when the chunk was first stored; such chunks are only reachable through keyword search.
 */
@Entity
@Table(
    name = "content_embeddings",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_content_hash_index",
            columnNames = {"content_hash", "chunk_index"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContentChunk {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "content_hash", nullable = false, length = 64)
  private String contentHash;

  @Column(name = "chunk_index", nullable = false)
  private Integer chunkIndex;

  @Column(length = 2048)
  private String sourceUrl;

  @Column(columnDefinition = "TEXT")
  private String title;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String chunkText;

  @Convert(converter = FloatListConverter.class)
  @Column(columnDefinition = "TEXT")
  private List<Float> embedding;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }
}
