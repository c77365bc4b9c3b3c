package com.flamingo.ai.webarchive.elasticsearch;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One searchable chunk of one user's archive.
 *
 * <p>Text and vector come from the shared content chunk; archive metadata is denormalized so that a
 * hit can be grouped and displayed without a database round trip.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveChunkDocument {

  private String id;
  private UUID userId;
  private UUID archiveId;
  private UUID contentId;
  private String url;
  private String title;
  @Builder.Default private List<String> tags = List.of();
  private int chunkIndex;
  private String content;

  /** Null for chunks stored without a vector. */
  private List<Float> embedding;

  /** Score of the hit that returned this document; only set on search results. */
  @Builder.Default private Double relevanceScore = 0.0;

  public static String documentIdFor(UUID archiveId, int chunkIndex) {
    return archiveId + "_" + chunkIndex;
  }
}
