package com.flamingo.ai.webarchive.service.search;

import java.util.List;
import java.util.UUID;

/** One fused chunk-level hit. {@code score} is normalized to 0..1. */
public record SearchHit(
    UUID archiveId,
    UUID contentId,
    String url,
    String title,
    List<String> tags,
    int chunkIndex,
    String content,
    double score,
    MatchType matchType) {}
