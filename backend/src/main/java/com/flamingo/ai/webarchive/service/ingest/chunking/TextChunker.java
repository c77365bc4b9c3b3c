package com.flamingo.ai.webarchive.service.ingest.chunking;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Splits document text into overlapping chunks, preferring to cut at a paragraph break, a
 * sentence end or a line break.
 *
 * <p>A boundary is only used when it lies at or past the middle of the window, so chunks never
 * shrink below half the configured size except at the end of the text. Indices are contiguous
 * from 0.
 */
@Component
@RequiredArgsConstructor
public class TextChunker {

  private final ArchiveConfig archiveConfig;

  /** Chunks with the configured size and overlap. */
  public List<TextChunk> chunk(String text) {
    ArchiveConfig.Chunking chunking = archiveConfig.getChunking();
    return chunk(text, chunking.getSize(), chunking.getOverlap());
  }

  public List<TextChunk> chunk(String text, int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    List<TextChunk> chunks = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return chunks;
    }

    int length = text.length();
    int position = 0;
    while (position < length) {
      int end = Math.min(position + chunkSize, length);
      if (end < length) {
        int breakPoint =
            Math.max(
                text.lastIndexOf("\n\n", end),
                Math.max(text.lastIndexOf(". ", end), text.lastIndexOf('\n', end)));
        if (breakPoint >= position + chunkSize / 2.0) {
          end = breakPoint + 1;
        }
      }

      String content = text.substring(position, end).trim();
      if (!content.isEmpty()) {
        chunks.add(new TextChunk(content, chunks.size()));
      }
      if (end >= length) {
        break;
      }

      int next = end - Math.max(overlap, 0);
      // overlap >= chunk length would stall or rewind
      position = next > position ? next : end;
    }
    return chunks;
  }
}
