package com.flamingo.ai.webarchive.service.ingest.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.webarchive.config.ArchiveConfig;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TextChunkerTest {

  private TextChunker textChunker;

  @BeforeEach
  void setUp() {
    textChunker = new TextChunker(new ArchiveConfig());
  }

  @Nested
  @DisplayName("boundaries")
  class BoundaryTests {

    @Test
    @DisplayName("should cut at sentence ends in the second half of the window")
    void shouldCutAtSentenceEnds() {
      String text = "First sentence here. Second sentence follows. Third one ends it.";

      List<TextChunk> chunks = textChunker.chunk(text, 30, 0);

      assertThat(chunks)
          .extracting(TextChunk::content)
          .containsExactly(
              "First sentence here.", "Second sentence follows.", "Third one ends it.");
    }

    @Test
    @DisplayName("should accept a break exactly half way through the window")
    void shouldCutAtHalfWindowBreak() {
      List<TextChunk> chunks = textChunker.chunk("Aaaaa bbbb. Cccc dddd eeee ffff.", 20, 0);

      assertThat(chunks.get(0).content()).isEqualTo("Aaaaa bbbb.");
    }

    @Test
    @DisplayName("should cut after a paragraph break and carry the overlap")
    void shouldCutAtParagraphBreak() {
      List<TextChunk> chunks = textChunker.chunk("Paragraph one.\n\nParagraph two.", 20, 5);

      assertThat(chunks)
          .extracting(TextChunk::content)
          .containsExactly("Paragraph one.", "ne.\n\nParagraph two.");
    }

    @Test
    @DisplayName("should return a single chunk for text shorter than the window")
    void shouldReturnSingleChunkForShortText() {
      List<TextChunk> chunks = textChunker.chunk("  short text  ", 1500, 300);

      assertThat(chunks).containsExactly(new TextChunk("short text", 0));
    }
  }

  @Nested
  @DisplayName("termination")
  class TerminationTests {

    @Test
    @DisplayName("should terminate when overlap equals chunk size")
    void shouldTerminateWhenOverlapEqualsSize() {
      List<TextChunk> chunks = textChunker.chunk("a".repeat(100), 1, 1);

      assertThat(chunks).hasSize(100);
    }

    @Test
    @DisplayName("should terminate when overlap exceeds chunk size")
    void shouldTerminateWhenOverlapExceedsSize() {
      List<TextChunk> chunks = textChunker.chunk("x".repeat(50), 20, 25);

      assertThat(chunks).extracting(c -> c.content().length()).containsExactly(20, 20, 10);
    }

    @Test
    @DisplayName("should number chunks contiguously from zero")
    void shouldNumberChunksContiguously() {
      String text = "Lorem ipsum dolor sit amet. ".repeat(400);

      List<TextChunk> chunks = textChunker.chunk(text);

      assertThat(chunks).hasSizeGreaterThan(1);
      assertThat(chunks)
          .extracting(TextChunk::index)
          .containsExactlyElementsOf(IntStream.range(0, chunks.size()).boxed().toList());
    }
  }

  @Test
  @DisplayName("should return nothing for null or empty text")
  void shouldReturnNothingForEmptyText() {
    assertThat(textChunker.chunk(null)).isEmpty();
    assertThat(textChunker.chunk("")).isEmpty();
  }

  @Test
  @DisplayName("should reject a non-positive chunk size")
  void shouldRejectNonPositiveSize() {
    assertThatThrownBy(() -> textChunker.chunk("text", 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
