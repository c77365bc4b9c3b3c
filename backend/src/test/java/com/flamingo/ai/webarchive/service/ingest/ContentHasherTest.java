package com.flamingo.ai.webarchive.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContentHasherTest {

  private final ContentHasher contentHasher = new ContentHasher();

  @Test
  @DisplayName("should produce a stable 64-character hex digest")
  void shouldProduceStableHexDigest() {
    String first = contentHasher.hash("https://example.com/a", "some text");
    String second = contentHasher.hash("https://example.com/a", "some text");

    assertThat(first).isEqualTo(second).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  @DisplayName("should hash the url and the text together")
  void shouldDependOnUrlAndText() {
    String base = contentHasher.hash("https://example.com/a", "some text");

    assertThat(contentHasher.hash("https://example.com/b", "some text")).isNotEqualTo(base);
    assertThat(contentHasher.hash("https://example.com/a", "other text")).isNotEqualTo(base);
  }

  @Test
  @DisplayName("should match the SHA-256 of url colon text")
  void shouldMatchKnownDigest() {
    assertThat(contentHasher.hash("a", "b"))
        .isEqualTo("6783a31eabf68ccc0660f935c0826282bdd2241f3a80a9f2d10d59aea9ebb5d8");
  }
}
