package com.flamingo.ai.webarchive.domain.converter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FloatListConverterTest {

  private final FloatListConverter converter = new FloatListConverter();

  @Test
  @DisplayName("should store a missing vector as NULL")
  void shouldStoreMissingVectorAsNull() {
    assertThat(converter.convertToDatabaseColumn(null)).isNull();
    assertThat(converter.convertToDatabaseColumn(List.of())).isNull();
    assertThat(converter.convertToEntityAttribute(null)).isNull();
  }

  @Test
  @DisplayName("should read a stored vector back")
  void shouldReadStoredVector() {
    String column = converter.convertToDatabaseColumn(List.of(0.5f, -1.25f));

    assertThat(column).isEqualTo("[0.5,-1.25]");
    assertThat(converter.convertToEntityAttribute(column)).containsExactly(0.5f, -1.25f);
  }

  @Test
  @DisplayName("should treat an unreadable column as no vector")
  void shouldIgnoreUnreadableColumn() {
    assertThat(converter.convertToEntityAttribute("not json")).isNull();
  }
}
