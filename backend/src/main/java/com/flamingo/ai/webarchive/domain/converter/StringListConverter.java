package com.flamingo.ai.webarchive.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** Stores tag lists as a JSON array in a TEXT column. */
@Converter
@Slf4j
public class StringListConverter implements AttributeConverter<List<String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<String> tags) {
    if (tags == null || tags.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(tags);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize tags " + tags, e);
    }
  }

  @Override
  public List<String> convertToEntityAttribute(String column) {
    if (column == null || column.isBlank()) {
      return new ArrayList<>();
    }
    try {
      return MAPPER.readValue(column, LIST_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Ignoring unreadable tag column '{}': {}", column, e.getOriginalMessage());
      return new ArrayList<>();
    }
  }
}
