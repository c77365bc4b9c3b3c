package com.flamingo.ai.webarchive.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores an embedding vector as a JSON array. A null or empty vector is stored as NULL so "no
 * embedding" stays distinguishable in queries.
 */
@Converter
@Slf4j
public class FloatListConverter implements AttributeConverter<List<Float>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<Float>> VECTOR_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<Float> vector) {
    if (vector == null || vector.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(vector);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize embedding vector", e);
    }
  }

  @Override
  public List<Float> convertToEntityAttribute(String column) {
    if (column == null || column.isBlank()) {
      return null;
    }
    try {
      return MAPPER.readValue(column, VECTOR_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Stored embedding is unreadable, treating chunk as vector-less: {}", e.getMessage());
      return null;
    }
  }
}
