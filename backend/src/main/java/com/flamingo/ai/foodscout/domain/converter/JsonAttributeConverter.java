package com.flamingo.ai.foodscout.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import lombok.extern.slf4j.Slf4j;

/**
 * Base JPA converter storing a value as JSON in a TEXT column. Unreadable column data converts to
 * {@link #emptyValue()} so one corrupt row never blocks recovery of a session.
 */
@Slf4j
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

  static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final TypeReference<T> type;

  protected JsonAttributeConverter(TypeReference<T> type) {
    this.type = type;
  }

  /** Value used for null columns and unreadable data. */
  protected abstract T emptyValue();

  @Override
  public String convertToDatabaseColumn(T attribute) {
    if (attribute == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize {}: {}", type.getType(), e.getMessage());
      return null;
    }
  }

  @Override
  public T convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return emptyValue();
    }
    try {
      return MAPPER.readValue(dbData, type);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize {}: {}", type.getType(), e.getMessage());
      return emptyValue();
    }
  }
}
