package com.flamingo.ai.foodscout.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import jakarta.persistence.Converter;

/** Persists the intent a turn searched with; null for follow-ups that did not search. */
@Converter
public class SearchIntentConverter extends JsonAttributeConverter<SearchIntent> {

  public SearchIntentConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected SearchIntent emptyValue() {
    return null;
  }
}
