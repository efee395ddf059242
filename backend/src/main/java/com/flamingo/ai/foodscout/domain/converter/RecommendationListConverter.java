package com.flamingo.ai.foodscout.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/** Persists a turn's recommendation snapshot as a JSON array. */
@Converter
public class RecommendationListConverter
    extends JsonAttributeConverter<List<RestaurantRecommendation>> {

  public RecommendationListConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected List<RestaurantRecommendation> emptyValue() {
    return new ArrayList<>();
  }
}
