package com.flamingo.ai.foodscout.domain.converter;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.foodscout.domain.enums.ShopVerdict;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import com.flamingo.ai.foodscout.domain.model.ShopAssessment;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonAttributeConverterTest {

  @Test
  void shouldRestoreRecommendationSnapshot_withAssessmentAndFilterState() {
    // Given
    RecommendationListConverter converter = new RecommendationListConverter();
    RestaurantRecommendation shop =
        RestaurantRecommendation.builder()
            .name("Old Noodle House")
            .confidence(0.63)
            .sourceDocumentIds(List.of("d1"))
            .assessment(
                new ShopAssessment(
                    ShopVerdict.LIKELY_GENUINE, 0.9, List.of("2 local comments"), true))
            .build();
    shop.markFiltered("Excluded by user");

    // When
    List<RestaurantRecommendation> restored =
        converter.convertToEntityAttribute(converter.convertToDatabaseColumn(List.of(shop)));

    // Then
    assertThat(restored).hasSize(1);
    RestaurantRecommendation copy = restored.get(0);
    assertThat(copy.getName()).isEqualTo("Old Noodle House");
    assertThat(copy.isRecommended()).isFalse();
    assertThat(copy.getFilterReason()).isEqualTo("Excluded by user");
    assertThat(copy.getAssessment().verdict()).isEqualTo(ShopVerdict.LIKELY_GENUINE);
    assertThat(copy.getAssessment().localMentions()).isTrue();
  }

  @Test
  void shouldReturnEmptyValue_forCorruptOrMissingColumns() {
    assertThat(new RecommendationListConverter().convertToEntityAttribute("[{not json"))
        .isEmpty();
    assertThat(new StringListConverter().convertToEntityAttribute(null)).isEmpty();
    assertThat(new SearchIntentConverter().convertToEntityAttribute("{\"location\":")).isNull();
  }

  @Test
  void shouldRestoreIntent() {
    SearchIntentConverter converter = new SearchIntentConverter();
    SearchIntent intent =
        new SearchIntent("Alpha City", "noodles", List.of("open late"), List.of("chain"));

    assertThat(converter.convertToEntityAttribute(converter.convertToDatabaseColumn(intent)))
        .isEqualTo(intent);
  }
}
