package com.flamingo.ai.foodscout.service.followup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.foodscout.agent.dto.FollowUpInterpretation;
import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import com.flamingo.ai.foodscout.domain.model.ConversationContext;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FollowUpClassifierTest {

  @Mock private FollowUpInterpreter interpreter;

  private SimpleMeterRegistry meterRegistry;
  private FollowUpClassifier classifier;
  private ConversationContext context;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    classifier = new FollowUpClassifier(interpreter, meterRegistry);

    context = new ConversationContext();
    context.setLastIntent(SearchIntent.of("Alpha City", "noodles"));
    context.replaceRecommendations(
        List.of(shop("Old Noodle House"), shop("Spicy Corner"), shop("Riverside Dumplings")));
    context.setTurnCount(1);
  }

  @Test
  void shouldStartNewSearch_onFirstTurn() {
    // Given
    ConversationContext fresh = new ConversationContext();

    // When
    FollowUpDecision decision = classifier.classify("exclude Old Noodle House", fresh);

    // Then
    assertThat(decision.type()).isEqualTo(FollowUpType.NEW_SEARCH);
    assertThat(decision.tier()).isEqualTo("initial");
    verifyNoInteractions(interpreter);
  }

  @ParameterizedTest
  @CsvSource({
    "'exclude Old Noodle House', EXCLUDE_FILTER, Old Noodle House",
    "'please remove \"Spicy Corner\"', EXCLUDE_FILTER, Spicy Corner",
    "排除老面馆, EXCLUDE_FILTER, 老面馆",
    "'only spicy ones', CATEGORY_FILTER, spicy",
    "'just dumplings please', CATEGORY_FILTER, dumplings",
    "只看面馆, CATEGORY_FILTER, 面馆",
    "'only near the station', LOCATION_FILTER, the station",
    "'around the old town', LOCATION_FILTER, the old town",
    "人民广场附近的, LOCATION_FILTER, 人民广场",
    "'tell me about Riverside Dumplings', DETAIL, Riverside Dumplings",
    "老面馆怎么样, DETAIL, 老面馆"
  })
  void shouldClassifyByRule_withTarget(String text, FollowUpType type, String target) {
    // When
    FollowUpDecision decision = classifier.classify(text, context);

    // Then
    assertThat(decision.type()).isEqualTo(type);
    assertThat(decision.target()).isEqualTo(target);
    assertThat(decision.tier()).isEqualTo("rule");
    verifyNoInteractions(interpreter);
  }

  @ParameterizedTest
  @CsvSource({
    "more, EXPAND",
    "'show me more options!', EXPAND",
    "anything else?, EXPAND",
    "换一批, EXPAND",
    "'which one is best?', CONFIRM",
    "'pick one for me', CONFIRM",
    "哪家最好, CONFIRM"
  })
  void shouldClassifyByRule_withoutTarget(String text, FollowUpType type) {
    // When
    FollowUpDecision decision = classifier.classify(text, context);

    // Then
    assertThat(decision.type()).isEqualTo(type);
    assertThat(decision.hasTarget()).isFalse();
    verifyNoInteractions(interpreter);
  }

  @Test
  void shouldReturnSameDecision_whenCalledTwiceWithSameInput() {
    FollowUpDecision first = classifier.classify("only spicy ones", context);
    FollowUpDecision second = classifier.classify("only spicy ones", context);

    assertThat(second).isEqualTo(first);
    verifyNoInteractions(interpreter);
  }

  @Test
  void shouldTreatShortKnownShopName_asDetail() {
    // When
    FollowUpDecision decision = classifier.classify("noodle house", context);

    // Then
    assertThat(decision.type()).isEqualTo(FollowUpType.DETAIL);
    assertThat(decision.target()).isEqualTo("Old Noodle House");
    assertThat(decision.tier()).isEqualTo("name");
    verifyNoInteractions(interpreter);
  }

  @Test
  void shouldUseCollaboratorSelection_whenNoRuleMatches() {
    // Given
    String text = "somewhere quiet for a date with my partner";
    when(interpreter.interpret(anyString(), any()))
        .thenReturn(
            Optional.of(
                new FollowUpInterpretation(false, List.of("Riverside Dumplings"), "Calm spot.")));

    // When
    FollowUpDecision decision = classifier.classify(text, context);

    // Then
    assertThat(decision.type()).isEqualTo(FollowUpType.CATEGORY_FILTER);
    assertThat(decision.selectedShops()).containsExactly("Riverside Dumplings");
    assertThat(decision.response()).isEqualTo("Calm spot.");
    assertThat(decision.tier()).isEqualTo("collaborator");
    verify(interpreter).interpret(text, context);
  }

  @Test
  void shouldStartNewSearch_whenCollaboratorAsksForIt() {
    // Given
    when(interpreter.interpret(anyString(), any()))
        .thenReturn(Optional.of(new FollowUpInterpretation(true, List.of(), null)));

    // When
    FollowUpDecision decision =
        classifier.classify("I would rather have barbecue in Beta Town", context);

    // Then
    assertThat(decision.type()).isEqualTo(FollowUpType.NEW_SEARCH);
    assertThat(decision.tier()).isEqualTo("collaborator");
  }

  @Test
  void shouldKeepCurrentList_whenCollaboratorUnavailable() {
    // Given
    when(interpreter.interpret(anyString(), any())).thenReturn(Optional.empty());

    // When
    FollowUpDecision decision =
        classifier.classify("hmm not sure what I feel like tonight honestly", context);

    // Then
    assertThat(decision.type()).isEqualTo(FollowUpType.CATEGORY_FILTER);
    assertThat(decision.selectedShops()).isEmpty();
    assertThat(decision.hasTarget()).isFalse();
    assertThat(decision.response()).contains("current list");
  }

  @Test
  void shouldCountClassifications_byTypeAndTier() {
    classifier.classify("more", context);

    assertThat(
            meterRegistry
                .counter("scout.followup.classified", "type", "EXPAND", "tier", "rule")
                .count())
        .isEqualTo(1.0);
  }

  private static RestaurantRecommendation shop(String name) {
    return RestaurantRecommendation.builder().name(name).confidence(0.7).build();
  }
}
