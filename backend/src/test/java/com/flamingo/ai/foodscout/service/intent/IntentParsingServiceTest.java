package com.flamingo.ai.foodscout.service.intent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.foodscout.agent.IntentParserAgent;
import com.flamingo.ai.foodscout.agent.dto.ParsedIntent;
import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.enums.MessageRole;
import com.flamingo.ai.foodscout.domain.model.ConversationContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IntentParsingServiceTest {

  @Mock private IntentParserAgent agent;

  private SimpleMeterRegistry meterRegistry;
  private IntentParsingService service;
  private ConversationContext context;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service = new IntentParsingService(agent, new ScoutConfig(), meterRegistry);
    context = new ConversationContext();
  }

  @Test
  void shouldBuildIntent_andCarryExcludedShopsAsKeywords() {
    // Given
    context.exclude("Shop B");
    when(agent.parse(anyString(), eq("spicy noodles in Alpha City, no chains")))
        .thenReturn(
            new ParsedIntent(
                false,
                List.of(),
                " Alpha City ",
                "noodles",
                List.of("spicy"),
                List.of("chain")));

    // When
    IntentParseOutcome outcome = service.parse("spicy noodles in Alpha City, no chains", context);

    // Then
    assertThat(outcome.needsClarification()).isFalse();
    assertThat(outcome.intent().location()).isEqualTo("Alpha City");
    assertThat(outcome.intent().foodType()).isEqualTo("noodles");
    assertThat(outcome.intent().requirements()).containsExactly("spicy");
    assertThat(outcome.intent().excludeKeywords()).containsExactly("chain", "Shop B");
  }

  @Test
  void shouldAskQuestions_whenLocationMissing() {
    // Given
    when(agent.parse(anyString(), anyString()))
        .thenReturn(
            new ParsedIntent(true, List.of("Which district?"), null, "noodles", null, null));

    // When
    IntentParseOutcome outcome = service.parse("some noodles", context);

    // Then
    assertThat(outcome.needsClarification()).isTrue();
    assertThat(outcome.questions()).containsExactly("Which district?");
    assertThat(meterRegistry.counter("scout.intent.clarifications").count()).isEqualTo(1.0);
  }

  @Test
  void shouldFallBackToDefaultQuestions_whenAgentFails() {
    // Given
    when(agent.parse(anyString(), anyString())).thenThrow(new RuntimeException("rate limited"));

    // When
    IntentParseOutcome outcome = service.parse("noodles", context);

    // Then
    assertThat(outcome.questions()).isEqualTo(IntentParsingService.DEFAULT_QUESTIONS);
    assertThat(meterRegistry.counter("scout.intent.errors").count()).isEqualTo(1.0);
  }

  @Test
  void shouldPassRecentHistory_toAgent() {
    // Given
    context.addMessage(MessageRole.USER, "noodles in Alpha City");
    context.addMessage(MessageRole.ASSISTANT, "Found 3 places");
    when(agent.parse(anyString(), anyString()))
        .thenReturn(new ParsedIntent(false, null, "Beta Town", "barbecue", null, null));

    // When
    service.parse("barbecue in Beta Town instead", context);

    // Then
    verify(agent)
        .parse(contains("USER: noodles in Alpha City"), eq("barbecue in Beta Town instead"));
  }
}
