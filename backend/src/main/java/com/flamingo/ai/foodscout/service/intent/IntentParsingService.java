package com.flamingo.ai.foodscout.service.intent;

import com.flamingo.ai.foodscout.agent.IntentParserAgent;
import com.flamingo.ai.foodscout.agent.dto.ParsedIntent;
import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.model.ConversationContext;
import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a request into a {@link SearchIntent}. A request without a location, or one the
 * collaborator could not read, yields clarification questions instead of an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentParsingService {

  static final List<String> DEFAULT_QUESTIONS =
      List.of(
          "Which city or neighbourhood should I search in?",
          "What kind of food are you in the mood for?");

  private final IntentParserAgent agent;
  private final ScoutConfig scoutConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "scout.intent.parse", description = "Time to parse a search intent")
  @CircuitBreaker(name = "llm", fallbackMethod = "parseFallback")
  public IntentParseOutcome parse(String text, ConversationContext context) {
    String history = context.transcript(scoutConfig.getMemory().getHistoryWindow());
    ParsedIntent parsed;
    try {
      parsed = agent.parse(history, text);
    } catch (Exception e) {
      meterRegistry.counter("scout.intent.errors").increment();
      log.warn("Intent parsing failed, asking for clarification: {}", e.getMessage());
      return IntentParseOutcome.clarify(DEFAULT_QUESTIONS);
    }

    if (parsed == null || parsed.location() == null || parsed.location().isBlank()) {
      meterRegistry.counter("scout.intent.clarifications").increment();
      List<String> questions =
          parsed != null && parsed.questions() != null && !parsed.questions().isEmpty()
              ? parsed.questions()
              : DEFAULT_QUESTIONS;
      return IntentParseOutcome.clarify(questions);
    }

    SearchIntent intent =
        new SearchIntent(
                parsed.location(),
                parsed.foodType(),
                parsed.requirements(),
                parsed.excludeKeywords())
            .withExcluded(context.getExcludedShops());
    log.info(
        "Parsed intent: location={}, foodType={}, excludes={}",
        intent.location(),
        intent.foodType(),
        intent.excludeKeywords().size());
    return IntentParseOutcome.ready(intent);
  }

  private IntentParseOutcome parseFallback(String text, ConversationContext context, Throwable t) {
    log.warn("Intent parsing unavailable: {}", t.getMessage());
    return IntentParseOutcome.clarify(DEFAULT_QUESTIONS);
  }
}
