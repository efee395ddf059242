package com.flamingo.ai.foodscout.service.followup;

import com.flamingo.ai.foodscout.agent.FollowUpInterpretationAgent;
import com.flamingo.ai.foodscout.agent.dto.FollowUpInterpretation;
import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.model.ConversationContext;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Asks the text-understanding collaborator what an unrecognised follow-up means. */
@Service
@RequiredArgsConstructor
@Slf4j
public class FollowUpInterpreter {

  private static final int MAX_LISTED_SHOPS = 20;

  private final FollowUpInterpretationAgent agent;
  private final ScoutConfig scoutConfig;
  private final MeterRegistry meterRegistry;

  /** Returns empty when the collaborator is unavailable or answered nothing. */
  @Timed(value = "scout.followup.interpret", description = "Time to interpret a follow-up")
  @CircuitBreaker(name = "llm", fallbackMethod = "interpretFallback")
  public Optional<FollowUpInterpretation> interpret(String text, ConversationContext context) {
    try {
      String history = context.transcript(scoutConfig.getMemory().getHistoryWindow());
      FollowUpInterpretation interpretation = agent.interpret(history, shopList(context), text);
      return Optional.ofNullable(interpretation);
    } catch (Exception e) {
      meterRegistry.counter("scout.followup.interpret.errors").increment();
      log.warn("Follow-up interpretation failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<FollowUpInterpretation> interpretFallback(
      String text, ConversationContext context, Throwable t) {
    log.warn("Follow-up interpretation unavailable: {}", t.getMessage());
    return Optional.empty();
  }

  private String shopList(ConversationContext context) {
    List<RestaurantRecommendation> shops = context.all();
    if (shops.isEmpty()) {
      return "(no shops)";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < Math.min(shops.size(), MAX_LISTED_SHOPS); i++) {
      RestaurantRecommendation shop = shops.get(i);
      List<String> features =
          shop.getFeatures().subList(0, Math.min(3, shop.getFeatures().size()));
      sb.append(i + 1)
          .append(". ")
          .append(shop.getName())
          .append(" | ")
          .append(shop.getLocation())
          .append(" | ")
          .append(String.join("; ", features))
          .append("\n");
    }
    return sb.toString();
  }
}
