package com.flamingo.ai.foodscout.service.followup;

import com.flamingo.ai.foodscout.agent.dto.FollowUpInterpretation;
import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import com.flamingo.ai.foodscout.domain.model.ConversationContext;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.domain.model.ShopNames;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies a conversation turn. Keyword rules are tried first, in a fixed order, and the first
 * match wins; only input no rule recognises reaches the collaborator. Given the same text and
 * context, a rule match always yields the same decision.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FollowUpClassifier {

  private static final int SHORT_INPUT_LENGTH = 20;

  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s.!?。！？,，~～]+$");

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  private static final List<Rule> RULES =
      List.of(
          new Rule(
              FollowUpType.EXCLUDE_FILTER,
              "^(?:please\\s+)?(?:exclude|remove|drop|skip|hide|no more|not interested in"
                  + "|don't show|do not show|i don't want)\\s+(?<target>.+)$"),
          new Rule(
              FollowUpType.EXCLUDE_FILTER, "^(?:排除|去掉|不要|不去|删掉|别推荐)\\s*(?<target>.+)$"),
          new Rule(
              FollowUpType.CATEGORY_FILTER,
              "^(?:show me\\s+)?(?:only|just)\\s+(?!(?:in|near|around|close to|nearby)\\b)"
                  + "(?<target>.+?)(?:\\s+(?:places|shops|ones|restaurants|please))?$"),
          new Rule(
              FollowUpType.CATEGORY_FILTER,
              "^(?:只看|只要|只想吃)(?!.*(?:附近|周边|那边|这边))(?<target>.+)$"),
          new Rule(
              FollowUpType.LOCATION_FILTER,
              "^(?:(?:show me\\s+)?(?:only|just)\\s+)?(?:in|near|around|close to|nearby)\\s+"
                  + "(?<target>.+)$"),
          new Rule(
              FollowUpType.LOCATION_FILTER,
              "^(?:只看|限定|就在)?(?<target>.+?)(?:附近|周边|那边|这边)(?:的)?(?:店|呢|吧)?$"),
          new Rule(
              FollowUpType.EXPAND,
              "^(?:(?:show|find|give|get)\\s+(?:me\\s+)?)?(?:some\\s+|any\\s+)?more"
                  + "(?:\\s+(?:options|places|shops|restaurants|results))?"
                  + "(?:\\s+please)?(?<target>)$"),
          new Rule(FollowUpType.EXPAND, "^(?:anything|something|somewhere) else(?<target>)$"),
          new Rule(
              FollowUpType.EXPAND, "^(?:再找|再来|再推荐|还有吗|还有别的|更多|换一批|多找)(?<target>.*)$"),
          new Rule(
              FollowUpType.DETAIL,
              "^(?:tell me (?:more )?about|what about|how about|details? (?:on|about|of|for)"
                  + "|more (?:info|details) (?:on|about)|describe)\\s+(?<target>.+)$"),
          new Rule(FollowUpType.DETAIL, "^(?:介绍一下|详细说说|说说|讲讲)\\s*(?<target>.+)$"),
          new Rule(FollowUpType.DETAIL, "^(?<target>.+?)(?:怎么样|如何|好吃吗|在哪)$"),
          new Rule(
              FollowUpType.CONFIRM,
              "^(?:which (?:one )?(?:is (?:the )?best|should i (?:go to|pick|choose))|which one"
                  + "|pick (?:one|for me)|recommend (?:just )?one|decide for me|your top pick"
                  + "|the best one)(?<target>).*$"),
          new Rule(
              FollowUpType.CONFIRM, "^(?:哪家最好|哪个最好|选一家|推荐一家|最推荐哪家|就去哪家)(?<target>).*$"));

  private final FollowUpInterpreter interpreter;
  private final MeterRegistry meterRegistry;

  public FollowUpDecision classify(String text, ConversationContext context) {
    if (context.getTurnCount() == 0 || !context.hasRecommendations()) {
      return record(FollowUpDecision.newSearch("initial"));
    }

    String input = TRAILING_PUNCTUATION.matcher(text == null ? "" : text.strip()).replaceAll("");

    for (Rule rule : RULES) {
      Matcher matcher = rule.pattern().matcher(input);
      if (matcher.matches()) {
        return record(FollowUpDecision.rule(rule.type(), cleanTarget(matcher.group("target"))));
      }
    }

    Optional<String> knownShop = shortShopReference(input, context);
    if (knownShop.isPresent()) {
      return record(
          new FollowUpDecision(FollowUpType.DETAIL, knownShop.get(), List.of(), null, "name"));
    }

    Optional<FollowUpInterpretation> interpretation = interpreter.interpret(input, context);
    if (interpretation.isEmpty()) {
      return record(
          new FollowUpDecision(
              FollowUpType.CATEGORY_FILTER,
              null,
              List.of(),
              "I couldn't quite follow that, so here is the current list.",
              "collaborator"));
    }
    if (interpretation.get().newSearch()) {
      return record(FollowUpDecision.newSearch("collaborator"));
    }
    return record(
        new FollowUpDecision(
            FollowUpType.CATEGORY_FILTER,
            null,
            interpretation.get().shops(),
            interpretation.get().response(),
            "collaborator"));
  }

  /** A short input naming part of a known shop is a detail request about that shop. */
  private Optional<String> shortShopReference(String input, ConversationContext context) {
    int length = input.codePointCount(0, input.length());
    if (length < 2 || length >= SHORT_INPUT_LENGTH) {
      return Optional.empty();
    }
    for (RestaurantRecommendation shop : context.all()) {
      if (ShopNames.looselyMatches(shop.getName(), input)) {
        return Optional.of(shop.getName());
      }
    }
    return Optional.empty();
  }

  private FollowUpDecision record(FollowUpDecision decision) {
    meterRegistry
        .counter(
            "scout.followup.classified", "type", decision.type().name(), "tier", decision.tier())
        .increment();
    log.debug("Turn classified as {} by {} tier", decision.type(), decision.tier());
    return decision;
  }

  private static String cleanTarget(String target) {
    if (target == null) {
      return null;
    }
    String cleaned = target.strip().replaceAll("^[\"'“”‘’]+|[\"'“”‘’]+$", "").strip();
    return cleaned.isEmpty() ? null : cleaned;
  }

  private record Rule(FollowUpType type, Pattern pattern) {

    private Rule(FollowUpType type, String regex) {
      this(type, Pattern.compile(regex, FLAGS));
    }
  }
}
