package com.flamingo.ai.foodscout.service.search;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import com.flamingo.ai.foodscout.domain.enums.SearchStep;
import com.flamingo.ai.foodscout.domain.enums.ShopVerdict;
import com.flamingo.ai.foodscout.domain.model.ConversationContext;
import com.flamingo.ai.foodscout.domain.model.RecommendationSet;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import com.flamingo.ai.foodscout.domain.model.ShopNames;
import com.flamingo.ai.foodscout.domain.model.SourceDocument;
import com.flamingo.ai.foodscout.service.followup.FollowUpDecision;
import com.flamingo.ai.foodscout.service.source.DocumentSource;
import com.flamingo.ai.foodscout.service.source.SourceSearchResult;
import com.flamingo.ai.foodscout.service.stream.SearchEventEmitter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs fresh searches through the four evidence-gathering phases and applies follow-ups to the
 * results already held in the conversation.
 *
 * <p>Phases run in order, since verification reads the titles found by the first two; queries
 * within a phase run concurrently. Each query has its own timeout and degrades to an empty result
 * on failure. Documents are deduplicated by source id across the whole run.
 */
@Service
@Slf4j
public class SearchOrchestrator {

  private static final List<SearchStep> SEARCH_PHASES =
      List.of(SearchStep.BROAD, SearchStep.HIDDEN, SearchStep.VERIFY, SearchStep.CATEGORY);

  private final DocumentSource documentSource;
  private final QueryPlanner queryPlanner;
  private final DocumentAnalysisService analysisService;
  private final RecommendationMerger merger;
  private final ScoutConfig scoutConfig;
  private final MeterRegistry meterRegistry;

  private final Map<FollowUpType, FollowUpHandler> handlers = new EnumMap<>(FollowUpType.class);

  public SearchOrchestrator(
      DocumentSource documentSource,
      QueryPlanner queryPlanner,
      DocumentAnalysisService analysisService,
      RecommendationMerger merger,
      ScoutConfig scoutConfig,
      MeterRegistry meterRegistry) {
    this.documentSource = documentSource;
    this.queryPlanner = queryPlanner;
    this.analysisService = analysisService;
    this.merger = merger;
    this.scoutConfig = scoutConfig;
    this.meterRegistry = meterRegistry;

    handlers.put(FollowUpType.CATEGORY_FILTER, this::filterByCategory);
    handlers.put(FollowUpType.LOCATION_FILTER, this::filterByLocation);
    handlers.put(FollowUpType.EXCLUDE_FILTER, this::exclude);
    handlers.put(FollowUpType.EXPAND, this::expand);
    handlers.put(FollowUpType.DETAIL, this::detail);
    handlers.put(FollowUpType.CONFIRM, this::confirm);
  }

  /**
   * Runs all phases for a fresh intent and replaces the conversation's results.
   *
   * @return the ranked set; an empty set with an explanatory summary when nothing was found
   */
  @Timed(value = "scout.search.new", description = "Time to run a fresh multi-phase search")
  public RecommendationSet runNewSearch(
      SearchIntent intent, ConversationContext context, SearchEventEmitter emitter) {
    log.info("Starting search: location={}, foodType={}", intent.location(), intent.foodType());
    List<SourceDocument> documents = gatherEvidence(intent, SEARCH_PHASES, Set.of(), emitter);

    List<String> documentIds = documents.stream().map(SourceDocument::id).toList();
    context.resetSearch(intent, documentIds);

    if (documents.isEmpty()) {
      context.replaceRecommendations(List.of());
      return new RecommendationSet(
          FollowUpType.NEW_SEARCH,
          List.of(),
          List.of(),
          "No posts found about food in " + intent.location() + ". Try a broader area.",
          List.of(),
          0);
    }

    MergeResult merged = analyse(documents, intent, context.getExcludedShops(), emitter);
    context.replaceRecommendations(merged.all());

    log.info(
        "Search finished: {} documents, {} recommended, {} filtered",
        documents.size(),
        merged.recommended().size(),
        merged.filtered().size());
    return new RecommendationSet(
        FollowUpType.NEW_SEARCH,
        merged.recommended(),
        merged.filtered(),
        summarize(merged.recommended().size(), documents.size(), intent),
        List.of(),
        documents.size());
  }

  /** Applies a follow-up decision through the handler registered for its type. */
  @Timed(value = "scout.search.followup", description = "Time to apply a follow-up")
  public RecommendationSet handleFollowUp(
      FollowUpDecision decision, ConversationContext context, SearchEventEmitter emitter) {
    FollowUpHandler handler = handlers.get(decision.type());
    if (handler == null) {
      throw new IllegalArgumentException("No follow-up handler for " + decision.type());
    }
    return handler.handle(decision, context, emitter);
  }

  private RecommendationSet filterByCategory(
      FollowUpDecision decision, ConversationContext context, SearchEventEmitter emitter) {
    if (!decision.selectedShops().isEmpty()) {
      List<RestaurantRecommendation> selected = new ArrayList<>();
      for (String name : decision.selectedShops()) {
        for (RestaurantRecommendation shop : context.all()) {
          if (ShopNames.looselyMatches(shop.getName(), name) && !selected.contains(shop)) {
            selected.add(shop);
            break;
          }
        }
      }
      // Answers only; the working set stays as it was.
      return followUpResult(
          FollowUpType.CATEGORY_FILTER,
          selected.isEmpty() ? context.visible() : selected,
          decision.response());
    }

    if (!decision.hasTarget()) {
      String summary =
          decision.response() != null ? decision.response() : "Here is the current list.";
      return followUpResult(FollowUpType.CATEGORY_FILTER, context.visible(), summary);
    }
    return narrow(
        FollowUpType.CATEGORY_FILTER,
        decision.target(),
        context,
        shop -> concat(shop.getName(), shop.getFeatures(), shop.getTags()));
  }

  private RecommendationSet filterByLocation(
      FollowUpDecision decision, ConversationContext context, SearchEventEmitter emitter) {
    if (!decision.hasTarget()) {
      return followUpResult(FollowUpType.LOCATION_FILTER, context.visible(), "Which area?");
    }
    return narrow(
        FollowUpType.LOCATION_FILTER,
        decision.target(),
        context,
        shop ->
            concat(
                (shop.getLocation() == null ? "" : shop.getLocation())
                    + " "
                    + (shop.getAddress() == null ? "" : shop.getAddress()),
                shop.getFeatures(),
                List.of()));
  }

  /**
   * Narrows the working set to every known shop whose text contains the target, best first. The
   * full set is kept, so a later filter can pivot to a different category.
   */
  private RecommendationSet narrow(
      FollowUpType type,
      String target,
      ConversationContext context,
      Function<RestaurantRecommendation, String> text) {
    String needle = target.toLowerCase(Locale.ROOT);
    List<RestaurantRecommendation> matches = new ArrayList<>();
    for (RestaurantRecommendation shop : context.all()) {
      if (text.apply(shop).toLowerCase(Locale.ROOT).contains(needle)) {
        matches.add(shop);
      }
    }

    if (matches.isEmpty()) {
      return followUpResult(
          type,
          context.visible(),
          "Nothing in the current results matches \"" + target + "\"; here is the current list.");
    }

    matches.sort(Comparator.comparingDouble(RestaurantRecommendation::getConfidence).reversed());
    context.scopeTo(matches);
    return followUpResult(
        type, context.visible(), matches.size() + " places match \"" + target + "\".");
  }

  private RecommendationSet exclude(
      FollowUpDecision decision, ConversationContext context, SearchEventEmitter emitter) {
    if (!decision.hasTarget()) {
      return followUpResult(
          FollowUpType.EXCLUDE_FILTER, context.visible(), "Which place should I leave out?");
    }

    List<RestaurantRecommendation> removed = new ArrayList<>();
    for (RestaurantRecommendation shop : context.all()) {
      if (ShopNames.looselyMatches(shop.getName(), decision.target())) {
        removed.add(shop);
      }
    }

    if (removed.isEmpty()) {
      context.exclude(decision.target());
    }
    for (RestaurantRecommendation shop : removed) {
      context.exclude(shop.getName());
      shop.markFiltered("Excluded by user");
    }

    String summary =
        removed.isEmpty()
            ? "\"" + decision.target() + "\" is not in the current list; it will be left out."
            : "Removed "
                + String.join(
                    ", ", removed.stream().map(RestaurantRecommendation::getName).toList())
                + ".";
    return new RecommendationSet(
        FollowUpType.EXCLUDE_FILTER, context.visible(), removed, summary, List.of(), 0);
  }

  /**
   * Searches again with the last intent and adds shops the conversation has not seen. Documents
   * already analysed are skipped, and excluded shops stay excluded.
   */
  private RecommendationSet expand(
      FollowUpDecision decision, ConversationContext context, SearchEventEmitter emitter) {
    SearchIntent intent = context.getLastIntent();
    if (intent == null) {
      return followUpResult(
          FollowUpType.EXPAND, context.visible(), "Tell me where to look first.");
    }

    List<SourceDocument> documents =
        gatherEvidence(
            intent, List.of(SearchStep.EXPAND), Set.copyOf(context.getLastDocumentIds()), emitter);
    if (documents.isEmpty()) {
      return followUpResult(
          FollowUpType.EXPAND,
          context.visible(),
          "No new posts turned up; here is the current list.");
    }

    context.rememberDocuments(documents.stream().map(SourceDocument::id).toList());
    MergeResult merged = analyse(documents, intent, context.getExcludedShops(), emitter);
    List<RestaurantRecommendation> added = context.mergeNew(merged.recommended());

    log.info("Expansion added {} shops from {} documents", added.size(), documents.size());
    return new RecommendationSet(
        FollowUpType.EXPAND,
        context.visible(),
        merged.filtered(),
        added.isEmpty()
            ? "No new places beyond the current list."
            : "Found " + added.size() + " more places.",
        List.of(),
        documents.size());
  }

  private RecommendationSet detail(
      FollowUpDecision decision, ConversationContext context, SearchEventEmitter emitter) {
    if (decision.hasTarget()) {
      for (RestaurantRecommendation shop : context.all()) {
        if (ShopNames.looselyMatches(shop.getName(), decision.target())) {
          return followUpResult(FollowUpType.DETAIL, List.of(shop), explain(shop));
        }
      }
    }
    return followUpResult(
        FollowUpType.DETAIL,
        List.of(),
        "I couldn't find \"" + decision.target() + "\" in the current results.");
  }

  /** Picks the shop with the highest verdict weight times confidence. */
  private RecommendationSet confirm(
      FollowUpDecision decision, ConversationContext context, SearchEventEmitter emitter) {
    RestaurantRecommendation best = null;
    double bestScore = -1;
    for (RestaurantRecommendation shop : context.visible()) {
      double score = confirmScore(shop);
      if (score > bestScore) {
        best = shop;
        bestScore = score;
      }
    }
    if (best == null) {
      return followUpResult(FollowUpType.CONFIRM, List.of(), "There is nothing left to pick from.");
    }
    return followUpResult(FollowUpType.CONFIRM, List.of(best), "My pick: " + explain(best));
  }

  static double confirmScore(RestaurantRecommendation shop) {
    ShopVerdict verdict =
        shop.getAssessment() != null ? shop.getAssessment().verdict() : ShopVerdict.UNKNOWN;
    return verdict.getConfirmWeight() * shop.getConfidence();
  }

  private List<SourceDocument> gatherEvidence(
      SearchIntent intent,
      List<SearchStep> phases,
      Set<String> skipIds,
      SearchEventEmitter emitter) {
    ScoutConfig.Search search = scoutConfig.getSearch();
    Map<String, SourceDocument> pool = new LinkedHashMap<>();

    for (int i = 0; i < phases.size(); i++) {
      SearchStep phase = phases.get(i);
      if (i > 0 && search.isFastMode() && pool.size() >= search.getFastModeThreshold()) {
        log.info("Fast mode: stopping before {} with {} documents", phase, pool.size());
        break;
      }

      List<String> queries = queryPlanner.plan(phase, intent, pool.values());
      if (queries.isEmpty()) {
        log.debug("No queries for {}, skipping", phase);
        continue;
      }

      emitter.stepStarted(phase);
      int before = pool.size();
      for (SourceSearchResult result : runQueries(queries)) {
        for (SourceDocument document : result.documents()) {
          if (!skipIds.contains(document.id())) {
            pool.putIfAbsent(document.id(), document);
          }
        }
      }
      int added = pool.size() - before;
      log.info("{}: {} queries, {} new documents", phase, queries.size(), added);
      emitter.stepFinished(phase, added + " new posts");
    }
    return new ArrayList<>(pool.values());
  }

  /** Runs queries concurrently; results come back in query order. */
  private List<SourceSearchResult> runQueries(List<String> queries) {
    ScoutConfig.Search search = scoutConfig.getSearch();
    Duration timeout = Duration.ofMillis(search.getQueryTimeoutMs());
    List<SourceSearchResult> results =
        Flux.fromIterable(queries)
            .flatMapSequential(
                query ->
                    Mono.fromCallable(
                            () ->
                                documentSource.search(
                                    query, search.getMaxResultsPerQuery(), search.getSort()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .timeout(timeout)
                        .doOnNext(result -> recordQuery(query, result.partial() ? "partial" : "ok"))
                        .onErrorResume(
                            e -> {
                              boolean timedOut = e instanceof TimeoutException;
                              recordQuery(query, timedOut ? "timeout" : "failed");
                              log.warn("Query '{}' degraded to empty: {}", query, e.getMessage());
                              return Mono.just(SourceSearchResult.empty());
                            }),
                Math.max(1, search.getPhaseConcurrency()))
            .collectList()
            .block();
    return results == null ? List.of() : results;
  }

  private void recordQuery(String query, String outcome) {
    meterRegistry.counter("scout.source.queries", "outcome", outcome).increment();
    log.debug("Query '{}' finished: {}", query, outcome);
  }

  private MergeResult analyse(
      List<SourceDocument> documents,
      SearchIntent intent,
      Collection<String> excludedShops,
      SearchEventEmitter emitter) {
    emitter.stepStarted(SearchStep.ANALYSIS);
    List<RestaurantRecommendation> candidates = analysisService.analyzeAll(documents, intent);
    MergeResult merged = merger.merge(candidates, excludedShops, intent.excludeKeywords());
    emitter.stepFinished(
        SearchStep.ANALYSIS,
        merged.recommended().size() + " places, " + merged.filtered().size() + " filtered");
    return merged;
  }

  private static RecommendationSet followUpResult(
      FollowUpType type, List<RestaurantRecommendation> recommendations, String summary) {
    return new RecommendationSet(type, recommendations, List.of(), summary, List.of(), 0);
  }

  private static String summarize(int recommended, int documents, SearchIntent intent) {
    String what = intent.hasFoodType() ? intent.foodType() + " places" : "places";
    if (recommended == 0) {
      return "Read " + documents + " posts but found no " + what + " locals vouch for.";
    }
    return "Found "
        + recommended
        + " "
        + what
        + " in "
        + intent.location()
        + " from "
        + documents
        + " posts.";
  }

  private static String explain(RestaurantRecommendation shop) {
    StringBuilder sb = new StringBuilder(shop.getName());
    if (shop.getAssessment() != null) {
      sb.append(" (")
          .append(shop.getAssessment().verdict().name().toLowerCase(Locale.ROOT))
          .append(String.format(Locale.ROOT, ", confidence %.2f", shop.getConfidence()))
          .append(")");
      if (!shop.getAssessment().reasons().isEmpty()) {
        sb.append(": ").append(String.join(", ", shop.getAssessment().reasons()));
      }
    }
    sb.append(". Backed by ").append(shop.sourceCount()).append(" posts.");
    return sb.toString();
  }

  private static String concat(String head, List<String> first, List<String> second) {
    StringBuilder sb = new StringBuilder(head == null ? "" : head);
    for (String part : first) {
      sb.append(' ').append(part);
    }
    for (String part : second) {
      sb.append(' ').append(part);
    }
    return sb.toString();
  }
}
