package com.flamingo.ai.foodscout.service.session;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.entity.SearchRequest;
import com.flamingo.ai.foodscout.domain.entity.TurnResult;
import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import com.flamingo.ai.foodscout.domain.enums.MessageRole;
import com.flamingo.ai.foodscout.domain.enums.RecoveryStatus;
import com.flamingo.ai.foodscout.domain.enums.RequestStatus;
import com.flamingo.ai.foodscout.domain.enums.SearchEventType;
import com.flamingo.ai.foodscout.domain.enums.SearchStep;
import com.flamingo.ai.foodscout.domain.enums.SessionStatus;
import com.flamingo.ai.foodscout.domain.model.ConversationContext;
import com.flamingo.ai.foodscout.domain.model.MessageEntry;
import com.flamingo.ai.foodscout.domain.model.RecommendationSet;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import com.flamingo.ai.foodscout.domain.repository.SearchRequestRepository;
import com.flamingo.ai.foodscout.domain.repository.TurnResultRepository;
import com.flamingo.ai.foodscout.exception.SessionBusyException;
import com.flamingo.ai.foodscout.exception.SessionNotFoundException;
import com.flamingo.ai.foodscout.service.followup.FollowUpClassifier;
import com.flamingo.ai.foodscout.service.followup.FollowUpDecision;
import com.flamingo.ai.foodscout.service.intent.IntentParseOutcome;
import com.flamingo.ai.foodscout.service.intent.IntentParsingService;
import com.flamingo.ai.foodscout.service.memory.ConversationMemoryStore;
import com.flamingo.ai.foodscout.service.poi.PoiEnrichmentService;
import com.flamingo.ai.foodscout.service.search.SearchOrchestrator;
import com.flamingo.ai.foodscout.service.stream.SearchEvent;
import com.flamingo.ai.foodscout.service.stream.SearchEventEmitter;
import com.flamingo.ai.foodscout.service.stream.SessionEventLog;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Owns the session lifecycle: accepts turns, runs each one in the background, streams its events
 * and answers recovery requests.
 *
 * <p>Recovery consults the in-memory record first, then the durable turn results, then the durable
 * request status. Durable rows are written only after a turn's in-memory work succeeded.
 */
@Service
@Slf4j
public class SearchSessionService {

  static final String CLARIFICATION_SUMMARY = "I need a bit more detail before searching.";

  static final String RESET_DETAIL = "The session was reset.";

  private final FollowUpClassifier classifier;
  private final IntentParsingService intentParsingService;
  private final SearchOrchestrator orchestrator;
  private final PoiEnrichmentService poiEnrichmentService;
  private final ConversationMemoryStore memoryStore;
  private final TurnResultRepository turnResultRepository;
  private final SearchRequestRepository searchRequestRepository;
  private final AsyncTaskExecutor searchExecutor;
  private final ScoutConfig scoutConfig;
  private final MeterRegistry meterRegistry;

  private final Map<UUID, SessionRecord> sessions = new ConcurrentHashMap<>();

  public SearchSessionService(
      FollowUpClassifier classifier,
      IntentParsingService intentParsingService,
      SearchOrchestrator orchestrator,
      PoiEnrichmentService poiEnrichmentService,
      ConversationMemoryStore memoryStore,
      TurnResultRepository turnResultRepository,
      SearchRequestRepository searchRequestRepository,
      @Qualifier("searchExecutor") AsyncTaskExecutor searchExecutor,
      ScoutConfig scoutConfig,
      MeterRegistry meterRegistry) {
    this.classifier = classifier;
    this.intentParsingService = intentParsingService;
    this.orchestrator = orchestrator;
    this.poiEnrichmentService = poiEnrichmentService;
    this.memoryStore = memoryStore;
    this.turnResultRepository = turnResultRepository;
    this.searchRequestRepository = searchRequestRepository;
    this.searchExecutor = searchExecutor;
    this.scoutConfig = scoutConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Accepts a turn and starts it in the background.
   *
   * @param sessionId existing session, or null to open a new one
   * @throws SessionBusyException if the session's previous turn is still loading
   */
  @Timed(value = "scout.turn.submit", description = "Time to accept a turn")
  public TurnSubmission submitTurn(UUID sessionId, String text) {
    UUID id = sessionId != null ? sessionId : UUID.randomUUID();
    SessionRecord record = sessions.computeIfAbsent(id, this::restoreOrCreate);

    SessionEventLog eventLog = new SessionEventLog();
    int turnId = record.startTurn(eventLog);
    if (turnId < 0) {
      throw new SessionBusyException(id, record.getCurrentTurnId());
    }

    try {
      searchRequestRepository.save(
          SearchRequest.builder().sessionId(id).turnId(turnId).query(text).build());
      record.attachTask(searchExecutor.submit(() -> runTurn(record, turnId, text, eventLog)));
    } catch (RuntimeException e) {
      String detail = "Could not start the search: " + e.getMessage();
      log.error("Turn {} of session {} could not be started: {}", turnId, id, e.getMessage(), e);
      record.fail(detail);
      new SearchEventEmitter(eventLog, turnId).error(detail);
      meterRegistry.counter("scout.turns", "outcome", "rejected").increment();
      markRequestFailed(id, turnId, detail);
      throw e;
    }
    log.info("Accepted turn {} for session {}", turnId, id);
    return new TurnSubmission(id, turnId, subscribeUrl(id));
  }

  /**
   * Streams the current turn's events from {@code lastIndex}.
   *
   * @throws SessionNotFoundException if the session is not held in memory
   */
  public Flux<SearchEvent> subscribe(UUID sessionId, int lastIndex) {
    SessionRecord record = sessions.get(sessionId);
    if (record == null) {
      throw new SessionNotFoundException(sessionId);
    }
    record.touch();
    SessionEventLog eventLog = record.getEventLog();
    if (eventLog == null) {
      return Flux.empty();
    }
    return eventLog.subscribe(
        Math.max(0, lastIndex), Duration.ofSeconds(scoutConfig.getStream().getHeartbeatSeconds()));
  }

  /**
   * Reports where a turn stands. Never throws for unknown sessions.
   *
   * @param turnId specific turn, or null for the latest
   */
  public RecoveryInfo recover(UUID sessionId, Integer turnId) {
    SessionRecord record = sessions.get(sessionId);
    if (record != null) {
      Optional<RecoveryInfo> fromMemory = recoverFromMemory(record, turnId);
      if (fromMemory.isPresent()) {
        return fromMemory.get();
      }
    }

    Optional<TurnResult> stored =
        turnId != null
            ? turnResultRepository.findBySessionIdAndTurnId(sessionId, turnId)
            : turnResultRepository.findFirstBySessionIdOrderByTurnIdDesc(sessionId);
    Optional<SearchRequest> request =
        turnId != null
            ? searchRequestRepository.findBySessionIdAndTurnId(sessionId, turnId)
            : searchRequestRepository.findFirstBySessionIdOrderByTurnIdDesc(sessionId);

    // A later request without a result means the latest turn never finished.
    if (stored.isPresent()
        && (request.isEmpty() || request.get().getTurnId() <= stored.get().getTurnId())) {
      TurnResult result = stored.get();
      return new RecoveryInfo(
          sessionId,
          result.getTurnId(),
          RecoveryStatus.COMPLETED,
          null,
          -1,
          result.getAction(),
          result.getRecommendations(),
          result.getFilteredCount(),
          result.getSummary(),
          null,
          "durable");
    }

    if (request.isPresent()) {
      SearchRequest status = request.get();
      return switch (status.getStatus()) {
        case LOADING -> RecoveryInfo.failed(
            sessionId,
            status.getTurnId(),
            RecoveryStatus.INTERRUPTED,
            "The search was interrupted before it finished.",
            "request");
        case ERROR -> RecoveryInfo.failed(
            sessionId,
            status.getTurnId(),
            RecoveryStatus.ERROR,
            status.getErrorDetail(),
            "request");
        case COMPLETED -> RecoveryInfo.notFound(sessionId, status.getTurnId());
      };
    }
    return RecoveryInfo.notFound(sessionId, turnId);
  }

  /**
   * Starts the session over: cancels a running turn and clears conversation memory. Turn ids keep
   * increasing so earlier durable results stay addressable.
   *
   * @throws SessionNotFoundException if the session is unknown in memory and in storage
   */
  public void reset(UUID sessionId) {
    SessionRecord previous = sessions.remove(sessionId);
    int lastTurnId =
        Math.max(
            previous != null ? previous.getLastTurnId() : 0, storedMaxTurnId(sessionId));
    if (previous == null && lastTurnId == 0) {
      throw new SessionNotFoundException(sessionId);
    }
    if (previous != null) {
      boolean wasLoading = previous.getStatus() == SessionStatus.LOADING;
      previous.cancel();
      // A queued turn never runs once cancelled, so its stream is closed here.
      SessionEventLog eventLog = previous.getEventLog();
      if (eventLog != null && !eventLog.isFinished()) {
        new SearchEventEmitter(eventLog, previous.getCurrentTurnId()).error(RESET_DETAIL);
      }
      if (wasLoading) {
        markRequestFailed(sessionId, previous.getCurrentTurnId(), RESET_DETAIL);
      }
    }
    memoryStore.clear(sessionId);
    sessions.put(sessionId, new SessionRecord(sessionId, new ConversationContext(), lastTurnId));
    meterRegistry.counter("scout.sessions.reset").increment();
    log.info("Reset session {} after turn {}", sessionId, lastTurnId);
  }

  /** Drops finished sessions idle past the eviction window. Durable stores keep their results. */
  @Scheduled(fixedDelayString = "${scout.stream.eviction-check-ms:60000}")
  public void evictIdleSessions() {
    Instant cutoff =
        Instant.now().minus(Duration.ofMinutes(scoutConfig.getStream().getEvictionMinutes()));
    int before = sessions.size();
    sessions
        .entrySet()
        .removeIf(
            entry ->
                entry.getValue().getStatus() != SessionStatus.LOADING
                    && entry.getValue().getLastActivity().isBefore(cutoff));
    int evicted = before - sessions.size();
    if (evicted > 0) {
      log.info("Evicted {} idle sessions, {} remain", evicted, sessions.size());
    }
  }

  int activeSessionCount() {
    return sessions.size();
  }

  void runTurn(SessionRecord record, int turnId, String text, SessionEventLog eventLog) {
    UUID sessionId = record.getSessionId();
    SearchEventEmitter emitter = new SearchEventEmitter(eventLog, turnId);
    ConversationContext context = record.getContext();

    try {
      RecommendationSet result = computeResult(text, context, emitter);

      if (!result.recommendations().isEmpty()) {
        emitter.stepStarted(SearchStep.ENRICHMENT);
        String cityHint =
            context.getLastIntent() != null ? context.getLastIntent().location() : null;
        for (RestaurantRecommendation recommendation : result.recommendations()) {
          emitter.recommendationItem(poiEnrichmentService.enrich(recommendation, cityHint));
        }
        emitter.stepFinished(SearchStep.ENRICHMENT, result.recommendations().size() + " places");
      }

      if (record.isCancelled()) {
        log.info("Turn {} of session {} finished after reset, discarding", turnId, sessionId);
        emitter.error(RESET_DETAIL);
        return;
      }

      persistTurn(sessionId, turnId, text, result, context);
      updateRequest(
          sessionId, turnId, RequestStatus.COMPLETED, null, result.recommendations().size());

      context.addMessage(MessageRole.USER, text);
      context.addMessage(MessageRole.ASSISTANT, result.summary());
      context.incrementTurn();
      memoryStore.append(sessionId, MessageRole.USER, text);
      memoryStore.append(sessionId, MessageRole.ASSISTANT, result.summary());

      emitter.finalResult(result);
      record.complete(result);
      meterRegistry.counter("scout.turns", "outcome", "completed").increment();
      log.info(
          "Turn {} of session {} completed: action={}, {} recommendations",
          turnId,
          sessionId,
          result.action(),
          result.recommendations().size());
      emitter.done();
    } catch (Exception e) {
      String outcome = record.isCancelled() ? "cancelled" : "failed";
      String detail = record.isCancelled() ? RESET_DETAIL : "Search failed: " + e.getMessage();
      log.error("Turn {} of session {} {}: {}", turnId, sessionId, outcome, e.getMessage(), e);
      record.fail(detail);
      emitter.error(detail);
      meterRegistry.counter("scout.turns", "outcome", outcome).increment();
      markRequestFailed(sessionId, turnId, detail);
    }
  }

  /** Best-effort ERROR status for a turn's request row; failures are logged. */
  private void markRequestFailed(UUID sessionId, int turnId, String detail) {
    try {
      updateRequest(sessionId, turnId, RequestStatus.ERROR, detail, null);
    } catch (RuntimeException persistFailure) {
      log.error(
          "Could not record failure of turn {} for session {}: {}",
          turnId,
          sessionId,
          persistFailure.getMessage());
    }
  }

  private RecommendationSet computeResult(
      String text, ConversationContext context, SearchEventEmitter emitter) {
    FollowUpDecision decision = classifier.classify(text, context);
    log.debug("Classified turn as {} via {}", decision.type(), decision.tier());
    if (decision.type() != FollowUpType.NEW_SEARCH) {
      return orchestrator.handleFollowUp(decision, context, emitter);
    }

    emitter.stepStarted(SearchStep.INTENT);
    IntentParseOutcome outcome = intentParsingService.parse(text, context);
    if (outcome.needsClarification()) {
      emitter.stepFinished(SearchStep.INTENT, "needs clarification");
      return RecommendationSet.clarification(CLARIFICATION_SUMMARY, outcome.questions());
    }
    SearchIntent intent = outcome.intent();
    emitter.stepFinished(
        SearchStep.INTENT,
        intent.hasFoodType() ? intent.foodType() + " in " + intent.location() : intent.location());
    return orchestrator.runNewSearch(intent, context, emitter);
  }

  private Optional<RecoveryInfo> recoverFromMemory(SessionRecord record, Integer turnId) {
    SessionEventLog eventLog = record.getEventLog();
    int currentTurnId = record.getCurrentTurnId();
    if (eventLog == null || (turnId != null && turnId != currentTurnId)) {
      return Optional.empty();
    }

    UUID sessionId = record.getSessionId();
    return switch (record.getStatus()) {
      case LOADING -> Optional.of(
          RecoveryInfo.loading(
              sessionId, currentTurnId, subscribeUrl(sessionId), eventLog.size() - 1));
      case COMPLETED -> {
        RecommendationSet result = record.getLastResult();
        List<RestaurantRecommendation> items = streamedItems(eventLog);
        yield Optional.of(
            new RecoveryInfo(
                sessionId,
                currentTurnId,
                RecoveryStatus.COMPLETED,
                null,
                eventLog.size() - 1,
                result.action(),
                items.isEmpty() ? result.recommendations() : items,
                result.filteredCount(),
                result.summary(),
                null,
                "memory"));
      }
      case ERROR -> Optional.of(
          RecoveryInfo.failed(
              sessionId, currentTurnId, RecoveryStatus.ERROR, record.getErrorDetail(), "memory"));
      case IDLE -> Optional.empty();
    };
  }

  private static List<RestaurantRecommendation> streamedItems(SessionEventLog eventLog) {
    List<RestaurantRecommendation> items = new ArrayList<>();
    for (SearchEvent event : eventLog.snapshot()) {
      if (event.type() == SearchEventType.RECOMMENDATION_ITEM
          && event.data().get("restaurant") instanceof RestaurantRecommendation recommendation) {
        items.add(recommendation);
      }
    }
    return items;
  }

  private void persistTurn(
      UUID sessionId,
      int turnId,
      String text,
      RecommendationSet result,
      ConversationContext context) {
    TurnResult turn =
        TurnResult.builder()
            .sessionId(sessionId)
            .turnId(turnId)
            .query(text)
            .action(result.action())
            .intent(context.getLastIntent())
            .recommendations(copies(result.recommendations()))
            .filtered(copies(result.filtered()))
            .summary(result.summary())
            .filteredCount(result.filteredCount())
            .documentIds(new ArrayList<>(context.getLastDocumentIds()))
            .excludedShops(new ArrayList<>(context.getExcludedShops()))
            .build();
    turnResultRepository.save(turn);
  }

  private void updateRequest(
      UUID sessionId, int turnId, RequestStatus status, String detail, Integer resultCount) {
    searchRequestRepository
        .findBySessionIdAndTurnId(sessionId, turnId)
        .ifPresentOrElse(
            request -> {
              request.setStatus(status);
              request.setErrorDetail(detail);
              request.setResultCount(resultCount);
              searchRequestRepository.save(request);
            },
            () -> log.warn("No request row for turn {} of session {}", turnId, sessionId));
  }

  /**
   * Rebuilds a session from storage. The latest fresh search's full set becomes the superset,
   * later expansions are merged in, and the working set is scoped to the latest turn.
   */
  private SessionRecord restoreOrCreate(UUID sessionId) {
    int lastTurnId = storedMaxTurnId(sessionId);
    ConversationContext context = new ConversationContext();
    List<TurnResult> turns =
        lastTurnId > 0
            ? turnResultRepository.findBySessionIdOrderByTurnIdAsc(sessionId)
            : List.of();
    if (turns.isEmpty()) {
      return new SessionRecord(sessionId, context, lastTurnId);
    }

    int supersetIndex = 0;
    for (int i = 0; i < turns.size(); i++) {
      TurnResult turn = turns.get(i);
      if (turn.getAction() == FollowUpType.NEW_SEARCH
          && (turn.hasRecommendations() || !turn.getFiltered().isEmpty())) {
        supersetIndex = i;
      }
    }
    TurnResult superset = turns.get(supersetIndex);
    List<RestaurantRecommendation> known = new ArrayList<>(superset.getRecommendations());
    known.addAll(superset.getFiltered());
    context.replaceRecommendations(known);
    for (TurnResult later : turns.subList(supersetIndex + 1, turns.size())) {
      context.mergeNew(later.getRecommendations());
    }

    TurnResult latest = turns.get(turns.size() - 1);
    if (latest.hasRecommendations()) {
      context.scopeTo(latest.getRecommendations());
    }
    latest.getExcludedShops().forEach(context::exclude);
    for (int i = turns.size() - 1; i >= 0; i--) {
      if (turns.get(i).getIntent() != null) {
        context.setLastIntent(turns.get(i).getIntent());
        break;
      }
    }
    context.rememberDocuments(latest.getDocumentIds());
    context.setTurnCount(turns.size());
    for (MessageEntry message :
        memoryStore.recent(sessionId, scoutConfig.getMemory().getMaxMessages())) {
      context.addMessage(message.role(), message.content());
    }

    meterRegistry.counter("scout.sessions.restored").increment();
    log.info(
        "Restored session {} from {} stored turns ({} known shops)",
        sessionId,
        turns.size(),
        context.getRecommendations().size());
    return new SessionRecord(sessionId, context, lastTurnId);
  }

  private int storedMaxTurnId(UUID sessionId) {
    return Math.max(
        turnResultRepository.findMaxTurnId(sessionId),
        searchRequestRepository.findMaxTurnId(sessionId));
  }

  private static String subscribeUrl(UUID sessionId) {
    return "/api/search/" + sessionId + "/stream";
  }

  private static List<RestaurantRecommendation> copies(List<RestaurantRecommendation> source) {
    return new ArrayList<>(source.stream().map(RestaurantRecommendation::copy).toList());
  }
}
