package com.flamingo.ai.foodscout.service.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.entity.SearchRequest;
import com.flamingo.ai.foodscout.domain.entity.TurnResult;
import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import com.flamingo.ai.foodscout.domain.enums.MessageRole;
import com.flamingo.ai.foodscout.domain.enums.RecoveryStatus;
import com.flamingo.ai.foodscout.domain.enums.RequestStatus;
import com.flamingo.ai.foodscout.domain.enums.SearchEventType;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.support.TaskExecutorAdapter;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SearchSessionServiceTest {

  private static final SearchIntent INTENT = SearchIntent.of("Alpha City", "noodles");

  @Mock private FollowUpClassifier classifier;

  @Mock private IntentParsingService intentParsingService;

  @Mock private SearchOrchestrator orchestrator;

  @Mock private PoiEnrichmentService poiEnrichmentService;

  @Mock private ConversationMemoryStore memoryStore;

  @Mock private TurnResultRepository turnResultRepository;

  @Mock private SearchRequestRepository searchRequestRepository;

  private final List<Runnable> pendingTasks = new ArrayList<>();
  private final List<SearchRequest> savedRequests = new ArrayList<>();
  private ScoutConfig scoutConfig;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    scoutConfig = new ScoutConfig();
    meterRegistry = new SimpleMeterRegistry();
    when(poiEnrichmentService.enrich(any(), any())).thenAnswer(i -> i.getArgument(0));
    when(searchRequestRepository.save(any(SearchRequest.class)))
        .thenAnswer(
            i -> {
              SearchRequest request = i.getArgument(0);
              if (!savedRequests.contains(request)) {
                savedRequests.add(request);
              }
              return request;
            });
    when(searchRequestRepository.findBySessionIdAndTurnId(any(), anyInt()))
        .thenAnswer(
            i ->
                savedRequests.stream()
                    .filter(
                        r ->
                            r.getSessionId().equals(i.getArgument(0))
                                && r.getTurnId() == (int) i.getArgument(1))
                    .findFirst());
  }

  private SearchSessionService synchronousService() {
    return service(new TaskExecutorAdapter(Runnable::run));
  }

  private SearchSessionService deferredService() {
    return service(new TaskExecutorAdapter(pendingTasks::add));
  }

  private SearchSessionService service(TaskExecutorAdapter executor) {
    return new SearchSessionService(
        classifier,
        intentParsingService,
        orchestrator,
        poiEnrichmentService,
        memoryStore,
        turnResultRepository,
        searchRequestRepository,
        executor,
        scoutConfig,
        meterRegistry);
  }

  private void givenFreshSearchFinds(String... names) {
    when(classifier.classify(anyString(), any())).thenReturn(FollowUpDecision.newSearch("initial"));
    when(intentParsingService.parse(anyString(), any()))
        .thenReturn(IntentParseOutcome.ready(INTENT));
    List<RestaurantRecommendation> shops = new ArrayList<>();
    for (String name : names) {
      shops.add(RestaurantRecommendation.builder().name(name).confidence(0.8).build());
    }
    when(orchestrator.runNewSearch(eq(INTENT), any(), any()))
        .thenAnswer(
            i -> {
              ConversationContext context = i.getArgument(1);
              context.resetSearch(INTENT, List.of("d1"));
              context.replaceRecommendations(shops);
              return new RecommendationSet(
                  FollowUpType.NEW_SEARCH, shops, List.of(), "Found places", List.of(), 1);
            });
  }

  @Test
  void shouldRunTurn_andRecoverCompletedResultFromMemory() {
    // Given
    SearchSessionService service = synchronousService();
    givenFreshSearchFinds("Shop A", "Shop B");

    // When
    TurnSubmission submission = service.submitTurn(null, "noodles in Alpha City");
    RecoveryInfo recovery = service.recover(submission.sessionId(), null);

    // Then
    assertThat(submission.turnId()).isEqualTo(1);
    assertThat(submission.subscribeUrl())
        .isEqualTo("/api/search/" + submission.sessionId() + "/stream");
    assertThat(recovery.status()).isEqualTo(RecoveryStatus.COMPLETED);
    assertThat(recovery.source()).isEqualTo("memory");
    assertThat(recovery.recommendations())
        .extracting(RestaurantRecommendation::getName)
        .containsExactly("Shop A", "Shop B");
    assertThat(recovery.summary()).isEqualTo("Found places");

    ArgumentCaptor<TurnResult> stored = ArgumentCaptor.forClass(TurnResult.class);
    verify(turnResultRepository).save(stored.capture());
    assertThat(stored.getValue().getTurnId()).isEqualTo(1);
    assertThat(stored.getValue().getAction()).isEqualTo(FollowUpType.NEW_SEARCH);
    assertThat(stored.getValue().getIntent()).isEqualTo(INTENT);
    assertThat(stored.getValue().getDocumentIds()).containsExactly("d1");
    assertThat(savedRequests.get(0).getStatus()).isEqualTo(RequestStatus.COMPLETED);
    assertThat(savedRequests.get(0).getResultCount()).isEqualTo(2);
    verify(memoryStore).append(submission.sessionId(), MessageRole.USER, "noodles in Alpha City");
    verify(memoryStore).append(submission.sessionId(), MessageRole.ASSISTANT, "Found places");
    assertThat(meterRegistry.counter("scout.turns", "outcome", "completed").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldStreamItemsThenResultThenDone() {
    // Given
    SearchSessionService service = synchronousService();
    givenFreshSearchFinds("Shop A");
    TurnSubmission submission = service.submitTurn(null, "noodles in Alpha City");

    // When
    List<SearchEvent> events = service.subscribe(submission.sessionId(), 0).collectList().block();

    // Then
    List<SearchEventType> types = events.stream().map(SearchEvent::type).toList();
    assertThat(types).contains(SearchEventType.RECOMMENDATION_ITEM);
    assertThat(types.indexOf(SearchEventType.RECOMMENDATION_ITEM))
        .isLessThan(types.indexOf(SearchEventType.FINAL_RESULT));
    assertThat(types.get(types.size() - 1)).isEqualTo(SearchEventType.STREAM_DONE);
    assertThat(events).allMatch(SearchEvent::replayed);
  }

  @Test
  void shouldReportLoading_andRejectSecondTurnWhileRunning() {
    // Given
    SearchSessionService service = deferredService();
    givenFreshSearchFinds("Shop A");
    TurnSubmission submission = service.submitTurn(null, "noodles in Alpha City");
    UUID sessionId = submission.sessionId();

    // When
    RecoveryInfo loading = service.recover(sessionId, null);

    // Then
    assertThat(loading.status()).isEqualTo(RecoveryStatus.LOADING);
    assertThat(loading.subscribeUrl()).isEqualTo(submission.subscribeUrl());
    assertThat(loading.lastEventIndex()).isEqualTo(-1);
    assertThatThrownBy(() -> service.submitTurn(sessionId, "more"))
        .isInstanceOf(SessionBusyException.class);

    // When
    pendingTasks.get(0).run();

    // Then
    assertThat(service.recover(sessionId, 1).status()).isEqualTo(RecoveryStatus.COMPLETED);
    assertThat(service.submitTurn(sessionId, "more").turnId()).isEqualTo(2);
  }

  @Test
  void shouldAnswerWithClarification_whenLocationMissing() {
    // Given
    SearchSessionService service = synchronousService();
    when(classifier.classify(anyString(), any())).thenReturn(FollowUpDecision.newSearch("initial"));
    when(intentParsingService.parse(anyString(), any()))
        .thenReturn(IntentParseOutcome.clarify(List.of("Which city are you in?")));

    // When
    TurnSubmission submission = service.submitTurn(null, "something tasty");
    List<SearchEvent> events = service.subscribe(submission.sessionId(), 0).collectList().block();

    // Then
    SearchEvent result =
        events.stream()
            .filter(e -> e.type() == SearchEventType.FINAL_RESULT)
            .findFirst()
            .orElseThrow();
    assertThat(result.data())
        .containsEntry("summary", SearchSessionService.CLARIFICATION_SUMMARY)
        .containsEntry("clarificationQuestions", List.of("Which city are you in?"));
    verify(orchestrator, never()).runNewSearch(any(), any(), any());
  }

  @Test
  void shouldRecordError_whenSearchFails() {
    // Given
    SearchSessionService service = synchronousService();
    when(classifier.classify(anyString(), any())).thenReturn(FollowUpDecision.newSearch("initial"));
    when(intentParsingService.parse(anyString(), any()))
        .thenReturn(IntentParseOutcome.ready(INTENT));
    when(orchestrator.runNewSearch(any(), any(), any()))
        .thenThrow(new IllegalStateException("source down"));

    // When
    TurnSubmission submission = service.submitTurn(null, "noodles in Alpha City");
    RecoveryInfo recovery = service.recover(submission.sessionId(), null);

    // Then
    assertThat(recovery.status()).isEqualTo(RecoveryStatus.ERROR);
    assertThat(recovery.errorDetail()).isEqualTo("Search failed: source down");
    assertThat(savedRequests.get(0).getStatus()).isEqualTo(RequestStatus.ERROR);
    assertThat(meterRegistry.counter("scout.turns", "outcome", "failed").count()).isEqualTo(1.0);
    verify(turnResultRepository, never()).save(any());
    verify(memoryStore, never()).append(any(), any(), any());
  }

  @Test
  void shouldNotEmitResultOrRemember_whenTurnCannotBePersisted() {
    // Given
    SearchSessionService service = synchronousService();
    givenFreshSearchFinds("Shop A");
    when(turnResultRepository.save(any())).thenThrow(new IllegalStateException("disk full"));

    // When
    TurnSubmission submission = service.submitTurn(null, "noodles in Alpha City");
    List<SearchEvent> events = service.subscribe(submission.sessionId(), 0).collectList().block();

    // Then
    List<SearchEventType> types = events.stream().map(SearchEvent::type).toList();
    assertThat(types).doesNotContain(SearchEventType.FINAL_RESULT);
    assertThat(types.get(types.size() - 1)).isEqualTo(SearchEventType.ERROR);
    assertThat(service.recover(submission.sessionId(), null).status())
        .isEqualTo(RecoveryStatus.ERROR);
    assertThat(savedRequests.get(0).getStatus()).isEqualTo(RequestStatus.ERROR);
    verify(memoryStore, never()).append(any(), any(), any());
  }

  @Test
  void shouldReleaseSession_whenRequestRowCannotBeSaved() {
    // Given
    SearchSessionService service = synchronousService();
    givenFreshSearchFinds("Shop A");
    UUID sessionId = UUID.randomUUID();
    doAnswer(
            i -> {
              throw new IllegalStateException("database is locked");
            })
        .doAnswer(
            i -> {
              SearchRequest request = i.getArgument(0);
              if (!savedRequests.contains(request)) {
                savedRequests.add(request);
              }
              return request;
            })
        .when(searchRequestRepository)
        .save(any(SearchRequest.class));

    // When
    assertThatThrownBy(() -> service.submitTurn(sessionId, "noodles in Alpha City"))
        .isInstanceOf(IllegalStateException.class);
    RecoveryInfo afterFailure = service.recover(sessionId, null);

    // Then
    assertThat(afterFailure.status()).isEqualTo(RecoveryStatus.ERROR);
    assertThat(afterFailure.errorDetail())
        .isEqualTo("Could not start the search: database is locked");
    assertThat(meterRegistry.counter("scout.turns", "outcome", "rejected").count())
        .isEqualTo(1.0);

    // When
    TurnSubmission retry = service.submitTurn(sessionId, "noodles in Alpha City");

    // Then
    assertThat(retry.turnId()).isEqualTo(2);
    assertThat(service.recover(sessionId, null).status()).isEqualTo(RecoveryStatus.COMPLETED);
  }

  @Test
  void shouldMarkRequestFailed_whenExecutorRejectsTurn() {
    // Given
    SearchSessionService service =
        service(
            new TaskExecutorAdapter(
                task -> {
                  throw new RejectedExecutionException("pool full");
                }));
    givenFreshSearchFinds("Shop A");

    // When
    assertThatThrownBy(() -> service.submitTurn(null, "noodles in Alpha City"))
        .isInstanceOf(RejectedExecutionException.class);

    // Then
    assertThat(savedRequests).hasSize(1);
    assertThat(savedRequests.get(0).getStatus()).isEqualTo(RequestStatus.ERROR);
    assertThat(savedRequests.get(0).getErrorDetail()).startsWith("Could not start the search");
  }

  @Test
  void shouldFallBackToDurableResult_whenSessionNotInMemory() {
    // Given
    SearchSessionService service = synchronousService();
    UUID sessionId = UUID.randomUUID();
    when(turnResultRepository.findFirstBySessionIdOrderByTurnIdDesc(sessionId))
        .thenReturn(Optional.of(turnResult(sessionId, 2, FollowUpType.EXPAND, "Shop A")));
    when(searchRequestRepository.findFirstBySessionIdOrderByTurnIdDesc(sessionId))
        .thenReturn(Optional.of(request(sessionId, 2, RequestStatus.COMPLETED)));

    // When
    RecoveryInfo recovery = service.recover(sessionId, null);

    // Then
    assertThat(recovery.status()).isEqualTo(RecoveryStatus.COMPLETED);
    assertThat(recovery.source()).isEqualTo("durable");
    assertThat(recovery.turnId()).isEqualTo(2);
    assertThat(recovery.action()).isEqualTo(FollowUpType.EXPAND);
    assertThat(recovery.recommendations()).hasSize(1);
  }

  @Test
  void shouldReportInterrupted_whenLatestRequestNeverFinished() {
    // Given
    SearchSessionService service = synchronousService();
    UUID sessionId = UUID.randomUUID();
    when(turnResultRepository.findFirstBySessionIdOrderByTurnIdDesc(sessionId))
        .thenReturn(Optional.of(turnResult(sessionId, 1, FollowUpType.NEW_SEARCH, "Shop A")));
    when(searchRequestRepository.findFirstBySessionIdOrderByTurnIdDesc(sessionId))
        .thenReturn(Optional.of(request(sessionId, 2, RequestStatus.LOADING)));

    // When
    RecoveryInfo recovery = service.recover(sessionId, null);

    // Then
    assertThat(recovery.status()).isEqualTo(RecoveryStatus.INTERRUPTED);
    assertThat(recovery.turnId()).isEqualTo(2);
    assertThat(recovery.subscribeUrl()).isNull();
  }

  @Test
  void shouldReportNotFound_forUnknownSession() {
    SearchSessionService service = synchronousService();

    RecoveryInfo recovery = service.recover(UUID.randomUUID(), null);

    assertThat(recovery.status()).isEqualTo(RecoveryStatus.NOT_FOUND);
    assertThat(recovery.source()).isEqualTo("none");
  }

  @Test
  void shouldRejectSubscription_forUnknownSession() {
    SearchSessionService service = synchronousService();

    assertThatThrownBy(() -> service.subscribe(UUID.randomUUID(), 0))
        .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  void shouldRejectReset_forUnknownSession() {
    SearchSessionService service = synchronousService();

    assertThatThrownBy(() -> service.reset(UUID.randomUUID()))
        .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  void shouldResetSession_keepingTurnCounter() {
    // Given
    SearchSessionService service = synchronousService();
    givenFreshSearchFinds("Shop A");
    UUID sessionId = service.submitTurn(null, "noodles in Alpha City").sessionId();

    // When
    service.reset(sessionId);

    // Then
    verify(memoryStore).clear(sessionId);
    assertThat(service.recover(sessionId, null).status()).isNotEqualTo(RecoveryStatus.COMPLETED);
    assertThat(service.submitTurn(sessionId, "noodles in Alpha City").turnId()).isEqualTo(2);
    assertThat(meterRegistry.counter("scout.sessions.reset").count()).isEqualTo(1.0);
  }

  @Test
  void shouldDiscardResult_whenResetDuringTurn() {
    // Given
    SearchSessionService service = deferredService();
    givenFreshSearchFinds("Shop A");
    UUID sessionId = service.submitTurn(null, "noodles in Alpha City").sessionId();

    // When
    service.reset(sessionId);
    pendingTasks.get(0).run();

    // Then
    verify(turnResultRepository, never()).save(any());
    verify(memoryStore, never()).append(any(), any(), any());
  }

  @Test
  void shouldEndOpenStream_whenQueuedTurnIsReset() throws Exception {
    // Given
    SearchSessionService service = deferredService();
    givenFreshSearchFinds("Shop A");
    UUID sessionId = service.submitTurn(null, "noodles in Alpha City").sessionId();
    CompletableFuture<List<SearchEvent>> seen =
        service.subscribe(sessionId, 0).collectList().toFuture();

    // When
    service.reset(sessionId);
    pendingTasks.get(0).run();

    // Then
    List<SearchEvent> events = seen.get(5, TimeUnit.SECONDS);
    SearchEvent last = events.get(events.size() - 1);
    assertThat(last.type()).isEqualTo(SearchEventType.ERROR);
    assertThat(last.data()).containsEntry("message", SearchSessionService.RESET_DETAIL);
    assertThat(savedRequests.get(0).getStatus()).isEqualTo(RequestStatus.ERROR);
    assertThat(savedRequests.get(0).getErrorDetail()).isEqualTo(SearchSessionService.RESET_DETAIL);
  }

  @Test
  void shouldRestoreSessionFromStorage_beforeNextTurn() {
    // Given
    SearchSessionService service = synchronousService();
    UUID sessionId = UUID.randomUUID();
    TurnResult first = turnResult(sessionId, 1, FollowUpType.NEW_SEARCH, "Shop A", "Shop B");
    RestaurantRecommendation filtered =
        RestaurantRecommendation.builder().name("Shop C").build();
    filtered.markFiltered("Judged as promoted");
    first.setFiltered(new ArrayList<>(List.of(filtered)));
    TurnResult second = turnResult(sessionId, 2, FollowUpType.CATEGORY_FILTER, "Shop B");
    when(turnResultRepository.findMaxTurnId(sessionId)).thenReturn(2);
    when(searchRequestRepository.findMaxTurnId(sessionId)).thenReturn(2);
    when(turnResultRepository.findBySessionIdOrderByTurnIdAsc(sessionId))
        .thenReturn(List.of(first, second));
    when(memoryStore.recent(eq(sessionId), anyInt()))
        .thenReturn(
            List.of(
                new MessageEntry(MessageRole.USER, "noodles in Alpha City"),
                new MessageEntry(MessageRole.ASSISTANT, "Found places")));
    when(classifier.classify(anyString(), any()))
        .thenReturn(FollowUpDecision.rule(FollowUpType.CONFIRM, null));
    when(orchestrator.handleFollowUp(any(), any(), any()))
        .thenReturn(
            new RecommendationSet(
                FollowUpType.CONFIRM, List.of(), List.of(), "My pick", List.of(), 0));

    // When
    TurnSubmission submission = service.submitTurn(sessionId, "which one is best");

    // Then
    assertThat(submission.turnId()).isEqualTo(3);
    ArgumentCaptor<ConversationContext> captor = ArgumentCaptor.forClass(ConversationContext.class);
    verify(classifier).classify(eq("which one is best"), captor.capture());
    ConversationContext context = captor.getValue();
    assertThat(context.all())
        .extracting(RestaurantRecommendation::getName)
        .containsExactly("Shop A", "Shop B");
    assertThat(context.visible())
        .extracting(RestaurantRecommendation::getName)
        .containsExactly("Shop B");
    assertThat(context.getRecommendations()).containsKey("shop c");
    assertThat(context.getLastIntent()).isEqualTo(INTENT);
    assertThat(context.getTurnCount()).isEqualTo(3);
    assertThat(context.getMessages()).hasSize(4);
    assertThat(meterRegistry.counter("scout.sessions.restored").count()).isEqualTo(1.0);
  }

  @Test
  void shouldEvictFinishedSessions_butKeepLoadingOnes() {
    // Given
    scoutConfig.getStream().setEvictionMinutes(-1);
    SearchSessionService service = deferredService();
    givenFreshSearchFinds("Shop A");
    service.submitTurn(null, "noodles in Alpha City");
    pendingTasks.get(0).run();
    service.submitTurn(null, "noodles in Alpha City");

    // When
    service.evictIdleSessions();

    // Then
    assertThat(service.activeSessionCount()).isEqualTo(1);
    verify(turnResultRepository, times(1)).save(any());
  }

  private static TurnResult turnResult(
      UUID sessionId, int turnId, FollowUpType action, String... names) {
    List<RestaurantRecommendation> shops = new ArrayList<>();
    for (String name : names) {
      shops.add(RestaurantRecommendation.builder().name(name).confidence(0.8).build());
    }
    return TurnResult.builder()
        .sessionId(sessionId)
        .turnId(turnId)
        .query("turn " + turnId)
        .action(action)
        .intent(INTENT)
        .recommendations(shops)
        .filteredCount(0)
        .summary("Found places")
        .documentIds(new ArrayList<>(List.of("d1")))
        .build();
  }

  private static SearchRequest request(UUID sessionId, int turnId, RequestStatus status) {
    return SearchRequest.builder()
        .sessionId(sessionId)
        .turnId(turnId)
        .query("turn " + turnId)
        .status(status)
        .build();
  }
}
