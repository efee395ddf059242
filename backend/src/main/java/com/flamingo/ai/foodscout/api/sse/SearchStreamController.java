package com.flamingo.ai.foodscout.api.sse;

import com.flamingo.ai.foodscout.service.session.SearchSessionService;
import com.flamingo.ai.foodscout.service.stream.SearchEvent;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Streams a session's turn events over Server-Sent Events, resuming from a given index. */
@RestController
@RequestMapping("/api/search/{sessionId}")
@RequiredArgsConstructor
@Slf4j
public class SearchStreamController {

  private final SearchSessionService sessionService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams events from {@code lastEventIndex}; earlier events are replayed first.
   *
   * @param sessionId the session ID
   * @param lastEventIndex first event index the client still needs (default 0)
   * @return a Flux of SSE events, completing after the turn's terminal event
   */
  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<Map<String, Object>>> stream(
      @PathVariable UUID sessionId, @RequestParam(defaultValue = "0") int lastEventIndex) {

    Flux<SearchEvent> events = sessionService.subscribe(sessionId, lastEventIndex);
    log.info("Opening event stream for session {} from index {}", sessionId, lastEventIndex);
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return events
        .map(SearchStreamController::toServerSentEvent)
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Event stream completed for session {}", sessionId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Event stream error for session {}: {}", sessionId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Event stream cancelled for session {}", sessionId);
            });
  }

  static ServerSentEvent<Map<String, Object>> toServerSentEvent(SearchEvent event) {
    Map<String, Object> payload = new LinkedHashMap<>(event.data());
    payload.put("index", event.index());
    payload.put("timestamp", event.timestamp().toString());
    payload.put("replayed", event.replayed());

    ServerSentEvent.Builder<Map<String, Object>> builder =
        ServerSentEvent.<Map<String, Object>>builder()
            .event(event.type().getWireName())
            .data(payload);
    if (event.index() >= 0) {
      builder.id(String.valueOf(event.index()));
    }
    return builder.build();
  }
}
