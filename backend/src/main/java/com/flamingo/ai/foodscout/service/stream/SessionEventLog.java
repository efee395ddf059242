package com.flamingo.ai.foodscout.service.stream;

import com.flamingo.ai.foodscout.domain.enums.SearchEventType;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Append-only, indexed event log for one turn with live subscription.
 *
 * <p>Appends are serialized, so indexes are dense and every subscriber sees them in order. A
 * subscriber first receives the retained events from its requested index (flagged as replayed),
 * then live ones, and completes after the first terminal event.
 */
@Slf4j
public class SessionEventLog {

  private final List<SearchEvent> events = new ArrayList<>();
  private final Sinks.Many<SearchEvent> sink = Sinks.many().replay().all();

  /** Appends an event and wakes live subscribers. Null data values are dropped. */
  public SearchEvent append(SearchEventType type, Map<String, Object> data) {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (data != null) {
      data.forEach(
          (key, value) -> {
            if (value != null) {
              payload.put(key, value);
            }
          });
    }

    synchronized (events) {
      SearchEvent event =
          new SearchEvent(
              events.size(), type, Instant.now(), Collections.unmodifiableMap(payload), false);
      events.add(event);
      Sinks.EmitResult result = sink.tryEmitNext(event);
      if (result.isFailure()) {
        log.warn(
            "Event {} ({}) not delivered to live subscribers: {}", event.index(), type, result);
      }
      return event;
    }
  }

  /**
   * Appends unless a terminal event was already appended.
   *
   * @return false when the log was already finished and the event was dropped
   */
  public boolean appendIfOpen(SearchEventType type, Map<String, Object> data) {
    synchronized (events) {
      if (isFinished()) {
        log.debug("Dropping {} event for a finished log", type);
        return false;
      }
      append(type, data);
      return true;
    }
  }

  /**
   * Subscribes from {@code lastIndex}.
   *
   * @param heartbeatInterval idle time after which a heartbeat is sent, repeated while idle
   */
  public Flux<SearchEvent> subscribe(int lastIndex, Duration heartbeatInterval) {
    return Flux.defer(
        () -> {
          int boundary;
          boolean finished;
          synchronized (events) {
            boundary = events.size();
            finished = !events.isEmpty() && events.get(events.size() - 1).terminal();
          }
          if (finished && lastIndex >= boundary) {
            return Flux.empty();
          }

          Flux<SearchEvent> ordered =
              sink.asFlux()
                  .filter(event -> event.index() >= lastIndex)
                  .map(event -> event.index() < boundary ? event.asReplayed() : event);

          return ordered
              .publish(shared -> Flux.merge(shared, heartbeats(shared, heartbeatInterval)))
              .takeUntil(SearchEvent::terminal);
        });
  }

  private static Flux<SearchEvent> heartbeats(Flux<SearchEvent> events, Duration interval) {
    return events
        .map(event -> 0L)
        .startWith(0L)
        .switchMap(reset -> Flux.interval(interval).map(tick -> SearchEvent.heartbeat()));
  }

  public List<SearchEvent> snapshot() {
    synchronized (events) {
      return List.copyOf(events);
    }
  }

  public int size() {
    synchronized (events) {
      return events.size();
    }
  }

  public boolean isFinished() {
    synchronized (events) {
      return !events.isEmpty() && events.get(events.size() - 1).terminal();
    }
  }
}
