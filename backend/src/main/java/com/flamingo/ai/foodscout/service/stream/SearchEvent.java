package com.flamingo.ai.foodscout.service.stream;

import com.flamingo.ai.foodscout.domain.enums.SearchEventType;
import java.time.Instant;
import java.util.Map;

/**
 * One entry of a turn's event log.
 *
 * @param index position in the log, starting at 0; heartbeats carry -1
 * @param replayed true when delivered from the log rather than live
 */
public record SearchEvent(
    int index,
    SearchEventType type,
    Instant timestamp,
    Map<String, Object> data,
    boolean replayed) {

  public static SearchEvent heartbeat() {
    return new SearchEvent(-1, SearchEventType.HEARTBEAT, Instant.now(), Map.of(), false);
  }

  public SearchEvent asReplayed() {
    return new SearchEvent(index, type, timestamp, data, true);
  }

  public boolean terminal() {
    return type.isTerminal();
  }
}
