package com.flamingo.ai.foodscout.service.memory;

import com.flamingo.ai.foodscout.config.ScoutConfig;
import com.flamingo.ai.foodscout.domain.entity.ConversationMessage;
import com.flamingo.ai.foodscout.domain.enums.MessageRole;
import com.flamingo.ai.foodscout.domain.model.MessageEntry;
import com.flamingo.ai.foodscout.domain.repository.ConversationMessageRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

/**
 * Short-term conversation memory. Recent messages per session live in a TTL cache; every append is
 * written through to {@code conversation_messages}, and a cache miss is warmed from that table.
 */
@Service
@Slf4j
public class ConversationMemoryStore {

  private final ConversationMessageRepository repository;
  private final int maxMessages;
  private final Cache<UUID, History> cache;

  public ConversationMemoryStore(
      ConversationMessageRepository repository, ScoutConfig scoutConfig) {
    this.repository = repository;
    ScoutConfig.Memory memory = scoutConfig.getMemory();
    this.maxMessages = memory.getMaxMessages();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(memory.getMaxSessions())
            .expireAfterAccess(Duration.ofMinutes(memory.getTtlMinutes()))
            .build();
  }

  /** Appends a message, persisting it before it becomes visible in the cache. */
  public void append(UUID sessionId, MessageRole role, String content) {
    History history = cache.get(sessionId, this::load);
    synchronized (history) {
      ConversationMessage message =
          ConversationMessage.builder()
              .sessionId(sessionId)
              .messageIndex(history.nextIndex)
              .role(role)
              .content(content)
              .build();
      repository.save(message);
      history.nextIndex++;
      history.messages.addLast(new MessageEntry(role, content));
      trim(history);
    }
  }

  /** The last {@code limit} messages, oldest first. */
  public List<MessageEntry> recent(UUID sessionId, int limit) {
    History history = cache.get(sessionId, this::load);
    synchronized (history) {
      List<MessageEntry> all = new ArrayList<>(history.messages);
      return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }
  }

  /** Drops the cached copy and the stored messages. */
  public void clear(UUID sessionId) {
    cache.invalidate(sessionId);
    repository.deleteBySessionId(sessionId);
    log.debug("Cleared conversation memory for session {}", sessionId);
  }

  private History load(UUID sessionId) {
    List<ConversationMessage> newestFirst =
        repository.findRecentMessages(sessionId, Pageable.ofSize(maxMessages));
    History history = new History();
    for (int i = newestFirst.size() - 1; i >= 0; i--) {
      ConversationMessage message = newestFirst.get(i);
      history.messages.addLast(new MessageEntry(message.getRole(), message.getContent()));
    }
    history.nextIndex = newestFirst.isEmpty() ? 0 : newestFirst.get(0).getMessageIndex() + 1;
    if (!newestFirst.isEmpty()) {
      log.debug("Warmed {} messages for session {}", newestFirst.size(), sessionId);
    }
    return history;
  }

  private void trim(History history) {
    while (history.messages.size() > maxMessages) {
      history.messages.removeFirst();
    }
  }

  private static final class History {
    private final Deque<MessageEntry> messages = new ArrayDeque<>();
    private long nextIndex;
  }
}
