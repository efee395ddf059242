package com.flamingo.ai.foodscout.domain.repository;

import com.flamingo.ai.foodscout.domain.entity.ConversationMessage;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for ConversationMessage entities. */
@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, UUID> {

  /** Finds recent messages for a session, newest first. */
  @Query(
      "SELECT m FROM ConversationMessage m WHERE m.sessionId = :sessionId "
          + "ORDER BY m.messageIndex DESC")
  List<ConversationMessage> findRecentMessages(
      @Param("sessionId") UUID sessionId, Pageable pageable);

  long countBySessionId(UUID sessionId);

  /** Deletes all messages for a session. */
  @Transactional
  void deleteBySessionId(UUID sessionId);
}
