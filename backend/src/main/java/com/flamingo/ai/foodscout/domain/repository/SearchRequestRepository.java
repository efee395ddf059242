package com.flamingo.ai.foodscout.domain.repository;

import com.flamingo.ai.foodscout.domain.entity.SearchRequest;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for SearchRequest entities. */
@Repository
public interface SearchRequestRepository extends JpaRepository<SearchRequest, UUID> {

  Optional<SearchRequest> findBySessionIdAndTurnId(UUID sessionId, int turnId);

  Optional<SearchRequest> findFirstBySessionIdOrderByTurnIdDesc(UUID sessionId);

  /** Highest submitted turn id for a session, 0 when none. */
  @Query("SELECT COALESCE(MAX(r.turnId), 0) FROM SearchRequest r WHERE r.sessionId = :sessionId")
  int findMaxTurnId(@Param("sessionId") UUID sessionId);
}
