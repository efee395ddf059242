package com.flamingo.ai.foodscout.domain.repository;

import com.flamingo.ai.foodscout.domain.entity.TurnResult;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for TurnResult entities. */
@Repository
public interface TurnResultRepository extends JpaRepository<TurnResult, UUID> {

  Optional<TurnResult> findBySessionIdAndTurnId(UUID sessionId, int turnId);

  Optional<TurnResult> findFirstBySessionIdOrderByTurnIdDesc(UUID sessionId);

  List<TurnResult> findBySessionIdOrderByTurnIdAsc(UUID sessionId);

  /** Highest stored turn id for a session, 0 when none. */
  @Query("SELECT COALESCE(MAX(t.turnId), 0) FROM TurnResult t WHERE t.sessionId = :sessionId")
  int findMaxTurnId(@Param("sessionId") UUID sessionId);
}
