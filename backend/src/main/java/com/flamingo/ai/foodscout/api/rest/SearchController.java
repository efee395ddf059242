package com.flamingo.ai.foodscout.api.rest;

import com.flamingo.ai.foodscout.api.dto.request.SearchTurnRequest;
import com.flamingo.ai.foodscout.api.dto.response.RecoveryResponse;
import com.flamingo.ai.foodscout.api.dto.response.TurnSubmissionResponse;
import com.flamingo.ai.foodscout.service.session.SearchSessionService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for submitting turns, recovering results and resetting sessions. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

  private final SearchSessionService sessionService;

  /**
   * Submits a turn, or returns recovery info when only a session id is given.
   *
   * @return 202 with the subscribe URL for a new turn, 200 with recovery info otherwise
   */
  @PostMapping
  public ResponseEntity<?> submit(@Valid @RequestBody SearchTurnRequest request) {
    if (!request.hasQuery()) {
      if (request.getSessionId() == null) {
        throw new IllegalArgumentException("query is required to start a session");
      }
      return ResponseEntity.ok(
          RecoveryResponse.from(sessionService.recover(request.getSessionId(), null)));
    }

    TurnSubmissionResponse response =
        TurnSubmissionResponse.from(
            sessionService.submitTurn(request.getSessionId(), request.getQuery().trim()));
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
  }

  /** Gets recovery info for the latest or a specific turn. */
  @GetMapping("/{sessionId}/recovery")
  public ResponseEntity<RecoveryResponse> recover(
      @PathVariable UUID sessionId, @RequestParam(required = false) Integer turnId) {
    return ResponseEntity.ok(RecoveryResponse.from(sessionService.recover(sessionId, turnId)));
  }

  /** Starts the session over. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> reset(@PathVariable UUID sessionId) {
    log.info("Reset requested for session {}", sessionId);
    sessionService.reset(sessionId);
    return ResponseEntity.noContent().build();
  }
}
