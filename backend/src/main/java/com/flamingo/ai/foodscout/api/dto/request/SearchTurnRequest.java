package com.flamingo.ai.foodscout.api.dto.request;

import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the search endpoint. Without a session id a new session is opened; with a
 * session id and no query the session's recovery info is returned instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchTurnRequest {

  private UUID sessionId;

  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  public boolean hasQuery() {
    return query != null && !query.isBlank();
  }
}
