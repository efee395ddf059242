package com.flamingo.ai.foodscout.api.dto.response;

import com.flamingo.ai.foodscout.service.session.TurnSubmission;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an accepted turn. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnSubmissionResponse {

  private UUID sessionId;
  private int turnId;
  private String subscribeUrl;

  public static TurnSubmissionResponse from(TurnSubmission submission) {
    return TurnSubmissionResponse.builder()
        .sessionId(submission.sessionId())
        .turnId(submission.turnId())
        .subscribeUrl(submission.subscribeUrl())
        .build();
  }
}
