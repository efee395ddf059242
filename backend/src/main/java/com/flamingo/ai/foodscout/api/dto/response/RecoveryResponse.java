package com.flamingo.ai.foodscout.api.dto.response;

import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import com.flamingo.ai.foodscout.domain.enums.RecoveryStatus;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.service.session.RecoveryInfo;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for session recovery. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryResponse {

  private UUID sessionId;
  private Integer turnId;
  private RecoveryStatus status;
  private String subscribeUrl;
  private int lastEventIndex;
  private FollowUpType action;
  private List<RestaurantRecommendation> recommendations;
  private int filteredCount;
  private String summary;
  private String errorDetail;
  private String source;

  public static RecoveryResponse from(RecoveryInfo info) {
    return RecoveryResponse.builder()
        .sessionId(info.sessionId())
        .turnId(info.turnId())
        .status(info.status())
        .subscribeUrl(info.subscribeUrl())
        .lastEventIndex(info.lastEventIndex())
        .action(info.action())
        .recommendations(info.recommendations())
        .filteredCount(info.filteredCount())
        .summary(info.summary())
        .errorDetail(info.errorDetail())
        .source(info.source())
        .build();
  }
}
