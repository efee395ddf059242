package com.flamingo.ai.foodscout.domain.entity;

import com.flamingo.ai.foodscout.domain.converter.RecommendationListConverter;
import com.flamingo.ai.foodscout.domain.converter.SearchIntentConverter;
import com.flamingo.ai.foodscout.domain.converter.StringListConverter;
import com.flamingo.ai.foodscout.domain.enums.FollowUpType;
import com.flamingo.ai.foodscout.domain.model.RestaurantRecommendation;
import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Durable snapshot of one completed turn. Written only after the turn's in-memory work succeeded;
 * read back for recovery and for restoring a session after a restart.
 */
@Entity
@Table(
    name = "turn_results",
    uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "turn_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TurnResult {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "session_id", nullable = false)
  private UUID sessionId;

  @Column(name = "turn_id", nullable = false)
  private int turnId;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String query;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private FollowUpType action;

  /** Intent in force after this turn, null until the first successful search. */
  @Convert(converter = SearchIntentConverter.class)
  @Column(columnDefinition = "TEXT")
  private SearchIntent intent;

  @Convert(converter = RecommendationListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<RestaurantRecommendation> recommendations = new ArrayList<>();

  @Convert(converter = RecommendationListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<RestaurantRecommendation> filtered = new ArrayList<>();

  @Column(columnDefinition = "TEXT")
  private String summary;

  private int filteredCount;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> documentIds = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> excludedShops = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }

  public boolean hasRecommendations() {
    return recommendations != null && !recommendations.isEmpty();
  }
}
