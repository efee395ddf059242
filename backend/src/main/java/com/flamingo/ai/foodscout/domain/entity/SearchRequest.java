package com.flamingo.ai.foodscout.domain.entity;

import com.flamingo.ai.foodscout.domain.enums.RequestStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Status record for one submitted turn. A LOADING row with no result means it was interrupted. */
@Entity
@Table(name = "search_requests")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchRequest {

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
  @Builder.Default
  private RequestStatus status = RequestStatus.LOADING;

  @Column(columnDefinition = "TEXT")
  private String errorDetail;

  private Integer resultCount;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
