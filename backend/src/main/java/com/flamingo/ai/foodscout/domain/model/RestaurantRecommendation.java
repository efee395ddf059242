package com.flamingo.ai.foodscout.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A recommended (or filtered) shop. Created during merge, adjusted by the corroboration rules and
 * never deleted: exclusion only clears {@code recommended} and records a reason.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RestaurantRecommendation {

  private String name;

  private String location;

  @Builder.Default private List<String> features = new ArrayList<>();

  @Builder.Default private List<String> sourceDocumentIds = new ArrayList<>();

  private double confidence;

  private ShopAssessment assessment;

  @Builder.Default private boolean recommended = true;

  private String filterReason;

  // Enrichment fields
  private String address;
  private String phone;
  private Double rating;
  @Builder.Default private List<String> photos = new ArrayList<>();
  @Builder.Default private List<String> tags = new ArrayList<>();
  @Builder.Default private List<String> pros = new ArrayList<>();
  @Builder.Default private List<String> cons = new ArrayList<>();
  @Builder.Default private List<String> mustTry = new ArrayList<>();
  @Builder.Default private List<String> avoid = new ArrayList<>();

  /** Number of distinct documents backing this shop. */
  public int sourceCount() {
    return (int) sourceDocumentIds.stream().distinct().count();
  }

  /** Deep enough copy for snapshots handed to events and storage. */
  public RestaurantRecommendation copy() {
    return toBuilder()
        .features(new ArrayList<>(features))
        .sourceDocumentIds(new ArrayList<>(sourceDocumentIds))
        .photos(new ArrayList<>(photos))
        .tags(new ArrayList<>(tags))
        .pros(new ArrayList<>(pros))
        .cons(new ArrayList<>(cons))
        .mustTry(new ArrayList<>(mustTry))
        .avoid(new ArrayList<>(avoid))
        .build();
  }

  public void markFiltered(String reason) {
    this.recommended = false;
    this.filterReason = reason;
  }

  public void applyPoi(PoiRecord poi) {
    if (poi.address() != null) {
      this.address = poi.address();
    }
    if (poi.phone() != null) {
      this.phone = poi.phone();
    }
    if (poi.rating() != null) {
      this.rating = poi.rating();
    }
    if (poi.photos() != null) {
      this.photos = new ArrayList<>(poi.photos());
    }
    if (poi.tags() != null) {
      this.tags = new ArrayList<>(poi.tags());
    }
  }
}
