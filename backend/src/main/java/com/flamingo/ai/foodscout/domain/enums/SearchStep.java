package com.flamingo.ai.foodscout.domain.enums;

/** Steps reported to subscribers while a turn runs, with the progress reached at each. */
public enum SearchStep {
  INTENT("intent", "Understanding the request", 5),
  BROAD("phase1", "Searching broadly", 20),
  HIDDEN("phase2", "Digging for hidden gems", 35),
  VERIFY("phase3", "Verifying candidate shops", 50),
  CATEGORY("phase4", "Searching the food category", 60),
  EXPAND("expand", "Looking for more places", 50),
  ANALYSIS("analysis", "Scoring comments", 85),
  ENRICHMENT("enrichment", "Adding shop details", 95);

  private final String id;
  private final String title;
  private final int progress;

  SearchStep(String id, String title, int progress) {
    this.id = id;
    this.title = title;
    this.progress = progress;
  }

  public String getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public int getProgress() {
    return progress;
  }
}
