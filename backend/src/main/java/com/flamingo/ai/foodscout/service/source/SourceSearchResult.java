package com.flamingo.ai.foodscout.service.source;

import com.flamingo.ai.foodscout.domain.model.SourceDocument;
import java.util.List;

/** Documents returned for one query. */
public record SourceSearchResult(List<SourceDocument> documents, boolean partial) {

  public SourceSearchResult {
    documents = documents == null ? List.of() : List.copyOf(documents);
  }

  public static SourceSearchResult of(List<SourceDocument> documents) {
    return new SourceSearchResult(documents, false);
  }

  public static SourceSearchResult empty() {
    return new SourceSearchResult(List.of(), false);
  }
}
