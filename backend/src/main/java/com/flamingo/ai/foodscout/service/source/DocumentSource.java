package com.flamingo.ai.foodscout.service.source;

import com.flamingo.ai.foodscout.domain.model.SourceDocument;
import com.flamingo.ai.foodscout.exception.DocumentSourceException;
import java.util.Optional;

/** Client contract for the social-content source. */
public interface DocumentSource {

  /**
   * Searches for documents.
   *
   * @return matching documents, possibly empty; {@link SourceSearchResult#partial()} is set when
   *     the source reported that only part of the result could be produced
   * @throws DocumentSourceException when the source failed outright
   */
  SourceSearchResult search(String query, int maxResults, String sort);

  /**
   * Fetches one document with its comments.
   *
   * @return empty when the source does not know the id
   * @throws DocumentSourceException when the source failed outright
   */
  Optional<SourceDocument> fetch(String documentId);
}
