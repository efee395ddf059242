package com.flamingo.ai.foodscout.exception;

/**
 * Exception thrown when the document source fails outright. Distinct from an empty result, and
 * never propagated past the search orchestrator.
 */
public class DocumentSourceException extends RuntimeException {

  private final String query;

  public DocumentSourceException(String query, String message, Throwable cause) {
    super(message, cause);
    this.query = query;
  }

  public DocumentSourceException(String query, String message) {
    this(query, message, null);
  }

  public String getQuery() {
    return query;
  }
}
