package com.flamingo.ai.foodscout.exception;

/** Exception thrown when the semantic tagger cannot label a batch; triggers the legacy path. */
public class SemanticTaggingException extends RuntimeException {

  private final String documentId;

  public SemanticTaggingException(String documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
  }

  public SemanticTaggingException(String documentId, String message) {
    this(documentId, message, null);
  }

  public String getDocumentId() {
    return documentId;
  }
}
