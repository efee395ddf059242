package com.flamingo.ai.foodscout.domain.model;

import java.util.List;

/** A post from the content source. Identity is the external id. */
public record SourceDocument(String id, String title, String content, List<RawComment> comments) {

  public SourceDocument {
    title = title == null ? "" : title;
    content = content == null ? "" : content;
    comments = comments == null ? List.of() : List.copyOf(comments);
  }

  public boolean hasComments() {
    return !comments.isEmpty();
  }

  public SourceDocument withComments(List<RawComment> fetched) {
    return new SourceDocument(id, title, content, fetched);
  }
}
