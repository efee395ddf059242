package com.flamingo.ai.foodscout.domain.model;

/**
 * A comment as delivered by the document source.
 *
 * @param text free text, possibly carrying inline engagement markup such as "[112 likes]"
 * @param likes explicit engagement count, null when the source did not report one
 * @param subCommentCount replies under this comment, null when unknown
 */
public record RawComment(String text, Integer likes, Integer subCommentCount) {

  public static RawComment of(String text) {
    return new RawComment(text, null, null);
  }
}
