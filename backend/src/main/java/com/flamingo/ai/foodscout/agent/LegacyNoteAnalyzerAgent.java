package com.flamingo.ai.foodscout.agent;

import com.flamingo.ai.foodscout.agent.dto.NoteAnalysis;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Single-pass document analysis used when comment-level tagging is unavailable. Judges shops from
 * the whole document at once, without the per-comment contract.
 */
public interface LegacyNoteAnalyzerAgent {

  @SystemMessage(
      """
        You read a social-media post about food and its comments, and list the restaurants it
        mentions, judging for each whether locals genuinely go there or whether it is mostly
        popular through paid promotion.

        Signals of a genuine local place: locals vouching for it, many years in business,
        corrections from residents, complaints about decor but praise for food.
        Signals of a promoted place: photo-spot focus, queues of tourists, identical praise,
        influencer tie-ins, complaints that it is overrated.

        For each restaurant return:
        - name, location, features (short phrases)
        - verdict: genuine, likely_genuine, unknown, likely_promoted or promoted
        - confidence: 0.0 to 1.0
        - reasons: short phrases supporting the verdict
        - hasLocalMentions: true if a local resident vouches for it

        Skip any restaurant matching the excluded keywords.

        Return JSON: {"restaurants": [...]}
        """)
  @UserMessage(
      """
        Title: {{title}}

        Post:
        {{content}}

        Comments (engagement in brackets):
        {{comments}}

        Excluded keywords: {{exclude}}
        """)
  NoteAnalysis analyze(
      @V("title") String title,
      @V("content") String content,
      @V("comments") String comments,
      @V("exclude") String exclude);
}
