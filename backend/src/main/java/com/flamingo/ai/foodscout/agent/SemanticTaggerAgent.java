package com.flamingo.ai.foodscout.agent;

import com.flamingo.ai.foodscout.agent.dto.CommentTagBatch;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Labels comment units with identity, sentiment, correction and shop mentions. Only labels come
 * back; all weighting happens in code.
 */
public interface SemanticTaggerAgent {

  @SystemMessage(
      """
        You label short social-media comments about restaurants.

        For every comment return exactly one tag with:
        - id: the comment id, copied verbatim
        - identity: how strongly the author reads as a local resident
            strong  = explicit ("I grew up here", "locals all go to", "been eating here 20 years")
            medium  = implicit (knows side streets, old names, compares with neighbourhood places)
            none    = no signal
        - sentiment: positive, neutral or negative, toward the shop(s) mentioned
        - isCorrection: true only if the comment corrects or disputes another claim
          ("no, the real one is on X street", "that place changed owners, go to Y instead")
        - shops: the shop names mentioned in the comment, as written; empty if none

        Rules:
        1. Do not compute scores or counts. Only label.
        2. Use only the values listed above for identity and sentiment.
        3. Do not invent shop names that are not in the comment or the document title.

        Return JSON: {"tags": [{"id", "identity", "sentiment", "isCorrection", "shops"}]}
        """)
  @UserMessage(
      """
        Document title: {{title}}

        Comments (JSON array of {id, text}):
        {{comments}}

        Return JSON with a tags array, one entry per comment id.
        """)
  CommentTagBatch tag(@V("title") String title, @V("comments") String comments);
}
