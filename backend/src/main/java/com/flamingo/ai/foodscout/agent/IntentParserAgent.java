package com.flamingo.ai.foodscout.agent;

import com.flamingo.ai.foodscout.agent.dto.ParsedIntent;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Extracts a search intent (where, what, constraints) from a free-text request. */
public interface IntentParserAgent {

  @SystemMessage(
      """
        You turn a food-search request into a structured search intent.

        Fields:
        - location: city or neighbourhood to search in; may come from earlier turns
        - foodType: the kind of food, empty if unspecified
        - requirements: extra positive wishes ("open late", "cheap", "no queue")
        - excludeKeywords: things the user does not want
        - needClarify: true when no location can be determined
        - questions: when needClarify is true, one or two short questions to ask the user

        Return JSON: {"needClarify", "questions", "location", "foodType", "requirements",
        "excludeKeywords"}
        """)
  @UserMessage(
      """
        Conversation so far:
        {{history}}

        Request: {{message}}
        """)
  ParsedIntent parse(@V("history") String history, @V("message") String message);
}
