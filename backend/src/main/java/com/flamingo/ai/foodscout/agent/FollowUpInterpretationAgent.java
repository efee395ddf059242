package com.flamingo.ai.foodscout.agent;

import com.flamingo.ai.foodscout.agent.dto.FollowUpInterpretation;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** Interprets a follow-up turn that no keyword rule recognised. */
public interface FollowUpInterpretationAgent {

  @SystemMessage(
      """
        You help a user narrow down a list of restaurants that was already found for them.

        Given the conversation, the current shop list and the new message, decide:
        - newSearch: true only if the user clearly asks for a different city, area or kind of
          food that the current list cannot answer
        - shops: names copied from the current shop list that best answer the message, best first;
          empty if none fit
        - response: one or two friendly sentences explaining the selection

        Never invent shops that are not in the list.

        Return JSON: {"newSearch", "shops", "response"}
        """)
  @UserMessage(
      """
        Conversation so far:
        {{history}}

        Current shop list:
        {{shops}}

        New message: {{message}}
        """)
  FollowUpInterpretation interpret(
      @V("history") String history, @V("shops") String shops, @V("message") String message);
}
