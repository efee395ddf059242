package com.flamingo.ai.foodscout.service.intent;

import com.flamingo.ai.foodscout.domain.model.SearchIntent;
import java.util.List;

/** Either a usable intent or the questions to ask before searching. */
public record IntentParseOutcome(SearchIntent intent, List<String> questions) {

  public IntentParseOutcome {
    questions = questions == null ? List.of() : List.copyOf(questions);
  }

  public static IntentParseOutcome ready(SearchIntent intent) {
    return new IntentParseOutcome(intent, List.of());
  }

  public static IntentParseOutcome clarify(List<String> questions) {
    return new IntentParseOutcome(null, questions);
  }

  public boolean needsClarification() {
    return intent == null;
  }
}
