package com.flamingo.ai.foodscout.service.search;

import com.flamingo.ai.foodscout.domain.model.ConversationContext;
import com.flamingo.ai.foodscout.domain.model.RecommendationSet;
import com.flamingo.ai.foodscout.service.followup.FollowUpDecision;
import com.flamingo.ai.foodscout.service.stream.SearchEventEmitter;

/** Applies one kind of follow-up to the conversation's existing results. */
@FunctionalInterface
interface FollowUpHandler {

  RecommendationSet handle(
      FollowUpDecision decision, ConversationContext context, SearchEventEmitter emitter);
}
