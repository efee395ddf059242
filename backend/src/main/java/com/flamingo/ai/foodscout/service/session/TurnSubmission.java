package com.flamingo.ai.foodscout.service.session;

import java.util.UUID;

/** Accepted turn: where to subscribe for its events. */
public record TurnSubmission(UUID sessionId, int turnId, String subscribeUrl) {}
