package com.feedrelay.core.events;

import java.time.Instant;
import java.util.Set;

public record SubscriptionStarted(
        Instant timestamp,
        String targetEndpoint,
        String sourceIdentity,
        long runId,
        Set<String> keywords
) implements Event {
    @Override
    public String type() {
        return "SubscriptionStarted";
    }
}
