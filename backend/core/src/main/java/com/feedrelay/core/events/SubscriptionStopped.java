package com.feedrelay.core.events;

import java.time.Instant;

public record SubscriptionStopped(
        Instant timestamp,
        String targetEndpoint,
        String sourceIdentity,
        long runId,
        long pollCount
) implements Event {
    @Override
    public String type() {
        return "SubscriptionStopped";
    }
}
