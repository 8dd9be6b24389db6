package com.feedrelay.core.events;

import java.time.Instant;

public record ItemRelayed(
        Instant timestamp,
        String targetEndpoint,
        String sourceIdentity,
        String itemId,
        boolean delivered
) implements Event {
    @Override
    public String type() {
        return "ItemRelayed";
    }
}
