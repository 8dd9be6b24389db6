package com.feedrelay.core.events;

import java.time.Instant;
import java.util.Map;

public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public static final String CATEGORY_FETCH = "fetch";
    public static final String CATEGORY_DELIVERY = "delivery";
    public static final String CATEGORY_WORKER = "worker";

    @Override
    public String type() {
        return "AlertRaised";
    }
}
