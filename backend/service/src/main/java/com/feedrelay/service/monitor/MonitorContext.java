package com.feedrelay.service.monitor;

import com.feedrelay.core.bus.EventBus;
import com.feedrelay.service.notify.MessageFormatter;
import com.feedrelay.service.notify.NotificationSink;
import com.feedrelay.sources.api.ContentSource;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public record MonitorContext(
        ContentSource contentSource,
        NotificationSink notificationSink,
        MessageFormatter formatter,
        DedupFilterEvaluator evaluator,
        EventBus eventBus,
        Clock clock,
        Duration pollInterval
) {
    public MonitorContext {
        Objects.requireNonNull(contentSource, "contentSource is required");
        Objects.requireNonNull(notificationSink, "notificationSink is required");
        Objects.requireNonNull(formatter, "formatter is required");
        Objects.requireNonNull(evaluator, "evaluator is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(pollInterval, "pollInterval is required");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }
}
