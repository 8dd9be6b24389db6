package com.feedrelay.service.config;

import com.feedrelay.sources.config.TimelineSourceConfig;

import java.time.Duration;

public record RelayConfig(
        int port,
        Duration pollInterval,
        Duration connectTimeout,
        TimelineSourceConfig timeline,
        TelegramConfig telegram,
        PresentationConfig presentation
) {
    public RelayConfig {
        port = port <= 0 ? 8080 : port;
        pollInterval = pollInterval == null ? Duration.ofSeconds(5) : pollInterval;
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
        timeline = timeline == null ? new TimelineSourceConfig(null, null, null, 0, null) : timeline;
        telegram = telegram == null ? new TelegramConfig(null, null) : telegram;
        presentation = presentation == null ? new PresentationConfig(null, null, null) : presentation;
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }
}
