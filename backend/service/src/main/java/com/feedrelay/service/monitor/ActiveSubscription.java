package com.feedrelay.service.monitor;

import java.time.Instant;

public record ActiveSubscription(String targetEndpoint, String sourceIdentity, Instant startedAt) {
}
