package com.feedrelay.core.model;

import java.util.Objects;

public record SubscriptionKey(String targetEndpoint, String sourceIdentity) {
    public SubscriptionKey {
        Objects.requireNonNull(targetEndpoint, "targetEndpoint is required");
        Objects.requireNonNull(sourceIdentity, "sourceIdentity is required");
        if (targetEndpoint.isBlank()) {
            throw new IllegalArgumentException("targetEndpoint must not be blank");
        }
        if (sourceIdentity.isBlank()) {
            throw new IllegalArgumentException("sourceIdentity must not be blank");
        }
    }

    public boolean belongsTo(String endpoint) {
        return targetEndpoint.equals(endpoint);
    }

    @Override
    public String toString() {
        return targetEndpoint + "/" + sourceIdentity;
    }
}
