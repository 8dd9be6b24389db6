package com.feedrelay.sources.api;

import com.feedrelay.core.model.FeedItem;

import java.util.Objects;
import java.util.Optional;

public record FetchOutcome(Status status, FeedItem item, String errorMessage, Throwable cause) {
    public enum Status {
        ITEM,
        NO_ITEM,
        FAILURE
    }

    public FetchOutcome {
        Objects.requireNonNull(status, "status is required");
        if (status == Status.ITEM) {
            Objects.requireNonNull(item, "item is required for ITEM outcomes");
        }
    }

    public static FetchOutcome item(FeedItem item) {
        return new FetchOutcome(Status.ITEM, item, null, null);
    }

    public static FetchOutcome noItem() {
        return new FetchOutcome(Status.NO_ITEM, null, null, null);
    }

    public static FetchOutcome failure(String message, Throwable cause) {
        return new FetchOutcome(Status.FAILURE, null, message, cause);
    }

    public boolean failed() {
        return status == Status.FAILURE;
    }

    public Optional<FeedItem> latestItem() {
        return Optional.ofNullable(item);
    }
}
