package com.feedrelay.core.model;

import com.feedrelay.core.util.ItemTextUtils;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The most recent item observed for a source identity on one poll. Never persisted.
 */
public record FeedItem(
        String id,
        String text,
        boolean retransmission,
        List<String> tags,
        Instant observedAt
) {
    public FeedItem {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static FeedItem observed(String id, String text, Instant observedAt) {
        return new FeedItem(
                id,
                text,
                ItemTextUtils.isRetransmission(text),
                ItemTextUtils.extractTags(text),
                observedAt
        );
    }
}
