package com.feedrelay.sources.timeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.feedrelay.core.model.FeedItem;

import java.time.Instant;
import java.util.Optional;

/**
 * Navigates the user-tweets document down to the newest tweet:
 * {@code result.timeline.instructions[].entries[].content.itemContent.tweet_results.result.legacy}.
 * Any missing step yields an empty result instead of an error.
 */
final class TimelineResponseParser {
    private TimelineResponseParser() {
    }

    static Optional<FeedItem> latestItem(JsonNode root, Instant observedAt) {
        if (root == null) {
            return Optional.empty();
        }
        JsonNode instructions = root.path("result").path("timeline").path("instructions");
        if (!instructions.isArray()) {
            return Optional.empty();
        }
        for (JsonNode instruction : instructions) {
            JsonNode entries = instruction.path("entries");
            if (!entries.isArray() || entries.isEmpty()) {
                continue;
            }
            // Only the first entry list holds the timeline; later ones are modules and cursors.
            for (JsonNode entry : entries) {
                Optional<FeedItem> item = itemFrom(entry, observedAt);
                if (item.isPresent()) {
                    return item;
                }
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    private static Optional<FeedItem> itemFrom(JsonNode entry, Instant observedAt) {
        JsonNode result = entry.path("content").path("itemContent").path("tweet_results").path("result");
        if (result.has("tweet")) {
            result = result.path("tweet");
        }
        JsonNode legacy = result.path("legacy");
        Optional<String> id = text(legacy, "id_str");
        Optional<String> text = text(legacy, "full_text");
        if (id.isEmpty() || text.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(FeedItem.observed(id.get(), text.get(), observedAt));
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}
