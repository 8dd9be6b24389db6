package com.feedrelay.service.notify;

import com.feedrelay.core.model.FeedItem;
import com.feedrelay.service.config.PresentationConfig;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

public final class MessageFormatter {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);
    private static final String SEPARATOR = "-".repeat(50);

    private final ZoneId zone;
    private final String zoneLabel;
    private final String permalinkTemplate;

    public MessageFormatter(ZoneId zone, String zoneLabel, String permalinkTemplate) {
        this.zone = Objects.requireNonNull(zone, "zone is required");
        this.zoneLabel = zoneLabel == null ? "" : zoneLabel.trim();
        this.permalinkTemplate = Objects.requireNonNull(permalinkTemplate, "permalinkTemplate is required");
    }

    public static MessageFormatter from(PresentationConfig config) {
        return new MessageFormatter(ZoneId.of(config.zone()), config.zoneLabel(), config.permalinkTemplate());
    }

    public String newItem(String sourceIdentity, FeedItem item) {
        String tags = item.tags().isEmpty() ? "None" : String.join(", ", item.tags());
        return "[" + timestamp(item) + "] New tweet detected!\n"
                + "Twitter User: " + sourceIdentity + "\n"
                + "Tweet ID: " + item.id() + "\n"
                + "Type: " + (item.retransmission() ? "Retweet" : "Original Tweet") + "\n"
                + "Hashtags: " + tags + "\n"
                + "Content: " + item.text() + "\n"
                + "Link: " + permalink(item.id()) + "\n"
                + SEPARATOR;
    }

    public String fetchFailure(String sourceIdentity, String detail) {
        return "Could not fetch tweets for " + sourceIdentity + ", retrying: " + detail;
    }

    public String workerFault(String sourceIdentity, Exception error) {
        return "An error occurred in tweet monitor for " + sourceIdentity + ": " + error;
    }

    public String permalink(String itemId) {
        return String.format(Locale.ROOT, permalinkTemplate, itemId);
    }

    private String timestamp(FeedItem item) {
        String formatted = TIMESTAMP.format(item.observedAt().atZone(zone));
        return zoneLabel.isEmpty() ? formatted : formatted + " " + zoneLabel;
    }
}
