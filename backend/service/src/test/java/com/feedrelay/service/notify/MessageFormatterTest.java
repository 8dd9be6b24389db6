package com.feedrelay.service.notify;

import com.feedrelay.core.model.FeedItem;
import com.feedrelay.service.config.PresentationConfig;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageFormatterTest {
    private static final Instant OBSERVED = Instant.parse("2026-02-12T20:00:00Z");

    private final MessageFormatter formatter =
            new MessageFormatter(ZoneId.of("Asia/Kolkata"), "IST", "https://twitter.com/i/web/status/%s");

    @Test
    void retransmissionWithTagsRendersEveryField() {
        FeedItem item = FeedItem.observed("1893001", "RT check this out #space #news", OBSERVED);

        String message = formatter.newItem("NASA", item);

        String expected = "[2026-02-13 01:30:00 IST] New tweet detected!\n"
                + "Twitter User: NASA\n"
                + "Tweet ID: 1893001\n"
                + "Type: Retweet\n"
                + "Hashtags: #space, #news\n"
                + "Content: RT check this out #space #news\n"
                + "Link: https://twitter.com/i/web/status/1893001\n"
                + "-".repeat(50);
        assertEquals(expected, message);
    }

    @Test
    void originalWithoutTagsSaysNone() {
        FeedItem item = FeedItem.observed("5", "Plain update", OBSERVED);

        String message = formatter.newItem("esa", item);

        assertTrue(message.contains("Type: Original Tweet\n"));
        assertTrue(message.contains("Hashtags: None\n"));
    }

    @Test
    void blankZoneLabelIsOmitted() {
        MessageFormatter utc = new MessageFormatter(ZoneId.of("UTC"), " ", "https://x.test/%s");

        String message = utc.newItem("esa", FeedItem.observed("5", "x", OBSERVED));

        assertTrue(message.startsWith("[2026-02-12 20:00:00] New tweet detected!"));
        assertTrue(message.contains("Link: https://x.test/5\n"));
    }

    @Test
    void diagnosticsNameTheSource() {
        assertEquals("Could not fetch tweets for NASA, retrying: status 503",
                formatter.fetchFailure("NASA", "status 503"));
        assertEquals("An error occurred in tweet monitor for NASA: java.lang.IllegalStateException: boom",
                formatter.workerFault("NASA", new IllegalStateException("boom")));
    }

    @Test
    void fromDefaultPresentationConfig() {
        MessageFormatter fromConfig = MessageFormatter.from(new PresentationConfig(null, null, null));

        assertEquals("https://twitter.com/i/web/status/42", fromConfig.permalink("42"));
        assertTrue(fromConfig.newItem("NASA", FeedItem.observed("42", "x", OBSERVED)).startsWith("[2026-02-13 01:30:00 IST]"));
    }
}
