package com.feedrelay.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ItemTextUtils {
    public static final String RETRANSMISSION_PREFIX = "RT ";

    private static final Pattern TAG_PATTERN = Pattern.compile("#\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private ItemTextUtils() {
    }

    public static boolean isRetransmission(String text) {
        return text != null && text.startsWith(RETRANSMISSION_PREFIX);
    }

    /**
     * Hash-prefixed tokens in order of appearance. Repeats are kept.
     */
    public static List<String> extractTags(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Matcher matcher = TAG_PATTERN.matcher(text);
        List<String> tags = new ArrayList<>();
        while (matcher.find()) {
            tags.add(matcher.group());
        }
        return List.copyOf(tags);
    }
}
