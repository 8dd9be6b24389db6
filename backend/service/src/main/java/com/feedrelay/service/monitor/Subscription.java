package com.feedrelay.service.monitor;

import com.feedrelay.core.model.SubscriptionKey;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A configured monitor. Keywords are lower-cased and de-duplicated; an empty set matches everything.
 */
public record Subscription(SubscriptionKey key, Set<String> keywords) {
    public Subscription {
        Objects.requireNonNull(key, "key is required");
        keywords = normalize(keywords);
    }

    public static Subscription of(String targetEndpoint, String sourceIdentity, Collection<String> keywords) {
        return new Subscription(new SubscriptionKey(trimmed(targetEndpoint), trimmed(sourceIdentity)), normalize(keywords));
    }

    public String targetEndpoint() {
        return key.targetEndpoint();
    }

    public String sourceIdentity() {
        return key.sourceIdentity();
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    private static Set<String> normalize(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String keyword : raw) {
            if (keyword != null && !keyword.isBlank()) {
                normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(normalized);
    }
}
