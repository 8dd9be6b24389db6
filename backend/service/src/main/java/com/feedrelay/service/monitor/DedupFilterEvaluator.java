package com.feedrelay.service.monitor;

import com.feedrelay.core.model.FeedItem;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a fetched item should be relayed.
 *
 * <p>The dedup marker only advances on {@link Evaluation#NOTIFY}: the caller stores the item id
 * after acting on the decision, so an item rejected by the keyword filter leaves the marker where
 * it was and is simply rejected again on the next poll.
 */
public class DedupFilterEvaluator {

    public Evaluation evaluate(Optional<FeedItem> item, String lastSeenId, Set<String> keywords) {
        if (item.isEmpty()) {
            return Evaluation.SKIP_NO_ITEM;
        }
        FeedItem candidate = item.get();
        if (candidate.id().equals(lastSeenId)) {
            return Evaluation.SKIP_ALREADY_SEEN;
        }
        if (!matchesKeywords(candidate.text(), keywords)) {
            return Evaluation.SKIP_FILTERED;
        }
        return Evaluation.NOTIFY;
    }

    static boolean matchesKeywords(String text, Set<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return true;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(keyword -> lowered.contains(keyword.toLowerCase(Locale.ROOT)));
    }
}
