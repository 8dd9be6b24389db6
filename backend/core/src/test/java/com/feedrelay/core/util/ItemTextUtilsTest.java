package com.feedrelay.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ItemTextUtilsTest {
    @Test
    void retransmissionRequiresExactPrefix() {
        assertTrue(ItemTextUtils.isRetransmission("RT check this out #space #news"));
        assertFalse(ItemTextUtils.isRetransmission("rt lowercase does not count"));
        assertFalse(ItemTextUtils.isRetransmission("RTX 4090 announced"));
        assertFalse(ItemTextUtils.isRetransmission(" RT leading space"));
        assertFalse(ItemTextUtils.isRetransmission(null));
    }

    @Test
    void tagsKeepOrderAndDuplicates() {
        assertEquals(List.of("#space", "#news"), ItemTextUtils.extractTags("RT check this out #space #news"));
        assertEquals(List.of("#a", "#b", "#a"), ItemTextUtils.extractTags("#a then #b then #a again"));
        assertEquals(List.of("#launch_day", "#2026"), ItemTextUtils.extractTags("#launch_day!! #2026."));
    }

    @Test
    void tagsMatchNonLatinLetters() {
        assertEquals(List.of("#café", "#日本", "#Zürich"), ItemTextUtils.extractTags("Visit #café #日本 #Zürich"));
        assertEquals(List.of("#चंद्रयान३"), ItemTextUtils.extractTags("Proud moment #चंद्रयान३ for ISRO"));
    }

    @Test
    void tagsEmptyWhenNoneOrBlank() {
        assertEquals(List.of(), ItemTextUtils.extractTags("no tags here # nope"));
        assertEquals(List.of(), ItemTextUtils.extractTags(""));
        assertEquals(List.of(), ItemTextUtils.extractTags(null));
    }
}
