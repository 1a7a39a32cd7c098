/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link PlaceholderScanner}.
 */
class PlaceholderScannerTest {

    @Test
    void testFind_returnsEveryLiveOccurrenceInOrder() {
        String template = "${title} and ${title} again ${title}";

        List<PlaceholderSpan> spans = PlaceholderScanner.find(template, "title");

        assertEquals(3, spans.size());
        assertEquals(new PlaceholderSpan(0, 8, false), spans.get(0));
        assertEquals(new PlaceholderSpan(13, 21, false), spans.get(1));
        assertEquals(new PlaceholderSpan(28, 36, false), spans.get(2));
    }

    @Test
    void testFind_skipsEscapedOccurrences() {
        String template = "a ${title} b \\${title} c ${title}";

        List<PlaceholderSpan> live = PlaceholderScanner.find(template, "title");
        List<PlaceholderSpan> all = PlaceholderScanner.scan(template, "title");

        assertEquals(2, live.size());
        assertEquals(3, all.size());
        assertTrue(all.get(1).escaped());
        // escaped span starts at the backslash
        assertEquals(13, all.get(1).start());
        assertEquals(22, all.get(1).end());
    }

    @Test
    void testFind_placeholderAtStartOfTemplateIsLive() {
        List<PlaceholderSpan> spans = PlaceholderScanner.find("${items}</body>", "items");

        assertEquals(1, spans.size());
        assertEquals(0, spans.get(0).start());
    }

    @Test
    void testFind_noOccurrences_returnsEmpty() {
        assertTrue(PlaceholderScanner.find("<p>nothing here</p>", "title").isEmpty());
        assertTrue(PlaceholderScanner.find("", "title").isEmpty());
    }

    @Test
    void testFind_doesNotMatchLongerName() {
        assertTrue(PlaceholderScanner.find("${titles} ${title_x}", "title").isEmpty());
    }

    @Test
    void testScan_rejectsInvalidNames() {
        assertThrows(IllegalArgumentException.class, () -> PlaceholderScanner.scan("x", "bad name"));
        assertThrows(IllegalArgumentException.class, () -> PlaceholderScanner.scan("x", ""));
        assertThrows(IllegalArgumentException.class, () -> PlaceholderScanner.scan("x", null));
    }

    @Test
    void testLiteral() {
        assertEquals("${channel_count}", PlaceholderScanner.literal("channel_count"));
        assertFalse(PlaceholderScanner.literal("x").contains("\\"));
    }

    @Test
    void testFind_offsetsAreCharIndices() {
        // U+1F4F0 takes two chars, "é" one
        String template = "\uD83D\uDCF0 é ${title}";

        List<PlaceholderSpan> spans = PlaceholderScanner.find(template, "title");

        assertEquals(new PlaceholderSpan(5, 13, false), spans.get(0));
        assertEquals("${title}", template.substring(spans.get(0).start(), spans.get(0).end()));
    }
}
