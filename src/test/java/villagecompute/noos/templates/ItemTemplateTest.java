/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import org.junit.jupiter.api.Test;

import villagecompute.noos.data.models.TimelineEntry;

/**
 * Unit tests for {@link ItemTemplate} and the {@link CompiledTemplate} engine underneath it.
 */
class ItemTemplateTest {

    private static final ZonedDateTime PUBLISHED = ZonedDateTime.of(2024, 3, 5, 14, 7, 9, 0, ZoneOffset.UTC);

    private static TimelineEntry entry(String title, String description) {
        return TimelineEntry.published(title, description, "Example Blog", "https://example.com",
                "https://example.com/post", PUBLISHED);
    }

    @Test
    void testCompile_countsLiveAndEscapedOccurrences() {
        ItemTemplate template = ItemTemplate
                .compile("${title} ${title} \\${title} ${description} \\${source} ${title}");

        CompiledTemplate<ItemPlaceholder, TimelineEntry> compiled = template.compiled();
        assertEquals(3, compiled.occurrenceCount(ItemPlaceholder.TITLE));
        assertEquals(1, compiled.occurrenceCount(ItemPlaceholder.DESCRIPTION));
        assertEquals(0, compiled.occurrenceCount(ItemPlaceholder.SOURCE));
        assertEquals(2, compiled.escapedCount());
        assertTrue(compiled.contains(ItemPlaceholder.TITLE));
        assertFalse(compiled.contains(ItemPlaceholder.LINK));
    }

    @Test
    void testCompile_occurrencesAreOrderedByPosition() {
        ItemTemplate template = ItemTemplate.compile("${source}|${title}|${date}");

        var occurrences = template.compiled().occurrences();
        assertEquals(ItemPlaceholder.SOURCE, occurrences.get(0).placeholder());
        assertEquals(ItemPlaceholder.TITLE, occurrences.get(1).placeholder());
        assertEquals(ItemPlaceholder.DATE, occurrences.get(2).placeholder());
    }

    @Test
    void testRender_substitutesEveryPlaceholder() {
        ItemTemplate template = ItemTemplate.compile(
                "[${title}|${description}|${source}|${date}|${time}|${timestamp}]");

        String html = template.render(entry("Hello", "World"));

        assertEquals("[Hello|World|Example Blog|2024-03-05|14:07:09|" + PUBLISHED.toEpochSecond() + "]", html);
    }

    @Test
    void testRender_linksAreEscaped() {
        ItemTemplate template = ItemTemplate.compile("<a href=\"${link}\">${channel_link}</a>");

        String html = template.render(entry("t", "d"));

        assertEquals("<a href=\"https:&#x2F;&#x2F;example.com&#x2F;post\">https:&#x2F;&#x2F;example.com</a>", html);
    }

    @Test
    void testRender_zeroPlaceholders_returnsTemplateUnchanged() {
        String text = "<div class=\"static\">no placeholders here</div>";
        ItemTemplate template = ItemTemplate.compile(text);

        assertFalse(template.compiled().hasPlaceholders());
        assertEquals(text, template.render(entry("a", "b")));
    }

    @Test
    void testRender_isIdempotent() {
        ItemTemplate template = ItemTemplate.compile("<h2>${title}</h2><p>${description}</p>");
        TimelineEntry item = entry("Same", "Twice");

        assertEquals(template.render(item), template.render(item));
    }

    @Test
    void testRender_escapesHtmlInValues() {
        ItemTemplate template = ItemTemplate.compile("<h2>${title}</h2>");

        String html = template.render(entry("<script>x</script>", "d"));

        assertEquals("<h2>&lt;script&gt;x&lt;&#x2F;script&gt;</h2>", html);
        assertFalse(html.contains("<script>"));
    }

    @Test
    void testRender_escapesAmpersand() {
        ItemTemplate template = ItemTemplate.compile("${description}");

        assertEquals("Salt &amp; Pepper", template.render(entry("t", "Salt & Pepper")));
    }

    @Test
    void testRender_escapedPlaceholderIsLiteral() {
        ItemTemplate template = ItemTemplate.compile("Use \\${title} to show ${title}");

        assertEquals("Use ${title} to show Real", template.render(entry("Real", "d")));
    }

    @Test
    void testRender_doubleBackslashKeepsOneBackslash() {
        ItemTemplate template = ItemTemplate.compile("\\\\${title}");

        assertEquals("\\${title}", template.render(entry("x", "d")));
    }

    @Test
    void testRender_missingFieldsUseDefaults() {
        ItemTemplate template = ItemTemplate.compile("${title}|${description}|${source}|${date}|${time}");
        TimelineEntry undated = TimelineEntry.undated(null, null, null, null, null, 100L);

        assertEquals("(No title)|(No description)|(No source)||", template.render(undated));
    }

    @Test
    void testPredictLength_matchesRenderedLength() {
        ItemTemplate template = ItemTemplate
                .compile("<li>${title} &middot; ${source} \\${title} ${timestamp} ${link}</li>");
        TimelineEntry item = entry("A <b>bold</b> & \"quoted\" title", "d");

        assertEquals(template.render(item).length(), template.predictLength(item));
    }

    @Test
    void testRender_emptyFieldsStayEmpty() {
        ItemTemplate template = ItemTemplate.compile("${title}|${description}|${source}");
        TimelineEntry empty = TimelineEntry.undated("", "", "", "", "", 1L);

        assertEquals("||", template.render(empty));
    }

    @Test
    void testPredictLength_zeroPlaceholders() {
        String text = "<div class=\"static\">no placeholders here</div>";
        ItemTemplate template = ItemTemplate.compile(text);

        assertEquals(text.length(), template.predictLength(entry("a", "b")));
        assertEquals(template.render(entry("a", "b")).length(), template.predictLength(entry("a", "b")));
    }

    @Test
    void testPredictLength_onlyEscapedOccurrences() {
        ItemTemplate template = ItemTemplate.compile("abc\\${title}");

        assertEquals(11, template.predictLength(entry("ignored", "d")));
        assertEquals("abc${title}", template.render(entry("ignored", "d")));
    }
}
