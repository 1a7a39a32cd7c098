/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

import org.jboss.logging.Logger;
import villagecompute.noos.data.models.TimelineEntry;
import villagecompute.noos.services.TimelineStore;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Compiled template for the page surrounding the timeline items.
 *
 * <p>
 * Rendering selects every entry whose timestamp is not after the render time, orders them newest first (entries with
 * equal timestamps keep their insertion order), renders each with the supplied {@link ItemTemplate} and substitutes
 * the concatenation for every {@code ${items}}. The remaining placeholders of {@link PagePlaceholder} are computed
 * from the selected entries and the render clock on every call.
 *
 * <p>
 * A page template without {@code ${items}} is a template author error: it is logged and the text is returned
 * unchanged.
 */
public final class PageTemplate {

    private static final Logger LOG = Logger.getLogger(PageTemplate.class);

    private static final Comparator<TimelineEntry> NEWEST_FIRST = Comparator
            .comparingLong(TimelineEntry::timestamp).reversed();

    private final CompiledTemplate<PagePlaceholder, PageRenderContext> compiled;
    private final ZoneId zone;

    private PageTemplate(CompiledTemplate<PagePlaceholder, PageRenderContext> compiled, ZoneId zone) {
        this.compiled = compiled;
        this.zone = zone;
    }

    /**
     * Compiles page template text, formatting render dates in UTC.
     */
    public static PageTemplate compile(String text) {
        return compile(text, ZoneOffset.UTC);
    }

    /**
     * Compiles page template text.
     *
     * @param text
     *            raw template text
     * @param zone
     *            zone used for {@code ${date}} and {@code ${time}}
     * @return the compiled template
     */
    public static PageTemplate compile(String text, ZoneId zone) {
        Objects.requireNonNull(zone, "zone");
        return new PageTemplate(CompiledTemplate.compile(text, PagePlaceholder.class), zone);
    }

    /**
     * Renders the page from a point-in-time snapshot of the store. The store lock is released before rendering starts.
     *
     * @param store
     *            timeline store
     * @param itemTemplate
     *            template for each entry
     * @param renderTime
     *            render wall-clock
     * @return rendered HTML
     */
    public String render(TimelineStore store, ItemTemplate itemTemplate, Instant renderTime) {
        return render(store.snapshot(), itemTemplate, renderTime);
    }

    /**
     * Renders the page from a list of entries in any order.
     *
     * @param entries
     *            candidate entries
     * @param itemTemplate
     *            template for each entry
     * @param renderTime
     *            render wall-clock
     * @return rendered HTML
     */
    public String render(List<TimelineEntry> entries, ItemTemplate itemTemplate, Instant renderTime) {
        if (!compiled.contains(PagePlaceholder.ITEMS)) {
            LOG.warnf("No %s placeholder found in page template, rendering it unchanged",
                    PagePlaceholder.ITEMS.literal());
            return compiled.text();
        }
        return compiled.render(buildContext(entries, itemTemplate, renderTime));
    }

    /**
     * Computes the exact length {@link #render(List, ItemTemplate, Instant)} will produce.
     */
    public int predictLength(List<TimelineEntry> entries, ItemTemplate itemTemplate, Instant renderTime) {
        if (!compiled.contains(PagePlaceholder.ITEMS)) {
            return compiled.text().length();
        }
        return compiled.predictLength(compiled.resolveValues(buildContext(entries, itemTemplate, renderTime)));
    }

    /**
     * Drops entries dated after the render time and orders the rest newest first.
     *
     * @param entries
     *            candidate entries
     * @param renderTime
     *            render wall-clock
     * @return selected entries
     */
    public static List<TimelineEntry> selectEntries(List<TimelineEntry> entries, Instant renderTime) {
        long now = renderTime.getEpochSecond();
        return entries.stream().filter(entry -> entry.timestamp() <= now).sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    private PageRenderContext buildContext(List<TimelineEntry> entries, ItemTemplate itemTemplate,
            Instant renderTime) {
        List<TimelineEntry> selected = selectEntries(entries, renderTime);
        int skipped = entries.size() - selected.size();
        if (skipped > 0) {
            LOG.debugf("Skipping %d timeline entries dated in the future", skipped);
        }

        StringBuilder items = new StringBuilder();
        for (TimelineEntry entry : selected) {
            items.append(itemTemplate.render(entry));
        }

        long channelCount = selected.stream().map(TimelineEntry::sourceLink).distinct().count();
        return new PageRenderContext(selected, items.toString(), channelCount, renderTime.atZone(zone));
    }

    public CompiledTemplate<PagePlaceholder, PageRenderContext> compiled() {
        return compiled;
    }

    public String text() {
        return compiled.text();
    }

    public ZoneId zone() {
        return zone;
    }
}
