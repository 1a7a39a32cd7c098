/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

import org.jboss.logging.Logger;
import villagecompute.noos.data.models.TimelineEntry;

/**
 * Compiled template for a single timeline entry.
 *
 * <p>
 * Supports the placeholders of {@link ItemPlaceholder}. Every substituted value is HTML-escaped. The output depends
 * only on the template and the entry: {@code ${date}}, {@code ${time}} and {@code ${timestamp}} come from the entry's
 * own publish data, never from the clock.
 *
 * <pre>
 * ItemTemplate item = ItemTemplate.compile("&lt;li&gt;&lt;a href=\"${link}\"&gt;${title}&lt;/a&gt;&lt;/li&gt;");
 * String html = item.render(entry);
 * </pre>
 */
public final class ItemTemplate {

    private static final Logger LOG = Logger.getLogger(ItemTemplate.class);

    private final CompiledTemplate<ItemPlaceholder, TimelineEntry> compiled;

    private ItemTemplate(CompiledTemplate<ItemPlaceholder, TimelineEntry> compiled) {
        this.compiled = compiled;
    }

    /**
     * Compiles item template text. Never fails on content; a template without any placeholder is logged.
     *
     * @param text
     *            raw template text
     * @return the compiled template
     */
    public static ItemTemplate compile(String text) {
        CompiledTemplate<ItemPlaceholder, TimelineEntry> compiled = CompiledTemplate.compile(text,
                ItemPlaceholder.class);
        if (!compiled.hasPlaceholders()) {
            LOG.warn("Item template contains no placeholders; every item will render identically");
        }
        return new ItemTemplate(compiled);
    }

    /**
     * Renders one entry.
     *
     * @param entry
     *            the entry
     * @return rendered HTML
     */
    public String render(TimelineEntry entry) {
        return compiled.render(entry);
    }

    /**
     * Computes the exact length {@link #render(TimelineEntry)} will produce for an entry.
     *
     * @param entry
     *            the entry
     * @return output length in chars
     */
    public int predictLength(TimelineEntry entry) {
        return compiled.predictLength(compiled.resolveValues(entry));
    }

    public CompiledTemplate<ItemPlaceholder, TimelineEntry> compiled() {
        return compiled;
    }

    public String text() {
        return compiled.text();
    }
}
