/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

import java.util.function.Function;

/**
 * Placeholders available in page templates.
 *
 * <p>
 * {@link #ITEMS} carries the concatenated item renderings and is the only value spliced in without escaping; its
 * entries were escaped when each item was rendered. {@link #DATE}, {@link #TIME} and {@link #TIMESTAMP} describe the
 * render wall-clock, not any entry.
 */
public enum PagePlaceholder implements Placeholder<PageRenderContext> {

    ITEMS("items", PageRenderContext::renderedItems, false),

    ITEM_COUNT("item_count", context -> Integer.toString(context.itemCount()), true),

    CHANNEL_COUNT("channel_count", context -> Long.toString(context.channelCount()), true),

    DATE("date", PageRenderContext::renderDate, true),

    TIME("time", PageRenderContext::renderClock, true),

    TIMESTAMP("timestamp", context -> Long.toString(context.renderTimestamp()), true);

    private final String placeholderName;
    private final Function<PageRenderContext, String> accessor;
    private final boolean escapeValue;

    PagePlaceholder(String placeholderName, Function<PageRenderContext, String> accessor, boolean escapeValue) {
        this.placeholderName = placeholderName;
        this.accessor = accessor;
        this.escapeValue = escapeValue;
    }

    @Override
    public String placeholderName() {
        return placeholderName;
    }

    @Override
    public String resolve(PageRenderContext context) {
        return accessor.apply(context);
    }

    @Override
    public boolean escapeValue() {
        return escapeValue;
    }
}
