/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

import villagecompute.noos.data.models.TimelineEntry;

import java.util.function.Function;

/**
 * Placeholders available in item templates, each mapped to the {@link TimelineEntry} field it renders.
 */
public enum ItemPlaceholder implements Placeholder<TimelineEntry> {

    TITLE("title", TimelineEntry::title),

    DESCRIPTION("description", TimelineEntry::description),

    /** Channel name. */
    SOURCE("source", TimelineEntry::sourceName),

    LINK("link", TimelineEntry::link),

    DATE("date", TimelineEntry::date),

    TIME("time", TimelineEntry::time),

    /** Epoch seconds, as decimal text. */
    TIMESTAMP("timestamp", entry -> Long.toString(entry.timestamp())),

    /** Channel URL. */
    CHANNEL_LINK("channel_link", TimelineEntry::sourceLink);

    private final String placeholderName;
    private final Function<TimelineEntry, String> accessor;

    ItemPlaceholder(String placeholderName, Function<TimelineEntry, String> accessor) {
        this.placeholderName = placeholderName;
        this.accessor = accessor;
    }

    @Override
    public String placeholderName() {
        return placeholderName;
    }

    @Override
    public String resolve(TimelineEntry entry) {
        return accessor.apply(entry);
    }
}
