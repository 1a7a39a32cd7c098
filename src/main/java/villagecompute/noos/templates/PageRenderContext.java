/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

import villagecompute.noos.data.models.TimelineEntry;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Aggregate data a page template is rendered from, computed fresh for every render.
 *
 * @param entries
 *            entries selected for this page, newest first
 * @param renderedItems
 *            concatenated item renderings of {@code entries}, already escaped
 * @param channelCount
 *            number of distinct channel links among {@code entries}
 * @param renderTime
 *            wall-clock time of the render
 */
public record PageRenderContext(List<TimelineEntry> entries, String renderedItems, long channelCount,
        ZonedDateTime renderTime) {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    public PageRenderContext {
        entries = List.copyOf(entries);
    }

    public int itemCount() {
        return entries.size();
    }

    public String renderDate() {
        return DATE_FORMAT.format(renderTime);
    }

    public String renderClock() {
        return TIME_FORMAT.format(renderTime);
    }

    public long renderTimestamp() {
        return renderTime.toEpochSecond();
    }
}
