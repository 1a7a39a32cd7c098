/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.data.models;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * One article on the timeline, attributed to the channel it came from.
 *
 * <p>
 * Absent fields ({@code null} at construction) take their display defaults; fields that are present but empty stay
 * empty. {@link #timestamp()} is always set, even when the source gave no usable publish date; in that case
 * {@link #publishedAt()} is {@code null} and {@link #date()} / {@link #time()} are empty.
 *
 * @param title
 *            article title, {@value #NO_TITLE} when absent
 * @param description
 *            article summary, {@value #NO_DESCRIPTION} when absent
 * @param sourceName
 *            human-readable channel name, {@value #NO_SOURCE} when absent
 * @param sourceLink
 *            canonical channel URL, empty when absent
 * @param link
 *            article URL, empty when absent
 * @param timestamp
 *            epoch seconds used for ordering and future filtering
 * @param publishedAt
 *            parsed publish date, {@code null} when it could not be determined
 */
public record TimelineEntry(String title, String description, String sourceName, String sourceLink, String link,
        long timestamp, ZonedDateTime publishedAt) {

    public static final String NO_TITLE = "(No title)";
    public static final String NO_DESCRIPTION = "(No description)";
    public static final String NO_SOURCE = "(No source)";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    public TimelineEntry {
        title = Objects.requireNonNullElse(title, NO_TITLE);
        description = Objects.requireNonNullElse(description, NO_DESCRIPTION);
        sourceName = Objects.requireNonNullElse(sourceName, NO_SOURCE);
        sourceLink = Objects.requireNonNullElse(sourceLink, "");
        link = Objects.requireNonNullElse(link, "");
    }

    /**
     * Creates an entry whose timestamp is taken from its publish date.
     */
    public static TimelineEntry published(String title, String description, String sourceName, String sourceLink,
            String link, ZonedDateTime publishedAt) {
        Objects.requireNonNull(publishedAt, "publishedAt");
        return new TimelineEntry(title, description, sourceName, sourceLink, link, publishedAt.toEpochSecond(),
                publishedAt);
    }

    /**
     * Creates an entry without a usable publish date, timestamped by the caller's fallback policy.
     */
    public static TimelineEntry undated(String title, String description, String sourceName, String sourceLink,
            String link, long fallbackTimestamp) {
        return new TimelineEntry(title, description, sourceName, sourceLink, link, fallbackTimestamp, null);
    }

    /**
     * @return publish date as {@code yyyy-MM-dd}, or empty if unknown
     */
    public String date() {
        return publishedAt == null ? "" : DATE_FORMAT.format(publishedAt);
    }

    /**
     * @return publish time as {@code HH:mm:ss}, or empty if unknown
     */
    public String time() {
        return publishedAt == null ? "" : TIME_FORMAT.format(publishedAt);
    }
}
