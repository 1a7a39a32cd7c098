/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

/**
 * Half-open {@code [start, end)} range of one placeholder occurrence in template text.
 *
 * @param start
 *            index of the first char ({@code $} for live occurrences, the backslash for escaped ones)
 * @param end
 *            index just past the closing {@code }}
 * @param escaped
 *            whether the occurrence was preceded by a backslash
 */
public record PlaceholderSpan(int start, int end, boolean escaped) {

    public PlaceholderSpan {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span: [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
