/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

/**
 * One placeholder occurrence inside a {@link CompiledTemplate}.
 *
 * @param start
 *            start offset in the template text
 * @param end
 *            end offset (exclusive)
 * @param placeholder
 *            the placeholder kind
 * @param escaped
 *            {@code true} for a backslash-escaped occurrence that renders as the literal placeholder text
 * @param <K>
 *            placeholder kind enum
 */
public record TemplateOccurrence<K>(int start, int end, K placeholder, boolean escaped) {

    static <K> TemplateOccurrence<K> of(PlaceholderSpan span, K placeholder) {
        return new TemplateOccurrence<>(span.start(), span.end(), placeholder, span.escaped());
    }
}
