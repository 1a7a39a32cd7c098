/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Locates {@code ${name}} placeholders in template text.
 *
 * <p>
 * A placeholder is the exact literal {@code ${name}}; matching is case-sensitive and anchored by the {@code ${} and
 * {@code }} delimiters, so {@code ${date}} never matches inside {@code ${date_extra}}. A single backslash immediately
 * before the {@code $} escapes the occurrence: it is reported with {@link PlaceholderSpan#escaped()} set, its span
 * starts at the backslash, and renderers emit the placeholder text without the backslash.
 *
 * <p>
 * Offsets are {@code char} (UTF-16 code unit) indices into the scanned {@link String}. They play the role a byte
 * offset plays over raw template bytes: every offset points into the same immutable text the renderer splices, so
 * spans stay valid for any content, including characters outside the BMP.
 */
public final class PlaceholderScanner {

    private static final Logger LOG = Logger.getLogger(PlaceholderScanner.class);

    static final String OPEN = "${";
    static final String CLOSE = "}";
    static final char ESCAPE = '\\';

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_]+");

    private PlaceholderScanner() {
        // Utility class
    }

    /**
     * Finds every live (non-escaped) occurrence of {@code ${name}} in the template.
     *
     * @param template
     *            template text
     * @param name
     *            placeholder name without delimiters
     * @return start-ordered spans of live occurrences, empty if there are none
     */
    public static List<PlaceholderSpan> find(String template, String name) {
        List<PlaceholderSpan> live = new ArrayList<>();
        for (PlaceholderSpan span : scan(template, name)) {
            if (!span.escaped()) {
                live.add(span);
            }
        }
        return live;
    }

    /**
     * Finds every occurrence of {@code ${name}} in the template, live and escaped, in a single left-to-right pass.
     *
     * @param template
     *            template text
     * @param name
     *            placeholder name without delimiters
     * @return start-ordered spans, escaped ones starting at their backslash
     * @throws IllegalArgumentException
     *             if the name is empty or contains characters other than letters, digits and underscores
     */
    public static List<PlaceholderSpan> scan(String template, String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid placeholder name: " + name);
        }

        String literal = literal(name);
        List<PlaceholderSpan> spans = new ArrayList<>();

        int from = 0;
        int index;
        while ((index = template.indexOf(literal, from)) >= 0) {
            int end = index + literal.length();
            if (index > 0 && template.charAt(index - 1) == ESCAPE) {
                LOG.debugf("Placeholder '%s' at %d is escaped, ignoring", literal, index);
                spans.add(new PlaceholderSpan(index - 1, end, true));
            } else {
                spans.add(new PlaceholderSpan(index, end, false));
            }
            from = end;
        }

        if (spans.isEmpty()) {
            LOG.debugf("Placeholder '%s' not found in template", literal);
        }
        return spans;
    }

    /**
     * Builds the template literal for a placeholder name.
     *
     * @param name
     *            placeholder name
     * @return {@code ${name}}
     */
    public static String literal(String name) {
        return OPEN + name + CLOSE;
    }
}
