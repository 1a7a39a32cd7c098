/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

/**
 * Escapes text for safe inclusion in HTML element content and quoted attribute values.
 *
 * <p>
 * Replaces {@code & < > " ' /} with entity references. This is the only injection guard applied when rendering;
 * template text itself is trusted and never escaped.
 */
public final class HtmlEscaper {

    private HtmlEscaper() {
        // Utility class
    }

    /**
     * Escapes the given text.
     *
     * @param text
     *            raw text, {@code null} treated as empty
     * @return escaped text (the same instance when nothing needs escaping)
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        StringBuilder escaped = null;
        int last = 0;
        for (int i = 0; i < text.length(); i++) {
            String entity = entityFor(text.charAt(i));
            if (entity == null) {
                continue;
            }
            if (escaped == null) {
                escaped = new StringBuilder(text.length() + 16);
            }
            escaped.append(text, last, i).append(entity);
            last = i + 1;
        }

        if (escaped == null) {
            return text;
        }
        return escaped.append(text, last, text.length()).toString();
    }

    private static String entityFor(char c) {
        return switch (c) {
            case '&' -> "&amp;";
            case '<' -> "&lt;";
            case '>' -> "&gt;";
            case '"' -> "&quot;";
            case '\'' -> "&#x27;";
            case '/' -> "&#x2F;";
            default -> null;
        };
    }
}
