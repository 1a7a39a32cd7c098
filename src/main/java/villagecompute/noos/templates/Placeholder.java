/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

/**
 * Contract for a closed set of template placeholder kinds.
 *
 * <p>
 * Each kind knows its literal name (the text between {@code ${} and {@code }}), how to pull its value out of a render
 * context, and whether that value must be HTML-escaped before it is spliced into the output. Implementations are enums
 * so that a {@link CompiledTemplate} can key its lookups with an {@link java.util.EnumMap}.
 *
 * @param <C>
 *            render context type (a single entry for item templates, aggregate page data for page templates)
 * @see ItemPlaceholder
 * @see PagePlaceholder
 */
public interface Placeholder<C> {

    /**
     * Returns the literal placeholder name, e.g. {@code title} for {@code ${title}}.
     *
     * @return the placeholder name
     */
    String placeholderName();

    /**
     * Extracts the raw (unescaped) value for this kind from the render context.
     *
     * @param context
     *            the render context
     * @return the raw value, never {@code null}
     */
    String resolve(C context);

    /**
     * Whether the resolved value is HTML-escaped before substitution. Only pre-rendered markup opts out.
     *
     * @return {@code true} if the value is escaped
     */
    default boolean escapeValue() {
        return true;
    }

    /**
     * Returns the placeholder exactly as it appears in template text.
     *
     * @return {@code ${name}}
     */
    default String literal() {
        return PlaceholderScanner.literal(placeholderName());
    }
}
