/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.noos.templates;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Template text paired with the pre-scanned, start-ordered list of its placeholder occurrences.
 *
 * <p>
 * Compilation scans the text once per placeholder kind of {@code K} and merges the results. Rendering then resolves one
 * value per kind present, predicts the exact output length and splices the values into the text in a single walk over
 * the occurrence list:
 *
 * <pre>
 * length = template.length()
 *         + sum over live occurrences (value.length() - literal.length())
 *         - number of escaped occurrences
 * </pre>
 *
 * <p>
 * Instances are immutable and can be rendered from any number of threads.
 *
 * @param <K>
 *            placeholder kind enum
 * @param <C>
 *            render context type
 * @see ItemTemplate
 * @see PageTemplate
 */
public final class CompiledTemplate<K extends Enum<K> & Placeholder<C>, C> {

    private static final Logger LOG = Logger.getLogger(CompiledTemplate.class);

    private final String text;
    private final Class<K> kindType;
    private final List<TemplateOccurrence<K>> splices;
    private final List<TemplateOccurrence<K>> occurrences;
    private final Set<K> presentKinds;
    private final int escapedCount;

    private CompiledTemplate(String text, Class<K> kindType, List<TemplateOccurrence<K>> splices) {
        this.text = text;
        this.kindType = kindType;
        this.splices = List.copyOf(splices);

        List<TemplateOccurrence<K>> live = new ArrayList<>();
        Set<K> kinds = EnumSet.noneOf(kindType);
        int escaped = 0;
        for (TemplateOccurrence<K> occurrence : splices) {
            if (occurrence.escaped()) {
                escaped++;
            } else {
                live.add(occurrence);
                kinds.add(occurrence.placeholder());
            }
        }
        this.occurrences = List.copyOf(live);
        this.presentKinds = Collections.unmodifiableSet(kinds);
        this.escapedCount = escaped;
    }

    /**
     * Compiles template text against every placeholder kind of the given enum.
     *
     * @param text
     *            raw template text
     * @param kindType
     *            placeholder kind enum class
     * @return the compiled template
     */
    public static <K extends Enum<K> & Placeholder<C>, C> CompiledTemplate<K, C> compile(String text,
            Class<K> kindType) {
        Objects.requireNonNull(text, "template text");

        List<TemplateOccurrence<K>> splices = new ArrayList<>();
        for (K kind : kindType.getEnumConstants()) {
            for (PlaceholderSpan span : PlaceholderScanner.scan(text, kind.placeholderName())) {
                splices.add(TemplateOccurrence.of(span, kind));
            }
        }
        splices.sort(Comparator.comparingInt(TemplateOccurrence::start));

        CompiledTemplate<K, C> compiled = new CompiledTemplate<>(text, kindType, splices);
        LOG.debugf("Compiled %s template: %d chars, %d live placeholder(s), %d escaped", kindType.getSimpleName(),
                text.length(), compiled.occurrences.size(), compiled.escapedCount);
        return compiled;
    }

    /**
     * @return the template text as compiled
     */
    public String text() {
        return text;
    }

    /**
     * @return live occurrences ordered by start offset
     */
    public List<TemplateOccurrence<K>> occurrences() {
        return occurrences;
    }

    /**
     * @return number of backslash-escaped occurrences
     */
    public int escapedCount() {
        return escapedCount;
    }

    public boolean contains(K kind) {
        return presentKinds.contains(kind);
    }

    public int occurrenceCount(K kind) {
        int count = 0;
        for (TemplateOccurrence<K> occurrence : occurrences) {
            if (occurrence.placeholder() == kind) {
                count++;
            }
        }
        return count;
    }

    public boolean hasPlaceholders() {
        return !occurrences.isEmpty();
    }

    /**
     * Resolves the substitution value of every kind present in this template, escaping where the kind requires it.
     *
     * @param context
     *            render context
     * @return values keyed by kind; kinds absent from the template are not resolved
     */
    public Map<K, String> resolveValues(C context) {
        Map<K, String> values = new EnumMap<>(kindType);
        for (K kind : presentKinds) {
            String raw = kind.resolve(context);
            values.put(kind, kind.escapeValue() ? HtmlEscaper.escape(raw) : Objects.requireNonNullElse(raw, ""));
        }
        return values;
    }

    /**
     * Computes the exact length of the output produced by {@link #assemble(Map)} for the given values.
     *
     * @param values
     *            substitution values as returned by {@link #resolveValues(Object)}
     * @return predicted output length in chars
     */
    public int predictLength(Map<K, String> values) {
        long size = text.length() - (long) escapedCount;
        for (TemplateOccurrence<K> occurrence : occurrences) {
            size += values.get(occurrence.placeholder()).length() - (occurrence.end() - occurrence.start());
        }
        if (size > Integer.MAX_VALUE) {
            throw new IllegalStateException("Rendered template exceeds maximum string length: " + size);
        }
        return (int) size;
    }

    /**
     * Splices the values into the template text.
     *
     * @param values
     *            substitution values for every kind present
     * @return rendered text
     */
    public String assemble(Map<K, String> values) {
        StringBuilder out = new StringBuilder(predictLength(values));
        int last = 0;
        for (TemplateOccurrence<K> occurrence : splices) {
            out.append(text, last, occurrence.start());
            if (occurrence.escaped()) {
                // drop the backslash, keep the placeholder literal
                out.append(text, occurrence.start() + 1, occurrence.end());
            } else {
                out.append(values.get(occurrence.placeholder()));
            }
            last = occurrence.end();
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    /**
     * Renders the template against a context.
     *
     * @param context
     *            render context
     * @return rendered text
     */
    public String render(C context) {
        return assemble(resolveValues(context));
    }
}
