package org.pragmatica.cop.rule;

import org.pragmatica.cop.tree.SourceSpan;

import static java.util.Objects.requireNonNull;

/**
 * Text to put in place of an exact source range.
 */
public record ReplacementSpan(SourceSpan span, String replacement) {

    public ReplacementSpan {
        requireNonNull(span);
        requireNonNull(replacement);
    }

    public static ReplacementSpan of(SourceSpan span, String replacement) {
        return new ReplacementSpan(span, replacement);
    }

    /**
     * Apply to the source the span was taken from.
     */
    public String applyTo(String source) {
        return source.substring(0, span.start().offset()) + replacement + source.substring(span.end().offset());
    }

    @Override
    public String toString() {
        return span + " -> " + replacement;
    }
}
