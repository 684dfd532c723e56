package org.pragmatica.cop.tree;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Source map of a node.
 *
 * @param buffer     buffer the node was parsed from
 * @param expression span of the whole construct
 * @param begin      opening delimiter, e.g. {@code (} of a call or {@code {} of a block
 * @param end        closing delimiter
 * @param selector   method name of a call
 */
public record NodeLocation(
    SourceBuffer buffer,
    SourceSpan expression,
    Optional<SourceSpan> begin,
    Optional<SourceSpan> end,
    Optional<SourceSpan> selector) {

    public NodeLocation {
        requireNonNull(buffer);
        requireNonNull(expression);
        requireNonNull(begin);
        requireNonNull(end);
        requireNonNull(selector);
    }

    public static NodeLocation of(SourceBuffer buffer, SourceSpan expression) {
        return new NodeLocation(buffer, expression, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public NodeLocation withDelimiters(SourceSpan begin, SourceSpan end) {
        return new NodeLocation(buffer, expression, Optional.of(begin), Optional.of(end), selector);
    }

    public NodeLocation withSelector(SourceSpan selector) {
        return new NodeLocation(buffer, expression, begin, end, Optional.of(selector));
    }

    public String source() {
        return buffer.source(expression);
    }

    public Optional<String> beginSource() {
        return begin.map(buffer::source);
    }

    public Optional<String> endSource() {
        return end.map(buffer::source);
    }
}
