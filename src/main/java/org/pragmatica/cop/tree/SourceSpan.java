package org.pragmatica.cop.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public SourceSpan {
        requireNonNull(start);
        requireNonNull(end);
        checkArgument(start.offset() <= end.offset(), "span ends before it starts: %s-%s", start, end);
    }

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    public boolean overlaps(SourceSpan other) {
        return start.offset() < other.end.offset() && other.start.offset() < end.offset();
    }

    public boolean contains(SourceSpan other) {
        return start.offset() <= other.start.offset() && other.end.offset() <= end.offset();
    }

    public SourceSpan merge(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
