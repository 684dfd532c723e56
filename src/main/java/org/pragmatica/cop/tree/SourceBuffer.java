package org.pragmatica.cop.tree;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkPositionIndexes;
import static java.util.Objects.requireNonNull;

/**
 * Named source text together with a line index for offset to line/column conversion.
 */
public final class SourceBuffer {
    private final String name;
    private final String text;
    private final int[] lineStarts;

    private SourceBuffer(String name, String text) {
        this.name = requireNonNull(name);
        this.text = requireNonNull(text);
        this.lineStarts = indexLines(text);
    }

    public static SourceBuffer of(String name, String text) {
        return new SourceBuffer(name, text);
    }

    public static SourceBuffer of(String text) {
        return new SourceBuffer("(string)", text);
    }

    public String name() {
        return name;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    /**
     * Location of the given offset. Offsets equal to the length map to the end of input.
     */
    public SourceLocation locationAt(int offset) {
        checkPositionIndexes(0, offset, text.length());
        int index = Arrays.binarySearch(lineStarts, offset);
        int lineIndex = index >= 0 ? index : -index - 2;
        return SourceLocation.at(lineIndex + 1, offset - lineStarts[lineIndex] + 1, offset);
    }

    public SourceSpan span(int begin, int end) {
        return SourceSpan.of(locationAt(begin), locationAt(end));
    }

    public String source(SourceSpan span) {
        return span.extract(text);
    }

    /**
     * The text of a 1-based line, without its terminator.
     */
    public String line(int line) {
        int begin = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        if (end > begin && text.charAt(end - 1) == '\r') {
            end--;
        }
        return text.substring(begin, Math.max(begin, end));
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Same name, new text. Used when corrected source is linted again.
     */
    public SourceBuffer withText(String newText) {
        return new SourceBuffer(name, newText);
    }

    private static int[] indexLines(String text) {
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        var starts = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        return starts;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof SourceBuffer other && name.equals(other.name) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + text.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
