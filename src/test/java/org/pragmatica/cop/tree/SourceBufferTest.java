package org.pragmatica.cop.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceBufferTest {

    // === Locations ===

    @Test
    void locationAt_firstLine_countsColumnsFromOne() {
        var buffer = SourceBuffer.of("create :user");

        var location = buffer.locationAt(7);

        assertEquals(1, location.line());
        assertEquals(8, location.column());
        assertEquals(7, location.offset());
    }

    @Test
    void locationAt_afterNewline_startsNextLine() {
        var buffer = SourceBuffer.of("a = 1\nb = 2\n");

        var location = buffer.locationAt(6);

        assertEquals(2, location.line());
        assertEquals(1, location.column());
    }

    @Test
    void locationAt_endOfInput_isValid() {
        var buffer = SourceBuffer.of("abc");

        assertEquals(4, buffer.locationAt(3).column());
    }

    @Test
    void locationAt_pastEnd_throws() {
        var buffer = SourceBuffer.of("abc");

        assertThrows(IndexOutOfBoundsException.class, () -> buffer.locationAt(4));
    }

    // === Lines ===

    @Test
    void line_returnsTextWithoutTerminator() {
        var buffer = SourceBuffer.of("first\r\nsecond\nthird");

        assertEquals(3, buffer.lineCount());
        assertEquals("first", buffer.line(1));
        assertEquals("second", buffer.line(2));
        assertEquals("third", buffer.line(3));
    }

    @Test
    void line_emptyTrailingLine_isEmpty() {
        var buffer = SourceBuffer.of("x\n");

        assertEquals(2, buffer.lineCount());
        assertEquals("", buffer.line(2));
    }

    // === Spans ===

    @Test
    void source_extractsSpanText() {
        var buffer = SourceBuffer.of("3.times { create :user }");

        assertEquals("3.times", buffer.source(buffer.span(0, 7)));
    }

    @Test
    void span_overlapsAndContains_followOffsets() {
        var buffer = SourceBuffer.of("0123456789");
        var outer = buffer.span(0, 6);
        var inner = buffer.span(2, 4);
        var after = buffer.span(6, 9);

        assertTrue(outer.contains(inner));
        assertTrue(outer.overlaps(inner));
        assertFalse(outer.overlaps(after));
        assertEquals(buffer.span(0, 9), outer.merge(after));
    }

    @Test
    void span_endingBeforeStart_throws() {
        var buffer = SourceBuffer.of("0123456789");

        assertThrows(IllegalArgumentException.class,
                     () -> SourceSpan.of(buffer.locationAt(5), buffer.locationAt(2)));
    }

    @Test
    void withText_keepsName() {
        var buffer = SourceBuffer.of("spec/user_spec.rb", "old");

        var updated = buffer.withText("new");

        assertEquals("spec/user_spec.rb", updated.name());
        assertEquals("new", updated.text());
        assertNotEquals(buffer, updated);
    }
}
