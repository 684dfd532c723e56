package org.pragmatica.cop.pattern;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PatternLibraryTest {

    @Test
    void parse_definitions_areAvailableByName() {
        var library = PatternLibrary.parse("""
            n_times <- (send (int _) :times)
            body    <- {(send ...) nil}
            """);

        assertThat(library.names()).containsExactly("n_times", "body");
        assertTrue(library.pattern("n_times").isPresent());
        assertTrue(library.pattern("other").isEmpty());
    }

    @Test
    void empty_hasNoPatterns() {
        assertThat(PatternLibrary.empty().names()).isEmpty();
    }

    // === Validation ===

    @Test
    void parse_undefinedReference_fails() {
        var error = assertThrows(PatternSyntaxException.class, () -> PatternLibrary.parse("""
            block <- (block #missing _ _)
            """));

        assertEquals("undefined pattern reference '#missing'", error.reason());
        assertEquals(17, error.location().column());
    }

    @Test
    void parse_selfReferenceOnSameNode_fails() {
        assertThrows(PatternSyntaxException.class, () -> PatternLibrary.parse("a <- {#a (int _)}"));
    }

    @Test
    void parse_mutualReferenceOnSameNode_fails() {
        assertThrows(PatternSyntaxException.class, () -> PatternLibrary.parse("""
            a <- $x<#b>
            b <- {(int _) #a}
            """));
    }

    @Test
    void parse_recursionThroughChild_isAllowed() {
        var library = PatternLibrary.parse("""
            nested <- {(int _) (array #nested)}
            """);

        assertThat(library.names()).containsExactly("nested");
    }

    @Test
    void of_validatesPatternsBuiltInCode() {
        var reference = new Pattern.Reference(Pattern.NO_SPAN, "nowhere");

        assertThrows(PatternSyntaxException.class, () -> PatternLibrary.of(Map.of("ref", reference)));
    }

    @Test
    void with_addsDefinitionAndRevalidates() {
        var library = PatternLibrary.parse("count <- (int _)");

        var extended = library.with("times", PatternParser.parse("(send #count :times)"));

        assertThat(extended.names()).containsExactly("count", "times");
        assertThat(library.names()).containsExactly("count");
        assertThrows(PatternSyntaxException.class,
                     () -> library.with("bad", PatternParser.parse("#undefined")));
    }
}
