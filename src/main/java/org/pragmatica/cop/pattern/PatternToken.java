package org.pragmatica.cop.pattern;

import org.pragmatica.cop.tree.SourceSpan;

/**
 * Token types for the node pattern lexer.
 */
public sealed interface PatternToken {
    SourceSpan span();

    // Names and literals
    record Identifier(SourceSpan span, String name) implements PatternToken {}

    record Symbol(SourceSpan span, String name) implements PatternToken {}

    record Number(SourceSpan span, long value) implements PatternToken {}

    record StringLiteral(SourceSpan span, String value) implements PatternToken {}

    // $name
    record CaptureName(SourceSpan span, String name) implements PatternToken {}

    // $name...
    record RestCapture(SourceSpan span, String name) implements PatternToken {}

    // #name
    record ReferenceName(SourceSpan span, String name) implements PatternToken {}

    // Operators
    record Ellipsis(SourceSpan span) implements PatternToken {}

    // ...
    record LeftArrow(SourceSpan span) implements PatternToken {}

    // <-
    // Delimiters
    record LParen(SourceSpan span) implements PatternToken {}

    // (
    record RParen(SourceSpan span) implements PatternToken {}

    // )
    record LBrace(SourceSpan span) implements PatternToken {}

    // {
    record RBrace(SourceSpan span) implements PatternToken {}

    // }
    record LAngle(SourceSpan span) implements PatternToken {}

    // <
    record RAngle(SourceSpan span) implements PatternToken {}

    // >
    // Special
    record Eof(SourceSpan span) implements PatternToken {}

    record Error(SourceSpan span, String message) implements PatternToken {}
}
