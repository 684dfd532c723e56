package org.pragmatica.cop.parser;

import org.pragmatica.cop.tree.SourceSpan;

/**
 * Token types for the Ruby source lexer.
 */
public sealed interface SourceToken {
    SourceSpan span();

    // Names and literals
    record Identifier(SourceSpan span, String name) implements SourceToken {}

    record Constant(SourceSpan span, String name) implements SourceToken {}

    // name: (keyword argument or hash key); span covers the trailing colon
    record Label(SourceSpan span, String name) implements SourceToken {}

    record IntegerLiteral(SourceSpan span, long value) implements SourceToken {}

    record FloatLiteral(SourceSpan span, double value) implements SourceToken {}

    record StringLiteral(SourceSpan span, String value) implements SourceToken {}

    record Symbol(SourceSpan span, String name) implements SourceToken {}

    // Operators
    record Dot(SourceSpan span) implements SourceToken {}

    // .
    record SafeNavigation(SourceSpan span) implements SourceToken {}

    // &.
    record Scope(SourceSpan span) implements SourceToken {}

    // ::
    record Assign(SourceSpan span) implements SourceToken {}

    // =
    record FatArrow(SourceSpan span) implements SourceToken {}

    // =>
    record Comma(SourceSpan span) implements SourceToken {}

    // ,
    record Pipe(SourceSpan span) implements SourceToken {}

    // |
    // Delimiters
    record LParen(SourceSpan span) implements SourceToken {}

    // (
    record RParen(SourceSpan span) implements SourceToken {}

    // )
    record LBrace(SourceSpan span) implements SourceToken {}

    // {
    record RBrace(SourceSpan span) implements SourceToken {}

    // }
    record LBracket(SourceSpan span) implements SourceToken {}

    // [
    record RBracket(SourceSpan span) implements SourceToken {}

    // ]
    // Statement terminators
    record Newline(SourceSpan span) implements SourceToken {}

    record Semicolon(SourceSpan span) implements SourceToken {}

    // Special
    record Eof(SourceSpan span) implements SourceToken {}

    record Error(SourceSpan span, String message) implements SourceToken {}
}
