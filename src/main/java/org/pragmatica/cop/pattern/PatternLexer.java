package org.pragmatica.cop.pattern;

import org.pragmatica.cop.tree.SourceLocation;
import org.pragmatica.cop.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for node pattern syntax.
 */
public final class PatternLexer {
    private static final int MAX_INPUT_SIZE = 100_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;
    // Longest first
    private static final List<String> OPERATOR_SYMBOLS = List.of(
        "[]=", "<=>", "===", "[]", "==", "!=", "<=", ">=", "<<", ">>", "**", "=~",
        "+", "-", "*", "/", "%", "<", ">", "!", "&", "|", "^", "~");

    private final String input;
    private int pos;
    private int line;
    private int column;

    private PatternLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<PatternToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
                "Pattern input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new PatternLexer(input).tokenizeAll();
    }

    private List<PatternToken> tokenizeAll() {
        var tokens = new ArrayList<PatternToken>();
        while (!isAtEnd()) {
            skipWhitespace();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new PatternToken.Eof(span(currentLocation())));
        return tokens;
    }

    private PatternToken nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            var name = scanName();
            return new PatternToken.Identifier(span(start), name);
        }
        if (isDigit(c) || (c == '-' && isDigit(peekAhead(1)))) {
            return scanNumber(start);
        }
        return switch (c) {
            case ':' -> scanSymbol(start);
            case '"' -> scanString(start);
            case '$' -> scanCapture(start);
            case '#' -> scanReference(start);
            default -> scanOperator(start);
        };
    }

    private PatternToken scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        if (peek() == '-') {
            sb.append(advance());
        }
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            char c = advance();
            if (c != '_') {
                sb.append(c);
            }
        }
        try {
            return new PatternToken.Number(span(start), Long.parseLong(sb.toString()));
        } catch (NumberFormatException e) {
            return new PatternToken.Error(span(start), "Integer literal out of range: " + sb);
        }
    }

    private PatternToken scanSymbol(SourceLocation start) {
        advance();
        // skip :
        if (!isAtEnd() && isIdentifierStart(peek())) {
            var sb = new StringBuilder(scanName());
            if (!isAtEnd() && (peek() == '?' || peek() == '!' || peek() == '=')) {
                sb.append(advance());
            }
            return new PatternToken.Symbol(span(start), sb.toString());
        }
        for (var operator : OPERATOR_SYMBOLS) {
            if (input.startsWith(operator, pos)) {
                for (int i = 0; i < operator.length(); i++) {
                    advance();
                }
                return new PatternToken.Symbol(span(start), operator);
            }
        }
        return new PatternToken.Error(span(start), "Expected symbol name after ':'");
    }

    private PatternToken scanString(SourceLocation start) {
        advance();
        // skip opening quote
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                sb.append(scanEscape());
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return new PatternToken.Error(span(start), "Unterminated string literal");
        }
        advance();
        // skip closing quote
        return new PatternToken.StringLiteral(span(start), sb.toString());
    }

    private char scanEscape() {
        char c = advance();
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> c;
        };
    }

    private PatternToken scanCapture(SourceLocation start) {
        advance();
        // skip $
        if (isAtEnd() || !isIdentifierStart(peek())) {
            return new PatternToken.Error(span(start), "Expected capture name after '$'");
        }
        var name = scanName();
        if (input.startsWith("...", pos)) {
            advance();
            advance();
            advance();
            return new PatternToken.RestCapture(span(start), name);
        }
        return new PatternToken.CaptureName(span(start), name);
    }

    private PatternToken scanReference(SourceLocation start) {
        advance();
        // skip #
        if (isAtEnd() || !isIdentifierStart(peek())) {
            return new PatternToken.Error(span(start), "Expected pattern name after '#'");
        }
        return new PatternToken.ReferenceName(span(start), scanName());
    }

    private PatternToken scanOperator(SourceLocation start) {
        if (input.startsWith("...", pos)) {
            advance();
            advance();
            advance();
            return new PatternToken.Ellipsis(span(start));
        }
        if (input.startsWith("<-", pos)) {
            advance();
            advance();
            return new PatternToken.LeftArrow(span(start));
        }
        char c = advance();
        return switch (c) {
            case '(' -> new PatternToken.LParen(span(start));
            case ')' -> new PatternToken.RParen(span(start));
            case '{' -> new PatternToken.LBrace(span(start));
            case '}' -> new PatternToken.RBrace(span(start));
            case '<' -> new PatternToken.LAngle(span(start));
            case '>' -> new PatternToken.RAngle(span(start));
            default -> new PatternToken.Error(span(start), "Unexpected character '" + c + "'");
        };
    }

    private String scanName() {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    // === Character access ===

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekAhead(int offset) {
        return pos + offset < input.length() ? input.charAt(pos + offset) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
