package org.pragmatica.cop.parser;

import org.pragmatica.cop.tree.SourceBuffer;
import org.pragmatica.cop.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the supported Ruby subset.
 *
 * <p>Consecutive line breaks collapse into one {@link SourceToken.Newline}; a backslash at the end
 * of a line continues the statement.
 */
public final class SourceLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final SourceBuffer buffer;
    private final String input;
    private int pos;

    private SourceLexer(SourceBuffer buffer) {
        this.buffer = buffer;
        this.input = buffer.text();
        this.pos = 0;
    }

    public static List<SourceToken> tokenize(SourceBuffer buffer) {
        return new SourceLexer(buffer).tokenizeAll();
    }

    private List<SourceToken> tokenizeAll() {
        var tokens = new ArrayList<SourceToken>();
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            var token = nextToken();
            if (token instanceof SourceToken.Newline && (tokens.isEmpty() || last(tokens) instanceof SourceToken.Newline)) {
                continue;
            }
            tokens.add(token);
        }
        tokens.add(new SourceToken.Eof(span(pos)));
        return tokens;
    }

    private SourceToken nextToken() {
        int start = pos;
        char c = peek();
        if (c == '\n') {
            advance();
            return new SourceToken.Newline(span(start));
        }
        if (isLowerIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (Character.isUpperCase(c)) {
            return scanConstant(start);
        }
        if (isDigit(c) || (c == '-' && isDigit(peekAhead(1)))) {
            return scanNumber(start);
        }
        if (c == '\'' || c == '"') {
            var text = scanQuoted();
            return text == null
                   ? new SourceToken.Error(span(start), "Unterminated string literal")
                   : new SourceToken.StringLiteral(span(start), text);
        }
        if (c == ':' && peekAhead(1) != ':') {
            return scanSymbol(start);
        }
        return scanOperator(start);
    }

    private SourceToken scanIdentifier(int start) {
        var name = scanName();
        if (!isAtEnd() && (peek() == '?' || peek() == '!') && peekAhead(1) != '=') {
            name += advance();
        }
        if (isLabelColon()) {
            advance();
            return new SourceToken.Label(span(start), name);
        }
        return new SourceToken.Identifier(span(start), name);
    }

    private SourceToken scanConstant(int start) {
        var name = scanName();
        if (isLabelColon()) {
            advance();
            return new SourceToken.Label(span(start), name);
        }
        return new SourceToken.Constant(span(start), name);
    }

    private boolean isLabelColon() {
        return !isAtEnd() && peek() == ':' && peekAhead(1) != ':';
    }

    private SourceToken scanNumber(int start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        if (peek() == '-') {
            sb.append(advance());
        }
        scanDigits(sb);
        boolean isFloat = false;
        if (!isAtEnd() && peek() == '.' && isDigit(peekAhead(1))) {
            isFloat = true;
            sb.append(advance());
            scanDigits(sb);
        }
        try {
            return isFloat
                   ? new SourceToken.FloatLiteral(span(start), Double.parseDouble(sb.toString()))
                   : new SourceToken.IntegerLiteral(span(start), Long.parseLong(sb.toString()));
        } catch (NumberFormatException e) {
            return new SourceToken.Error(span(start), "Malformed number literal '" + sb + "'");
        }
    }

    private void scanDigits(StringBuilder sb) {
        while (!isAtEnd() && (isDigit(peek()) || (peek() == '_' && isDigit(peekAhead(1))))) {
            char c = advance();
            if (c != '_') {
                sb.append(c);
            }
        }
    }

    private SourceToken scanSymbol(int start) {
        advance();
        // skip :
        if (isAtEnd()) {
            return new SourceToken.Error(span(start), "Expected symbol name after ':'");
        }
        char c = peek();
        if (c == '"' || c == '\'') {
            var text = scanQuoted();
            return text == null
                   ? new SourceToken.Error(span(start), "Unterminated symbol literal")
                   : new SourceToken.Symbol(span(start), text);
        }
        if (isLowerIdentifierStart(c) || Character.isUpperCase(c)) {
            var name = scanName();
            if (!isAtEnd() && (peek() == '?' || peek() == '!' || peek() == '=') && peekAhead(1) != '>') {
                name += advance();
            }
            return new SourceToken.Symbol(span(start), name);
        }
        return new SourceToken.Error(span(start), "Expected symbol name after ':'");
    }

    /**
     * Quoted text with simple escapes. Returns null when the closing quote is missing.
     */
    private String scanQuoted() {
        char quote = advance();
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
                char escaped = advance();
                sb.append(quote == '"' ? unescape(escaped) : escaped);
            } else {
                sb.append(advance());
            }
        }
        if (isAtEnd()) {
            return null;
        }
        advance();
        // skip closing quote
        return sb.toString();
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> '\0';
            default -> c;
        };
    }

    private SourceToken scanOperator(int start) {
        if (input.startsWith("&.", pos)) {
            pos += 2;
            return new SourceToken.SafeNavigation(span(start));
        }
        if (input.startsWith("::", pos)) {
            pos += 2;
            return new SourceToken.Scope(span(start));
        }
        if (input.startsWith("=>", pos)) {
            pos += 2;
            return new SourceToken.FatArrow(span(start));
        }
        char c = advance();
        return switch (c) {
            case '.' -> new SourceToken.Dot(span(start));
            case '=' -> new SourceToken.Assign(span(start));
            case ',' -> new SourceToken.Comma(span(start));
            case '|' -> new SourceToken.Pipe(span(start));
            case ';' -> new SourceToken.Semicolon(span(start));
            case '(' -> new SourceToken.LParen(span(start));
            case ')' -> new SourceToken.RParen(span(start));
            case '{' -> new SourceToken.LBrace(span(start));
            case '}' -> new SourceToken.RBrace(span(start));
            case '[' -> new SourceToken.LBracket(span(start));
            case ']' -> new SourceToken.RBracket(span(start));
            default -> new SourceToken.Error(span(start), "Unsupported character '" + c + "'");
        };
    }

    private String scanName() {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return sb.toString();
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '\\' && peekAhead(1) == '\n') {
                advance();
                advance();
            } else if (c == '\\' && peekAhead(1) == '\r' && peekAhead(2) == '\n') {
                advance();
                advance();
                advance();
            } else if (c == '#') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                return;
            }
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
        return input.charAt(pos++);
    }

    private SourceSpan span(int start) {
        return buffer.span(start, pos);
    }

    private static SourceToken last(List<SourceToken> tokens) {
        return tokens.get(tokens.size() - 1);
    }

    private static boolean isLowerIdentifierStart(char c) {
        return Character.isLowerCase(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
