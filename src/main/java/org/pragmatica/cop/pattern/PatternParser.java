package org.pragmatica.cop.pattern;

import org.pragmatica.cop.tree.SourceLocation;
import org.pragmatica.cop.tree.SourceSpan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parser for node pattern syntax.
 *
 * <pre>
 * pattern  := '(' TYPE element* ')' | '_' | 'nil' | ':' SYMBOL | INTEGER | STRING
 *           | '$' NAME | '$' NAME '&lt;' pattern '&gt;' | '{' pattern+ '}' | '#' NAME
 * element  := pattern | '...' | '$' NAME '...'
 * library  := (NAME '&lt;-' pattern)*
 * </pre>
 */
public final class PatternParser {

    private final List<PatternToken> tokens;
    private int pos;

    private PatternParser(List<PatternToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse a single pattern.
     *
     * @throws PatternSyntaxException if the text is not a well-formed pattern
     */
    public static Pattern parse(String patternText) {
        var parser = create(patternText);
        var pattern = parser.parsePattern();
        if (!parser.isAtEnd()) {
            throw parser.unexpected("end of pattern");
        }
        return pattern;
    }

    /**
     * Parse {@code name <- pattern} definitions, in order of appearance.
     *
     * @throws PatternSyntaxException on malformed text or a name defined twice
     */
    public static Map<String, Pattern> parseDefinitions(String definitionsText) {
        return create(definitionsText).parseLibrary();
    }

    private static PatternParser create(String text) {
        var tokens = PatternLexer.tokenize(text);
        // Check for lexer errors
        for (var token : tokens) {
            if (token instanceof PatternToken.Error error) {
                throw new PatternSyntaxException(error.span().start(), error.message());
            }
        }
        return new PatternParser(tokens);
    }

    private Map<String, Pattern> parseLibrary() {
        var definitions = new LinkedHashMap<String, Pattern>();
        while (!isAtEnd()) {
            if (!(peek() instanceof PatternToken.Identifier name)) {
                throw unexpected("pattern name");
            }
            advance();
            if (!(peek() instanceof PatternToken.LeftArrow)) {
                throw unexpected("'<-'");
            }
            advance();
            var pattern = parsePattern();
            if (definitions.putIfAbsent(name.name(), pattern) != null) {
                throw new PatternSyntaxException(name.span().start(), "pattern '" + name.name() + "' is defined twice");
            }
        }
        return definitions;
    }

    private Pattern parsePattern() {
        var token = peek();
        var start = token.span().start();

        if (token instanceof PatternToken.LParen) {
            return parseNode(start);
        }
        if (token instanceof PatternToken.LBrace) {
            return parseAlternation(start);
        }
        if (token instanceof PatternToken.CaptureName capture) {
            advance();
            return parseCapture(start, capture.name());
        }
        if (token instanceof PatternToken.ReferenceName ref) {
            advance();
            return new Pattern.Reference(token.span(), ref.name());
        }
        if (token instanceof PatternToken.Symbol symbol) {
            advance();
            return new Pattern.SymLiteral(token.span(), symbol.name());
        }
        if (token instanceof PatternToken.Number number) {
            advance();
            return new Pattern.IntLiteral(token.span(), number.value());
        }
        if (token instanceof PatternToken.StringLiteral str) {
            advance();
            return new Pattern.StrLiteral(token.span(), str.value());
        }
        if (token instanceof PatternToken.Identifier id) {
            if (id.name().equals("_")) {
                advance();
                return new Pattern.Wildcard(token.span());
            }
            if (id.name().equals("nil")) {
                advance();
                return new Pattern.NilLiteral(token.span());
            }
            throw new PatternSyntaxException(start,
                                             "Unexpected identifier '" + id.name() + "', node types go inside parentheses");
        }
        if (token instanceof PatternToken.Ellipsis || token instanceof PatternToken.RestCapture) {
            throw new PatternSyntaxException(start, "'...' is only allowed as the last child of a node");
        }
        throw unexpected("pattern");
    }

    private Pattern parseNode(SourceLocation start) {
        advance();
        // skip (
        if (!(peek() instanceof PatternToken.Identifier type)) {
            throw unexpected("node type");
        }
        advance();
        var children = new ArrayList<Pattern>();
        while (!(peek() instanceof PatternToken.RParen)) {
            if (isAtEnd()) {
                throw unexpected("')'");
            }
            children.add(parseElement());
        }
        advance();
        // skip )
        return new Pattern.Node(SourceSpan.of(start, previousEnd()), type.name(), children);
    }

    private Pattern parseElement() {
        var token = peek();
        if (token instanceof PatternToken.Ellipsis) {
            advance();
            return new Pattern.Rest(token.span(), Optional.empty());
        }
        if (token instanceof PatternToken.RestCapture rest) {
            advance();
            return new Pattern.Rest(token.span(), Optional.of(rest.name()));
        }
        return parsePattern();
    }

    private Pattern parseAlternation(SourceLocation start) {
        advance();
        // skip {
        var alternatives = new ArrayList<Pattern>();
        while (!(peek() instanceof PatternToken.RBrace)) {
            if (isAtEnd()) {
                throw unexpected("'}'");
            }
            alternatives.add(parsePattern());
        }
        advance();
        // skip }
        return new Pattern.Alternation(SourceSpan.of(start, previousEnd()), alternatives);
    }

    private Pattern parseCapture(SourceLocation start, String name) {
        if (!(peek() instanceof PatternToken.LAngle)) {
            var span = SourceSpan.of(start, previousEnd());
            return new Pattern.Capture(span, name, new Pattern.Wildcard(span));
        }
        advance();
        // skip <
        var inner = parsePattern();
        if (!(peek() instanceof PatternToken.RAngle)) {
            throw unexpected("'>'");
        }
        advance();
        // skip >
        return new Pattern.Capture(SourceSpan.of(start, previousEnd()), name, inner);
    }

    // === Token access ===

    private boolean isAtEnd() {
        return peek() instanceof PatternToken.Eof;
    }

    private PatternToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private SourceLocation previousEnd() {
        return tokens.get(Math.max(0, pos - 1)).span().end();
    }

    private PatternSyntaxException unexpected(String expected) {
        var token = peek();
        return new PatternSyntaxException(token.span().start(),
                                          "Unexpected " + tokenDescription(token) + ", expected " + expected);
    }

    private static String tokenDescription(PatternToken token) {
        if (token instanceof PatternToken.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof PatternToken.Symbol symbol) {
            return "symbol :" + symbol.name();
        }
        if (token instanceof PatternToken.Number number) {
            return "number " + number.value();
        }
        if (token instanceof PatternToken.StringLiteral) {
            return "string literal";
        }
        if (token instanceof PatternToken.CaptureName capture) {
            return "capture '$" + capture.name() + "'";
        }
        if (token instanceof PatternToken.RestCapture rest) {
            return "capture '$" + rest.name() + "...'";
        }
        if (token instanceof PatternToken.ReferenceName ref) {
            return "reference '#" + ref.name() + "'";
        }
        if (token instanceof PatternToken.Eof) {
            return "end of input";
        }
        if (token instanceof PatternToken.Ellipsis) {
            return "'...'";
        }
        if (token instanceof PatternToken.LeftArrow) {
            return "'<-'";
        }
        if (token instanceof PatternToken.LParen) {
            return "'('";
        }
        if (token instanceof PatternToken.RParen) {
            return "')'";
        }
        if (token instanceof PatternToken.LBrace) {
            return "'{'";
        }
        if (token instanceof PatternToken.RBrace) {
            return "'}'";
        }
        if (token instanceof PatternToken.LAngle) {
            return "'<'";
        }
        if (token instanceof PatternToken.RAngle) {
            return "'>'";
        }
        return "error";
    }
}
