package org.pragmatica.cop.parser;

import org.pragmatica.cop.tree.Atom;
import org.pragmatica.cop.tree.Child;
import org.pragmatica.cop.tree.NodeLocation;
import org.pragmatica.cop.tree.SourceBuffer;
import org.pragmatica.cop.tree.SourceSpan;
import org.pragmatica.cop.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Recursive descent parser for a Ruby subset, producing trees shaped like the Ruby {@code parser} gem.
 *
 * <p>Supported: literals, constants, local variables, method calls with parenthesized or bare
 * arguments, keyword arguments, hash and array literals, {@code { }} and {@code do ... end} blocks
 * with parameters, local assignment and statement sequences. A single statement is returned as is;
 * several statements are wrapped in a {@code begin} node.
 */
public final class SourceParser {
    private static final Set<String> VALUE_KEYWORDS = Set.of("nil", "true", "false", "self");
    private static final Set<String> UNSUPPORTED_KEYWORDS = Set.of(
        "alias", "and", "begin", "break", "case", "class", "def", "defined?", "else", "elsif", "ensure",
        "for", "if", "in", "module", "next", "not", "or", "redo", "rescue", "retry", "return", "super",
        "then", "undef", "unless", "until", "when", "while", "yield");

    /**
     * Where an expression appears, which decides how calls without parentheses are read.
     */
    private enum Context {
        // statement level, parenthesized arguments, grouping
        STATEMENT(true, true),
        // first bare argument, which may itself be a command: `to eq 1`
        FIRST_COMMAND_ARGUMENT(true, false),
        // further bare arguments: `create :user, <here>`
        COMMAND_ARGUMENT(false, false),
        // array element or hash value
        ELEMENT(false, true);

        private final boolean allowCommand;
        private final boolean allowDo;

        Context(boolean allowCommand, boolean allowDo) {
            this.allowCommand = allowCommand;
            this.allowDo = allowDo;
        }

        /**
         * Context of a hash value: never a command, `do` binds as it does here.
         */
        Context withoutCommand() {
            return allowDo ? ELEMENT : COMMAND_ARGUMENT;
        }
    }

    private final SourceBuffer buffer;
    private final List<SourceToken> tokens;
    private int pos;
    private LocalScope scope;

    private SourceParser(SourceBuffer buffer, List<SourceToken> tokens) {
        this.buffer = buffer;
        this.tokens = tokens;
        this.pos = 0;
        this.scope = new LocalScope(null, false);
    }

    /**
     * Parse a whole buffer. Empty input (only blanks and comments) yields empty.
     *
     * @throws SourceParseException if the text is outside the supported subset
     */
    public static Optional<SyntaxNode> parse(SourceBuffer buffer) {
        var tokens = SourceLexer.tokenize(buffer);
        for (var token : tokens) {
            if (token instanceof SourceToken.Error error) {
                throw new SourceParseException(buffer.name(), error.span().start(), error.message());
            }
        }
        return new SourceParser(buffer, tokens).parseProgram();
    }

    /**
     * Parse source text that must contain at least one statement.
     */
    public static SyntaxNode parse(String source) {
        var buffer = SourceBuffer.of(source);
        return parse(buffer).orElseThrow(
            () -> new SourceParseException(buffer.name(), buffer.locationAt(0), "Empty source"));
    }

    private Optional<SyntaxNode> parseProgram() {
        var statements = parseStatements(token -> false);
        if (!isAtEnd()) {
            throw unexpected("end of input");
        }
        return statements.isEmpty()
               ? Optional.empty()
               : Optional.of(wrapStatements(statements));
    }

    // === Statements ===

    private List<SyntaxNode> parseStatements(Predicate<SourceToken> isTerminator) {
        var statements = new ArrayList<SyntaxNode>();
        skipTerminators();
        while (!isAtEnd() && !isTerminator.test(peek())) {
            statements.add(parseStatement());
            if (!isAtEnd() && !isTerminator.test(peek()) && !isStatementTerminator(peek())) {
                throw unexpected("end of statement");
            }
            skipTerminators();
        }
        return statements;
    }

    private SyntaxNode parseStatement() {
        if (peek() instanceof SourceToken.Identifier id
            && peekAhead(1) instanceof SourceToken.Assign
            && !isKeyword(id.name())) {
            advance();
            advance();
            // skip name and =
            skipNewlines();
            var value = parseExpression(Context.STATEMENT);
            scope.declare(id.name());
            return node("lvasgn", List.of(Atom.sym(id.name()), value), startOf(id), endOf(value));
        }
        return parseExpression(Context.STATEMENT);
    }

    /**
     * One statement is returned as is, several become {@code (begin ...)}.
     */
    private Child wrapBody(List<SyntaxNode> statements) {
        return statements.isEmpty()
               ? Atom.NIL
               : wrapStatements(statements);
    }

    private SyntaxNode wrapStatements(List<SyntaxNode> statements) {
        if (statements.size() == 1) {
            return statements.get(0);
        }
        return node("begin", statements, startOf(statements.get(0)), endOf(statements.get(statements.size() - 1)));
    }

    // === Expressions ===

    private SyntaxNode parseExpression(Context context) {
        var expression = parsePrimary(context);
        while (true) {
            var token = peek();
            if (token instanceof SourceToken.Dot || token instanceof SourceToken.SafeNavigation) {
                advance();
                var selector = peek();
                if (!(selector instanceof SourceToken.Identifier) && !(selector instanceof SourceToken.Constant)) {
                    throw unexpected("method name");
                }
                advance();
                expression = parseCall(expression, startOf(expression), selector, context,
                                       token instanceof SourceToken.SafeNavigation);
            } else if (token instanceof SourceToken.Scope) {
                advance();
                expression = parseScoped(expression, context);
            } else {
                return expression;
            }
        }
    }

    private SyntaxNode parseScoped(SyntaxNode namespace, Context context) {
        var token = peek();
        if (!(token instanceof SourceToken.Identifier) && !(token instanceof SourceToken.Constant)) {
            throw unexpected("constant or method name after '::'");
        }
        advance();
        if (token instanceof SourceToken.Constant constant && !isAdjacentParen(token)) {
            return node("const", List.of(namespace, Atom.sym(constant.name())), startOf(namespace), endOf(token));
        }
        return parseCall(namespace, startOf(namespace), token, context, false);
    }

    private SyntaxNode parsePrimary(Context context) {
        var token = peek();
        if (token instanceof SourceToken.IntegerLiteral literal) {
            advance();
            return node("int", List.of(Atom.of(literal.value())), token);
        }
        if (token instanceof SourceToken.FloatLiteral literal) {
            advance();
            return node("float", List.of(new Atom.Real(literal.value())), token);
        }
        if (token instanceof SourceToken.StringLiteral literal) {
            advance();
            return node("str", List.of(Atom.str(literal.value())), token);
        }
        if (token instanceof SourceToken.Symbol symbol) {
            advance();
            return node("sym", List.of(Atom.sym(symbol.name())), token);
        }
        if (token instanceof SourceToken.Identifier id) {
            return parseIdentifier(id, context);
        }
        if (token instanceof SourceToken.Constant constant) {
            advance();
            if (isAdjacentParen(token)) {
                return parseCall(Atom.NIL, startOf(token), token, context, false);
            }
            return node("const", List.of(Atom.NIL, Atom.sym(constant.name())), token);
        }
        if (token instanceof SourceToken.LParen) {
            return parseGroup();
        }
        if (token instanceof SourceToken.LBracket) {
            return parseArray();
        }
        if (token instanceof SourceToken.LBrace) {
            return parseHash();
        }
        throw unexpected("expression");
    }

    private SyntaxNode parseIdentifier(SourceToken.Identifier id, Context context) {
        var name = id.name();
        if (UNSUPPORTED_KEYWORDS.contains(name)) {
            throw new SourceParseException(buffer.name(), id.span().start(), "Unsupported keyword '" + name + "'");
        }
        if (name.equals("do") || name.equals("end")) {
            throw unexpected("expression");
        }
        advance();
        if (VALUE_KEYWORDS.contains(name)) {
            return node(name, List.of(), id);
        }
        if (!isAdjacentParen(id)) {
            if (scope.isLocal(name)) {
                return node("lvar", List.of(Atom.sym(name)), id);
            }
            if (scope.acceptsNumbered(name)) {
                return node("lvar", List.of(Atom.sym(name)), id);
            }
        }
        return parseCall(Atom.NIL, startOf(id), id, context, false);
    }

    // === Calls ===

    private SyntaxNode parseCall(Child receiver, int start, SourceToken selector, Context context, boolean safeNavigation) {
        var name = selectorName(selector);
        var arguments = new Arguments();
        int end = endOf(selector);
        SourceSpan open = null;
        SourceSpan close = null;
        boolean commandArguments = false;

        if (isAdjacentParen(selector)) {
            open = advance().span();
            skipNewlines();
            while (!(peek() instanceof SourceToken.RParen)) {
                // only a sole argument may be a command: `create(build :user)`
                arguments.add(parseArgument(arguments.isEmpty() ? Context.STATEMENT : Context.ELEMENT));
                skipNewlines();
                if (!(peek() instanceof SourceToken.Comma)) {
                    break;
                }
                advance();
                skipNewlines();
            }
            close = expect(SourceToken.RParen.class, "')'").span();
            end = close.end().offset();
        } else if (context.allowCommand && isCommandArgumentStart(selector)) {
            commandArguments = true;
            arguments.add(parseArgument(Context.FIRST_COMMAND_ARGUMENT));
            while (peek() instanceof SourceToken.Comma) {
                advance();
                skipNewlines();
                arguments.add(parseArgument(Context.COMMAND_ARGUMENT));
            }
            end = arguments.end();
        }

        var children = new ArrayList<Child>();
        children.add(receiver);
        children.add(Atom.sym(name));
        children.addAll(arguments.build());
        var location = NodeLocation.of(buffer, buffer.span(start, end))
                                   .withSelector(selector.span());
        if (open != null) {
            location = location.withDelimiters(open, close);
        }
        var call = SyntaxNode.of(safeNavigation ? "csend" : "send", children, location);

        if (peek() instanceof SourceToken.LBrace && !commandArguments) {
            return parseBlock(call, SourceToken.RBrace.class::isInstance);
        }
        if (isKeyword(peek(), "do") && context.allowDo) {
            return parseBlock(call, token -> isKeyword(token, "end"));
        }
        return call;
    }

    private SyntaxNode parseArgument(Context context) {
        var token = peek();
        if (token instanceof SourceToken.Label label) {
            advance();
            skipNewlines();
            var value = parseExpression(context.withoutCommand());
            return node("pair", List.of(labelKey(label), value), startOf(label), endOf(value));
        }
        var expression = parseExpression(context);
        if (peek() instanceof SourceToken.FatArrow) {
            advance();
            skipNewlines();
            var value = parseExpression(context.withoutCommand());
            return node("pair", List.of(expression, value), startOf(expression), endOf(value));
        }
        return expression;
    }

    private boolean isCommandArgumentStart(SourceToken selector) {
        var next = peek();
        if (isAdjacent(selector, next)) {
            return false;
        }
        if (next instanceof SourceToken.Identifier id) {
            return !isKeyword(id.name()) || VALUE_KEYWORDS.contains(id.name());
        }
        return next instanceof SourceToken.IntegerLiteral
               || next instanceof SourceToken.FloatLiteral
               || next instanceof SourceToken.StringLiteral
               || next instanceof SourceToken.Symbol
               || next instanceof SourceToken.Constant
               || next instanceof SourceToken.Label
               || next instanceof SourceToken.LBracket
               || next instanceof SourceToken.LParen;
    }

    // === Blocks ===

    private SyntaxNode parseBlock(SyntaxNode call, Predicate<SourceToken> isClose) {
        var open = advance();
        scope = new LocalScope(scope, true);
        try {
            var parameters = parseBlockParameters(open);
            var body = parseStatements(isClose);
            if (!isClose.test(peek())) {
                throw unexpected(open instanceof SourceToken.LBrace ? "'}'" : "'end'");
            }
            var close = advance();
            Child second = parameters;
            var type = "block";
            if (scope.maxNumbered > 0 && parameters.arity() == 0) {
                type = "numblock";
                second = Atom.of(scope.maxNumbered);
            }
            var location = NodeLocation.of(buffer, buffer.span(startOf(call), endOf(close)))
                                       .withDelimiters(open.span(), close.span());
            return SyntaxNode.of(type, List.of(call, second, wrapBody(body)), location);
        } finally {
            scope = scope.parent;
        }
    }

    private SyntaxNode parseBlockParameters(SourceToken open) {
        if (!(peek() instanceof SourceToken.Pipe)) {
            return node("args", List.of(), endOf(open), endOf(open));
        }
        var first = advance();
        var parameters = new ArrayList<Child>();
        while (!(peek() instanceof SourceToken.Pipe)) {
            if (!(peek() instanceof SourceToken.Identifier id) || isKeyword(id.name())) {
                throw unexpected("block parameter name");
            }
            advance();
            scope.declare(id.name());
            scope.explicitParameters = true;
            parameters.add(node("arg", List.of(Atom.sym(id.name())), id));
            if (peek() instanceof SourceToken.Comma) {
                advance();
            } else if (!(peek() instanceof SourceToken.Pipe)) {
                throw unexpected("',' or '|'");
            }
        }
        var last = advance();
        return node("args", parameters, startOf(first), endOf(last));
    }

    // === Collections ===

    private SyntaxNode parseGroup() {
        var open = advance();
        var statements = parseStatements(SourceToken.RParen.class::isInstance);
        var close = expect(SourceToken.RParen.class, "')'");
        var location = NodeLocation.of(buffer, buffer.span(startOf(open), endOf(close)))
                                   .withDelimiters(open.span(), close.span());
        return SyntaxNode.of("begin", statements, location);
    }

    private SyntaxNode parseArray() {
        var open = advance();
        var elements = new ArrayList<SyntaxNode>();
        skipNewlines();
        while (!(peek() instanceof SourceToken.RBracket)) {
            elements.add(parseExpression(Context.ELEMENT));
            skipNewlines();
            if (!(peek() instanceof SourceToken.Comma)) {
                break;
            }
            advance();
            skipNewlines();
        }
        var close = expect(SourceToken.RBracket.class, "']'");
        var location = NodeLocation.of(buffer, buffer.span(startOf(open), endOf(close)))
                                   .withDelimiters(open.span(), close.span());
        return SyntaxNode.of("array", elements, location);
    }

    private SyntaxNode parseHash() {
        var open = advance();
        var pairs = new ArrayList<SyntaxNode>();
        skipNewlines();
        while (!(peek() instanceof SourceToken.RBrace)) {
            var start = peek();
            var pair = parseArgument(Context.ELEMENT);
            if (!pair.is("pair")) {
                throw new SourceParseException(buffer.name(), start.span().start(), "Expected 'key: value' or 'key => value'");
            }
            pairs.add(pair);
            skipNewlines();
            if (!(peek() instanceof SourceToken.Comma)) {
                break;
            }
            advance();
            skipNewlines();
        }
        var close = expect(SourceToken.RBrace.class, "'}'");
        var location = NodeLocation.of(buffer, buffer.span(startOf(open), endOf(close)))
                                   .withDelimiters(open.span(), close.span());
        return SyntaxNode.of("hash", pairs, location);
    }

    private SyntaxNode labelKey(SourceToken.Label label) {
        int start = startOf(label);
        // key span excludes the colon
        return node("sym", List.of(Atom.sym(label.name())), start, endOf(label) - 1);
    }

    /**
     * Positional arguments followed by keyword pairs, which are grouped into one trailing hash.
     */
    private final class Arguments {
        private final List<SyntaxNode> positional = new ArrayList<>();
        private final List<SyntaxNode> pairs = new ArrayList<>();

        void add(SyntaxNode argument) {
            if (argument.is("pair")) {
                pairs.add(argument);
                return;
            }
            if (!pairs.isEmpty()) {
                throw new SourceParseException(buffer.name(), argument.span().start(),
                                               "Positional argument after keyword arguments");
            }
            positional.add(argument);
        }

        boolean isEmpty() {
            return positional.isEmpty() && pairs.isEmpty();
        }

        int end() {
            var last = pairs.isEmpty() ? positional.get(positional.size() - 1) : pairs.get(pairs.size() - 1);
            return endOf(last);
        }

        List<SyntaxNode> build() {
            if (pairs.isEmpty()) {
                return positional;
            }
            var all = new ArrayList<>(positional);
            all.add(node("hash", pairs, startOf(pairs.get(0)), endOf(pairs.get(pairs.size() - 1))));
            return all;
        }
    }

    /**
     * Local variable names visible at the current position. Blocks see the enclosing scope.
     */
    private static final class LocalScope {
        private final LocalScope parent;
        private final boolean block;
        private final Set<String> locals = new HashSet<>();
        private boolean explicitParameters;
        private int maxNumbered;

        LocalScope(LocalScope parent, boolean block) {
            this.parent = parent;
            this.block = block;
        }

        void declare(String name) {
            locals.add(name);
        }

        boolean isLocal(String name) {
            for (var current = this; current != null; current = current.parent) {
                if (current.locals.contains(name)) {
                    return true;
                }
            }
            return false;
        }

        /**
         * {@code _1} to {@code _9} inside a block without explicit parameters.
         */
        boolean acceptsNumbered(String name) {
            if (!block || explicitParameters || name.length() != 2 || name.charAt(0) != '_') {
                return false;
            }
            char digit = name.charAt(1);
            if (digit < '1' || digit > '9') {
                return false;
            }
            maxNumbered = Math.max(maxNumbered, digit - '0');
            return true;
        }
    }

    // === Token access ===

    private boolean isAtEnd() {
        return peek() instanceof SourceToken.Eof;
    }

    private SourceToken peek() {
        return tokens.get(pos);
    }

    private SourceToken peekAhead(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private SourceToken advance() {
        var token = peek();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private SourceToken expect(Class<? extends SourceToken> tokenClass, String description) {
        if (!tokenClass.isInstance(peek())) {
            throw unexpected(description);
        }
        return advance();
    }

    private void skipNewlines() {
        while (peek() instanceof SourceToken.Newline) {
            advance();
        }
    }

    private void skipTerminators() {
        while (isStatementTerminator(peek())) {
            advance();
        }
    }

    private static boolean isStatementTerminator(SourceToken token) {
        return token instanceof SourceToken.Newline || token instanceof SourceToken.Semicolon;
    }

    private boolean isAdjacentParen(SourceToken token) {
        return peek() instanceof SourceToken.LParen && isAdjacent(token, peek());
    }

    private static boolean isAdjacent(SourceToken left, SourceToken right) {
        return left.span().end().offset() == right.span().start().offset();
    }

    private static boolean isKeyword(String name) {
        return VALUE_KEYWORDS.contains(name) || UNSUPPORTED_KEYWORDS.contains(name)
               || name.equals("do") || name.equals("end");
    }

    private static boolean isKeyword(SourceToken token, String keyword) {
        return token instanceof SourceToken.Identifier id && id.name().equals(keyword);
    }

    private static String selectorName(SourceToken selector) {
        if (selector instanceof SourceToken.Identifier id) {
            return id.name();
        }
        return ((SourceToken.Constant) selector).name();
    }

    private SyntaxNode node(String type, List<? extends Child> children, SourceToken token) {
        return node(type, children, startOf(token), endOf(token));
    }

    private SyntaxNode node(String type, List<? extends Child> children, int start, int end) {
        return SyntaxNode.of(type, children, NodeLocation.of(buffer, buffer.span(start, end)));
    }

    private static int startOf(SourceToken token) {
        return token.span().start().offset();
    }

    private static int endOf(SourceToken token) {
        return token.span().end().offset();
    }

    private static int startOf(SyntaxNode node) {
        return node.span().start().offset();
    }

    private static int endOf(SyntaxNode node) {
        return node.span().end().offset();
    }

    private SourceParseException unexpected(String expected) {
        var token = peek();
        return new SourceParseException(buffer.name(), token.span().start(),
                                        "Unexpected " + tokenDescription(token) + ", expected " + expected);
    }

    private String tokenDescription(SourceToken token) {
        if (token instanceof SourceToken.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof SourceToken.Constant constant) {
            return "constant '" + constant.name() + "'";
        }
        if (token instanceof SourceToken.Label label) {
            return "label '" + label.name() + ":'";
        }
        if (token instanceof SourceToken.IntegerLiteral || token instanceof SourceToken.FloatLiteral) {
            return "number";
        }
        if (token instanceof SourceToken.StringLiteral) {
            return "string literal";
        }
        if (token instanceof SourceToken.Symbol symbol) {
            return "symbol :" + symbol.name();
        }
        if (token instanceof SourceToken.Newline) {
            return "end of line";
        }
        if (token instanceof SourceToken.Eof) {
            return "end of input";
        }
        return "'" + buffer.source(token.span()) + "'";
    }
}
