package org.pragmatica.cop.pattern;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.cop.tree.Atom;
import org.pragmatica.cop.tree.Child;
import org.pragmatica.cop.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Pattern matching engine - interprets {@link Pattern} values against syntax tree children.
 *
 * <p>Matching is total: wrong tags, arities or atom kinds produce {@link MatchResult#NO_MATCH},
 * never an exception. The engine holds no mutable state and may be shared between threads.
 * A {@code #name} reference the library does not define is a programming error and throws.
 */
public final class PatternMatcher {

    private final PatternLibrary library;

    private PatternMatcher(PatternLibrary library) {
        this.library = library;
    }

    public static PatternMatcher create(PatternLibrary library) {
        return new PatternMatcher(requireNonNull(library));
    }

    public static PatternMatcher create() {
        return new PatternMatcher(PatternLibrary.empty());
    }

    /**
     * Match a library pattern by name.
     *
     * @throws IllegalArgumentException if the library has no such pattern
     */
    public MatchResult match(String patternName, Child child) {
        var pattern = library.pattern(patternName)
                             .orElseThrow(() -> new IllegalArgumentException("Unknown pattern: " + patternName));
        return match(pattern, child);
    }

    public MatchResult match(Pattern pattern, Child child) {
        var captures = new Captures();
        if (!matchChild(pattern, child, captures)) {
            return MatchResult.NO_MATCH;
        }
        return MatchResult.matched(captures.toBindings());
    }

    public boolean matches(String patternName, Child child) {
        return match(patternName, child).isMatch();
    }

    // === Dispatch ===

    private boolean matchChild(Pattern pattern, Child child, Captures captures) {
        if (pattern instanceof Pattern.Node node) {
            return child instanceof SyntaxNode syntaxNode && matchNode(node, syntaxNode, captures);
        }
        if (pattern instanceof Pattern.Wildcard) {
            return true;
        }
        if (pattern instanceof Pattern.Capture capture) {
            return matchCapture(capture, child, captures);
        }
        if (pattern instanceof Pattern.Alternation alternation) {
            return matchAlternation(alternation, child, captures);
        }
        if (pattern instanceof Pattern.Reference ref) {
            return matchReference(ref, child);
        }
        if (pattern instanceof Pattern.IntLiteral lit) {
            return child instanceof Atom.Int value && value.value() == lit.value();
        }
        if (pattern instanceof Pattern.SymLiteral lit) {
            return child instanceof Atom.Sym sym && sym.name().equals(lit.name());
        }
        if (pattern instanceof Pattern.StrLiteral lit) {
            return child instanceof Atom.Str str && str.value().equals(lit.value());
        }
        if (pattern instanceof Pattern.NilLiteral) {
            return child instanceof Atom.Nil;
        }
        // A rest only has meaning as the tail of a node's children
        return false;
    }

    // === Structure ===

    private boolean matchNode(Pattern.Node pattern, SyntaxNode node, Captures captures) {
        if (!node.is(pattern.type())) {
            return false;
        }
        var children = node.children();
        int fixed = pattern.fixedArity();
        if (pattern.hasRest() ? children.size() < fixed : children.size() != fixed) {
            return false;
        }
        for (int i = 0; i < fixed; i++) {
            if (!matchChild(pattern.children().get(i), children.get(i), captures)) {
                return false;
            }
        }
        if (pattern.hasRest()) {
            var rest = (Pattern.Rest) pattern.children().get(fixed);
            rest.name()
                .ifPresent(name -> captures.put(name, new Bindings.Binding.Sequence(children.subList(fixed, children.size()))));
        }
        return true;
    }

    private boolean matchCapture(Pattern.Capture capture, Child child, Captures captures) {
        // Slot is taken before descending so bindings keep declaration order
        int slot = captures.reserve(capture.name());
        if (!matchChild(capture.pattern(), child, captures)) {
            return false;
        }
        captures.fill(slot, new Bindings.Binding.Single(child));
        return true;
    }

    // === Combinators ===

    private boolean matchAlternation(Pattern.Alternation alternation, Child child, Captures captures) {
        int mark = captures.mark();
        for (var alternative : alternation.alternatives()) {
            if (matchChild(alternative, child, captures)) {
                return true;
            }
            captures.reset(mark);
        }
        return false;
    }

    private boolean matchReference(Pattern.Reference ref, Child child) {
        var referenced = library.pattern(ref.name())
                                .orElseThrow(() -> new IllegalArgumentException(
                                    "Unknown pattern reference '#" + ref.name() + "' at " + ref.span().start()));
        // Referenced pattern acts as a predicate: its captures are not exported
        return matchChild(referenced, child, new Captures());
    }

    /**
     * Capture accumulator for one match attempt. Storage is allocated on the first capture,
     * so attempts which fail before capturing anything allocate nothing beyond this object.
     */
    private static final class Captures {
        private List<String> names;
        private List<Bindings.Binding> values;

        void put(String name, Bindings.Binding value) {
            fill(reserve(name), value);
        }

        int reserve(String name) {
            if (names == null) {
                names = new ArrayList<>(4);
                values = new ArrayList<>(4);
            }
            names.add(name);
            values.add(null);
            return names.size() - 1;
        }

        void fill(int slot, Bindings.Binding value) {
            values.set(slot, value);
        }

        int mark() {
            return names == null ? 0 : names.size();
        }

        void reset(int mark) {
            if (names != null) {
                names.subList(mark, names.size()).clear();
                values.subList(mark, values.size()).clear();
            }
        }

        Bindings toBindings() {
            if (names == null) {
                return new Bindings(ImmutableMap.of());
            }
            var builder = ImmutableMap.<String, Bindings.Binding>builderWithExpectedSize(names.size());
            for (int i = 0; i < names.size(); i++) {
                builder.put(names.get(i), values.get(i));
            }
            return new Bindings(builder.build());
        }
    }
}
