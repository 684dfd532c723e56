package org.pragmatica.cop.pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.cop.tree.SourceLocation;
import org.pragmatica.cop.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Node pattern types - declarative descriptions of an expected tree shape with named capture slots.
 *
 * <p>Structural rules are checked on construction, so a pattern that exists is well formed:
 * {@link Rest} may only appear as the last child of a {@link Node}, capture names are unique,
 * and all alternatives of an {@link Alternation} capture the same names.
 */
public sealed interface Pattern {

    SourceSpan NO_SPAN = SourceSpan.at(SourceLocation.START);

    /**
     * Source location of this pattern in the pattern text ({@link #NO_SPAN} when built in code).
     */
    SourceSpan span();

    /**
     * Names this pattern binds on a successful match, in declaration order.
     */
    ImmutableSet<String> captureNames();

    // === Structure ===

    /**
     * Node with a type tag and positional children: (send nil :create ...)
     */
    record Node(SourceSpan span, String type, ImmutableList<Pattern> children, ImmutableSet<String> captureNames)
        implements Pattern {

        public Node(SourceSpan span, String type, List<Pattern> children) {
            this(span, type, ImmutableList.copyOf(children), CaptureNames.union(children));
        }

        public Node {
            requireNonNull(type);
            for (int i = 0; i < children.size() - 1; i++) {
                if (children.get(i) instanceof Rest rest) {
                    throw new PatternSyntaxException(rest.span().start(),
                                                     "'...' is only allowed as the last child of (" + type + ")");
                }
            }
        }

        public boolean hasRest() {
            return !children.isEmpty() && children.get(children.size() - 1) instanceof Rest;
        }

        /**
         * Number of children matched positionally, i.e. excluding a trailing rest.
         */
        public int fixedArity() {
            return hasRest() ? children.size() - 1 : children.size();
        }
    }

    /**
     * Anything: _
     */
    record Wildcard(SourceSpan span) implements Pattern {
        @Override
        public ImmutableSet<String> captureNames() {
            return ImmutableSet.of();
        }
    }

    /**
     * Remaining children: ... or $name...
     */
    record Rest(SourceSpan span, Optional<String> name) implements Pattern {
        @Override
        public ImmutableSet<String> captureNames() {
            return name.map(ImmutableSet::of)
                       .orElse(ImmutableSet.of());
        }
    }

    // === Captures ===

    /**
     * Named capture of a single child: $name or $name&lt;pattern&gt;
     */
    record Capture(SourceSpan span, String name, Pattern pattern, ImmutableSet<String> captureNames)
        implements Pattern {

        public Capture(SourceSpan span, String name, Pattern pattern) {
            this(span, name, pattern, CaptureNames.prepend(span, name, pattern.captureNames()));
        }

        public Capture {
            requireNonNull(name);
            if (pattern instanceof Rest) {
                throw new PatternSyntaxException(span.start(), "use $" + name + "... to capture remaining children");
            }
        }
    }

    // === Atom literals ===

    /**
     * Integer literal: 42
     */
    record IntLiteral(SourceSpan span, long value) implements Pattern {
        @Override
        public ImmutableSet<String> captureNames() {
            return ImmutableSet.of();
        }
    }

    /**
     * Symbol literal: :times
     */
    record SymLiteral(SourceSpan span, String name) implements Pattern {
        @Override
        public ImmutableSet<String> captureNames() {
            return ImmutableSet.of();
        }
    }

    /**
     * String literal: "text"
     */
    record StrLiteral(SourceSpan span, String value) implements Pattern {
        @Override
        public ImmutableSet<String> captureNames() {
            return ImmutableSet.of();
        }
    }

    /**
     * Absent child: nil
     */
    record NilLiteral(SourceSpan span) implements Pattern {
        @Override
        public ImmutableSet<String> captureNames() {
            return ImmutableSet.of();
        }
    }

    // === Combinators ===

    /**
     * Ordered alternation: {p1 p2 p3}
     */
    record Alternation(SourceSpan span, ImmutableList<Pattern> alternatives, ImmutableSet<String> captureNames)
        implements Pattern {

        public Alternation(SourceSpan span, List<Pattern> alternatives) {
            this(span, ImmutableList.copyOf(alternatives), CaptureNames.common(span, alternatives));
        }

        public Alternation {
            if (alternatives.isEmpty()) {
                throw new PatternSyntaxException(span.start(), "alternation needs at least one alternative");
            }
            for (var alternative : alternatives) {
                if (alternative instanceof Rest rest) {
                    throw new PatternSyntaxException(rest.span().start(), "'...' is not allowed inside {}");
                }
            }
        }
    }

    /**
     * Reference to a named library pattern: #name.
     * Captures made inside the referenced pattern stay local to it.
     */
    record Reference(SourceSpan span, String name) implements Pattern {
        public Reference {
            requireNonNull(name);
        }

        @Override
        public ImmutableSet<String> captureNames() {
            return ImmutableSet.of();
        }
    }
}
