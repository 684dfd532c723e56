package org.pragmatica.cop.pattern;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Result of matching a pattern against a child - either bindings or no match.
 * A failed match is the shared {@link #NO_MATCH} instance.
 */
public sealed interface MatchResult {

    MatchResult NO_MATCH = new NoMatch();

    boolean isMatch();

    /**
     * Bindings of a successful match, empty otherwise.
     */
    default Optional<Bindings> toOptional() {
        return this instanceof Matched matched
               ? Optional.of(matched.bindings())
               : Optional.empty();
    }

    static MatchResult matched(Bindings bindings) {
        return new Matched(bindings);
    }

    record Matched(Bindings bindings) implements MatchResult {
        public Matched {
            requireNonNull(bindings);
        }

        @Override
        public boolean isMatch() {
            return true;
        }
    }

    final class NoMatch implements MatchResult {
        private NoMatch() {}

        @Override
        public boolean isMatch() {
            return false;
        }

        @Override
        public String toString() {
            return "NoMatch";
        }
    }
}
