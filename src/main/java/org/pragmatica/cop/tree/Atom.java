package org.pragmatica.cop.tree;

import static java.util.Objects.requireNonNull;

/**
 * Raw literal values stored directly in a node's children.
 * {@link Nil} marks an absent child, e.g. the receiver of {@code create :user}.
 */
public sealed interface Atom extends Child {

    Nil NIL = new Nil();

    static Int of(long value) {
        return new Int(value);
    }

    static Sym sym(String name) {
        return new Sym(name);
    }

    static Str str(String value) {
        return new Str(value);
    }

    record Int(long value) implements Atom {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Real(double value) implements Atom {
        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    record Sym(String name) implements Atom {
        public Sym {
            requireNonNull(name);
        }

        @Override
        public String toString() {
            return ":" + name;
        }
    }

    record Str(String value) implements Atom {
        public Str {
            requireNonNull(value);
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    record Nil() implements Atom {
        @Override
        public String toString() {
            return "nil";
        }
    }
}
