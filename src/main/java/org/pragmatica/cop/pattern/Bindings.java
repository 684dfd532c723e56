package org.pragmatica.cop.pattern;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.cop.tree.Child;
import org.pragmatica.cop.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Named results of a successful match. Keys are exactly the capture names of the matched pattern.
 */
public final class Bindings {
    private final ImmutableMap<String, Binding> values;

    Bindings(ImmutableMap<String, Binding> values) {
        this.values = values;
    }

    /**
     * Value bound to one capture slot.
     */
    public sealed interface Binding {
        /**
         * Captured by $name or $name&lt;pattern&gt;.
         */
        record Single(Child child) implements Binding {
            public Single {
                requireNonNull(child);
            }
        }

        /**
         * Captured by $name..., possibly empty.
         */
        record Sequence(ImmutableList<Child> children) implements Binding {
            public Sequence {
                requireNonNull(children);
            }
        }
    }

    public Set<String> names() {
        return values.keySet();
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * The single child bound to name.
     *
     * @throws IllegalArgumentException if the name is unknown or bound to a sequence
     */
    public Child child(String name) {
        if (values.get(name) instanceof Binding.Single single) {
            return single.child();
        }
        throw new IllegalArgumentException("no single capture named '" + name + "' in " + values.keySet());
    }

    /**
     * The node bound to name, or empty when the bound child is an atom such as {@code nil}.
     */
    public Optional<SyntaxNode> node(String name) {
        return child(name) instanceof SyntaxNode node
               ? Optional.of(node)
               : Optional.empty();
    }

    /**
     * Children bound to name by a rest capture.
     *
     * @throws IllegalArgumentException if the name is unknown or bound to a single child
     */
    public List<Child> sequence(String name) {
        if (values.get(name) instanceof Binding.Sequence sequence) {
            return sequence.children();
        }
        throw new IllegalArgumentException("no sequence capture named '" + name + "' in " + values.keySet());
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof Bindings other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
