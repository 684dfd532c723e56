package org.pragmatica.cop.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Immutable node of a parsed source tree: a type tag, ordered children and a source location.
 *
 * <p>Tags and child layouts follow the Ruby {@code parser} gem, e.g.
 * {@code 3.times { create :user }} is
 * {@code (block (send (int 3) :times) (args) (send nil :create (sym :user)))}.
 */
public record SyntaxNode(String type, ImmutableList<Child> children, NodeLocation location) implements Child {

    public SyntaxNode {
        requireNonNull(type);
        requireNonNull(children);
        requireNonNull(location);
    }

    public static SyntaxNode of(String type, List<? extends Child> children, NodeLocation location) {
        return new SyntaxNode(type, ImmutableList.copyOf(children), location);
    }

    public boolean is(String expectedType) {
        return type.equals(expectedType);
    }

    public int arity() {
        return children.size();
    }

    public Optional<Child> child(int index) {
        return index >= 0 && index < children.size()
               ? Optional.of(children.get(index))
               : Optional.empty();
    }

    /**
     * Child at index if it is a node. Atoms (including {@link Atom#NIL}) and missing children yield empty.
     */
    public Optional<SyntaxNode> nodeAt(int index) {
        return child(index).filter(SyntaxNode.class::isInstance)
                           .map(SyntaxNode.class::cast);
    }

    public Optional<Atom> atomAt(int index) {
        return child(index).filter(Atom.class::isInstance)
                           .map(Atom.class::cast);
    }

    public SourceSpan span() {
        return location.expression();
    }

    /**
     * Verbatim source text covered by this node.
     */
    public String source() {
        return location.source();
    }

    /**
     * Pre-order traversal over this node and all descendant nodes.
     */
    public void forEachNode(Consumer<SyntaxNode> visitor) {
        visitor.accept(this);
        for (var child : children) {
            if (child instanceof SyntaxNode node) {
                node.forEachNode(visitor);
            }
        }
    }

    public List<SyntaxNode> descendants() {
        var result = ImmutableList.<SyntaxNode>builder();
        forEachNode(result::add);
        return result.build();
    }

    /**
     * S-expression rendering, e.g. {@code (send nil :create (sym :user))}.
     */
    @Override
    public String toString() {
        var sb = new StringBuilder("(").append(type);
        for (var child : children) {
            sb.append(' ').append(child);
        }
        return sb.append(')').toString();
    }
}
