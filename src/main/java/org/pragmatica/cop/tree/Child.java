package org.pragmatica.cop.tree;

/**
 * Element of a node's child list: either a nested {@link SyntaxNode} or a raw {@link Atom} value.
 */
public sealed interface Child permits SyntaxNode, Atom {

    default boolean isNode() {
        return this instanceof SyntaxNode;
    }

    default boolean isNil() {
        return this instanceof Atom.Nil;
    }
}
