package org.pragmatica.cop.rule;

import org.pragmatica.cop.tree.SyntaxNode;

/**
 * Builds replacement text from fixed tokens and verbatim copies of original source,
 * so copied sub-expressions keep their exact formatting.
 */
public final class ReplacementBuilder {
    private final StringBuilder text = new StringBuilder(64);

    private ReplacementBuilder() {}

    public static ReplacementBuilder create() {
        return new ReplacementBuilder();
    }

    public ReplacementBuilder token(String token) {
        text.append(token);
        return this;
    }

    /**
     * Copy the node's original source text.
     */
    public ReplacementBuilder source(SyntaxNode node) {
        text.append(node.source());
        return this;
    }

    public String build() {
        return text.toString();
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
