package org.pragmatica.cop.rule;

import org.pragmatica.cop.tree.SourceSpan;
import org.pragmatica.cop.tree.SyntaxNode;

import java.util.Optional;
import java.util.Set;

/**
 * A single lint rule. Implementations are stateless: every call to {@link #detect} is independent.
 *
 * @param <M> what a successful detection carries into offense reporting and rewriting
 */
public interface Cop<M> {

    /**
     * Qualified name, e.g. {@code RSpec/FactoryGirl/CreateList}.
     */
    String name();

    String message();

    /**
     * Node types the driver should hand to {@link #detect}.
     */
    Set<String> nodeTypes();

    /**
     * Inspect one node. Empty is the normal outcome for code that does not contain the idiom.
     */
    Optional<M> detect(SyntaxNode node);

    /**
     * Where the offense is reported.
     */
    SourceSpan offenseSpan(M match);

    /**
     * Autocorrection for a detected match.
     */
    ReplacementSpan rewrite(M match);
}
