package org.pragmatica.cop.rule;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cop.tree.SyntaxNode;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A confirmed {@code N.times { create :factory, ... }} site.
 *
 * @param block       the whole block expression, which the rewrite replaces
 * @param timesCall   {@code N.times}, where the offense is reported
 * @param countNode   the integer literal {@code N}
 * @param count       value of {@code N}
 * @param factoryCall the single {@code create} call forming the block body
 * @param receiver    namespace of the call, e.g. {@code FactoryGirl}, if any
 * @param factoryNode the symbol naming the factory, e.g. {@code :user}
 * @param factory     factory name without the leading colon
 * @param options     arguments after the factory name, in source order
 */
public record DetectedIdiom(
    SyntaxNode block,
    SyntaxNode timesCall,
    SyntaxNode countNode,
    long count,
    SyntaxNode factoryCall,
    Optional<SyntaxNode> receiver,
    SyntaxNode factoryNode,
    String factory,
    ImmutableList<SyntaxNode> options) {

    public DetectedIdiom {
        requireNonNull(block);
        requireNonNull(timesCall);
        requireNonNull(countNode);
        requireNonNull(factoryCall);
        requireNonNull(receiver);
        requireNonNull(factoryNode);
        requireNonNull(factory);
        requireNonNull(options);
    }
}
