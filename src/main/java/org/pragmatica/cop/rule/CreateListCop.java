package org.pragmatica.cop.rule;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cop.pattern.Bindings;
import org.pragmatica.cop.pattern.PatternLibrary;
import org.pragmatica.cop.pattern.PatternMatcher;
import org.pragmatica.cop.tree.Atom;
import org.pragmatica.cop.tree.Child;
import org.pragmatica.cop.tree.SourceSpan;
import org.pragmatica.cop.tree.SyntaxNode;

import java.util.Optional;
import java.util.Set;

/**
 * Prefer {@code create_list} over {@code n.times { create ... }}.
 *
 * <pre>
 * # bad
 * 3.times { create :user }
 *
 * # good
 * create_list :user, 3
 *
 * # good - the block uses the iteration index
 * 3.times { |n| create :user, created_at: n.months.ago }
 * </pre>
 */
public final class CreateListCop implements Cop<DetectedIdiom> {
    public static final String NAME = "RSpec/FactoryGirl/CreateList";
    public static final String MESSAGE = "Prefer create_list.";

    static final String BULK_METHOD = "create_list";

    static final String PATTERNS = """
        n_times                  <- (send $count<(int _)> :times)
        times_block_without_args <- (block $times<#n_times> (args) $body)
        factory_call             <- (send $receiver<{nil (const ...)}> :create $factory<(sym _)> $options...)
        """;

    private static final PatternMatcher MATCHER = PatternMatcher.create(PatternLibrary.parse(PATTERNS));

    private CreateListCop() {}

    public static CreateListCop create() {
        return new CreateListCop();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String message() {
        return MESSAGE;
    }

    @Override
    public Set<String> nodeTypes() {
        return Set.of("block");
    }

    @Override
    public Optional<DetectedIdiom> detect(SyntaxNode node) {
        var outer = MATCHER.match("times_block_without_args", node).toOptional();
        if (outer.isEmpty()) {
            return Optional.empty();
        }
        // Several statements parse as (begin ...), which fails the send tag below
        var body = outer.get().child("body");
        var inner = MATCHER.match("factory_call", body).toOptional();
        if (inner.isEmpty() || !(body instanceof SyntaxNode factoryCall)) {
            return Optional.empty();
        }
        var timesCall = outer.get().node("times").orElseThrow();
        var countNode = MATCHER.match("n_times", timesCall)
                               .toOptional()
                               .flatMap(bindings -> bindings.node("count"))
                               .orElseThrow();
        return toIdiom(node, timesCall, countNode, factoryCall, inner.get());
    }

    private static Optional<DetectedIdiom> toIdiom(SyntaxNode block,
                                                   SyntaxNode timesCall,
                                                   SyntaxNode countNode,
                                                   SyntaxNode factoryCall,
                                                   Bindings bindings) {
        var options = ImmutableList.<SyntaxNode>builder();
        for (Child option : bindings.sequence("options")) {
            if (!(option instanceof SyntaxNode optionNode)) {
                return Optional.empty();
            }
            options.add(optionNode);
        }
        var factoryNode = bindings.node("factory").orElseThrow();
        if (!(countNode.atomAt(0).orElseThrow() instanceof Atom.Int count)
            || !(factoryNode.atomAt(0).orElseThrow() instanceof Atom.Sym factory)) {
            return Optional.empty();
        }
        return Optional.of(new DetectedIdiom(block,
                                             timesCall,
                                             countNode,
                                             count.value(),
                                             factoryCall,
                                             bindings.node("receiver"),
                                             factoryNode,
                                             factory.name(),
                                             options.build()));
    }

    @Override
    public SourceSpan offenseSpan(DetectedIdiom match) {
        return match.timesCall().span();
    }

    @Override
    public ReplacementSpan rewrite(DetectedIdiom match) {
        return ReplacementSpan.of(match.block().span(), generate(match));
    }

    /**
     * Replacement text for the whole block, keeping the call style of the original {@code create}.
     */
    public String generate(DetectedIdiom match) {
        var arguments = ReplacementBuilder.create()
                                          .source(match.factoryNode())
                                          .token(", ")
                                          .token(String.valueOf(match.count()));
        for (var option : match.options()) {
            arguments.token(", ").source(option);
        }

        var replacement = ReplacementBuilder.create();
        match.receiver().ifPresent(receiver -> replacement.source(receiver).token("."));
        replacement.token(BULK_METHOD);
        if (usesParentheses(match.factoryCall())) {
            replacement.token("(").token(arguments.build()).token(")");
        } else {
            replacement.token(" ").token(arguments.build());
        }
        return replacement.build();
    }

    static boolean usesParentheses(SyntaxNode call) {
        var location = call.location();
        return location.beginSource().filter("("::equals).isPresent()
               && location.endSource().filter(")"::equals).isPresent();
    }
}
