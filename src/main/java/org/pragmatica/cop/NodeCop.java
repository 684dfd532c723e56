package org.pragmatica.cop;

import org.pragmatica.cop.lint.LintConfig;
import org.pragmatica.cop.lint.LintReport;
import org.pragmatica.cop.lint.Linter;
import org.pragmatica.cop.rule.Cop;
import org.pragmatica.cop.rule.CreateListCop;
import org.pragmatica.cop.tree.SourceBuffer;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for linting Ruby test sources.
 *
 * <p>Example usage:
 * <pre>{@code
 * var report = NodeCop.lint("3.times { create :user }");
 * report.offenses();          // one RSpec/FactoryGirl/CreateList offense
 *
 * NodeCop.autocorrect("3.times { create :user }");   // "create_list :user, 3"
 * }</pre>
 */
public final class NodeCop {
    private NodeCop() {}

    /**
     * Cops enabled when none are configured explicitly.
     */
    public static List<Cop<?>> defaultCops() {
        return List.of(CreateListCop.create());
    }

    public static LintReport lint(String source) {
        return lint(SourceBuffer.of(source));
    }

    public static LintReport lint(SourceBuffer buffer) {
        return Linter.create(defaultCops(), LintConfig.DEFAULT)
                     .lint(buffer);
    }

    /**
     * Rewrite all detected idioms, returning the source unchanged when nothing fires.
     */
    public static String autocorrect(String source) {
        return Linter.create(defaultCops(), LintConfig.DEFAULT.withAutocorrect(true))
                     .lint(SourceBuffer.of(source))
                     .source();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Cop<?>> cops = new ArrayList<>();
        private boolean autocorrect = LintConfig.DEFAULT.autocorrect();
        private boolean parallel = LintConfig.DEFAULT.parallel();
        private int maxIterations = LintConfig.DEFAULT.maxIterations();

        private Builder() {}

        public Builder autocorrect(boolean enabled) {
            this.autocorrect = enabled;
            return this;
        }

        public Builder parallel(boolean enabled) {
            this.parallel = enabled;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder cop(Cop<?> cop) {
            cops.add(cop);
            return this;
        }

        public Linter build() {
            var config = new LintConfig(autocorrect, parallel, maxIterations);
            return Linter.create(cops.isEmpty() ? defaultCops() : cops, config);
        }
    }
}
