package org.pragmatica.cop.lint;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Linter configuration options.
 *
 * @param autocorrect   compute corrections and rewrite the source until no cop fires
 * @param parallel      inspect nodes of one tree on a parallel stream
 * @param maxIterations correction rounds before giving up on a source that never settles
 */
public record LintConfig(
    boolean autocorrect,
    boolean parallel,
    int maxIterations
) {
    public static final LintConfig DEFAULT = new LintConfig(
        false,
        false,
        200
    );

    public LintConfig {
        checkArgument(maxIterations > 0, "maxIterations must be positive: %s", maxIterations);
    }

    public LintConfig withAutocorrect(boolean enabled) {
        return new LintConfig(enabled, parallel, maxIterations);
    }
}
