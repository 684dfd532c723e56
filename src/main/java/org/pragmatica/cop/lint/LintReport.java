package org.pragmatica.cop.lint;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cop.tree.SourceBuffer;

import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of linting one buffer.
 *
 * @param buffer          the inspected source
 * @param offenses        offenses found in the original source, in source order
 * @param correctedSource rewritten source when autocorrect ran and changed something
 * @param iterations      lint rounds performed
 */
public record LintReport(
    SourceBuffer buffer,
    ImmutableList<Offense> offenses,
    Optional<String> correctedSource,
    int iterations) {

    public LintReport {
        requireNonNull(buffer);
        requireNonNull(offenses);
        requireNonNull(correctedSource);
    }

    public boolean hasOffenses() {
        return !offenses.isEmpty();
    }

    /**
     * Corrected source, or the original when nothing was corrected.
     */
    public String source() {
        return correctedSource.orElse(buffer.text());
    }

    public String format() {
        return offenses.stream()
                       .map(offense -> offense.format(buffer))
                       .collect(Collectors.joining("\n"));
    }
}
