package org.pragmatica.cop.lint;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cop.rule.ReplacementSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects replacements for one source text and applies them together.
 * A replacement overlapping one already accepted is skipped; the next correction round picks it up.
 */
public final class Corrector {
    private static final Logger log = LoggerFactory.getLogger(Corrector.class);

    private final List<ReplacementSpan> accepted = new ArrayList<>();

    private Corrector() {}

    public static Corrector create() {
        return new Corrector();
    }

    /**
     * @return false if the replacement was skipped because it overlaps an accepted one
     */
    public boolean add(ReplacementSpan replacement) {
        for (var existing : accepted) {
            if (existing.span().overlaps(replacement.span())) {
                log.warn("Skipping correction at {}: overlaps correction at {}", replacement.span(), existing.span());
                return false;
            }
        }
        accepted.add(replacement);
        return true;
    }

    public boolean isEmpty() {
        return accepted.isEmpty();
    }

    public List<ReplacementSpan> replacements() {
        return ImmutableList.copyOf(accepted);
    }

    /**
     * Apply all accepted replacements, last offset first so earlier offsets stay valid.
     */
    public String apply(String source) {
        var ordered = new ArrayList<>(accepted);
        ordered.sort(Comparator.comparingInt((ReplacementSpan r) -> r.span().start().offset()).reversed());
        var result = new StringBuilder(source);
        for (var replacement : ordered) {
            result.replace(replacement.span().start().offset(), replacement.span().end().offset(),
                           replacement.replacement());
        }
        return result.toString();
    }
}
