package org.pragmatica.cop.pattern;

import com.google.common.collect.ImmutableSet;
import org.pragmatica.cop.tree.SourceSpan;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Capture-name bookkeeping shared by the composite {@link Pattern} records.
 */
final class CaptureNames {
    private CaptureNames() {}

    /**
     * Names of all children in order; a name bound twice is an error.
     */
    static ImmutableSet<String> union(List<Pattern> patterns) {
        var names = new LinkedHashSet<String>();
        for (var pattern : patterns) {
            for (var name : pattern.captureNames()) {
                if (!names.add(name)) {
                    throw duplicate(pattern.span(), name);
                }
            }
        }
        return ImmutableSet.copyOf(names);
    }

    static ImmutableSet<String> prepend(SourceSpan span, String name, ImmutableSet<String> inner) {
        if (inner.contains(name)) {
            throw duplicate(span, name);
        }
        return ImmutableSet.<String>builder()
                           .add(name)
                           .addAll(inner)
                           .build();
    }

    /**
     * Names shared by every alternative. Alternatives binding different names are rejected.
     */
    static ImmutableSet<String> common(SourceSpan span, List<Pattern> alternatives) {
        if (alternatives.isEmpty()) {
            return ImmutableSet.of();
        }
        var first = alternatives.get(0).captureNames();
        for (var alternative : alternatives) {
            if (!alternative.captureNames().equals(first)) {
                throw new PatternSyntaxException(span.start(),
                                                 "alternatives capture different names: " + first + " vs "
                                                 + alternative.captureNames());
            }
        }
        return first;
    }

    private static PatternSyntaxException duplicate(SourceSpan span, String name) {
        return new PatternSyntaxException(span.start(), "duplicate capture '$" + name + "'");
    }
}
