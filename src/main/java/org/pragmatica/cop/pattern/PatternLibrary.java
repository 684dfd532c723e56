package org.pragmatica.cop.pattern;

import com.google.common.collect.ImmutableMap;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A set of named patterns which may refer to each other with {@code #name}.
 */
public final class PatternLibrary {
    private static final PatternLibrary EMPTY = new PatternLibrary(ImmutableMap.of());

    private final ImmutableMap<String, Pattern> patterns;

    private PatternLibrary(ImmutableMap<String, Pattern> patterns) {
        this.patterns = patterns;
    }

    public static PatternLibrary empty() {
        return EMPTY;
    }

    /**
     * Build a library from named patterns, checking that references resolve and terminate.
     *
     * @throws PatternSyntaxException on undefined or self-reaching references
     */
    public static PatternLibrary of(Map<String, Pattern> patterns) {
        return new PatternLibrary(ImmutableMap.copyOf(patterns)).validate();
    }

    /**
     * Parse {@code name <- pattern} definitions.
     */
    public static PatternLibrary parse(String definitions) {
        return of(PatternParser.parseDefinitions(definitions));
    }

    /**
     * Get pattern by name.
     */
    public Optional<Pattern> pattern(String name) {
        return Optional.ofNullable(patterns.get(name));
    }

    public Set<String> names() {
        return patterns.keySet();
    }

    /**
     * New library with an additional definition, validated as a whole.
     */
    public PatternLibrary with(String name, Pattern pattern) {
        var merged = ImmutableMap.<String, Pattern>builder()
                                 .putAll(patterns)
                                 .put(name, pattern)
                                 .buildKeepingLast();
        return new PatternLibrary(merged).validate();
    }

    private PatternLibrary validate() {
        for (var pattern : patterns.values()) {
            findUndefinedReference(pattern).ifPresent(ref -> {
                throw new PatternSyntaxException(ref.span().start(), "undefined pattern reference '#" + ref.name() + "'");
            });
        }
        for (var entry : patterns.entrySet()) {
            checkNoCycle(entry.getKey(), entry.getValue());
        }
        return this;
    }

    /**
     * Recursively find the first reference to a name this library does not define.
     */
    private Optional<Pattern.Reference> findUndefinedReference(Pattern pattern) {
        if (pattern instanceof Pattern.Reference ref) {
            return patterns.containsKey(ref.name())
                   ? Optional.empty()
                   : Optional.of(ref);
        }
        if (pattern instanceof Pattern.Node node) {
            return firstUndefined(node.children());
        }
        if (pattern instanceof Pattern.Alternation alternation) {
            return firstUndefined(alternation.alternatives());
        }
        if (pattern instanceof Pattern.Capture capture) {
            return findUndefinedReference(capture.pattern());
        }
        // Terminals - no nested patterns
        return Optional.empty();
    }

    private Optional<Pattern.Reference> firstUndefined(Iterable<Pattern> patterns) {
        for (var pattern : patterns) {
            var found = findUndefinedReference(pattern);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * A reference that leads back to its own pattern without entering a child node would
     * match the same child forever.
     */
    private void checkNoCycle(String start, Pattern pattern) {
        var visited = new HashSet<String>();
        var pending = new ArrayDeque<Pattern.Reference>();
        sameNodeReferences(pattern, pending);
        while (!pending.isEmpty()) {
            var ref = pending.pop();
            if (ref.name().equals(start)) {
                throw new PatternSyntaxException(ref.span().start(),
                                                 "pattern '" + start + "' refers to itself without descending into a child");
            }
            if (visited.add(ref.name())) {
                sameNodeReferences(patterns.get(ref.name()), pending);
            }
        }
    }

    private static void sameNodeReferences(Pattern pattern, Deque<Pattern.Reference> sink) {
        if (pattern instanceof Pattern.Reference ref) {
            sink.push(ref);
        } else if (pattern instanceof Pattern.Capture capture) {
            sameNodeReferences(capture.pattern(), sink);
        } else if (pattern instanceof Pattern.Alternation alternation) {
            alternation.alternatives()
                       .forEach(alternative -> sameNodeReferences(alternative, sink));
        }
    }

    @Override
    public String toString() {
        return "PatternLibrary" + new LinkedHashSet<>(patterns.keySet());
    }
}
