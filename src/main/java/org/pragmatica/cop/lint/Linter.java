package org.pragmatica.cop.lint;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cop.parser.SourceParseException;
import org.pragmatica.cop.parser.SourceParser;
import org.pragmatica.cop.rule.Cop;
import org.pragmatica.cop.tree.SourceBuffer;
import org.pragmatica.cop.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Runs a set of cops over every node of a parsed buffer and, when configured, rewrites the source
 * until no cop fires any more.
 */
public final class Linter {
    private static final Logger log = LoggerFactory.getLogger(Linter.class);

    private static final Comparator<Offense> SOURCE_ORDER =
        Comparator.comparingInt((Offense offense) -> offense.span().start().offset())
                  .thenComparingInt(offense -> offense.span().end().offset())
                  .thenComparing(Offense::copName);

    private final ImmutableList<Cop<?>> cops;
    private final LintConfig config;

    private Linter(ImmutableList<Cop<?>> cops, LintConfig config) {
        this.cops = cops;
        this.config = config;
    }

    public static Linter create(List<? extends Cop<?>> cops, LintConfig config) {
        requireNonNull(config);
        checkArgument(!cops.isEmpty(), "At least one cop is required");
        return new Linter(ImmutableList.copyOf(cops), config);
    }

    public List<Cop<?>> cops() {
        return cops;
    }

    public LintConfig config() {
        return config;
    }

    /**
     * Lint one buffer. Offenses are reported against the original text; with autocorrect on, the
     * report also carries the rewritten source.
     *
     * <p>A correction round whose output no longer parses is dropped, and the report carries the
     * source of the last round that parsed.
     *
     * @throws SourceParseException if the buffer does not parse
     * @throws IllegalStateException if corrections keep producing new offenses past {@code maxIterations}
     */
    public LintReport lint(SourceBuffer buffer) {
        var offenses = inspect(buffer);
        if (!config.autocorrect()) {
            return new LintReport(buffer, offenses, Optional.empty(), 1);
        }

        var current = buffer;
        var pending = offenses;
        int iterations = 1;
        while (true) {
            var corrector = Corrector.create();
            pending.stream()
                   .map(Offense::correction)
                   .flatMap(Optional::stream)
                   .forEach(corrector::add);
            if (corrector.isEmpty()) {
                break;
            }
            if (iterations >= config.maxIterations()) {
                throw new IllegalStateException(String.format(
                    "Infinite loop detected in %s: corrections did not settle after %d iterations",
                    buffer.name(), iterations));
            }
            var next = current.withText(corrector.apply(current.text()));
            log.debug("Correction round {} on {}: applied {} replacement(s)",
                      iterations, buffer.name(), corrector.replacements().size());
            try {
                pending = inspect(next);
            } catch (SourceParseException e) {
                // Interacting corrections produced text that does not parse; keep the last round that did
                log.warn("Discarding correction round {} on {}: {}", iterations, buffer.name(), e.getMessage());
                break;
            }
            current = next;
            iterations++;
        }

        var corrected = current.text().equals(buffer.text())
                        ? Optional.<String>empty()
                        : Optional.of(current.text());
        return new LintReport(buffer, offenses, corrected, iterations);
    }

    public LintReport lint(String source) {
        return lint(SourceBuffer.of(source));
    }

    private ImmutableList<Offense> inspect(SourceBuffer buffer) {
        var root = SourceParser.parse(buffer);
        if (root.isEmpty()) {
            return ImmutableList.of();
        }
        var nodes = root.get().descendants();
        Stream<SyntaxNode> stream = config.parallel() ? nodes.parallelStream() : nodes.stream();
        var offenses = stream.flatMap(node -> cops.stream()
                                                  .filter(cop -> cop.nodeTypes().contains(node.type()))
                                                  .flatMap(cop -> detect(cop, node).stream()))
                             .sorted(SOURCE_ORDER)
                             .collect(ImmutableList.toImmutableList());
        if (log.isDebugEnabled()) {
            offenses.forEach(offense -> log.debug("{}", offense.formatSimple(buffer.name())));
        }
        return offenses;
    }

    private <M> Optional<Offense> detect(Cop<M> cop, SyntaxNode node) {
        return cop.detect(node)
                  .map(match -> new Offense(cop.name(),
                                            cop.message(),
                                            cop.offenseSpan(match),
                                            config.autocorrect()
                                            ? Optional.of(cop.rewrite(match))
                                            : Optional.empty()));
    }
}
