package org.pragmatica.cop.lint;

import org.pragmatica.cop.rule.ReplacementSpan;
import org.pragmatica.cop.tree.SourceBuffer;
import org.pragmatica.cop.tree.SourceSpan;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A cop's finding at one source location.
 *
 * @param copName    name of the reporting cop
 * @param message    what to do instead
 * @param span       reported range
 * @param correction present when the linter was asked to autocorrect
 */
public record Offense(
    String copName,
    String message,
    SourceSpan span,
    Optional<ReplacementSpan> correction) {

    public Offense {
        requireNonNull(copName);
        requireNonNull(message);
        requireNonNull(span);
        requireNonNull(correction);
    }

    public boolean isCorrectable() {
        return correction.isPresent();
    }

    /**
     * Single-line form: {@code file:line:column: C: Cop/Name: message}.
     */
    public String formatSimple(String fileName) {
        var start = span.start();
        return String.format("%s:%d:%d: C: %s: %s", fileName, start.line(), start.column(), copName, message);
    }

    /**
     * Single-line form followed by the offending source line and a caret underline.
     *
     * <pre>
     * spec/user_spec.rb:1:1: C: RSpec/FactoryGirl/CreateList: Prefer create_list.
     * 3.times { create :user }
     * ^^^^^^^
     * </pre>
     */
    public String format(SourceBuffer buffer) {
        var sb = new StringBuilder(formatSimple(buffer.name())).append('\n');
        var start = span.start();
        var lineContent = buffer.line(start.line());
        sb.append(lineContent).append('\n');

        int endColumn = span.end().line() == start.line()
                        ? span.end().column()
                        : lineContent.length() + 1;
        int underlineLength = Math.max(1, endColumn - start.column());
        sb.append(" ".repeat(start.column() - 1))
          .append("^".repeat(underlineLength));
        return sb.toString();
    }
}
