package org.pragmatica.cop.pattern;

import org.pragmatica.cop.tree.SourceLocation;

import static java.util.Objects.requireNonNull;

/**
 * Malformed node pattern or pattern library.
 *
 * <p>Patterns are constants of the code that declares them, so this is unchecked.
 */
public class PatternSyntaxException extends RuntimeException {
    private final SourceLocation location;
    private final String reason;

    public PatternSyntaxException(SourceLocation location, String reason) {
        super(reason + " at " + location);
        this.location = requireNonNull(location);
        this.reason = requireNonNull(reason);
    }

    public SourceLocation location() {
        return location;
    }

    public String reason() {
        return reason;
    }
}
