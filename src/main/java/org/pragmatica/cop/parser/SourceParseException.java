package org.pragmatica.cop.parser;

import org.pragmatica.cop.tree.SourceLocation;

import static java.util.Objects.requireNonNull;

/**
 * Source text outside the supported Ruby subset, or malformed.
 */
public class SourceParseException extends RuntimeException {
    private final String sourceName;
    private final SourceLocation location;

    public SourceParseException(String sourceName, SourceLocation location, String reason) {
        super(sourceName + ":" + location + ": " + reason);
        this.sourceName = requireNonNull(sourceName);
        this.location = requireNonNull(location);
    }

    public String sourceName() {
        return sourceName;
    }

    public SourceLocation location() {
        return location;
    }
}
