package com.grapheasy.parser;

import java.util.Objects;

/**
 * Checked exception raised when graph text cannot be turned into a graph. The first failure aborts the
 * parse; no partial graph is returned.
 */
public final class GraphParseException extends Exception {
    private final ErrorKind kind;
    private final SourceLocation location;

    public GraphParseException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public GraphParseException(ErrorKind kind, String message, SourceLocation location) {
        this(kind, message, location, null);
    }

    public GraphParseException(ErrorKind kind, String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.location = location;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Where the failure was detected, or {@code null} when unknown. */
    public SourceLocation getLocation() {
        return location;
    }

    /** The message without the location prefix. */
    public String getDetail() {
        return super.getMessage();
    }

    /**
     * Returns an exception carrying {@code where}, or this one if a location is already known. Helpers
     * that only see a fragment of a line throw unlocated and let the line-level caller attach it.
     */
    public GraphParseException locate(SourceLocation where) {
        if (location != null || where == null) {
            return this;
        }
        return new GraphParseException(kind, getDetail(), where, this);
    }

    @Override
    public String getMessage() {
        String detail = super.getMessage();
        return location == null ? detail : location + ": " + detail;
    }
}
