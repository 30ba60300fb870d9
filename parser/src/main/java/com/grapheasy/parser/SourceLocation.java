package com.grapheasy.parser;

/**
 * Where a parse failure was detected: a 1-based line and column inside a named source. Prints as
 * {@code name:line:col}, the prefix {@link GraphParseException#getMessage()} puts on its messages.
 */
public record SourceLocation(String sourceName, int line, int column) {

    public SourceLocation {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column are 1-based, got " + line + ":" + column);
        }
    }

    /** Start of {@code line}; used where only the logical line is known. */
    public static SourceLocation ofLine(String sourceName, int line) {
        return new SourceLocation(sourceName, line, 1);
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
