package com.grapheasy.parser.dot;

import java.util.Locale;
import java.util.Objects;

/** One lexical token of a DOT file. {@code line} and {@code column} are 1-based. */
public record DotToken(Type type, String text, int line, int column) {

    public enum Type {
        PUNCT,
        EDGE_OP,
        ID
    }

    public DotToken {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    boolean isPunct(String value) {
        return type == Type.PUNCT && text.equals(value);
    }

    boolean isId() {
        return type == Type.ID;
    }

    /** Case-insensitive keyword test; quoted ids such as {@code "subgraph"} match as well. */
    boolean isKeyword(String keyword) {
        return type == Type.ID && text.equalsIgnoreCase(keyword);
    }

    String describe() {
        return String.format(Locale.ROOT, "%s '%s' at %d:%d", type, text, line, column);
    }
}
