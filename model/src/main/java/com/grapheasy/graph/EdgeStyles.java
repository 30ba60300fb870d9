package com.grapheasy.graph;

/** Derives an edge line style from the operator text the edge was written with. */
public final class EdgeStyles {
    public static final String SOLID = "solid";

    private EdgeStyles() {}

    /**
     * Maps operators such as {@code ==>}, {@code ..->} or {@code - >} to a style name. Arrowheads are
     * ignored; spaces are kept because {@code - >} (dashed) and {@code ->} (solid) differ only by one.
     */
    public static String fromOperators(String leftOp, String rightOp) {
        String core = strip(leftOp) + strip(rightOp);
        if (core.contains("~~")) {
            return "wave";
        }
        if (core.contains("..-")) {
            return "dot-dot-dash";
        }
        if (core.contains(".-")) {
            return "dot-dash";
        }
        if (core.contains("..")) {
            return "dotted";
        }
        // spaced variants must win over the "--"/"==" fallbacks below
        if (core.contains("= ")) {
            return "double-dash";
        }
        if (core.contains("- ")) {
            return "dashed";
        }
        if (core.contains("==")) {
            return "double";
        }
        if (core.contains("=")) {
            return "double-dash";
        }
        return SOLID;
    }

    private static String strip(String op) {
        return op == null ? "" : op.replace("<", "").replace(">", "");
    }
}
