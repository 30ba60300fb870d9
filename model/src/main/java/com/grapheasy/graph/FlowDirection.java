package com.grapheasy.graph;

import java.util.Locale;

/** Graph-level default layout direction, stored in the graph's {@code flow} attribute. */
public enum FlowDirection {
    NORTH,
    EAST,
    SOUTH,
    WEST;

    /**
     * Parses a {@code flow} attribute value. Accepts the absolute names, their aliases
     * ({@code up}, {@code down}, {@code left}, {@code right}, {@code forward}, {@code back}) and the
     * degree forms. Returns {@code null} for anything else.
     */
    public static FlowDirection fromAttribute(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "north", "up", "0" -> NORTH;
            case "east", "right", "forward", "front", "90" -> EAST;
            case "south", "down", "180" -> SOUTH;
            case "west", "left", "back", "270" -> WEST;
            default -> null;
        };
    }
}
