package com.grapheasy.graph;

import java.util.Locale;

/** The element kinds that own a default attribute table and class tables. */
public enum ElementKind {
    GRAPH("graph"),
    NODE("node"),
    EDGE("edge"),
    GROUP("group");

    private final String keyword;

    ElementKind(String keyword) {
        this.keyword = keyword;
    }

    /** Returns the kind named by {@code keyword} (case-insensitive), or {@code null}. */
    public static ElementKind fromKeyword(String keyword) {
        if (keyword == null) {
            return null;
        }
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        for (ElementKind kind : values()) {
            if (kind.keyword.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
