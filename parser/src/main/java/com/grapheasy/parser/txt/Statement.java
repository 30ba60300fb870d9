package com.grapheasy.parser.txt;

import com.grapheasy.graph.Attributes;
import com.grapheasy.graph.ElementKind;
import java.util.List;

/** What a logical line turned out to be, as decided by the first {@link StatementRecognizer} that claims it. */
sealed interface Statement
        permits Statement.Ignored,
                Statement.PendingEdgeAttributes,
                Statement.ScopeAttributes,
                Statement.GroupOpen,
                Statement.GroupClose,
                Statement.Chains {

    record Ignored() implements Statement {}

    /** A lone attribute block following a line that ended in an edge operator. */
    record PendingEdgeAttributes(Attributes attributes) implements Statement {}

    record ScopeAttributes(List<Selector> selectors, Attributes attributes) implements Statement {
        public ScopeAttributes {
            selectors = List.copyOf(selectors);
        }
    }

    /**
     * {@code kind} alone targets a default table, {@code kind.class} a class table, and a {@code null}
     * kind with a class ({@code .class}) the node, edge and group class tables together.
     */
    record Selector(ElementKind kind, String className) {}

    record GroupOpen(String name) implements Statement {}

    record GroupClose(Attributes attributes) implements Statement {}

    /** Comma separated chain fragments. */
    record Chains(List<String> fragments) implements Statement {
        public Chains {
            fragments = List.copyOf(fragments);
        }
    }
}
