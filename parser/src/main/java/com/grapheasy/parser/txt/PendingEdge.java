package com.grapheasy.parser.txt;

import com.grapheasy.graph.Node;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/** An edge whose sources and operators are known while its target is still to come. */
record PendingEdge(List<Node> sources, EdgeOperatorSpec spec, int lineNumber) {
    PendingEdge {
        sources = List.copyOf(sources);
        Objects.requireNonNull(spec, "spec");
    }

    PendingEdge withSources(List<Node> moreSources) {
        LinkedHashSet<Node> all = new LinkedHashSet<>(sources);
        all.addAll(moreSources);
        return new PendingEdge(List.copyOf(all), spec, lineNumber);
    }
}
