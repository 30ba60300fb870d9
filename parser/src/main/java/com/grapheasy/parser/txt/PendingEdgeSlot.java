package com.grapheasy.parser.txt;

import com.grapheasy.graph.Attributes;
import com.grapheasy.graph.Node;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.SourceLocation;
import java.util.List;

/**
 * Holds at most one {@link PendingEdge} between logical lines. States are idle and pending: an edge
 * operator without a target moves to pending, the next element resolves back to idle, and reaching the
 * end of input while pending is an error.
 */
final class PendingEdgeSlot {
    private PendingEdge pending;

    boolean isPending() {
        return pending != null;
    }

    void emit(PendingEdge edge) throws GraphParseException {
        if (pending != null) {
            throw new GraphParseException(
                    ErrorKind.DANGLING_EDGE,
                    "Edge from line " + pending.lineNumber() + " has no target before the next edge operator");
        }
        pending = edge;
    }

    /** Widens the sources of the pending edge; a no-op while idle. */
    void addSources(List<Node> sources) {
        if (pending != null && !sources.isEmpty()) {
            pending = pending.withSources(sources);
        }
    }

    PendingEdge resolve() {
        if (pending == null) {
            throw new IllegalStateException("No pending edge to resolve");
        }
        PendingEdge resolved = pending;
        pending = null;
        return resolved;
    }

    void mergeAttributes(Attributes attributes) {
        if (pending == null) {
            throw new IllegalStateException("No pending edge to receive attributes");
        }
        pending.spec().attributes().merge(attributes);
    }

    void failIfPending(String sourceName) throws GraphParseException {
        if (pending != null) {
            throw new GraphParseException(
                    ErrorKind.DANGLING_EDGE,
                    "Dangling edge at end of input: '" + pending.spec().leftOp() + "' has no target node",
                    SourceLocation.ofLine(sourceName, pending.lineNumber()));
        }
    }
}
