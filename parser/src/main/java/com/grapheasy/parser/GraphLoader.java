package com.grapheasy.parser;

import com.grapheasy.graph.Graph;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point: picks a parser for the text and returns the populated graph. */
public final class GraphLoader {
    private static final Logger LOG = LoggerFactory.getLogger(GraphLoader.class);
    private static final String DEFAULT_SOURCE = "<input>";

    private GraphLoader() {}

    /** Parses {@code text}, sniffing its format. */
    public static Graph load(String text) throws GraphParseException {
        return load(DEFAULT_SOURCE, text, null);
    }

    public static Graph load(String text, GraphFormat format) throws GraphParseException {
        return load(DEFAULT_SOURCE, text, format);
    }

    /**
     * Parses {@code text} as {@code format}. A {@code null} format is taken from the source name's
     * extension, then from the text itself.
     */
    public static Graph load(String sourceName, String text, GraphFormat format) throws GraphParseException {
        Objects.requireNonNull(text, "text");
        String name = sourceName == null ? DEFAULT_SOURCE : sourceName;
        GraphFormat effective = format;
        if (effective == null) {
            effective = GraphFormat.fromFileName(name).orElseGet(() -> GraphFormat.detect(text));
        }
        Graph graph = effective.newParser().parse(name, text);
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Parsed {} as {}: {} nodes, {} edges, {} groups",
                    name,
                    effective,
                    graph.getNodes().size(),
                    graph.getEdges().size(),
                    graph.allGroups().size());
        }
        return graph;
    }
}
