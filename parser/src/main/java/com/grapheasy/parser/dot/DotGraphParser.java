package com.grapheasy.parser.dot;

import com.grapheasy.graph.Attributes;
import com.grapheasy.graph.Edge;
import com.grapheasy.graph.ElementKind;
import com.grapheasy.graph.Graph;
import com.grapheasy.graph.Group;
import com.grapheasy.graph.Node;
import com.grapheasy.parser.Autosplit;
import com.grapheasy.parser.DebugFlags;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.GraphParser;
import com.grapheasy.parser.SourceLocation;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for Graphviz DOT. Edges are collected while parsing and only created once
 * the whole file is read, because record nodes are split into their field nodes first and edge
 * endpoints may refer to a field port.
 */
public final class DotGraphParser implements GraphParser {
    private static final Logger LOG = LoggerFactory.getLogger(DotGraphParser.class);

    @Override
    public Graph parse(String sourceName, String text) throws GraphParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(text, "text");

        List<DotToken> tokens = DotLexer.tokenize(sourceName, text);
        if (DebugFlags.isTokenDebugEnabled()) {
            List<String> dump = new ArrayList<>(tokens.size());
            for (DotToken token : tokens) {
                dump.add(String.format(Locale.ROOT, "%-8s @ %4d:%-3d -> %s",
                        token.type(), token.line(), token.column(), token.text()));
            }
            DebugFlags.logTokens("graphviz", dump);
        }
        return new Run(sourceName, tokens, DebugFlags.maxNestingDepth()).parseGraph();
    }

    /** {@code id[:port[:compass]]} as written in the source. */
    private record NodeRef(String id, String port, String compass) {}

    /** One side of an edge: a single node or a {@code { ... }} set. */
    private record Endpoint(List<NodeRef> refs, boolean contributesEdges) {}

    private record EdgeSpec(NodeRef from, NodeRef to, boolean directed, String label, Attributes attributes) {}

    private static final class Run {
        private final String sourceName;
        private final List<DotToken> tokens;
        private final int maxDepth;
        private final Graph graph = new Graph();
        private final Deque<Group> openGroups = new ArrayDeque<>();
        private final List<EdgeSpec> edgeSpecs = new ArrayList<>();
        private final Attributes nodeDefaults = new Attributes();
        private final Attributes edgeDefaults = new Attributes();
        private String defaultEdgeLabel = "";
        private boolean groupDefaultsSeeded;
        private int pos;

        Run(String sourceName, List<DotToken> tokens, int maxDepth) {
            this.sourceName = sourceName;
            this.tokens = tokens;
            this.maxDepth = maxDepth;
            graph.setGraphAttributes(Attributes.of("colorscheme", "x11", "flow", "south"));
            graph.setDefaultAttributes(ElementKind.EDGE, Attributes.of("arrowstyle", "filled"));
            graph.setPreserveLabelWhitespace(true);
        }

        Graph parseGraph() throws GraphParseException {
            if (peek() != null && peek().isKeyword("strict")) {
                pos++;
            }
            DotToken kind = next();
            if (!kind.isKeyword("graph") && !kind.isKeyword("digraph")) {
                throw error(ErrorKind.UNEXPECTED_TOKEN, "Expected 'graph' or 'digraph', got " + kind.describe(), kind);
            }
            if (kind.isKeyword("graph")) {
                graph.setGraphAttributes(Attributes.of("type", "undirected"));
            }
            String title = peekPunct("{") ? "" : parseIdExpr().trim();
            graph.setGraphAttributes(Attributes.of("title", title.isEmpty() ? "unnamed" : title));

            expectPunct("{");
            parseStatementsUntilClose();
            while (peekPunct(";")) {
                pos++;
            }
            if (pos < tokens.size()) {
                DotToken extra = tokens.get(pos);
                throw error(ErrorKind.UNEXPECTED_TOKEN, "Unexpected " + extra.describe() + " after graph body", extra);
            }

            Map<String, RecordLabel> records = splitRecords();
            materializeEdges(records);
            graph.edgesIntoGroups();
            LOG.debug("Parsed DOT graph '{}': {}", title, graph);
            return graph;
        }

        // statements

        private void parseStatementsUntilClose() throws GraphParseException {
            while (true) {
                DotToken token = peek();
                if (token == null) {
                    throw error(ErrorKind.UNTERMINATED_BLOCK, "Missing '}' before end of input", lastToken());
                }
                if (token.isPunct("}")) {
                    pos++;
                    return;
                }
                if (token.isPunct(";") || token.isPunct(",")) {
                    pos++;
                    continue;
                }
                parseStatement();
            }
        }

        private void parseStatement() throws GraphParseException {
            DotToken token = peek();
            if (token.isKeyword("subgraph")) {
                parseSubgraph();
                return;
            }
            if (token.isPunct("{")) {
                Endpoint set = parseNodeSet();
                if (peekEdgeOp()) {
                    parseEdgeStatement(set);
                }
                return;
            }
            if ((token.isKeyword("graph") || token.isKeyword("node") || token.isKeyword("edge"))
                    && peekPunctAt(pos + 1, "[")) {
                pos++;
                Attributes raw = parseAttrList();
                if (token.isKeyword("graph")) {
                    applyGraphAttributes(raw);
                } else if (token.isKeyword("node")) {
                    nodeDefaults.merge(DotAttributeMapper.node(raw));
                } else {
                    applyEdgeDefaults(raw);
                }
                return;
            }

            int start = pos;
            String key = parseIdExpr().trim();
            if (peekPunct("=")) {
                pos++;
                applyGraphAttributes(Attributes.of(key, parseIdExpr()));
                return;
            }
            pos = start;

            NodeRef ref = parseNodeRef();
            Node node = materialize(ref.id());
            if (peekEdgeOp()) {
                parseEdgeStatement(new Endpoint(List.of(ref), true));
                return;
            }
            if (peekPunct("[")) {
                applyNodeAttributes(node, DotAttributeMapper.node(parseAttrList()));
            }
        }

        private void parseSubgraph() throws GraphParseException {
            DotToken keyword = next();
            String name = peekPunct("{") ? "" : parseIdExpr().trim();
            expectPunct("{");
            if (openGroups.size() >= maxDepth) {
                throw error(ErrorKind.NESTING_TOO_DEEP,
                        "Subgraphs nested deeper than " + maxDepth + " levels", keyword);
            }
            if (!groupDefaultsSeeded) {
                graph.setDefaultAttributes(ElementKind.GROUP, Attributes.of("align", "center", "fill", "inherit"));
                groupDefaultsSeeded = true;
            }
            openGroups.push(graph.addGroup(name, openGroups.peek()));
            parseStatementsUntilClose();
            openGroups.pop();
        }

        private void parseEdgeStatement(Endpoint first) throws GraphParseException {
            record Segment(Endpoint from, Endpoint to, boolean directed) {}

            List<Segment> segments = new ArrayList<>();
            Endpoint previous = first;
            while (peekEdgeOp()) {
                boolean directed = next().text().equals("->");
                Endpoint target = parseEndpoint();
                segments.add(new Segment(previous, target, directed));
                previous = target;
            }

            Attributes raw = peekPunct("[") ? parseAttrList() : new Attributes();
            DotAttributeMapper.EdgeAttributes mapped = DotAttributeMapper.edge(raw);
            String label = mapped.label() != null ? mapped.label() : defaultEdgeLabel;

            for (Segment segment : segments) {
                if (!segment.from().contributesEdges() || !segment.to().contributesEdges()) {
                    continue;
                }
                boolean directed = segment.directed() && mapped.direction() != DotAttributeMapper.Direction.NONE;
                for (NodeRef from : segment.from().refs()) {
                    for (NodeRef to : segment.to().refs()) {
                        boolean back = mapped.direction() == DotAttributeMapper.Direction.BACK;
                        edgeSpecs.add(new EdgeSpec(
                                back ? to : from, back ? from : to, directed, label, mapped.attributes().copy()));
                    }
                }
            }
        }

        private Endpoint parseEndpoint() throws GraphParseException {
            if (peekPunct("{")) {
                return parseNodeSet();
            }
            NodeRef ref = parseNodeRef();
            // a named port on a plain node resolves to a literal id:port node, so the bare id stays unknown
            if (ref.port() == null || DotValues.isCompassPoint(ref.port())) {
                materialize(ref.id());
            }
            return new Endpoint(List.of(ref), true);
        }

        /** {@code { a b node [..] c }}; scoped statements make the set contribute no edges. */
        private Endpoint parseNodeSet() throws GraphParseException {
            DotToken open = expectPunct("{");
            List<NodeRef> refs = new ArrayList<>();
            Attributes scopedDefaults = new Attributes();
            boolean scoped = false;
            Set<String> existing = new HashSet<>(graph.getNodes().keySet());

            while (true) {
                DotToken token = peek();
                if (token == null) {
                    throw error(ErrorKind.UNTERMINATED_BLOCK, "Node set is never closed", open);
                }
                if (token.isPunct("}")) {
                    pos++;
                    break;
                }
                if (token.isPunct(";") || token.isPunct(",")) {
                    pos++;
                    continue;
                }
                if ((token.isKeyword("node") || token.isKeyword("graph") || token.isKeyword("edge"))
                        && peekPunctAt(pos + 1, "[")) {
                    pos++;
                    Attributes raw = parseAttrList();
                    scoped = true;
                    if (token.isKeyword("node")) {
                        scopedDefaults.merge(DotAttributeMapper.node(raw));
                    }
                    continue;
                }
                NodeRef ref = parseNodeRef();
                refs.add(ref);
                Node node = materialize(ref.id());
                if (existing.add(ref.id())) {
                    applyNodeAttributes(node, scopedDefaults);
                }
            }
            return new Endpoint(refs, !scoped);
        }

        private Attributes parseAttrList() throws GraphParseException {
            DotToken open = expectPunct("[");
            Attributes out = new Attributes();
            while (true) {
                DotToken token = peek();
                if (token == null) {
                    throw error(ErrorKind.UNTERMINATED_BLOCK, "Attribute list is never closed", open);
                }
                if (token.isPunct("]")) {
                    pos++;
                    return out;
                }
                if (token.isPunct(",") || token.isPunct(";")) {
                    pos++;
                    continue;
                }
                String key = parseIdExpr();
                if (peekPunct("=")) {
                    pos++;
                    out.set(key, parseIdExpr());
                } else {
                    out.set(key, "true");
                }
            }
        }

        private NodeRef parseNodeRef() throws GraphParseException {
            String id = parseIdExpr().trim();
            String port = null;
            String compass = null;
            if (peekPunct(":")) {
                pos++;
                port = parseIdExpr().trim();
                if (peekPunct(":")) {
                    pos++;
                    compass = parseIdExpr().trim();
                }
            }
            return new NodeRef(id, port, compass);
        }

        /** One or more ids joined with {@code +}. */
        private String parseIdExpr() throws GraphParseException {
            StringBuilder out = new StringBuilder(parseIdTerm());
            while (peekPunct("+")) {
                pos++;
                out.append(parseIdTerm());
            }
            return out.toString();
        }

        private String parseIdTerm() throws GraphParseException {
            DotToken token = peek();
            if (token == null) {
                throw error(ErrorKind.UNTERMINATED_BLOCK, "Expected an identifier before end of input", lastToken());
            }
            if (!token.isId()) {
                throw error(ErrorKind.UNEXPECTED_TOKEN, "Expected an identifier, got " + token.describe(), token);
            }
            pos++;
            return DotValues.htmlToText(token.text());
        }

        // graph building

        /** Creates or fetches the node, moves it into the open subgraph and applies {@code node [..]} once. */
        private Node materialize(String id) {
            boolean created = !graph.hasNode(id);
            Node node = graph.addNode(id);
            Group group = openGroups.peek();
            if (group != null) {
                group.addNode(node);
            }
            if (created) {
                applyNodeAttributes(node, nodeDefaults);
            }
            return node;
        }

        private static void applyNodeAttributes(Node node, Attributes mapped) {
            if (mapped.isEmpty()) {
                return;
            }
            Attributes copy = mapped.copy();
            String label = copy.remove("label");
            node.setAttributes(copy);
            if (label != null) {
                node.setLabel(label);
            }
        }

        /** {@code graph [..]} and {@code key = value}: the innermost subgraph, else the graph. */
        private void applyGraphAttributes(Attributes raw) {
            Group group = openGroups.peek();
            if (group != null) {
                group.setAttributes(DotAttributeMapper.group(raw));
            } else {
                graph.setGraphAttributes(DotAttributeMapper.graph(raw));
            }
        }

        private void applyEdgeDefaults(Attributes raw) {
            DotAttributeMapper.EdgeAttributes mapped = DotAttributeMapper.edge(raw);
            if (mapped.label() != null) {
                defaultEdgeLabel = mapped.label();
            }
            edgeDefaults.merge(mapped.attributes());
        }

        private Map<String, RecordLabel> splitRecords() {
            Map<String, RecordLabel> records = new HashMap<>();
            String flow = graph.attribute("flow").toLowerCase(Locale.ROOT);
            for (Node node : new ArrayList<>(graph.getNodes().values())) {
                if (!"record".equalsIgnoreCase(node.attribute("shape")) || !node.getLabel().contains("|")) {
                    continue;
                }
                RecordLabel record = RecordLabel.parse(node.getLabel(), flow);
                Attributes copied = node.getAttributes().copy();
                copied.remove("shape");
                copied.remove("label");
                Group group = node.getGroup();
                String base = node.getId();
                graph.deleteNode(base);
                for (Node field : Autosplit.split(
                        graph, base, record.displayLabel(), copied, record.ports(), Autosplit.EmptyField.BORDERED)) {
                    if (group != null) {
                        group.addNode(field);
                    }
                }
                records.put(base, record);
            }
            return records;
        }

        private void materializeEdges(Map<String, RecordLabel> records) {
            for (EdgeSpec spec : edgeSpecs) {
                Attributes attributes = spec.attributes();
                Node from = resolve(spec.from(), records, "start", attributes);
                Node to = resolve(spec.to(), records, "end", attributes);
                String rightOp = spec.directed() ? "-->" : "--";
                String leftOp = spec.directed() && spec.label().isEmpty() ? "-->" : "--";
                Edge edge = graph.addEdge(from, to, leftOp, rightOp, spec.label());
                edge.setAttributes(attributes);
                // edge [..] defaults win over per-edge values
                edge.getAttributes().merge(edgeDefaults);
            }
        }

        /**
         * Maps a reference onto the node it ends up on: a record field ({@code base.N}) for split
         * records, the node itself for a compass-only port, or a literal {@code id:port} node.
         */
        private Node resolve(NodeRef ref, Map<String, RecordLabel> records, String sideKey, Attributes attributes) {
            RecordLabel record = records.get(ref.id());
            String nodeId = ref.id();
            String compass = ref.compass();
            String port = ref.port();
            if (record != null) {
                int idx = 0;
                if (port != null && !port.isEmpty()) {
                    int exact = record.indexOfPort(port);
                    if (exact >= 0) {
                        idx = exact;
                    } else if (compass == null && DotValues.isCompassPoint(port)) {
                        compass = port;
                        idx = Math.max(0, record.indexOfPortIgnoreCase(port));
                    }
                }
                nodeId = ref.id() + "." + idx;
            } else if (port != null && !port.isEmpty()) {
                if (compass == null && DotValues.isCompassPoint(port)) {
                    compass = port;
                } else {
                    nodeId = ref.id() + ":" + port;
                }
            }
            if (compass != null && !compass.isEmpty() && !attributes.contains(sideKey)) {
                attributes.set(sideKey, DotValues.compassToSide(compass));
            }
            return graph.hasNode(nodeId) ? graph.node(nodeId) : graph.addNode(nodeId);
        }

        // token access

        private DotToken peek() {
            return pos < tokens.size() ? tokens.get(pos) : null;
        }

        private boolean peekPunct(String value) {
            return peekPunctAt(pos, value);
        }

        private boolean peekPunctAt(int at, String value) {
            return at < tokens.size() && tokens.get(at).isPunct(value);
        }

        private boolean peekEdgeOp() {
            DotToken token = peek();
            return token != null && token.type() == DotToken.Type.EDGE_OP;
        }

        private DotToken next() throws GraphParseException {
            DotToken token = peek();
            if (token == null) {
                throw error(ErrorKind.UNTERMINATED_BLOCK, "Unexpected end of input", lastToken());
            }
            pos++;
            return token;
        }

        private DotToken expectPunct(String value) throws GraphParseException {
            DotToken token = next();
            if (!token.isPunct(value)) {
                throw error(ErrorKind.UNEXPECTED_TOKEN, "Expected '" + value + "', got " + token.describe(), token);
            }
            return token;
        }

        private DotToken lastToken() {
            return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        }

        private GraphParseException error(ErrorKind kind, String message, DotToken at) {
            SourceLocation where = at == null
                    ? SourceLocation.ofLine(sourceName, 1)
                    : new SourceLocation(sourceName, at.line(), at.column());
            return new GraphParseException(kind, message, where);
        }
    }
}
