package com.grapheasy.parser.txt;

import com.grapheasy.graph.Attributes;
import com.grapheasy.graph.Edge;
import com.grapheasy.graph.Graph;
import com.grapheasy.graph.Group;
import com.grapheasy.graph.Node;
import com.grapheasy.parser.Autosplit;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.scan.AttributeBlocks;
import com.grapheasy.parser.scan.DelimiterScanner;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses chain fragments: node literals {@code [ ... ]} and group literals {@code ( name ... )} joined
 * by edge operators. Edges between node sets are the Cartesian product of both sides.
 */
final class ChainParser {
    private static final Pattern ESCAPED_SPECIAL = Pattern.compile("\\\\([\\[\\(\\{\\}\\]\\)#<>\\-.=])");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern SPLIT_SEPARATOR = Pattern.compile("\\s*\\|\\|?\\s*");

    /** Parses the content of an inline group as a logical line of its own. */
    @FunctionalInterface
    interface NestedLineParser {
        void parse(String line) throws GraphParseException;
    }

    /** A parsed node or group literal; {@code nodes} are the edge endpoints it contributes. */
    record Element(List<Node> nodes, Attributes attributes, int end) {}

    /** One connected pair of endpoint sets. */
    record Segment(List<Node> from, List<Node> to, EdgeOperatorSpec spec) {}

    /** First and last segment created while parsing a fragment, and whether a pending edge was left. */
    static final class ChainResult {
        private Segment first;
        private Segment last;
        private int segments;
        private boolean leftPending;

        Segment first() {
            return first;
        }

        Segment last() {
            return last;
        }

        int segments() {
            return segments;
        }

        boolean leftPending() {
            return leftPending;
        }

        private void add(Segment segment) {
            if (first == null) {
                first = segment;
            }
            last = segment;
            segments++;
        }
    }

    private final TxtParseState state;
    private final NestedLineParser nested;

    ChainParser(TxtParseState state, NestedLineParser nested) {
        this.state = state;
        this.nested = nested;
    }

    /**
     * Parses one comma-free fragment. Adjacent chains ({@code [A] [B] -> [C]}) are parsed one after the
     * other; a {@code )} closes the innermost open group.
     */
    ChainResult parseFragment(String fragment) throws GraphParseException {
        ChainResult result = new ChainResult();
        String rest = fragment.strip();
        while (!rest.isEmpty()) {
            if (rest.startsWith(")")) {
                Group group = state.closeGroup();
                group.setAttributes(StatementRecognizers.groupCloseTail(rest.substring(1)));
                break;
            }
            int consumed = parseChain(rest, result);
            rest = rest.substring(consumed).strip();
        }
        return result;
    }

    private int parseChain(String text, ChainResult result) throws GraphParseException {
        int pos = DelimiterScanner.skipWhitespace(text, 0);
        List<Node> current;
        char first = text.charAt(pos);
        if (first == '[' || first == '(') {
            Element element = parseElement(text, pos);
            current = element.nodes();
            if (!current.isEmpty() && state.pendingEdge().isPending()) {
                PendingEdge pending = state.pendingEdge().resolve();
                connect(pending.sources(), current, pending.spec(), result);
            }
            if (!current.isEmpty()) {
                state.setLastChainNode(current.get(0));
            }
            pos = element.end();
        } else if (EdgeOperatorSpec.startsWithOperator(text.substring(pos))) {
            Node previous = state.lastChainNode();
            if (previous == null) {
                throw new GraphParseException(
                        ErrorKind.UNSUPPORTED_STATEMENT, "Edge continuation without a previous node: " + text);
            }
            current = List.of(previous);
        } else {
            throw new GraphParseException(ErrorKind.UNSUPPORTED_STATEMENT, "Unsupported statement: " + text);
        }

        while (true) {
            pos = DelimiterScanner.skipWhitespace(text, pos);
            if (pos >= text.length()) {
                return pos;
            }
            char ch = text.charAt(pos);
            if (ch == '[' || ch == '(' || ch == ')') {
                return pos;
            }
            int next = DelimiterScanner.findNextElementStart(text, pos);
            EdgeOperatorSpec spec = EdgeOperatorSpec.parse(text.substring(pos, next < 0 ? text.length() : next));
            if (next < 0) {
                if (!current.isEmpty()) {
                    state.pendingEdge().emit(new PendingEdge(current, spec, state.lineNumber()));
                    result.leftPending = true;
                }
                return text.length();
            }
            Element element = parseElement(text, next);
            if (!element.nodes().isEmpty()) {
                if (!current.isEmpty()) {
                    connect(current, element.nodes(), spec, result);
                }
                current = element.nodes();
                state.setLastChainNode(current.get(0));
            }
            pos = element.end();
        }
    }

    Element parseElement(String text, int pos) throws GraphParseException {
        return text.charAt(pos) == '[' ? parseNode(text, pos) : parseGroup(text, pos);
    }

    /** Whether {@code fragment} is exactly one node literal with an optional attribute block. */
    static boolean isNodeOnly(String fragment) throws GraphParseException {
        String text = fragment.strip();
        if (!text.startsWith("[")) {
            return false;
        }
        int pos = DelimiterScanner.skipWhitespace(text, DelimiterScanner.findClosing(text, 0) + 1);
        if (pos < text.length() && text.charAt(pos) == '{') {
            pos = DelimiterScanner.skipWhitespace(text, DelimiterScanner.findClosing(text, pos) + 1);
        }
        return pos == text.length();
    }

    Element parseNode(String text, int pos) throws GraphParseException {
        int close = DelimiterScanner.findClosing(text, pos);
        String name = ESCAPED_SPECIAL.matcher(text.substring(pos + 1, close)).replaceAll("$1");

        int end = DelimiterScanner.skipWhitespace(text, close + 1);
        Attributes attributes = new Attributes();
        if (end < text.length() && text.charAt(end) == '{') {
            int blockEnd = DelimiterScanner.findClosing(text, end);
            attributes = AttributeBlocks.parse(text.substring(end, blockEnd + 1));
            end = blockEnd + 1;
        }

        Graph graph = state.graph();
        List<Node> nodes;
        if (DelimiterScanner.hasUnescapedPipe(name)) {
            nodes = splitNode(name, attributes);
        } else {
            String label = WHITESPACE_RUN.matcher(name.strip()).replaceAll(" ").replace("\\|", "|");
            Node node = label.isEmpty() ? graph.addAnonymousNode() : graph.addNode(label);
            if (!attributes.isEmpty()) {
                node.setAttributes(attributes);
            }
            nodes = List.of(node);
        }
        for (Node node : nodes) {
            state.claimForCurrentGroup(node);
        }
        return new Element(nodes, attributes, end);
    }

    private List<Node> splitNode(String name, Attributes attributes) {
        String explicitBase = attributes.get("basename");
        String base = explicitBase != null ? explicitBase : SPLIT_SEPARATOR.matcher(name).replaceAll("");
        base = state.reserveClusterName(base.strip());

        Attributes fieldAttributes = attributes.copy();
        fieldAttributes.remove("basename");
        List<Node> nodes = Autosplit.split(
                state.graph(), base, name, fieldAttributes, null, Autosplit.EmptyField.INVISIBLE);
        if (explicitBase != null) {
            nodes.get(0).setAttribute("basename", explicitBase);
        }
        return nodes;
    }

    /**
     * Parses {@code ( name content )}. The name runs up to the first {@code [} or {@code (}; the content
     * is parsed as a nested logical line. The group's last added node stands for it in the chain; a
     * group that added no node contributes no endpoint.
     */
    Element parseGroup(String text, int pos) throws GraphParseException {
        int close = DelimiterScanner.findClosing(text, pos);
        String inner = text.substring(pos + 1, close);
        int contentStart = firstElementStart(inner);
        String name = (contentStart < 0 ? inner : inner.substring(0, contentStart)).strip();
        String content = contentStart < 0 ? "" : inner.substring(contentStart).strip();

        Node before = state.lastChainNode();
        Group group = state.openGroup(name);
        state.enterNested();
        try {
            if (!content.isEmpty()) {
                nested.parse(content);
            }
        } finally {
            state.exitNested();
        }
        if (state.closeGroup() != group) {
            throw new GraphParseException(
                    ErrorKind.UNMATCHED_GROUP_CLOSE, "Group '" + name + "' was closed from inside its own content");
        }
        state.setLastChainNode(before);

        int end = DelimiterScanner.skipWhitespace(text, close + 1);
        Attributes attributes = new Attributes();
        if (end < text.length() && text.charAt(end) == '{') {
            int blockEnd = DelimiterScanner.findClosing(text, end);
            attributes = AttributeBlocks.parse(text.substring(end, blockEnd + 1));
            group.setAttributes(attributes);
            end = blockEnd + 1;
        }
        Node representative = state.lastAddedTo(group);
        return new Element(representative == null ? List.of() : List.of(representative), attributes, end);
    }

    private static int firstElementStart(String text) {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\\') {
                i++;
            } else if (ch == '[' || ch == '(') {
                return i;
            }
        }
        return -1;
    }

    /** Creates one edge per source/target pair and records the segment. */
    void connect(List<Node> sources, List<Node> targets, EdgeOperatorSpec spec, ChainResult result) {
        connect(sources, targets, spec);
        if (result != null) {
            result.add(new Segment(List.copyOf(sources), List.copyOf(targets), spec));
        }
    }

    void connect(List<Node> sources, List<Node> targets, EdgeOperatorSpec spec) {
        Graph graph = state.graph();
        for (Node from : sources) {
            for (Node to : targets) {
                Edge edge = graph.addEdge(from, to, spec.leftOp(), spec.rightOp(), spec.label());
                if (!spec.attributes().isEmpty()) {
                    edge.setAttributes(spec.attributes().copy());
                }
            }
        }
    }

    /** Returns a copy of {@code nodes} without the members of {@code exclude}. */
    static List<Node> without(List<Node> nodes, List<Node> exclude) {
        List<Node> out = new ArrayList<>();
        for (Node node : nodes) {
            if (!exclude.contains(node) && !out.contains(node)) {
                out.add(node);
            }
        }
        return out;
    }
}
