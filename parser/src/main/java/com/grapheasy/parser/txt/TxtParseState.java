package com.grapheasy.parser.txt;

import com.grapheasy.graph.Graph;
import com.grapheasy.graph.Group;
import com.grapheasy.graph.Node;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.SourceLocation;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Mutable state of one native parse. Never shared between parses. */
final class TxtParseState {
    private final String sourceName;
    private final Graph graph;
    private final int maxNestingDepth;
    private final Deque<Group> openGroups = new ArrayDeque<>();
    private final PendingEdgeSlot pendingEdge = new PendingEdgeSlot();
    private final Map<Group, Node> lastAddedByGroup = new HashMap<>();
    private final Set<String> clusterNames = new HashSet<>();
    private int nextClusterId = 1;
    private int nestingDepth;
    private int lineNumber;

    private Node lastChainNode;
    private List<Node> lastNodeList;

    TxtParseState(String sourceName, Graph graph, int maxNestingDepth) {
        this.sourceName = sourceName;
        this.graph = graph;
        this.maxNestingDepth = maxNestingDepth;
    }

    Graph graph() {
        return graph;
    }

    PendingEdgeSlot pendingEdge() {
        return pendingEdge;
    }

    int lineNumber() {
        return lineNumber;
    }

    void setLineNumber(int lineNumber) {
        this.lineNumber = lineNumber;
    }

    Node lastChainNode() {
        return lastChainNode;
    }

    void setLastChainNode(Node node) {
        this.lastChainNode = node;
    }

    /** Nodes of the previous comma list; cleared when read. */
    List<Node> takeLastNodeList() {
        List<Node> list = lastNodeList;
        lastNodeList = null;
        return list;
    }

    void setLastNodeList(List<Node> nodes) {
        this.lastNodeList = nodes == null || nodes.isEmpty() ? null : List.copyOf(nodes);
    }

    Group currentGroup() {
        return openGroups.peek();
    }

    Group openGroup(String name) {
        Group group = graph.addGroup(name, currentGroup());
        openGroups.push(group);
        return group;
    }

    Group closeGroup() throws GraphParseException {
        if (openGroups.isEmpty()) {
            throw new GraphParseException(ErrorKind.UNMATCHED_GROUP_CLOSE, "Encountered ')' with no open group");
        }
        return openGroups.pop();
    }

    void failIfGroupsOpen() throws GraphParseException {
        if (!openGroups.isEmpty()) {
            throw new GraphParseException(
                    ErrorKind.UNCLOSED_GROUP,
                    openGroups.size() + " group(s) still open at end of input, innermost '"
                            + openGroups.peek().getName() + "'",
                    SourceLocation.ofLine(sourceName, lineNumber));
        }
    }

    /** Puts {@code node} into the innermost open group, if any. */
    void claimForCurrentGroup(Node node) {
        Group group = currentGroup();
        if (group != null) {
            group.addNode(node);
            lastAddedByGroup.put(group, node);
        }
    }

    Node lastAddedTo(Group group) {
        return lastAddedByGroup.get(group);
    }

    /** Reserves a unique split-node base name, appending {@code -N} on collision. */
    String reserveClusterName(String base) {
        String name = base;
        while (!clusterNames.add(name)) {
            name = base + "-" + nextClusterId++;
        }
        return name;
    }

    void enterNested() throws GraphParseException {
        if (++nestingDepth > maxNestingDepth) {
            nestingDepth--;
            throw new GraphParseException(
                    ErrorKind.NESTING_TOO_DEEP, "Groups nested deeper than " + maxNestingDepth + " levels");
        }
    }

    void exitNested() {
        nestingDepth--;
    }
}
