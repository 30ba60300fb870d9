package com.grapheasy.graph;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A graph node. Nodes are created and owned by their {@link Graph}; relative-placement links to other
 * nodes ({@code origin} and {@code children}) are stored as ids and resolved through the graph, so no
 * node ever owns another.
 */
public final class Node {
    private final Graph graph;
    private final String id;
    private String label;
    private final Attributes attributes = new Attributes();
    private Group group;

    private String originId;
    private int dx;
    private int dy;
    private final Set<String> childIds = new LinkedHashSet<>();

    Node(Graph graph, String id, String label) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.id = Objects.requireNonNull(id, "id");
        this.label = Objects.requireNonNull(label, "label");
    }

    public Graph getGraph() {
        return graph;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = Objects.requireNonNull(label, "label");
    }

    public Attributes getAttributes() {
        return attributes;
    }

    /** Returns the attribute value or the empty string. */
    public String attribute(String key) {
        return attributes.getOrEmpty(key);
    }

    public void setAttribute(String key, String value) {
        attributes.set(key, value);
    }

    /**
     * Merges explicit attributes. A {@code class} entry first pulls in the named node class tables so that
     * the explicit values win.
     */
    public void setAttributes(Attributes incoming) {
        graph.applyClasses(ElementKind.NODE, attributes, incoming);
        attributes.merge(incoming);
    }

    public Group getGroup() {
        return group;
    }

    void setGroup(Group group) {
        this.group = group;
    }

    /** Returns the node this one is placed relative to, or {@code null}. */
    public Node getOrigin() {
        return originId == null ? null : graph.node(originId);
    }

    public int getDx() {
        return dx;
    }

    public int getDy() {
        return dy;
    }

    /** Nodes placed relative to this one, keyed by id in registration order. */
    public Map<String, Node> getChildren() {
        Map<String, Node> children = new LinkedHashMap<>();
        for (String childId : childIds) {
            Node child = graph.node(childId);
            if (child != null) {
                children.put(childId, child);
            }
        }
        return Collections.unmodifiableMap(children);
    }

    /**
     * Places this node at offset ({@code dx}, {@code dy}) from {@code origin}.
     *
     * @throws IllegalStateException if {@code origin} is already placed relative to this node
     */
    public void relativeTo(Node origin, int dx, int dy) {
        Objects.requireNonNull(origin, "origin");
        if (origin.graph != graph) {
            throw new IllegalArgumentException("Origin '" + origin.id + "' belongs to a different graph");
        }
        for (Node ancestor = origin; ancestor != null; ancestor = ancestor.getOrigin()) {
            if (ancestor == this) {
                throw new IllegalStateException(
                        "Detected loop in origin chain: '" + origin.id + "' is already placed relative to '" + id + "'");
            }
        }
        Node previous = getOrigin();
        if (previous != null) {
            previous.childIds.remove(id);
        }
        this.originId = origin.id;
        this.dx = dx;
        this.dy = dy;
        origin.childIds.add(id);
    }

    /** Follows origin links up to the node that has no origin. */
    public Node findGrandparent() {
        Node current = this;
        Set<String> seen = new HashSet<>();
        while (current.getOrigin() != null) {
            if (!seen.add(current.originId)) {
                throw new IllegalStateException("Detected loop in origin chain starting at '" + id + "'");
            }
            current = current.getOrigin();
        }
        return current;
    }

    void detachRelatives() {
        Node origin = getOrigin();
        if (origin != null) {
            origin.childIds.remove(id);
        }
        originId = null;
        for (String childId : childIds) {
            Node child = graph.node(childId);
            if (child != null && id.equals(child.originId)) {
                child.originId = null;
                child.dx = 0;
                child.dy = 0;
            }
        }
        childIds.clear();
    }

    @Override
    public String toString() {
        return "Node[" + id + "]";
    }
}
