package com.grapheasy.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** A named (possibly anonymous) cluster of nodes. Groups nest; a node belongs to at most one group. */
public final class Group {
    private final Graph graph;
    private final String name;
    private final Set<Node> nodes = new LinkedHashSet<>();
    private final List<Group> groups = new ArrayList<>();
    private final Attributes attributes = new Attributes();
    private Group parent;

    Group(Graph graph, String name) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public Group getParent() {
        return parent;
    }

    public Set<Node> getNodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public List<Group> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    public Attributes getAttributes() {
        return attributes;
    }

    public String attribute(String key) {
        return attributes.getOrEmpty(key);
    }

    public void setAttributes(Attributes incoming) {
        graph.applyClasses(ElementKind.GROUP, attributes, incoming);
        attributes.merge(incoming);
    }

    /** Claims {@code node}; it leaves whichever group held it before. */
    public void addNode(Node node) {
        Objects.requireNonNull(node, "node");
        if (node.getGraph() != graph) {
            throw new IllegalArgumentException("Node '" + node.getId() + "' belongs to a different graph");
        }
        Group previous = node.getGroup();
        if (previous != null && previous != this) {
            previous.nodes.remove(node);
        }
        nodes.add(node);
        node.setGroup(this);
    }

    void removeNode(Node node) {
        if (nodes.remove(node)) {
            node.setGroup(null);
        }
    }

    void addGroup(Group child) {
        child.parent = this;
        groups.add(child);
    }

    @Override
    public String toString() {
        return "Group[" + name + "]";
    }
}
