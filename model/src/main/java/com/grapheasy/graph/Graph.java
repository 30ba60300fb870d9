package com.grapheasy.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Format-agnostic graph built by the parsers and handed to layout.
 *
 * <p>The graph is the sole owner of its nodes; edges and groups refer to nodes it holds. Default
 * attribute tables per {@link ElementKind} are copied into new elements when they are created. The
 * {@link ElementKind#GRAPH} default table is the graph's own attribute map.
 */
public final class Graph {
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<Group> groups = new ArrayList<>();
    private final Map<ElementKind, Attributes> defaults = new EnumMap<>(ElementKind.class);
    private final Map<ElementKind, Map<String, Attributes>> classes = new EnumMap<>(ElementKind.class);
    private boolean preserveLabelWhitespace;
    private int anonymousCounter;

    public Graph() {
        for (ElementKind kind : ElementKind.values()) {
            defaults.put(kind, new Attributes());
            classes.put(kind, new HashMap<>());
        }
        Attributes groupDefaults = defaults.get(ElementKind.GROUP);
        groupDefaults.set("fill", "#a0d0ff");
        groupDefaults.set("borderstyle", "dashed");
        groupDefaults.set("bordercolor", "#000000");
        groupDefaults.set("borderwidth", "1");
    }

    /** Returns the node with {@code id}, creating it (label = id) if absent. */
    public Node addNode(String id) {
        return addNode(id, id);
    }

    /** Returns the node with {@code id}; a new node gets {@code label} and the node defaults. */
    public Node addNode(String id, String label) {
        Objects.requireNonNull(id, "id");
        Node existing = nodes.get(id);
        if (existing != null) {
            return existing;
        }
        Node node = new Node(this, id, label == null ? id : label);
        node.getAttributes().inherit(defaults.get(ElementKind.NODE));
        nodes.put(id, node);
        return node;
    }

    /** Creates a fresh invisible node with a {@code #N} id and a single-space label. */
    public Node addAnonymousNode() {
        String id;
        do {
            id = "#" + anonymousCounter++;
        } while (nodes.containsKey(id));
        Node node = addNode(id, " ");
        node.setAttribute("shape", "invisible");
        return node;
    }

    public Node node(String id) {
        return nodes.get(id);
    }

    public boolean hasNode(String id) {
        return nodes.containsKey(id);
    }

    public Map<String, Node> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /** Top-level groups only; see {@link #allGroups()}. */
    public List<Group> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    /** Every group, parents before children. */
    public List<Group> allGroups() {
        List<Group> all = new ArrayList<>();
        for (Group group : groups) {
            collectGroups(group, all);
        }
        return all;
    }

    private static void collectGroups(Group group, List<Group> into) {
        into.add(group);
        for (Group child : group.getGroups()) {
            collectGroups(child, into);
        }
    }

    /**
     * Connects two nodes owned by this graph. Direction and line style are derived from the operators.
     *
     * @throws IllegalArgumentException if either endpoint is not a node of this graph
     */
    public Edge addEdge(Node from, Node to, String leftOp, String rightOp, String label) {
        requireOwned(from, "from");
        requireOwned(to, "to");
        String left = leftOp == null ? "" : leftOp;
        String right = rightOp == null ? "" : rightOp;
        boolean leftArrow = left.startsWith("<");
        boolean rightArrow = right.endsWith(">");

        Edge edge = leftArrow && !rightArrow
                ? new Edge(to, from, left, right, label == null ? "" : label)
                : new Edge(from, to, left, right, label == null ? "" : label);
        edge.setBidirectional(leftArrow && rightArrow);
        edge.setUndirected(!leftArrow && !rightArrow);
        edge.getAttributes().inherit(defaults.get(ElementKind.EDGE));

        String operatorStyle = EdgeStyles.fromOperators(left, right);
        String inherited = edge.getAttributes().get("style");
        if (inherited == null) {
            edge.setAttribute("style", operatorStyle);
        } else if ("invisible".equals(inherited) && !EdgeStyles.SOLID.equals(operatorStyle)) {
            edge.setAttribute("style", operatorStyle);
        }
        edges.add(edge);
        return edge;
    }

    private void requireOwned(Node node, String role) {
        Objects.requireNonNull(node, role);
        if (nodes.get(node.getId()) != node) {
            throw new IllegalArgumentException(
                    "Edge endpoint '" + node.getId() + "' (" + role + ") is not part of this graph");
        }
    }

    /** Creates a group under {@code parent}, or at top level when {@code parent} is null. */
    public Group addGroup(String name, Group parent) {
        Group group = new Group(this, name == null ? "" : name);
        group.getAttributes().inherit(defaults.get(ElementKind.GROUP));
        if (parent == null) {
            groups.add(group);
        } else {
            parent.addGroup(group);
        }
        return group;
    }

    /** Removes the node together with its edges, group membership and placement links. */
    public boolean deleteNode(String id) {
        Node node = nodes.get(id);
        if (node == null) {
            return false;
        }
        edges.removeIf(edge -> edge.getFrom() == node || edge.getTo() == node);
        if (node.getGroup() != null) {
            node.getGroup().removeNode(node);
        }
        node.detachRelatives();
        nodes.remove(id);
        return true;
    }

    public Attributes getAttributes() {
        return defaults.get(ElementKind.GRAPH);
    }

    public String attribute(String key) {
        return getAttributes().getOrEmpty(key);
    }

    public void setGraphAttributes(Attributes incoming) {
        applyClasses(ElementKind.GRAPH, getAttributes(), incoming);
        getAttributes().merge(incoming);
    }

    public void setDefaultAttributes(ElementKind kind, Attributes incoming) {
        defaults.get(kind).merge(incoming);
    }

    public Attributes classAttributes(ElementKind kind, String className) {
        Attributes table = classes.get(kind).get(className.toLowerCase(Locale.ROOT));
        return table == null ? new Attributes() : table.copy();
    }

    public void setClassAttributes(ElementKind kind, String className, Attributes incoming) {
        classes.get(kind)
                .computeIfAbsent(className.toLowerCase(Locale.ROOT), key -> new Attributes())
                .merge(incoming);
    }

    void applyClasses(ElementKind kind, Attributes target, Attributes incoming) {
        String classList = incoming.get("class");
        if (classList == null) {
            return;
        }
        for (String name : classList.trim().split("[\\s,]+")) {
            if (name.isEmpty()) {
                continue;
            }
            Attributes table = classes.get(kind).get(name.toLowerCase(Locale.ROOT));
            if (table != null) {
                target.merge(table);
            }
        }
    }

    /** Assigns every edge whose endpoints share a group to that group. */
    public void edgesIntoGroups() {
        for (Edge edge : edges) {
            Group fromGroup = edge.getFrom().getGroup();
            if (fromGroup != null && fromGroup == edge.getTo().getGroup()) {
                edge.setGroup(fromGroup);
            }
        }
    }

    public boolean isPreserveLabelWhitespace() {
        return preserveLabelWhitespace;
    }

    public void setPreserveLabelWhitespace(boolean preserveLabelWhitespace) {
        this.preserveLabelWhitespace = preserveLabelWhitespace;
    }

    /** The graph's flow direction, {@link FlowDirection#EAST} when unset or unrecognised. */
    public FlowDirection flow() {
        FlowDirection flow = FlowDirection.fromAttribute(attribute("flow"));
        return flow == null ? FlowDirection.EAST : flow;
    }

    @Override
    public String toString() {
        return "Graph[nodes=" + nodes.size() + ", edges=" + edges.size() + ", groups=" + allGroups().size() + "]";
    }
}
