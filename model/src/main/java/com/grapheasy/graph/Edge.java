package com.grapheasy.graph;

import java.util.Objects;

/** A connection between two nodes of the same graph. */
public final class Edge {
    private final Node from;
    private final Node to;
    private final String leftOp;
    private final String rightOp;
    private final String label;
    private final Attributes attributes = new Attributes();
    private Group group;
    private boolean bidirectional;
    private boolean undirected;

    Edge(Node from, Node to, String leftOp, String rightOp, String label) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.leftOp = Objects.requireNonNull(leftOp, "leftOp");
        this.rightOp = Objects.requireNonNull(rightOp, "rightOp");
        this.label = Objects.requireNonNull(label, "label");
    }

    public Node getFrom() {
        return from;
    }

    public Node getTo() {
        return to;
    }

    public String getLeftOp() {
        return leftOp;
    }

    public String getRightOp() {
        return rightOp;
    }

    public String getLabel() {
        return label;
    }

    public Attributes getAttributes() {
        return attributes;
    }

    public String attribute(String key) {
        return attributes.getOrEmpty(key);
    }

    public void setAttribute(String key, String value) {
        attributes.set(key, value);
    }

    public void setAttributes(Attributes incoming) {
        from.getGraph().applyClasses(ElementKind.EDGE, attributes, incoming);
        attributes.merge(incoming);
    }

    public Group getGroup() {
        return group;
    }

    void setGroup(Group group) {
        this.group = group;
    }

    public boolean isBidirectional() {
        return bidirectional;
    }

    void setBidirectional(boolean bidirectional) {
        this.bidirectional = bidirectional;
    }

    public boolean isUndirected() {
        return undirected;
    }

    public void setUndirected(boolean undirected) {
        this.undirected = undirected;
    }

    @Override
    public String toString() {
        return "Edge[" + from.getId() + " " + leftOp + (label.isEmpty() ? "" : " " + label + " ") + rightOp + " "
                + to.getId() + "]";
    }
}
