package com.grapheasy.parser.gdl;

import com.grapheasy.graph.Attributes;
import com.grapheasy.graph.ElementKind;
import com.grapheasy.graph.Graph;
import com.grapheasy.graph.Node;
import com.grapheasy.parser.AttributeRemapper;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.SourceLocation;
import com.grapheasy.parser.gdl.grammar.GdlBaseVisitor;
import com.grapheasy.parser.gdl.grammar.GdlParser;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.RuleNode;

/**
 * Walks a GDL parse tree into a {@link Graph}. Edge blocks are collected and created after the whole
 * graph block is read so an edge may name nodes declared further down.
 */
final class GdlGraphBuilder extends GdlBaseVisitor<Void> {
    static final String VENDOR_PREFIX = "x-vcg-";
    static final String MAXDEPTH_RANK = "1000000";

    private static final Pattern COLOR_CODES = Pattern.compile("(?:\\f|\\\\f)\\d+|\\f");

    private static final AttributeRemapper GRAPH_FIELDS = AttributeRemapper.builder(VENDOR_PREFIX)
            .rename("title", "label")
            .map("orientation", (value, out) -> out.set("flow", orientationToFlow(value)))
            .build();

    private static final AttributeRemapper NODE_FIELDS = AttributeRemapper.builder(VENDOR_PREFIX)
            .map("label", (value, out) -> out.set("label", cleanLabel(value)))
            .map("vertical_order", (value, out) -> {
                out.set(VENDOR_PREFIX + "vertical_order", value);
                out.set("rank", "maxdepth".equals(value) ? MAXDEPTH_RANK : value);
            })
            .build();

    private record EdgeSpec(String source, String target, Attributes attributes) {}

    private final String sourceName;
    private final Graph graph = new Graph();
    private final List<EdgeSpec> edges = new ArrayList<>();
    private GraphParseException failure;

    GdlGraphBuilder(String sourceName) {
        this.sourceName = sourceName;
        graph.setGraphAttributes(Attributes.of("flow", "south"));
        graph.setDefaultAttributes(ElementKind.EDGE, Attributes.of("arrowstyle", "filled"));
        graph.setDefaultAttributes(ElementKind.NODE, Attributes.of("align", "left"));
        graph.setPreserveLabelWhitespace(true);
    }

    Graph build(GdlParser.GraphFileContext context) throws GraphParseException {
        visitGraphFile(context);
        if (failure != null) {
            throw failure;
        }
        for (EdgeSpec spec : edges) {
            Node from = graph.addNode(spec.source());
            Node to = graph.addNode(spec.target());
            graph.addEdge(from, to, "-->", "-->", "").setAttributes(spec.attributes());
        }
        graph.edgesIntoGroups();
        return graph;
    }

    @Override
    protected boolean shouldVisitNextChild(RuleNode node, Void currentResult) {
        return failure == null;
    }

    @Override
    public Void visitGraphField(GdlParser.GraphFieldContext ctx) {
        GdlParser.FieldContext field = ctx.field();
        Attributes out = new Attributes();
        GRAPH_FIELDS.remap(field.key().getText(), valueOf(field.value()), out);
        graph.setGraphAttributes(out);
        return null;
    }

    @Override
    public Void visitNodeBlock(GdlParser.NodeBlockContext ctx) {
        String title = null;
        Attributes attributes = new Attributes();
        for (GdlParser.FieldContext field : ctx.field()) {
            String key = field.key().getText();
            String value = valueOf(field.value());
            if (key.equals("title")) {
                title = value;
            } else {
                NODE_FIELDS.remap(key, value, attributes);
            }
        }
        if (title == null || title.isEmpty()) {
            fail(ErrorKind.MISSING_REQUIRED_FIELD, "node block has no 'title'", ctx);
            return null;
        }
        Node node = graph.addNode(title);
        String label = attributes.remove("label");
        if (label != null) {
            node.setLabel(label);
        }
        node.setAttributes(attributes);
        return null;
    }

    @Override
    public Void visitEdgeBlock(GdlParser.EdgeBlockContext ctx) {
        String source = null;
        String target = null;
        Attributes attributes = new Attributes();
        for (GdlParser.FieldContext field : ctx.field()) {
            String key = field.key().getText();
            String value = valueOf(field.value());
            switch (key) {
                case "source", "sourcename" -> source = value;
                case "target", "targetname" -> target = value;
                default -> attributes.set(VENDOR_PREFIX + key, value);
            }
        }
        if (source == null || source.isEmpty() || target == null || target.isEmpty()) {
            fail(ErrorKind.MISSING_REQUIRED_FIELD, "edge block needs both 'source' and 'target'", ctx);
            return null;
        }
        edges.add(new EdgeSpec(source, target, attributes));
        return null;
    }

    private void fail(ErrorKind kind, String message, ParserRuleContext ctx) {
        if (failure == null) {
            SourceLocation where = new SourceLocation(
                    sourceName, ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine() + 1);
            failure = new GraphParseException(kind, message, where);
        }
    }

    /** Quoted strings lose their quotes but keep backslash escapes. */
    static String valueOf(GdlParser.ValueContext value) {
        String text = value.getText();
        if (value.STRING() != null) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    static String cleanLabel(String label) {
        String stripped = COLOR_CODES.matcher(label).replaceAll("");
        return stripped.replace("\r\n", "\n").replace("\n", "\\n");
    }

    static String orientationToFlow(String orientation) {
        return switch (orientation.trim()) {
            case "bottom_to_top" -> "north";
            case "left_to_right" -> "east";
            case "right_to_left" -> "west";
            default -> "south";
        };
    }
}
