package com.grapheasy.parser.dot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.grapheasy.graph.Edge;
import com.grapheasy.graph.FlowDirection;
import com.grapheasy.graph.Graph;
import com.grapheasy.graph.Group;
import com.grapheasy.graph.Node;
import com.grapheasy.parser.Autosplit;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.TestResources;
import java.util.List;
import org.junit.jupiter.api.Test;

class DotGraphParserTest {

    private static Graph parse(String text) throws GraphParseException {
        return new DotGraphParser().parse("test.dot", text);
    }

    private static GraphParseException failure(String text) {
        return assertThrows(GraphParseException.class, () -> parse(text));
    }

    @Test
    void parsesRecordFixture() throws Exception {
        Graph graph = new DotGraphParser().parse("records.dot", TestResources.fixture("records.dot"));

        assertEquals(List.of("db", "struct1.0", "struct1.1", "struct1.2", "struct2.0", "struct2.1"),
                List.copyOf(graph.getNodes().keySet()));
        assertFalse(graph.hasNode("struct1"));
        assertEquals(FlowDirection.EAST, graph.flow());
        assertEquals("structs", graph.attribute("title"));

        Node left = graph.node("struct1.0");
        assertEquals("left", left.getLabel());
        assertEquals("f0", left.attribute(Autosplit.PORTNAME));
        assertEquals("struct1", left.attribute(Autosplit.BASENAME));
        assertSame(left, graph.node("struct1.1").getOrigin());

        List<Edge> edges = graph.getEdges();
        assertEquals(2, edges.size());
        assertEquals("struct1.1", edges.get(0).getFrom().getId());
        assertEquals("struct2.0", edges.get(0).getTo().getId());
        assertFalse(edges.get(0).isUndirected());

        Edge toDb = edges.get(1);
        assertEquals("struct1.2", toDb.getFrom().getId());
        assertEquals("db", toDb.getTo().getId());
        assertEquals("north", toDb.attribute("end"));
        assertEquals("red", toDb.attribute("color"));
        assertEquals("dashed", toDb.attribute("style"));
        assertEquals("filled", toDb.attribute("arrowstyle"));

        Group cluster = graph.getGroups().get(0);
        assertEquals("cluster_0", cluster.getName());
        assertEquals("Backend", cluster.attribute("label"));
        assertEquals("dashed  #ff0000", cluster.attribute("border"));
        assertEquals("center", cluster.attribute("align"));

        Node db = graph.node("db");
        assertSame(cluster, db.getGroup());
        assertEquals("rect", db.attribute("shape"));
        assertEquals("true", db.attribute("rounded"));
    }

    @Test
    void rankdirSetsFlow() throws Exception {
        assertEquals(FlowDirection.SOUTH, parse("digraph { a }").flow());
        assertEquals(FlowDirection.EAST, parse("digraph { rankdir=LR; a }").flow());
        assertEquals(FlowDirection.NORTH, parse("digraph { graph [rankdir=BT] a }").flow());
        assertEquals(FlowDirection.WEST, parse("digraph { rankdir = \"RL\" }").flow());
    }

    @Test
    void missingTitleBecomesUnnamed() throws Exception {
        assertEquals("unnamed", parse("strict digraph { }").attribute("title"));
        assertEquals("G", parse("digraph G { }").attribute("title"));
    }

    @Test
    void recordLabelSplitsIntoFieldNodes() throws Exception {
        Graph graph = parse("digraph { r [shape=record, label=\"A|B||C\"]; x -> r }");

        assertFalse(graph.hasNode("r"));
        Node a = graph.node("r.0");
        Node b = graph.node("r.1");
        Node c = graph.node("r.2");
        assertEquals("A", a.getLabel());
        assertSame(a, b.getOrigin());
        assertEquals(1, b.getDx());
        assertSame(a, c.getOrigin());
        assertEquals(1, c.getDy());
        assertEquals("0", a.attribute(Autosplit.PORTNAME));

        Edge edge = graph.getEdges().get(0);
        assertSame(a, edge.getTo());
    }

    @Test
    void portOnlyRecordFieldKeepsItsBorder() throws Exception {
        Graph graph = parse("digraph { r [shape=record, label=\"<f0>|<f1> x\"] }");

        Node empty = graph.node("r.0");
        assertEquals(" ", empty.getLabel());
        assertEquals("", empty.attribute("shape"));
        assertEquals("f0", empty.attribute(Autosplit.PORTNAME));
        assertEquals("x", graph.node("r.1").getLabel());
        assertEquals("f1", graph.node("r.1").attribute(Autosplit.PORTNAME));
    }

    @Test
    void recordWithoutPipeStaysOneNode() throws Exception {
        Graph graph = parse("digraph { r [shape=record, label=\"single\"] }");

        assertTrue(graph.hasNode("r"));
        assertEquals("single", graph.node("r").getLabel());
    }

    @Test
    void compassPortOnRecordPicksFirstField() throws Exception {
        Graph graph = parse("digraph { node [shape=record]; r [label=\"<a> x|<b> y\"]; r:s -> r:b }");

        Edge edge = graph.getEdges().get(0);
        assertEquals("r.0", edge.getFrom().getId());
        assertEquals("south", edge.attribute("start"));
        assertEquals("r.1", edge.getTo().getId());
    }

    @Test
    void nodeStyleMapsToShapeAndBorder() throws Exception {
        Graph graph = parse("digraph { a [style=\"filled,rounded\"]; b [style=dotted]; c [style=\"setlinewidth(4)\"];"
                + " d [shape=doublecircle, fontsize=12, fontname=Arial]; e [style=invis] }");

        assertEquals("rect", graph.node("a").attribute("shape"));
        assertEquals("true", graph.node("a").attribute("rounded"));
        assertEquals("dotted  black", graph.node("b").attribute("border"));
        assertEquals("bold", graph.node("c").attribute("border"));
        assertEquals("circle", graph.node("d").attribute("shape"));
        assertEquals("12px", graph.node("d").attribute("fontsize"));
        assertEquals("Arial", graph.node("d").attribute("font"));
        assertEquals("invisible", graph.node("e").attribute("shape"));
    }

    @Test
    void unknownAttributesKeepVendorPrefix() throws Exception {
        Graph graph = parse("digraph { a [penwidth=2, peripheries] }");

        assertEquals("2", graph.node("a").attribute("x-dot-penwidth"));
        assertEquals("true", graph.node("a").attribute("x-dot-peripheries"));
    }

    @Test
    void htmlLabelBecomesText() throws Exception {
        assertEquals("bold", parse("digraph { a [label=<bold>] }").node("a").getLabel());
    }

    @Test
    void plusConcatenatesIds() throws Exception {
        assertTrue(parse("digraph { \"ab\" + \"cd\" }").hasNode("abcd"));
    }

    @Test
    void dirBackSwapsEndpoints() throws Exception {
        Edge edge = parse("digraph { a -> b [dir=back] }").getEdges().get(0);

        assertEquals("b", edge.getFrom().getId());
        assertEquals("a", edge.getTo().getId());
    }

    @Test
    void dirNoneMakesEdgeUndirected() throws Exception {
        assertTrue(parse("digraph { a -> b [dir=none] }").getEdges().get(0).isUndirected());
    }

    @Test
    void undirectedGraph() throws Exception {
        Graph graph = parse("graph { a -- b -- c }");

        assertEquals("undirected", graph.attribute("type"));
        assertEquals(2, graph.getEdges().size());
        assertTrue(graph.getEdges().get(1).isUndirected());
        assertEquals("b", graph.getEdges().get(1).getFrom().getId());
    }

    @Test
    void nodeSetFansOutEdges() throws Exception {
        Graph graph = parse("digraph { a -> { b c } }");

        assertEquals(2, graph.getEdges().size());
        assertEquals("c", graph.getEdges().get(1).getTo().getId());
    }

    @Test
    void scopedNodeSetAppliesDefaultsAndDropsEdges() throws Exception {
        Graph graph = parse("digraph { old; { node [color=red] old fresh } -> tail; other }");

        assertTrue(graph.getEdges().isEmpty());
        assertEquals("red", graph.node("fresh").attribute("color"));
        assertEquals("", graph.node("old").attribute("color"));
        assertEquals("", graph.node("other").attribute("color"));
        assertTrue(graph.hasNode("tail"));
    }

    @Test
    void nodeDefaultsApplyToNewNodesOnly() throws Exception {
        Graph graph = parse("digraph { a; node [color=blue]; a; b }");

        assertEquals("", graph.node("a").attribute("color"));
        assertEquals("blue", graph.node("b").attribute("color"));
    }

    @Test
    void edgeDefaultsOverrideEdgeAttributes() throws Exception {
        Graph graph = parse("digraph { edge [color=blue, label=via]; a -> b; c -> d [color=green] }");

        for (Edge edge : graph.getEdges()) {
            assertEquals("blue", edge.attribute("color"));
            assertEquals("via", edge.getLabel());
        }
    }

    @Test
    void labelledEdgeKeepsDirection() throws Exception {
        Edge edge = parse("digraph { a -> b [label=\"go\"] }").getEdges().get(0);

        assertEquals("go", edge.getLabel());
        assertEquals("a", edge.getFrom().getId());
        assertFalse(edge.isUndirected());
        assertFalse(edge.isBidirectional());
    }

    @Test
    void compassPortsSetSides() throws Exception {
        Edge edge = parse("digraph { a:s -> b:w }").getEdges().get(0);

        assertEquals("a", edge.getFrom().getId());
        assertEquals("south", edge.attribute("start"));
        assertEquals("west", edge.attribute("end"));
    }

    @Test
    void namedPortOnPlainNodeIsLiteralNode() throws Exception {
        Graph graph = parse("digraph { a:p1 -> b }");

        assertEquals("a:p1", graph.getEdges().get(0).getFrom().getId());
        assertTrue(graph.hasNode("a"));
    }

    @Test
    void namedPortOnTargetLeavesBareIdUnknown() throws Exception {
        Graph graph = parse("digraph { a -> b:p1 }");

        assertEquals(List.of("a", "b:p1"), List.copyOf(graph.getNodes().keySet()));
        assertFalse(graph.hasNode("b"));
        assertEquals("b:p1", graph.getEdges().get(0).getTo().getId());
    }

    @Test
    void subgraphsNestAndCollectEdges() throws Exception {
        Graph graph = parse("digraph { label=Top; subgraph outer { label=Outer; subgraph inner { x -> y } } }");

        assertEquals("Top", graph.attribute("label"));
        Group outer = graph.getGroups().get(0);
        Group inner = outer.getGroups().get(0);
        assertEquals("Outer", outer.attribute("label"));
        assertSame(outer, inner.getParent());
        assertSame(inner, graph.node("x").getGroup());
        assertSame(inner, graph.getEdges().get(0).getGroup());
    }

    @Test
    void groupStyleBecomesBorder() throws Exception {
        Group group = parse("digraph { subgraph s { style=\"filled,bold\"; a } }").getGroups().get(0);

        assertEquals("bold  black", group.attribute("border"));
    }

    @Test
    void edgeColorSchemes() throws Exception {
        Graph graph = parse("digraph { a -> b [color=\"/accent4/2\"]; c -> d [color=\"0.5,1,1\"]; e -> f [color=\"0 1 1\"] }");

        assertEquals("#beaed4", graph.getEdges().get(0).attribute("color"));
        assertEquals("hsv(0.5,1,1)", graph.getEdges().get(1).attribute("color"));
        assertEquals("#ff0000", graph.getEdges().get(2).attribute("color"));
    }

    @Test
    void invisibleEdgeStyle() throws Exception {
        assertEquals("invisible", parse("digraph { a -> b [style=invis] }").getEdges().get(0).attribute("style"));
    }

    @Test
    void badHeaderIsUnexpectedToken() {
        GraphParseException ex = failure("network { a }");

        assertEquals(ErrorKind.UNEXPECTED_TOKEN, ex.getKind());
        assertEquals(1, ex.getLocation().line());
    }

    @Test
    void missingCloseBraceIsUnterminated() {
        assertEquals(ErrorKind.UNTERMINATED_BLOCK, failure("digraph {\n a -> b\n").getKind());
    }

    @Test
    void trailingTokensAreRejected() {
        assertEquals(ErrorKind.UNEXPECTED_TOKEN, failure("digraph { a } b").getKind());
    }

    @Test
    void missingEdgeTargetReportsLine() {
        GraphParseException ex = failure("digraph {\n  a -> ;\n}");

        assertEquals(ErrorKind.UNEXPECTED_TOKEN, ex.getKind());
        assertEquals(2, ex.getLocation().line());
        assertTrue(ex.getMessage().startsWith("test.dot:2"));
    }

    @Test
    void subgraphDepthIsLimited() {
        System.setProperty("grapheasy.maxNestingDepth", "1");
        try {
            assertEquals(ErrorKind.NESTING_TOO_DEEP,
                    failure("digraph { subgraph a { subgraph b { x } } }").getKind());
        } finally {
            System.clearProperty("grapheasy.maxNestingDepth");
        }
    }

    @Test
    void edgeOutsideGroupHasNoGroup() throws Exception {
        Graph graph = parse("digraph { subgraph s { a } b; a -> b }");

        assertNull(graph.getEdges().get(0).getGroup());
    }
}
