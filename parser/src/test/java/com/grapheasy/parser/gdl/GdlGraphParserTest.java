package com.grapheasy.parser.gdl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.grapheasy.graph.Edge;
import com.grapheasy.graph.FlowDirection;
import com.grapheasy.graph.Graph;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.TestResources;
import java.util.List;
import org.junit.jupiter.api.Test;

class GdlGraphParserTest {

    private static Graph parse(String text) throws GraphParseException {
        return new GdlGraphParser().parse("test.gdl", text);
    }

    private static GraphParseException failure(String text) {
        return assertThrows(GraphParseException.class, () -> parse(text));
    }

    @Test
    void parsesFixture() throws Exception {
        Graph graph = new GdlGraphParser().parse("compiler.gdl", TestResources.fixture("compiler.gdl"));

        assertEquals("cfg", graph.attribute("label"));
        assertEquals(FlowDirection.EAST, graph.flow());
        assertEquals("dfs", graph.attribute("x-vcg-layoutalgorithm"));

        assertEquals(List.of("entry", "loop", "exit"), List.copyOf(graph.getNodes().keySet()));
        assertEquals("start", graph.node("entry").getLabel());
        assertEquals("i < n", graph.node("loop").getLabel());
        assertEquals("2", graph.node("loop").attribute("rank"));
        assertEquals("2", graph.node("loop").attribute("x-vcg-vertical_order"));
        assertEquals("1000000", graph.node("exit").attribute("rank"));
        assertEquals("left", graph.node("entry").attribute("align"));

        List<Edge> edges = graph.getEdges();
        assertEquals(2, edges.size());
        assertEquals("entry", edges.get(0).getFrom().getId());
        assertEquals("loop", edges.get(0).getTo().getId());
        assertEquals("exit", edges.get(1).getTo().getId());
        assertFalse(edges.get(1).isUndirected());
        assertEquals("filled", edges.get(1).attribute("arrowstyle"));
    }

    @Test
    void defaultsToSouthFlow() throws Exception {
        assertEquals(FlowDirection.SOUTH, parse("graph: { }").flow());
        assertEquals(FlowDirection.NORTH, parse("graph: { orientation: bottom_to_top }").flow());
    }

    @Test
    void acceptsSemicolonSeparators() throws Exception {
        Graph graph = parse("graph: { title: \"t\"; node: { title: \"a\"; }; node: { title: b } };");

        assertEquals("t", graph.attribute("label"));
        assertTrue(graph.hasNode("a"));
        assertTrue(graph.hasNode("b"));
    }

    @Test
    void edgeMayPrecedeItsNodes() throws Exception {
        Graph graph = parse("graph: { edge: { source: a target: b } node: { title: \"b\" label: \"Bee\" } }");

        assertEquals("Bee", graph.getEdges().get(0).getTo().getLabel());
        assertEquals(2, graph.getNodes().size());
    }

    @Test
    void edgeExtrasKeepVendorPrefix() throws Exception {
        Edge edge = parse("graph: { edge: { source: a target: b color: red thickness: 3 } }").getEdges().get(0);

        assertEquals("red", edge.attribute("x-vcg-color"));
        assertEquals("3", edge.attribute("x-vcg-thickness"));
    }

    @Test
    void unknownNodeFieldsKeepVendorPrefix() throws Exception {
        Graph graph = parse("graph: { node: { title: a shape: box } }");

        assertEquals("box", graph.node("a").attribute("x-vcg-shape"));
    }

    @Test
    void labelLosesColorCodesAndNewlines() throws Exception {
        Graph graph = parse("graph: { node: { title: a label: \"\\f31red\" }"
                + " node: { title: b label: \"one\ntwo\" } }");

        assertEquals("red", graph.node("a").getLabel());
        assertEquals("one\\ntwo", graph.node("b").getLabel());
    }

    @Test
    void keywordsWorkAsValues() throws Exception {
        assertTrue(parse("graph: { node: { title: node } }").hasNode("node"));
    }

    @Test
    void commentsAreSkipped() throws Exception {
        assertTrue(parse("// header\ngraph: { // open\n node: { title: a } }").hasNode("a"));
    }

    @Test
    void nodeWithoutTitleFails() {
        GraphParseException ex = failure("graph: {\n  node: { label: \"x\" }\n}");

        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, ex.getKind());
        assertEquals(2, ex.getLocation().line());
        assertEquals(3, ex.getLocation().column());
    }

    @Test
    void edgeWithoutTargetFails() {
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, failure("graph: { edge: { source: a } }").getKind());
    }

    @Test
    void nestedBlockUnderUnknownKeyIsUnexpected() {
        assertEquals(ErrorKind.UNEXPECTED_TOKEN, failure("graph: { foo: { } }").getKind());
    }

    @Test
    void unclosedGraphIsUnterminated() {
        assertEquals(ErrorKind.UNTERMINATED_BLOCK, failure("graph: { node: { title: a }").getKind());
    }

    @Test
    void strayCharacterIsReported() {
        GraphParseException ex = failure("graph: { a: / }");

        assertEquals(ErrorKind.UNEXPECTED_CHARACTER, ex.getKind());
        assertEquals(13, ex.getLocation().column());
    }
}
