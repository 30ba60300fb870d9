package com.grapheasy.parser.txt;

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
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.TestResources;
import java.util.List;
import org.junit.jupiter.api.Test;

class TxtGraphParserTest {

    private static Graph parse(String text) throws GraphParseException {
        return new TxtGraphParser().parse("test.txt", text);
    }

    private static GraphParseException failure(String text) {
        return assertThrows(GraphParseException.class, () -> parse(text));
    }

    @Test
    void parsesFixture() throws Exception {
        Graph graph = new TxtGraphParser().parse("cities.txt", TestResources.fixture("cities.txt"));

        assertEquals(List.of("Bonn", "Berlin", "Potsdam", "Warsaw"), List.copyOf(graph.getNodes().keySet()));
        assertEquals(3, graph.getEdges().size());
        assertEquals(FlowDirection.SOUTH, graph.flow());
        assertEquals("Rail", graph.attribute("label"));

        Edge ice = graph.getEdges().get(0);
        assertEquals("ICE", ice.getLabel());
        assertEquals("Bonn", ice.getFrom().getId());
        assertEquals("Berlin", ice.getTo().getId());
        assertEquals("double", graph.getEdges().get(1).attribute("style"));

        Group germany = graph.getGroups().get(0);
        assertEquals("Germany", germany.getName());
        assertEquals(3, germany.getNodes().size());
        assertSame(germany, ice.getGroup());
        assertNull(graph.getEdges().get(2).getGroup());

        assertEquals("#303030", graph.node("Bonn").attribute("color"));
        assertEquals("red", graph.node("Berlin").attribute("color"));
    }

    @Test
    void simpleEdge() throws Exception {
        Graph graph = parse("[ Bonn ] -> [ Berlin ]");

        Edge edge = graph.getEdges().get(0);
        assertEquals("Bonn", edge.getFrom().getId());
        assertEquals("Berlin", edge.getTo().getId());
        assertFalse(edge.isUndirected());
        assertFalse(edge.isBidirectional());
        assertEquals("solid", edge.attribute("style"));
    }

    @Test
    void operatorsSetDirectionAndStyle() throws Exception {
        Graph graph = parse("[ A ] <-> [ B ]\n[ C ] <-- [ D ]\n[ E ] - > [ F ]\n[ G ] -- [ H ]");
        List<Edge> edges = graph.getEdges();

        assertTrue(edges.get(0).isBidirectional());
        assertEquals("D", edges.get(1).getFrom().getId());
        assertEquals("C", edges.get(1).getTo().getId());
        assertEquals("dashed", edges.get(2).attribute("style"));
        assertTrue(edges.get(3).isUndirected());
    }

    @Test
    void edgeWaitsForTargetOnNextLine() throws Exception {
        Graph graph = parse("[ A ] -->\n{ color: red; }\n[ B ]");

        assertEquals(1, graph.getEdges().size());
        Edge edge = graph.getEdges().get(0);
        assertEquals("B", edge.getTo().getId());
        assertEquals("red", edge.attribute("color"));
    }

    @Test
    void danglingEdgeAtEndOfInput() {
        GraphParseException ex = failure("[ A ] -->\n[ B ] -->\n");
        assertEquals(ErrorKind.DANGLING_EDGE, ex.getKind());
        assertEquals(2, ex.getLocation().line());
    }

    @Test
    void multiLineGroup() throws Exception {
        Graph graph = parse("( Cities\n  [ Bonn ] -> [ Berlin ]\n) { fill: white; }");

        Group group = graph.getGroups().get(0);
        assertEquals("Cities", group.getName());
        assertEquals("white", group.attribute("fill"));
        assertTrue(group.getNodes().contains(graph.node("Bonn")));
        assertSame(group, graph.getEdges().get(0).getGroup());
    }

    @Test
    void joinedGroupWithCommentLineStaysOpenUntilClosed() throws Exception {
        Graph graph = parse("( My-Group\n# note\n[ A ]\n)\n[ B ] -> [ C ]\n");

        assertEquals(1, graph.getGroups().size());
        Group group = graph.getGroups().get(0);
        assertTrue(group.getName().startsWith("My-Group"));
        assertSame(group, graph.node("A").getGroup());
        assertEquals(1, graph.getEdges().size());
        Edge edge = graph.getEdges().get(0);
        assertEquals("B", edge.getFrom().getId());
        assertEquals("C", edge.getTo().getId());
        assertNull(graph.node("B").getGroup());
    }

    @Test
    void inlineGroupIsRepresentedByItsLastNode() throws Exception {
        Graph graph = parse("( Team [ Ann ] [ Bob ] ) -> [ Boss ]");

        Group team = graph.getGroups().get(0);
        assertEquals("Team", team.getName());
        assertEquals(2, team.getNodes().size());
        assertNull(graph.node("Boss").getGroup());
        Edge edge = graph.getEdges().get(0);
        assertEquals("Bob", edge.getFrom().getId());
        assertEquals("Boss", edge.getTo().getId());
    }

    @Test
    void nestedGroups() throws Exception {
        Graph graph = parse("( Outer\n( Inner [ X ] )\n[ Y ]\n)");

        Group outer = graph.getGroups().get(0);
        Group inner = outer.getGroups().get(0);
        assertEquals("Inner", inner.getName());
        assertSame(inner, graph.node("X").getGroup());
        assertSame(outer, graph.node("Y").getGroup());
    }

    @Test
    void unclosedGroup() {
        assertEquals(ErrorKind.UNCLOSED_GROUP, failure("( Cities\n[ A ]").getKind());
    }

    @Test
    void unmatchedGroupClose() {
        GraphParseException ex = failure("[ A ]\n)");
        assertEquals(ErrorKind.UNMATCHED_GROUP_CLOSE, ex.getKind());
        assertEquals(2, ex.getLocation().line());
    }

    @Test
    void nestingDepthIsLimited() {
        System.setProperty("grapheasy.maxNestingDepth", "1");
        try {
            assertEquals(ErrorKind.NESTING_TOO_DEEP, failure("( a ( b [ X ] ) )").getKind());
        } finally {
            System.clearProperty("grapheasy.maxNestingDepth");
        }
    }

    @Test
    void scopesSetDefaultsAndClasses() throws Exception {
        Graph graph = parse("node { color: red; }\n.warn { fill: yellow; }\n[ A ]\n[ B ] { class: warn; }\n"
                + "graph {\n  flow: west;\n}");

        assertEquals("red", graph.node("A").attribute("color"));
        assertEquals("yellow", graph.node("B").attribute("fill"));
        assertEquals(FlowDirection.WEST, graph.flow());
    }

    @Test
    void commaListsFanOut() throws Exception {
        Graph sources = parse("[ A ], [ B ] -> [ C ]");
        assertEquals(2, sources.getEdges().size());
        for (Edge edge : sources.getEdges()) {
            assertEquals("C", edge.getTo().getId());
        }

        Graph targets = parse("[ A ] -> [ B ], [ C ]");
        assertEquals(2, targets.getEdges().size());
        assertEquals("A", targets.getEdges().get(1).getFrom().getId());
        assertEquals("C", targets.getEdges().get(1).getTo().getId());
    }

    @Test
    void nodeListHandsAttributesBack() throws Exception {
        Graph graph = parse("[ A ], [ B ] { color: blue; }");
        assertEquals("blue", graph.node("A").attribute("color"));
        assertEquals(0, graph.getEdges().size());
    }

    @Test
    void splitNodeCreatesFieldCluster() throws Exception {
        Graph graph = parse("[ A | B ] -> [ C ]");

        assertTrue(graph.hasNode("AB.0"));
        assertSame(graph.node("AB.0"), graph.node("AB.1").getOrigin());
        assertEquals("B", graph.node("AB.1").getLabel());
        assertEquals(2, graph.getEdges().size());
    }

    @Test
    void emptyNodeIsAnonymous() throws Exception {
        Graph graph = parse("[ ] -> [ B ]");
        Edge edge = graph.getEdges().get(0);
        assertTrue(edge.getFrom().getId().startsWith("#"));
        assertEquals("invisible", edge.getFrom().attribute("shape"));
    }

    @Test
    void commentsAreIgnored() throws Exception {
        Graph graph = parse("# heading\n[ A ] # trailing\n[ B ]");
        assertEquals(2, graph.getNodes().size());
        assertTrue(graph.getEdges().isEmpty());
    }

    @Test
    void unsupportedStatement() {
        GraphParseException ex = failure("[ A ]\nfoo bar");
        assertEquals(ErrorKind.UNSUPPORTED_STATEMENT, ex.getKind());
        assertEquals(2, ex.getLocation().line());
        assertTrue(ex.getMessage().startsWith("test.txt:2"));
    }

    @Test
    void unterminatedNode() {
        assertEquals(ErrorKind.UNTERMINATED_BLOCK, failure("[ A").getKind());
    }

    @Test
    void missingEdgeOperator() {
        assertEquals(ErrorKind.MISSING_EDGE_OPERATOR, failure("[ A ] foo [ B ]").getKind());
    }
}
