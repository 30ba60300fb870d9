package com.grapheasy.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.grapheasy.graph.Attributes;
import com.grapheasy.graph.Graph;
import com.grapheasy.graph.Node;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AutosplitTest {

    @Test
    void trailingSeparatorAddsOneEmptyField() {
        List<Autosplit.Field> fields = Autosplit.fields("|G|");
        assertEquals(3, fields.size());
        assertEquals("", fields.get(0).raw());
        assertEquals("G", fields.get(1).raw());
        assertEquals("", fields.get(2).raw());
    }

    @Test
    void escapedPipeStaysInField() {
        List<Autosplit.Field> fields = Autosplit.fields("a\\|b|c");
        assertEquals(2, fields.size());
        assertEquals("a\\|b", fields.get(0).raw());
    }

    @Test
    void rowsAndColumnsAreLinked() {
        Graph graph = new Graph();
        List<Node> nodes = Autosplit.split(graph, "rec", "A|B||C", null, null, Autosplit.EmptyField.INVISIBLE);

        assertEquals(3, nodes.size());
        Node a = graph.node("rec.0");
        Node b = graph.node("rec.1");
        Node c = graph.node("rec.2");
        assertNull(a.getOrigin());
        assertSame(a, b.getOrigin());
        assertEquals(1, b.getDx());
        assertEquals(0, b.getDy());
        assertSame(a, c.getOrigin());
        assertEquals(0, c.getDx());
        assertEquals(1, c.getDy());

        assertEquals("rec", c.attribute(Autosplit.BASENAME));
        assertEquals("0,1", c.attribute(Autosplit.XY));
        assertEquals("2", c.attribute(Autosplit.PORTNAME));
        assertTrue(a.getChildren().containsKey("rec.1"));
    }

    @Test
    void emptyFieldsFollowBorderRules() {
        Graph graph = new Graph();
        Autosplit.split(graph, "e", "| |A|  |B", null, null, Autosplit.EmptyField.INVISIBLE);

        // empty text
        assertEquals("invisible", graph.node("e.0").attribute("shape"));
        assertEquals(" ", graph.node("e.0").getLabel());
        // single blank, not at a row start and not last
        assertEquals("", graph.node("e.1").attribute("shape"));
        assertEquals("A", graph.node("e.2").getLabel());
        // two blanks are always bordered
        assertEquals("", graph.node("e.3").attribute("shape"));
        assertEquals(" ", graph.node("e.3").getLabel());
    }

    @Test
    void emptyFieldCanStayBordered() {
        Graph graph = new Graph();
        Autosplit.split(graph, "b", "|x| ", null, null, Autosplit.EmptyField.BORDERED);

        assertEquals("", graph.node("b.0").attribute("shape"));
        assertEquals(" ", graph.node("b.0").getLabel());
        // the single trailing blank is still borderless
        assertEquals("invisible", graph.node("b.2").attribute("shape"));
    }

    @Test
    void singleBlankAtEndIsBorderless() {
        Graph graph = new Graph();
        Autosplit.split(graph, "t", "A| ", null, null, Autosplit.EmptyField.INVISIBLE);
        assertEquals("invisible", graph.node("t.1").attribute("shape"));
    }

    @Test
    void explicitPortsAndDistributedValues() {
        Graph graph = new Graph();
        Attributes attributes = Attributes.of("fill", "red|blue", "color", "green", "origin", "X");
        Autosplit.split(graph, "p", "a|b", attributes, Arrays.asList("in", null), Autosplit.EmptyField.INVISIBLE);

        Node first = graph.node("p.0");
        Node second = graph.node("p.1");
        assertEquals("in", first.attribute(Autosplit.PORTNAME));
        assertEquals("1", second.attribute(Autosplit.PORTNAME));
        assertEquals("red", first.attribute("fill"));
        assertEquals("blue", second.attribute("fill"));
        assertEquals("green", second.attribute("color"));
        assertEquals("X", first.attribute("origin"));
        assertEquals("", second.attribute("origin"));
    }

    @Test
    void splitValueHonoursEscapes() {
        assertEquals(List.of("a|b", "c"), Autosplit.splitValue("a\\|b|c"));
    }
}
