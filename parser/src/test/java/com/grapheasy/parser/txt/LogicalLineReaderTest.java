package com.grapheasy.parser.txt;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class LogicalLineReaderTest {

    @Test
    void joinsUntilBracketsBalance() {
        List<LogicalLine> lines = LogicalLineReader.read("[ A ] { color: red;\n  fill: blue; }\n[ B ]");

        assertEquals(2, lines.size());
        assertEquals("[ A ] { color: red; fill: blue; }", lines.get(0).text());
        assertEquals(1, lines.get(0).lineNumber());
        assertEquals(3, lines.get(1).lineNumber());
    }

    @Test
    void scopeHeaderTakesNextBlockLine() {
        List<LogicalLine> lines = LogicalLineReader.read("node\n{ color: red; }");
        assertEquals(1, lines.size());
        assertEquals("node { color: red; }", lines.get(0).text());
    }

    @Test
    void trailingCommaContinues() {
        List<LogicalLine> lines = LogicalLineReader.read("[ A ],\n[ B ] -> [ C ]");
        assertEquals(1, lines.size());
        assertEquals("[ A ], [ B ] -> [ C ]", lines.get(0).text());
    }

    @Test
    void groupHeaderAndTrailingOperatorStayAlone() {
        List<LogicalLine> lines = LogicalLineReader.read("( Cities\n[ A ] -->\n[ B ]\n)");
        assertEquals(4, lines.size());
        assertEquals("( Cities", lines.get(0).text());
        assertEquals("[ A ] -->", lines.get(1).text());
    }

    @Test
    void openLabelKeepsLeadingBlanks() {
        List<LogicalLine> lines = LogicalLineReader.read("[ A |\n  B ]");
        assertEquals("[ A |   B ]", lines.get(0).text());
    }
}
