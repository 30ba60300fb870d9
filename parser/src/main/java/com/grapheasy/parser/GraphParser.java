package com.grapheasy.parser;

import com.grapheasy.graph.Graph;

/** Turns one complete text buffer into a new graph. Implementations keep no state between calls. */
public interface GraphParser {

    Graph parse(String sourceName, String text) throws GraphParseException;
}
