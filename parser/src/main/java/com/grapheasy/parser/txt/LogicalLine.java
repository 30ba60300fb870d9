package com.grapheasy.parser.txt;

/** One statement after physical lines have been joined, with the line it started on. */
public record LogicalLine(String text, int lineNumber) {}
