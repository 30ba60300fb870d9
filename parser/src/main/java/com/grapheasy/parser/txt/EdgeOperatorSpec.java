package com.grapheasy.parser.txt;

import com.grapheasy.graph.Attributes;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.scan.AttributeBlocks;
import com.grapheasy.parser.scan.DelimiterScanner;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The text between two chain elements: {@code leftOp [label words] rightOp}, optionally with one
 * attribute block for the edge. A span made only of operator fragments ({@code - >}) is one operator
 * used for both ends.
 */
record EdgeOperatorSpec(String leftOp, String rightOp, String label, Attributes attributes) {
    private static final Pattern OPERATOR = Pattern.compile("[-.=<>~]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    EdgeOperatorSpec {
        Objects.requireNonNull(leftOp, "leftOp");
        Objects.requireNonNull(rightOp, "rightOp");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(attributes, "attributes");
    }

    static boolean startsWithOperator(String text) {
        return !text.isEmpty() && isOperatorChar(text.charAt(0));
    }

    static boolean isOperatorChar(char ch) {
        return ch == '-' || ch == '.' || ch == '=' || ch == '<' || ch == '>' || ch == '~';
    }

    static EdgeOperatorSpec parse(String span) throws GraphParseException {
        Attributes attributes = new Attributes();
        String text = span;
        int brace = text.indexOf('{');
        if (brace >= 0) {
            int close = DelimiterScanner.findClosing(text, brace);
            attributes = AttributeBlocks.parse(text.substring(brace, close + 1));
            text = text.substring(0, brace) + " " + text.substring(close + 1);
        }
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            throw missing(span);
        }
        List<String> tokens = Arrays.asList(WHITESPACE.split(stripped));
        if (tokens.stream().allMatch(token -> OPERATOR.matcher(token).matches())) {
            String op = String.join(" ", tokens);
            return new EdgeOperatorSpec(op, op, "", attributes);
        }
        String left = tokens.get(0);
        String right = tokens.get(tokens.size() - 1);
        if (tokens.size() < 2 || !OPERATOR.matcher(left).matches() || !OPERATOR.matcher(right).matches()) {
            throw missing(span);
        }
        String label = String.join(" ", tokens.subList(1, tokens.size() - 1));
        return new EdgeOperatorSpec(left, right, label, attributes);
    }

    private static GraphParseException missing(String span) {
        return new GraphParseException(ErrorKind.MISSING_EDGE_OPERATOR, "Missing edge operator in: '" + span.strip() + "'");
    }
}
