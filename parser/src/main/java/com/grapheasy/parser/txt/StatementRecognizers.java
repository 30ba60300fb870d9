package com.grapheasy.parser.txt;

import com.grapheasy.graph.Attributes;
import com.grapheasy.graph.ElementKind;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.scan.AttributeBlocks;
import com.grapheasy.parser.scan.DelimiterScanner;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The recognizers of the native language in priority order. The order resolves the grammar's
 * ambiguities: a leading {@code .} is a class selector only while the scope recognizer accepts the
 * whole line, otherwise the line falls through to chain parsing.
 */
final class StatementRecognizers {
    private static final Pattern CLASS_SELECTOR = Pattern.compile("\\.([A-Za-z0-9_][A-Za-z0-9_-]*)");
    private static final Pattern KIND_SELECTOR =
            Pattern.compile("(graph|node|edge|group)(?:\\.([A-Za-z0-9_][A-Za-z0-9_-]*))?");
    private static final Pattern CLASS_PREFIX = Pattern.compile("^\\.[A-Za-z0-9_]");

    static final List<StatementRecognizer> ORDERED =
            List.of(
                    StatementRecognizers::blankOrComment,
                    StatementRecognizers::pendingEdgeAttributes,
                    StatementRecognizers::scopeAttributes,
                    StatementRecognizers::groupOpen,
                    StatementRecognizers::groupClose,
                    StatementRecognizers::chains);

    private StatementRecognizers() {}

    static Optional<Statement> blankOrComment(String line, TxtParseState state) {
        return line.isEmpty() || line.startsWith("#") ? Optional.of(new Statement.Ignored()) : Optional.empty();
    }

    static Optional<Statement> pendingEdgeAttributes(String line, TxtParseState state) throws GraphParseException {
        if (!state.pendingEdge().isPending() || !isSingleBlock(line)) {
            return Optional.empty();
        }
        return Optional.of(new Statement.PendingEdgeAttributes(AttributeBlocks.parse(line)));
    }

    static Optional<Statement> scopeAttributes(String line, TxtParseState state) throws GraphParseException {
        if (line.startsWith("[") || line.startsWith("(")) {
            return Optional.empty();
        }
        if (EdgeOperatorSpec.startsWithOperator(line) && !CLASS_PREFIX.matcher(line).find()) {
            return Optional.empty();
        }
        if (isSingleBlock(line)) {
            List<Statement.Selector> graphOnly = List.of(new Statement.Selector(ElementKind.GRAPH, null));
            return Optional.of(new Statement.ScopeAttributes(graphOnly, AttributeBlocks.parse(line)));
        }
        int brace = line.indexOf('{');
        if (brace <= 0 || !line.endsWith("}") || DelimiterScanner.findClosing(line, brace) != line.length() - 1) {
            return Optional.empty();
        }
        List<Statement.Selector> selectors = new ArrayList<>();
        for (String raw : DelimiterScanner.splitTopLevel(line.substring(0, brace), ',')) {
            String selector = raw.strip();
            if (selector.isEmpty()) {
                continue;
            }
            Matcher classOnly = CLASS_SELECTOR.matcher(selector);
            Matcher kind = KIND_SELECTOR.matcher(selector);
            if (classOnly.matches()) {
                selectors.add(new Statement.Selector(null, classOnly.group(1)));
            } else if (kind.matches()) {
                selectors.add(new Statement.Selector(ElementKind.fromKeyword(kind.group(1)), kind.group(2)));
            } else {
                return Optional.empty();
            }
        }
        if (selectors.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Statement.ScopeAttributes(selectors, AttributeBlocks.parse(line.substring(brace))));
    }

    static Optional<Statement> groupOpen(String line, TxtParseState state) {
        if (line.startsWith("(") && line.indexOf(')') < 0 && line.indexOf('[') < 0) {
            return Optional.of(new Statement.GroupOpen(line.substring(1).strip()));
        }
        return Optional.empty();
    }

    static Optional<Statement> groupClose(String line, TxtParseState state) throws GraphParseException {
        if (!line.startsWith(")")) {
            return Optional.empty();
        }
        return Optional.of(new Statement.GroupClose(groupCloseTail(line.substring(1))));
    }

    static Optional<Statement> chains(String line, TxtParseState state) {
        List<String> fragments = new ArrayList<>();
        for (String part : DelimiterScanner.splitTopLevel(line, ',')) {
            String fragment = part.strip();
            if (!fragment.isEmpty()) {
                fragments.add(fragment);
            }
        }
        return Optional.of(new Statement.Chains(fragments));
    }

    /** Parses what may follow a group's {@code )}: nothing or one attribute block. */
    static Attributes groupCloseTail(String tail) throws GraphParseException {
        String rest = tail.strip();
        if (rest.isEmpty()) {
            return new Attributes();
        }
        if (rest.startsWith("{") && DelimiterScanner.findClosing(rest, 0) == rest.length() - 1) {
            return AttributeBlocks.parse(rest);
        }
        throw new GraphParseException(ErrorKind.UNEXPECTED_TOKEN, "Unexpected trailing content after ')': " + rest);
    }

    private static boolean isSingleBlock(String line) throws GraphParseException {
        return line.startsWith("{") && DelimiterScanner.findClosing(line, 0) == line.length() - 1;
    }
}
