package com.grapheasy.parser.txt;

import com.grapheasy.parser.scan.DelimiterScanner;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Joins physical lines into logical statements.
 *
 * <p>A line with an open bracket, brace or parenthesis swallows following lines (joined with one space)
 * until it balances; a continuation line that is just {@code }} always ends the join. A trailing comma
 * also continues the statement. A scope header alone on its line is joined with a following
 * {@code {...}} line. A {@code ( name} group header without {@code )} is left alone: it opens a
 * multi-line group that a later {@code )} line closes.
 */
final class LogicalLineReader {
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?|\\n");
    private static final Pattern SCOPE_HEADER = Pattern.compile("^(graph|node|edge|group|\\.[A-Za-z0-9_-]+)$");
    private static final Pattern EDGE_CHARS = Pattern.compile("[-.=<>~]");
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*$");

    private LogicalLineReader() {}

    static List<LogicalLine> read(String text) {
        String[] raw = LINE_BREAK.split(text, -1);
        List<LogicalLine> lines = new ArrayList<>();
        int i = 0;
        while (i < raw.length) {
            int start = i;
            StringBuilder line = new StringBuilder(raw[i]);

            String header = raw[i].strip();
            if (SCOPE_HEADER.matcher(header).matches() && i + 1 < raw.length
                    && raw[i + 1].strip().startsWith("{")) {
                i++;
                line.append(' ').append(raw[i].strip());
            }

            while (shouldJoin(line.toString()) && i + 1 < raw.length) {
                String next = raw[i + 1];
                // leading blanks inside an open [...] label are significant for split fields
                String continuation = DelimiterScanner.hasUnclosedSquare(line.toString())
                        ? next.stripTrailing()
                        : next.strip();
                i++;
                line.append(' ').append(continuation);
                if (next.strip().equals("}")) {
                    break;
                }
            }
            lines.add(new LogicalLine(line.toString(), start + 1));
            i++;
        }
        return lines;
    }

    private static boolean shouldJoin(String line) {
        String trimmed = DelimiterScanner.stripLineComment(line).strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return false;
        }
        if (isGroupHeader(trimmed)) {
            return false;
        }
        if (!DelimiterScanner.isBalanced(trimmed)) {
            return true;
        }
        return TRAILING_COMMA.matcher(trimmed).find();
    }

    static boolean isGroupHeader(String trimmed) {
        return trimmed.startsWith("(")
                && trimmed.indexOf(')') < 0
                && trimmed.indexOf('[') < 0
                && !EDGE_CHARS.matcher(trimmed).find();
    }
}
