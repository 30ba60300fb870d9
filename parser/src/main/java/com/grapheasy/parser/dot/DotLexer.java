package com.grapheasy.parser.dot;

import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import com.grapheasy.parser.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hand-written DOT tokenizer. Quoted strings keep their backslash escapes verbatim, {@code <...>}
 * HTML-like ids are kept whole including the brackets, and a bare token such as {@code 123abc} is split
 * into {@code 123} and {@code abc}.
 */
public final class DotLexer {
    private static final String PUNCTUATION = "{}[]();=,:+";
    private static final String BARE_STOP = PUNCTUATION + "\"<>";
    private static final Pattern LINE_CONTINUATION = Pattern.compile("\\\\\\n\\s*");
    private static final Pattern DIGITS_THEN_NAME = Pattern.compile("^(\\d+)([A-Za-z_].*)$");

    private final String sourceName;
    private final String text;
    private final List<DotToken> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int lineStart;

    private DotLexer(String sourceName, String text) {
        this.sourceName = sourceName;
        this.text = text;
    }

    public static List<DotToken> tokenize(String sourceName, String input) throws GraphParseException {
        String normalized = input.replace("\r\n", "\n").replace('\r', '\n');
        normalized = LINE_CONTINUATION.matcher(normalized).replaceAll(" ");
        DotLexer lexer = new DotLexer(sourceName, normalized);
        lexer.run();
        return lexer.tokens;
    }

    private void run() throws GraphParseException {
        while (pos < text.length()) {
            char ch = text.charAt(pos);
            if (ch == '\n') {
                newline(pos);
                pos++;
            } else if (Character.isWhitespace(ch)) {
                pos++;
            } else if (ch == '#' || startsWith("//")) {
                skipToEndOfLine();
            } else if (startsWith("/*")) {
                skipBlockComment();
            } else if (startsWith("->") || startsWith("--")) {
                add(DotToken.Type.EDGE_OP, text.substring(pos, pos + 2), pos);
                pos += 2;
            } else if (PUNCTUATION.indexOf(ch) >= 0) {
                add(DotToken.Type.PUNCT, String.valueOf(ch), pos);
                pos++;
            } else if (ch == '"') {
                readQuoted();
            } else if (ch == '<') {
                readHtml();
            } else {
                readBare();
            }
        }
    }

    private boolean startsWith(String prefix) {
        return text.startsWith(prefix, pos);
    }

    private void newline(int at) {
        line++;
        lineStart = at + 1;
    }

    private void skipToEndOfLine() {
        while (pos < text.length() && text.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void skipBlockComment() throws GraphParseException {
        int start = pos;
        SourceLocation where = location(start);
        pos += 2;
        while (pos < text.length() && !startsWith("*/")) {
            if (text.charAt(pos) == '\n') {
                newline(pos);
            }
            pos++;
        }
        if (pos >= text.length()) {
            throw new GraphParseException(ErrorKind.UNTERMINATED_BLOCK, "Unterminated /* comment", where);
        }
        pos += 2;
    }

    private void readQuoted() throws GraphParseException {
        int start = pos;
        SourceLocation where = location(start);
        StringBuilder out = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char ch = text.charAt(pos);
            if (ch == '\\' && pos + 1 < text.length()) {
                out.append(ch).append(text.charAt(pos + 1));
                if (text.charAt(pos + 1) == '\n') {
                    newline(pos + 1);
                }
                pos += 2;
                continue;
            }
            if (ch == '"') {
                pos++;
                tokens.add(new DotToken(DotToken.Type.ID, out.toString(), where.line(), where.column()));
                return;
            }
            if (ch == '\n') {
                newline(pos);
            }
            out.append(ch);
            pos++;
        }
        throw new GraphParseException(ErrorKind.UNTERMINATED_BLOCK, "Unterminated quoted string", where);
    }

    private void readHtml() throws GraphParseException {
        int start = pos;
        SourceLocation where = location(start);
        int close = text.indexOf('>', pos);
        if (close < 0) {
            throw new GraphParseException(ErrorKind.UNTERMINATED_BLOCK, "Unterminated <...> token", where);
        }
        for (int i = pos; i < close; i++) {
            if (text.charAt(i) == '\n') {
                newline(i);
            }
        }
        tokens.add(new DotToken(DotToken.Type.ID, text.substring(start, close + 1), where.line(), where.column()));
        pos = close + 1;
    }

    private void readBare() throws GraphParseException {
        int start = pos;
        while (pos < text.length()) {
            char ch = text.charAt(pos);
            if (Character.isWhitespace(ch) || ch == '#' || BARE_STOP.indexOf(ch) >= 0
                    || startsWith("//") || startsWith("/*") || startsWith("->") || startsWith("--")) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw new GraphParseException(
                    ErrorKind.UNEXPECTED_CHARACTER, "Unexpected character '" + text.charAt(pos) + "'", location(pos));
        }
        String raw = text.substring(start, pos);
        Matcher split = DIGITS_THEN_NAME.matcher(raw);
        if (split.matches()) {
            add(DotToken.Type.ID, split.group(1), start);
            add(DotToken.Type.ID, split.group(2), start + split.group(1).length());
        } else {
            add(DotToken.Type.ID, raw, start);
        }
    }

    private void add(DotToken.Type type, String value, int at) {
        tokens.add(new DotToken(type, value, line, at - lineStart + 1));
    }

    private SourceLocation location(int at) {
        return new SourceLocation(sourceName, line, at - lineStart + 1);
    }
}
