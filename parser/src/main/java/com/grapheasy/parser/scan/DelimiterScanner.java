package com.grapheasy.parser.scan;

import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Escape-aware bracket scanning shared by the front ends. All methods are pure functions over their
 * input; a backslash always makes the next character literal.
 */
public final class DelimiterScanner {
    private static final char ESCAPE = '\\';

    private DelimiterScanner() {}

    /**
     * Returns the index of the delimiter that closes the one at {@code openPos}.
     *
     * <ul>
     *   <li>{@code [} nests with itself.
     *   <li>{@code {} is closed by the first {@code }} outside double quotes: attribute blocks do not
     *       nest, their values may contain braces.
     *   <li>{@code (} nests with itself and skips whole {@code [...]} and {@code {...}} spans.
     * </ul>
     *
     * @throws GraphParseException {@link ErrorKind#UNTERMINATED_BLOCK} when the text ends first
     */
    public static int findClosing(String text, int openPos) throws GraphParseException {
        char open = text.charAt(openPos);
        switch (open) {
            case '[':
                return closeNested(text, openPos, '[', ']', "node label");
            case '{':
                return closeAttributeBlock(text, openPos);
            case '(':
                return closeGroup(text, openPos);
            default:
                throw new IllegalArgumentException("Not an opening delimiter: '" + open + "' at " + openPos);
        }
    }

    private static int closeNested(String text, int openPos, char open, char close, String what)
            throws GraphParseException {
        int depth = 0;
        for (int i = openPos; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ESCAPE) {
                i++;
            } else if (ch == open) {
                depth++;
            } else if (ch == close && --depth == 0) {
                return i;
            }
        }
        throw unterminated(text, openPos, open, close, what);
    }

    private static int closeAttributeBlock(String text, int openPos) throws GraphParseException {
        boolean quoted = false;
        for (int i = openPos + 1; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ESCAPE) {
                i++;
            } else if (ch == '"') {
                quoted = !quoted;
            } else if (ch == '}' && !quoted) {
                return i;
            }
        }
        throw unterminated(text, openPos, '{', '}', "attribute block");
    }

    private static int closeGroup(String text, int openPos) throws GraphParseException {
        int depth = 0;
        for (int i = openPos; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ESCAPE) {
                i++;
            } else if (ch == '[' || ch == '{') {
                i = findClosing(text, i);
            } else if (ch == '(') {
                depth++;
            } else if (ch == ')' && --depth == 0) {
                return i;
            }
        }
        throw unterminated(text, openPos, '(', ')', "group");
    }

    private static GraphParseException unterminated(String text, int openPos, char open, char close, String what) {
        return new GraphParseException(
                ErrorKind.UNTERMINATED_BLOCK,
                "Unterminated " + what + ": '" + open + "' at offset " + openPos + " has no matching '" + close
                        + "' in: " + text.substring(openPos).trim());
    }

    /** Splits at {@code separator} where no {@code []}, {@code {}} or {@code ()} is open. */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int square = 0;
        int curly = 0;
        int paren = 0;
        int last = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ESCAPE) {
                i++;
                continue;
            }
            if (ch == '[') {
                square++;
            } else if (ch == ']' && square > 0) {
                square--;
            } else if (ch == '{') {
                curly++;
            } else if (ch == '}' && curly > 0) {
                curly--;
            } else if (ch == '(') {
                paren++;
            } else if (ch == ')' && paren > 0) {
                paren--;
            } else if (ch == separator && square == 0 && curly == 0 && paren == 0) {
                parts.add(text.substring(last, i));
                last = i + 1;
            }
        }
        parts.add(text.substring(last));
        return parts;
    }

    /**
     * Whether every bracket, brace and parenthesis opened on {@code line} is closed. Parentheses only
     * count outside node labels and attribute blocks.
     */
    public static boolean isBalanced(String line) {
        int square = 0;
        int curly = 0;
        int paren = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ESCAPE) {
                i++;
            } else if (ch == '[') {
                square++;
            } else if (ch == ']' && square > 0) {
                square--;
            } else if (ch == '{') {
                curly++;
            } else if (ch == '}' && curly > 0) {
                curly--;
            } else if (square == 0 && curly == 0) {
                if (ch == '(') {
                    paren++;
                } else if (ch == ')' && paren > 0) {
                    paren--;
                }
            }
        }
        return square == 0 && curly == 0 && paren == 0;
    }

    public static boolean hasUnclosedSquare(String text) {
        int square = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ESCAPE) {
                i++;
            } else if (ch == '[') {
                square++;
            } else if (ch == ']' && square > 0) {
                square--;
            }
        }
        return square > 0;
    }

    public static int skipWhitespace(String text, int pos) {
        int i = pos;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Cuts a trailing {@code #} comment. The {@code #} must sit outside labels, groups and attribute blocks and
     * be followed by whitespace or the end of the line, so {@code #ff0000} colours survive.
     */
    public static String stripLineComment(String line) {
        int square = 0;
        int curly = 0;
        int paren = 0;
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ESCAPE) {
                i++;
                continue;
            }
            if (quoted) {
                quoted = ch != '"';
                continue;
            }
            if (ch == '"' && curly > 0) {
                quoted = true;
            } else if (ch == '[') {
                square++;
            } else if (ch == ']' && square > 0) {
                square--;
            } else if (ch == '{') {
                curly++;
            } else if (ch == '}' && curly > 0) {
                curly--;
            } else if (ch == '(') {
                paren++;
            } else if (ch == ')' && paren > 0) {
                paren--;
            } else if (ch == '#' && square == 0 && curly == 0 && paren == 0
                    && (i + 1 == line.length() || Character.isWhitespace(line.charAt(i + 1)))) {
                return line.substring(0, i).stripTrailing();
            }
        }
        return line;
    }

    /** Whether {@code text} holds a {@code |} not preceded by a backslash. */
    public static boolean hasUnescapedPipe(String text) {
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ESCAPE) {
                i++;
            } else if (ch == '|') {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of the next {@code [} or {@code (} at or after {@code pos} that is not inside an attribute
     * block, or -1.
     */
    public static int findNextElementStart(String text, int pos) throws GraphParseException {
        for (int i = pos; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == ESCAPE) {
                i++;
            } else if (ch == '{') {
                i = findClosing(text, i);
            } else if (ch == '[' || ch == '(') {
                return i;
            }
        }
        return -1;
    }
}
