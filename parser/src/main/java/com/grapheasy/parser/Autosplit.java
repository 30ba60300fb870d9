package com.grapheasy.parser;

import com.grapheasy.graph.Attributes;
import com.grapheasy.graph.Graph;
import com.grapheasy.graph.Node;
import com.grapheasy.parser.scan.DelimiterScanner;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits a record-style label such as {@code A|B||C} into a cluster of field nodes. {@code |} separates
 * fields of one row, {@code ||} starts a new row and {@code \|} is a literal pipe. Field {@code N}
 * becomes node {@code base.N}; every field after the first is placed relative to its left neighbour
 * ({@code dx=1}) or, when it opens a row, below the first field of the previous row ({@code dy=1}).
 */
public final class Autosplit {
    public static final String BASENAME = "autosplit_basename";
    public static final String XY = "autosplit_xy";
    public static final String PORTNAME = "autosplit_portname";

    private static final String ROW_BREAK = "||";

    /** How a field with no text at all is drawn. */
    public enum EmptyField {
        /** borderless, for native labels such as {@code |A} */
        INVISIBLE,
        /** a bordered single-space box, as DOT record fields that only carry a port */
        BORDERED
    }

    private Autosplit() {}

    /**
     * One field of a split label with the separator that ended it ("" for the last field).
     * {@code endOfText} is set when nothing of the original label follows the separator.
     */
    public record Field(String raw, String separator, boolean endOfText) {
        public Field {
            Objects.requireNonNull(raw, "raw");
            Objects.requireNonNull(separator, "separator");
        }
    }

    /**
     * Cuts {@code label} at unescaped pipes. A trailing separator yields one extra empty field, so
     * {@code |G|} has three fields.
     */
    public static List<Field> fields(String label) {
        List<Field> fields = new ArrayList<>();
        String remaining = label;
        boolean padded = false;
        while (!remaining.isEmpty()) {
            int i = 0;
            while (i < remaining.length() && remaining.charAt(i) != '|') {
                i += remaining.charAt(i) == '\\' && i + 1 < remaining.length() && remaining.charAt(i + 1) == '|' ? 2 : 1;
            }
            String separator = "";
            if (i < remaining.length()) {
                separator = remaining.startsWith(ROW_BREAK, i) ? ROW_BREAK : "|";
            }
            String raw = remaining.substring(0, i);
            remaining = remaining.substring(i + separator.length());
            fields.add(new Field(raw, separator, remaining.isEmpty()));
            if (!padded && remaining.isEmpty() && !separator.isEmpty()) {
                padded = true;
                remaining = "|";
            }
        }
        return fields;
    }

    /**
     * Creates the field nodes for {@code label}.
     *
     * @param fieldAttributes copied to every field; a value with an unescaped pipe is split and its
     *     N-th part goes to field N. {@code origin} and {@code offset} only go to the first field.
     * @param portNames explicit port per field index, {@code null} entries (or a null list) fall back
     *     to the field index
     * @param emptyField how fields with no text are drawn; single blanks follow the row rule either way
     * @return the field nodes in field order
     */
    public static List<Node> split(
            Graph graph,
            String baseName,
            String label,
            Attributes fieldAttributes,
            List<String> portNames,
            EmptyField emptyField) {
        List<Field> fields = fields(label);
        List<Node> created = new ArrayList<>(fields.size());
        Node firstInRow = null;
        String previousSeparator = "";
        int x = 0;
        int y = 0;
        for (int idx = 0; idx < fields.size(); idx++) {
            Field field = fields.get(idx);
            String raw = field.raw();
            boolean rowStart = previousSeparator.isEmpty() || ROW_BREAK.equals(previousSeparator);

            String text;
            boolean borderless = false;
            if (raw.isEmpty()) {
                text = " ";
                borderless = emptyField == EmptyField.INVISIBLE;
            } else if (raw.isBlank()) {
                text = " ";
                borderless = raw.length() == 1 && (rowStart || field.endOfText());
            } else {
                text = raw.strip().replace("\\|", "|");
            }

            Node node = graph.addNode(baseName + "." + idx, text);
            node.setLabel(text);
            if (fieldAttributes != null) {
                node.setAttributes(attributesForField(fieldAttributes, idx));
            }
            if (borderless && !node.getAttributes().contains("shape")) {
                node.setAttribute("shape", "invisible");
            }
            String port = portNames != null && idx < portNames.size() ? portNames.get(idx) : null;
            node.setAttribute(BASENAME, baseName);
            node.setAttribute(XY, x + "," + y);
            node.setAttribute(PORTNAME, port == null ? Integer.toString(idx) : port);

            if (idx == 0) {
                firstInRow = node;
            } else if (ROW_BREAK.equals(previousSeparator)) {
                node.relativeTo(firstInRow, 0, 1);
                firstInRow = node;
            } else {
                node.relativeTo(created.get(idx - 1), 1, 0);
            }
            created.add(node);

            previousSeparator = field.separator();
            x++;
            if (ROW_BREAK.equals(field.separator())) {
                x = 0;
                y++;
            }
        }
        return created;
    }

    private static Attributes attributesForField(Attributes source, int idx) {
        Attributes out = new Attributes();
        for (Map.Entry<String, String> entry : source) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (idx != 0 && ("origin".equals(key) || "offset".equals(key))) {
                continue;
            }
            if (DelimiterScanner.hasUnescapedPipe(value)) {
                List<String> parts = splitValue(value);
                if (idx < parts.size() && !parts.get(idx).isBlank()) {
                    out.set(key, parts.get(idx).strip());
                }
                continue;
            }
            out.set(key, value);
        }
        return out;
    }

    /** Splits at every unescaped pipe; {@code \|} becomes a literal pipe. */
    static List<String> splitValue(String value) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\\' && i + 1 < value.length() && value.charAt(i + 1) == '|') {
                current.append('|');
                i++;
            } else if (ch == '|') {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        parts.add(current.toString());
        return parts;
    }
}
