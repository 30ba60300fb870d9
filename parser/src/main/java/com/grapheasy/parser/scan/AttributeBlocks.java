package com.grapheasy.parser.scan;

import com.grapheasy.graph.Attributes;
import com.grapheasy.parser.ErrorKind;
import com.grapheasy.parser.GraphParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses {@code { key: value; other = value }} attribute blocks. */
public final class AttributeBlocks {
    private static final Pattern ENTRY = Pattern.compile("^([^:=]+?)\\s*[:=]\\s*(.*?)\\s*$", Pattern.DOTALL);

    private AttributeBlocks() {}

    /**
     * Parses a complete block including its braces. Keys are lower-cased with dashes removed, so
     * {@code arrow-style} reads as {@code arrowstyle}.
     *
     * @throws GraphParseException {@link ErrorKind#INVALID_ATTRIBUTE} for an entry without a key or
     *     separator, or when {@code block} is not wrapped in braces
     */
    public static Attributes parse(String block) throws GraphParseException {
        String trimmed = block.strip();
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            throw new GraphParseException(
                    ErrorKind.INVALID_ATTRIBUTE, "Expected an attribute block like '{ a: b; }', got: " + block);
        }
        Attributes attributes = new Attributes();
        for (String entry : splitEntries(trimmed.substring(1, trimmed.length() - 1))) {
            String part = entry.strip();
            if (part.isEmpty()) {
                continue;
            }
            Matcher matcher = ENTRY.matcher(part);
            if (!matcher.matches()) {
                throw new GraphParseException(ErrorKind.INVALID_ATTRIBUTE, "Invalid attribute entry: " + part);
            }
            attributes.set(normalizeKey(matcher.group(1)), matcher.group(2).strip());
        }
        return attributes;
    }

    public static String normalizeKey(String key) {
        return key.strip().toLowerCase(Locale.ROOT).replace("-", "");
    }

    private static List<String> splitEntries(String inner) {
        List<String> entries = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < inner.length(); i++) {
            char ch = inner.charAt(i);
            if (ch == '\\' && i + 1 < inner.length()) {
                current.append(ch).append(inner.charAt(++i));
                continue;
            }
            if (ch == '"') {
                quoted = !quoted;
            } else if (ch == ';' && !quoted) {
                entries.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(ch);
        }
        entries.add(current.toString());
        return entries;
    }
}
