package com.grapheasy.parser;

import com.grapheasy.parser.dot.DotGraphParser;
import com.grapheasy.parser.gdl.GdlGraphParser;
import com.grapheasy.parser.txt.TxtGraphParser;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/** The input languages understood by {@link GraphLoader}. */
public enum GraphFormat {
    TXT(TxtGraphParser::new),
    GRAPHVIZ(DotGraphParser::new),
    GDL(GdlGraphParser::new);

    // checked before DOT: "graph:" would otherwise read as a DOT header
    private static final Pattern GDL_HEADER = Pattern.compile("\\A\\s*graph\\s*:\\s*\\{");
    private static final Pattern DOT_HEADER =
            Pattern.compile("\\A\\s*(?:strict\\s+)?(?:graph|digraph)\\b", Pattern.CASE_INSENSITIVE);

    private final Supplier<GraphParser> parserFactory;

    GraphFormat(Supplier<GraphParser> parserFactory) {
        this.parserFactory = parserFactory;
    }

    /** Returns a fresh parser for this format. */
    public GraphParser newParser() {
        return parserFactory.get();
    }

    /** Sniffs the format from the leading text. */
    public static GraphFormat detect(String text) {
        Objects.requireNonNull(text, "text");
        if (GDL_HEADER.matcher(text).find()) {
            return GDL;
        }
        if (DOT_HEADER.matcher(text).find()) {
            return GRAPHVIZ;
        }
        return TXT;
    }

    public static Optional<GraphFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".dot") || lower.endsWith(".gv")) {
            return Optional.of(GRAPHVIZ);
        }
        if (lower.endsWith(".gdl") || lower.endsWith(".vcg")) {
            return Optional.of(GDL);
        }
        if (lower.endsWith(".txt")) {
            return Optional.of(TXT);
        }
        return Optional.empty();
    }
}
