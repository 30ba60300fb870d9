package com.grapheasy.parser;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runtime switches read from system properties, falling back to environment variables. */
public final class DebugFlags {
    private static final Logger LOG = LoggerFactory.getLogger(DebugFlags.class);

    private static final String TOKENS_PROPERTY = "grapheasy.debugTokens";
    private static final String TOKENS_ENV = "GRAPHEASY_DEBUG_TOKENS";
    private static final String DEPTH_PROPERTY = "grapheasy.maxNestingDepth";
    private static final String DEPTH_ENV = "GRAPHEASY_MAX_NESTING_DEPTH";
    static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    private static final ThreadLocal<List<String>> CAPTURED_TOKENS = ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    /** Maximum depth of inline groups and DOT subgraphs. Invalid or non-positive values fall back to 64. */
    public static int maxNestingDepth() {
        String value = System.getProperty(DEPTH_PROPERTY);
        if (value == null) {
            value = System.getenv(DEPTH_ENV);
        }
        if (value == null || value.isBlank()) {
            return DEFAULT_MAX_NESTING_DEPTH;
        }
        try {
            int depth = Integer.parseInt(value.trim());
            return depth > 0 ? depth : DEFAULT_MAX_NESTING_DEPTH;
        } catch (NumberFormatException ex) {
            LOG.warn("Ignoring {}={}: not an integer", DEPTH_PROPERTY, value);
            return DEFAULT_MAX_NESTING_DEPTH;
        }
    }

    /** Logs a token dump and keeps the lines for {@link #drainCapturedTokens()}. */
    public static void logTokens(String format, List<String> lines) {
        LOG.info("Token dump for {}:", format);
        for (String line : lines) {
            LOG.info("  {}", line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }
}
