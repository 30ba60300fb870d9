package com.grapheasy.parser.dot;

import com.grapheasy.graph.Attributes;
import com.grapheasy.parser.AttributeRemapper;
import java.util.Locale;
import java.util.Map;

/**
 * DOT to native attribute tables. Keys are matched case-insensitively; anything not listed here is
 * kept under {@value #VENDOR_PREFIX}.
 */
final class DotAttributeMapper {
    static final String VENDOR_PREFIX = "x-dot-";

    /** How an edge statement's {@code dir} attribute changes materialisation. */
    enum Direction {
        FORWARD,
        BACK,
        NONE
    }

    /** Remapped edge attributes plus the two values that steer materialisation. */
    record EdgeAttributes(String label, Direction direction, Attributes attributes) {}

    private static final AttributeRemapper GRAPH = AttributeRemapper.builder(VENDOR_PREFIX)
            .map("rankdir", (value, out) -> out.set("flow", DotValues.rankdirToFlow(value)))
            .map("labeljust", (value, out) -> out.set("align", DotValues.labeljustToAlign(value)))
            .map("labelloc", (value, out) -> out.set("labelpos", DotValues.labellocToLabelpos(value)))
            .passThrough("label", "colorscheme", "output")
            .build();

    private static final AttributeRemapper GROUP = AttributeRemapper.builder(VENDOR_PREFIX)
            .passThrough("label")
            .map("labeljust", (value, out) -> out.set("align", DotValues.labeljustToAlign(value)))
            .map("labelloc", (value, out) -> out.set("labelpos", DotValues.labellocToLabelpos(value)))
            .map("pencolor", (value, out) -> out.set("border", "dashed  " + DotValues.color(value)))
            .map("style", DotAttributeMapper::groupStyle)
            .build();

    private static final AttributeRemapper NODE = AttributeRemapper.builder(VENDOR_PREFIX)
            .passThrough("label")
            .map("shape", (value, out) -> out.set("shape", DotValues.shape(value)))
            .map("fontsize", (value, out) -> out.set("fontsize", DotValues.fontSize(value)))
            .rename("fontname", "font")
            .map("color", (value, out) -> out.set("color", DotValues.color(value)))
            .map("style", DotAttributeMapper::nodeStyle)
            .build();

    private static final AttributeRemapper EDGE = AttributeRemapper.builder(VENDOR_PREFIX)
            .ignore("label")
            .ignore("dir")
            .map("headport", (value, out) -> out.set("end", DotValues.compassToSide(value)))
            .map("tailport", (value, out) -> out.set("start", DotValues.compassToSide(value)))
            .map("color", (value, out) -> out.set("color", DotValues.color(value)))
            .map("style", DotAttributeMapper::edgeStyle)
            .build();

    private DotAttributeMapper() {}

    static Attributes graph(Attributes raw) {
        return GRAPH.remap(lowerKeys(raw));
    }

    static Attributes group(Attributes raw) {
        return GROUP.remap(lowerKeys(raw));
    }

    static Attributes node(Attributes raw) {
        return NODE.remap(lowerKeys(raw));
    }

    static EdgeAttributes edge(Attributes raw) {
        Attributes keys = lowerKeys(raw);
        Direction direction = Direction.FORWARD;
        String dir = keys.get("dir");
        if (dir != null) {
            String d = dir.trim().toLowerCase(Locale.ROOT);
            if (d.equals("back")) {
                direction = Direction.BACK;
            } else if (d.equals("none")) {
                direction = Direction.NONE;
            }
        }
        return new EdgeAttributes(keys.get("label"), direction, EDGE.remap(keys));
    }

    private static Attributes lowerKeys(Attributes raw) {
        Attributes out = new Attributes();
        for (Map.Entry<String, String> entry : raw) {
            out.set(entry.getKey().trim().toLowerCase(Locale.ROOT), entry.getValue());
        }
        return out;
    }

    private static String[] styleTokens(String value) {
        return value.trim().toLowerCase(Locale.ROOT).split("\\s*,\\s*");
    }

    private static boolean isBorderStyle(String token) {
        return token.equals("dotted") || token.equals("dashed") || token.equals("bold");
    }

    private static void groupStyle(String value, Attributes out) {
        for (String token : styleTokens(value)) {
            if (isBorderStyle(token)) {
                out.set("border", token + "  black");
                return;
            }
        }
    }

    private static void nodeStyle(String value, Attributes out) {
        for (String token : styleTokens(value)) {
            if (token.equals("filled")) {
                out.set("shape", "rect");
            } else if (token.equals("rounded")) {
                out.set("rounded", "true");
            } else if (token.equals("invis")) {
                out.set("shape", "invisible");
            } else if (isBorderStyle(token)) {
                out.set("border", token + "  black");
            } else {
                String bucket = DotValues.lineWidthBucket(token);
                if (bucket != null && !bucket.equals("solid")) {
                    out.set("border", bucket);
                }
            }
        }
    }

    // solid is the implicit edge style and is never written
    private static void edgeStyle(String value, Attributes out) {
        for (String token : styleTokens(value)) {
            String style = switch (token) {
                case "invis" -> "invisible";
                case "normal", "" -> "solid";
                default -> {
                    String bucket = DotValues.lineWidthBucket(token);
                    yield bucket == null ? token : bucket;
                }
            };
            if (!style.equals("solid")) {
                out.set("style", style);
            }
        }
    }
}
