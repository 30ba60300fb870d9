package com.grapheasy.parser.dot;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Value translations from DOT vocabulary to native attribute values. */
final class DotValues {
    private static final Pattern SCHEME_COLOR = Pattern.compile("^/([^/]+)/(.+)$");
    private static final Pattern HSV_COMMA =
            Pattern.compile("^([0-9]+(?:\\.[0-9]+)?)\\s*,\\s*([0-9]+(?:\\.[0-9]+)?)\\s*,\\s*([0-9]+(?:\\.[0-9]+)?)$");
    private static final Pattern HSV_SPACE =
            Pattern.compile("^([0-9]+(?:\\.[0-9]+)?)\\s+([0-9]+(?:\\.[0-9]+)?)\\s+([0-9]+(?:\\.[0-9]+)?)$");
    private static final Pattern LINE_WIDTH = Pattern.compile("setlinewidth\\((\\d+|\\d*\\.\\d+)\\)");
    private static final Pattern NUMBER = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final List<String> ACCENT4 = List.of("#7fc97f", "#beaed4", "#fdc086", "#ffff99");
    private static final Set<String> RECT_SHAPES = Set.of("box", "polygon", "egg", "rectangle", "msquare");
    static final Set<String> COMPASS_POINTS = Set.of("n", "ne", "e", "se", "s", "sw", "w", "nw", "c", "_");

    private DotValues() {}

    static String rankdirToFlow(String rankdir) {
        return switch (rankdir.trim().toUpperCase(Locale.ROOT)) {
            case "RL" -> "west";
            case "TB" -> "south";
            case "BT" -> "north";
            default -> "east";
        };
    }

    static String labeljustToAlign(String labeljust) {
        return switch (labeljust.trim().toLowerCase(Locale.ROOT)) {
            case "l" -> "left";
            case "r" -> "right";
            default -> "center";
        };
    }

    static String labellocToLabelpos(String labelloc) {
        return labelloc.trim().toLowerCase(Locale.ROOT).startsWith("b") ? "bottom" : "top";
    }

    static String shape(String raw) {
        String shape = raw.trim().toLowerCase(Locale.ROOT);
        if (shape.startsWith("double")) {
            shape = shape.substring("double".length());
        }
        if (shape.startsWith("triple")) {
            shape = shape.substring("triple".length());
        }
        shape = shape.trim();
        if (shape.equals("plaintext") || shape.equals("none")) {
            return "none";
        }
        if (RECT_SHAPES.contains(shape)) {
            return "rect";
        }
        return shape.equals("mdiamond") ? "diamond" : shape;
    }

    /** First letter of a compass point as a side name, {@code east} when unrecognised. */
    static String compassToSide(String compass) {
        String c = compass.trim().toLowerCase(Locale.ROOT);
        if (c.startsWith("n")) {
            return "north";
        }
        if (c.startsWith("s")) {
            return "south";
        }
        if (c.startsWith("w")) {
            return "west";
        }
        return "east";
    }

    static boolean isCompassPoint(String port) {
        return COMPASS_POINTS.contains(port.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Buckets a {@code setlinewidth(N)} style token: below 3 {@code solid}, below 5 {@code bold},
     * below 11 {@code broad}, else {@code wide}. Returns {@code null} when {@code token} carries no width.
     */
    static String lineWidthBucket(String token) {
        Matcher m = LINE_WIDTH.matcher(token);
        if (!m.find()) {
            return null;
        }
        double width = Math.abs(Double.parseDouble(m.group(1)));
        if (width < 3) {
            return "solid";
        }
        if (width < 5) {
            return "bold";
        }
        return width < 11 ? "broad" : "wide";
    }

    static String fontSize(String raw) {
        String size = raw.trim();
        return NUMBER.matcher(size).matches() ? size + "px" : size;
    }

    static String color(String value) {
        String v = value.trim();
        if (v.startsWith("//")) {
            v = v.substring(2);
        }
        Matcher scheme = SCHEME_COLOR.matcher(v);
        if (scheme.matches()) {
            String name = scheme.group(1).toLowerCase(Locale.ROOT);
            String rest = scheme.group(2);
            if (name.equals("x11")) {
                return rest;
            }
            if (name.equals("accent4") && rest.trim().matches("[1-4]")) {
                return ACCENT4.get(Integer.parseInt(rest.trim()) - 1);
            }
        }
        Matcher comma = HSV_COMMA.matcher(v);
        if (comma.matches()) {
            return "hsv(" + comma.group(1) + "," + comma.group(2) + "," + comma.group(3) + ")";
        }
        Matcher space = HSV_SPACE.matcher(v);
        if (space.matches()) {
            return hsvToHex(
                    Double.parseDouble(space.group(1)),
                    Double.parseDouble(space.group(2)),
                    Double.parseDouble(space.group(3)));
        }
        if (v.startsWith("#")) {
            return "#" + v.substring(1).replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
        }
        return v;
    }

    /** Converts HSV components in the unit range to {@code #rrggbb}. */
    static String hsvToHex(double h0, double s0, double v0) {
        double h = ((h0 % 1) + 1) % 1;
        double s = Math.max(0, Math.min(1, s0));
        double v = Math.max(0, Math.min(1, v0));
        int sector = (int) Math.floor(h * 6);
        double f = h * 6 - sector;
        double p = v * (1 - s);
        double q = v * (1 - f * s);
        double t = v * (1 - (1 - f) * s);
        double[] rgb = switch (sector % 6) {
            case 0 -> new double[] {v, t, p};
            case 1 -> new double[] {q, v, p};
            case 2 -> new double[] {p, v, t};
            case 3 -> new double[] {p, q, v};
            case 4 -> new double[] {t, p, v};
            default -> new double[] {v, p, q};
        };
        StringBuilder out = new StringBuilder("#");
        for (double component : rgb) {
            int scaled = (int) Math.max(0, Math.min(255, Math.round(component * 255)));
            out.append(String.format(Locale.ROOT, "%02x", scaled));
        }
        return out.toString();
    }

    /** Unwraps an HTML-like {@code <...>} id into plain text unless it is a record label. */
    static String htmlToText(String value) {
        String trimmed = value.trim();
        if (trimmed.contains("|") || trimmed.length() < 2 || !trimmed.startsWith("<") || !trimmed.endsWith(">")) {
            return value;
        }
        // inner whitespace is kept: "< ] >" reads as " ] "
        String inner = trimmed.substring(1, trimmed.length() - 1);
        return inner.isEmpty() ? " " : inner;
    }
}
