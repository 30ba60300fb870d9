package com.grapheasy.parser.dot;

import com.grapheasy.parser.Autosplit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A DOT record label with its {@code <port>} tags pulled out of the displayed text. */
record RecordLabel(String displayLabel, List<String> ports) {
    private static final Pattern WRAPPED = Pattern.compile("^\\s*\\{[^{}]+\\}\\s*$");
    private static final Pattern PORT_TAG = Pattern.compile("^\\s*<([^>]*)>");
    private static final Pattern PORT_TAGS = Pattern.compile("(^|\\|)\\s*<[^>]*>");
    private static final Pattern SPACE_FIELD = Pattern.compile("\\|\\s\\|");

    RecordLabel {
        ports = Collections.unmodifiableList(new ArrayList<>(ports));
    }

    /**
     * Parses {@code raw} for a graph flowing in {@code flow}. A lone {@code {A|B}} wrapper is removed
     * and its separators biased so no field collapses to zero width.
     */
    static RecordLabel parse(String raw, String flow) {
        String label = raw;
        if (WRAPPED.matcher(label).matches()) {
            label = label.replace("{", "").replace("}", "");
            if (flow.equals("east") || flow.equals("west")) {
                label = label.replace("|", "||  ");
            } else if (flow.equals("north") || flow.equals("south")) {
                label = label.replace("||", "|  |");
            }
        }

        List<String> ports = new ArrayList<>();
        for (Autosplit.Field field : Autosplit.fields(label)) {
            Matcher m = PORT_TAG.matcher(field.raw());
            ports.add(m.find() ? m.group(1) : null);
        }

        String display = PORT_TAGS.matcher(label).replaceAll("$1");
        // overlapping "| | |" needs a second pass
        display = SPACE_FIELD.matcher(display).replaceAll("|  |");
        display = SPACE_FIELD.matcher(display).replaceAll("|  |");
        return new RecordLabel(display, ports);
    }

    /** Index of the field whose explicit port equals {@code port}, or -1. */
    int indexOfPort(String port) {
        return ports.indexOf(port);
    }

    int indexOfPortIgnoreCase(String port) {
        for (int i = 0; i < ports.size(); i++) {
            if (ports.get(i) != null && ports.get(i).equalsIgnoreCase(port)) {
                return i;
            }
        }
        return -1;
    }
}
