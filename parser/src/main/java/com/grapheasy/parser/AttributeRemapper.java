package com.grapheasy.parser;

import com.grapheasy.graph.Attributes;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Table-driven translation of foreign attribute vocabularies. Each known key maps to a rule that
 * writes zero or more native attributes; unknown keys are kept under a vendor prefix so nothing is
 * dropped.
 */
public final class AttributeRemapper {

    /** Writes the native attributes for one foreign value. */
    @FunctionalInterface
    public interface Rule {
        void apply(String value, Attributes out);
    }

    private final String vendorPrefix;
    private final Map<String, Rule> rules;

    private AttributeRemapper(String vendorPrefix, Map<String, Rule> rules) {
        this.vendorPrefix = vendorPrefix;
        this.rules = Map.copyOf(rules);
    }

    public static Builder builder(String vendorPrefix) {
        return new Builder(vendorPrefix);
    }

    /** Remaps every entry of {@code foreign}, in order. */
    public Attributes remap(Attributes foreign) {
        Attributes out = new Attributes();
        for (Map.Entry<String, String> entry : foreign) {
            remap(entry.getKey(), entry.getValue(), out);
        }
        return out;
    }

    public void remap(String key, String value, Attributes out) {
        Rule rule = rules.get(key);
        if (rule == null) {
            out.set(vendorPrefix + key, value);
        } else {
            rule.apply(value, out);
        }
    }

    public static final class Builder {
        private final String vendorPrefix;
        private final Map<String, Rule> rules = new HashMap<>();

        private Builder(String vendorPrefix) {
            this.vendorPrefix = Objects.requireNonNull(vendorPrefix, "vendorPrefix");
        }

        public Builder map(String key, Rule rule) {
            rules.put(key, rule);
            return this;
        }

        /** Copies the value unchanged under {@code nativeKey}. */
        public Builder rename(String key, String nativeKey) {
            return map(key, (value, out) -> out.set(nativeKey, value));
        }

        public Builder passThrough(String... keys) {
            for (String key : keys) {
                rename(key, key);
            }
            return this;
        }

        public Builder ignore(String key) {
            return map(key, (value, out) -> {});
        }

        public AttributeRemapper build() {
            return new AttributeRemapper(vendorPrefix, rules);
        }
    }
}
