package com.grapheasy.graph;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Insertion-ordered string attribute map. Renderers downstream are order sensitive, so keys keep the
 * position of their first assignment even when the value is later replaced.
 */
public final class Attributes implements Iterable<Map.Entry<String, String>> {
    private final Map<String, String> values = new LinkedHashMap<>();

    public Attributes() {}

    public static Attributes of(String... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs, got " + keysAndValues.length + " strings");
        }
        Attributes attributes = new Attributes();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            attributes.set(keysAndValues[i], keysAndValues[i + 1]);
        }
        return attributes;
    }

    /** Returns the value for {@code key}, or {@code null} when absent. */
    public String get(String key) {
        return values.get(key);
    }

    public String getOrEmpty(String key) {
        return values.getOrDefault(key, "");
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public void set(String key, String value) {
        values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    /** Copies every entry of {@code incoming}, replacing existing values. */
    public void merge(Attributes incoming) {
        if (incoming != null) {
            incoming.values.forEach(this::set);
        }
    }

    /** Copies only the entries of {@code defaults} whose key is not yet present. */
    public void inherit(Attributes defaults) {
        if (defaults != null) {
            defaults.values.forEach(values::putIfAbsent);
        }
    }

    public String remove(String key) {
        return values.remove(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public Attributes copy() {
        Attributes copy = new Attributes();
        copy.values.putAll(values);
        return copy;
    }

    @Override
    public Iterator<Map.Entry<String, String>> iterator() {
        return asMap().entrySet().iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Attributes)) {
            return false;
        }
        return values.equals(((Attributes) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
