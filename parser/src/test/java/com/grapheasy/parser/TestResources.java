package com.grapheasy.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads text fixtures from {@code src/test/resources/fixtures}. */
public final class TestResources {
    private TestResources() {}

    public static String fixture(String name) {
        String path = "/fixtures/" + name;
        try (InputStream in = TestResources.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test fixture " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read test fixture " + path, ex);
        }
    }
}
