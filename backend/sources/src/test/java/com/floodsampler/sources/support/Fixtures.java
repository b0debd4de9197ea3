package com.floodsampler.sources.support;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public final class Fixtures {
    private Fixtures() {
    }

    public static String read(String relativePath) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(relativePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + relativePath);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read fixture: " + relativePath, e);
        }
    }
}
