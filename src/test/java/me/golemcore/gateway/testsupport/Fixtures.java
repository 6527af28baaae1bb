package me.golemcore.gateway.testsupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads captured wire transcripts from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String read(String name) {
        try (InputStream is = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (is == null) {
                throw new IllegalArgumentException("Missing fixture: " + name);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<String> lines(String name) {
        return read(name).lines().toList();
    }
}
