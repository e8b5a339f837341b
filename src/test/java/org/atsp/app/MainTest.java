package org.atsp.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Command Line Tests")
class MainTest {

    private static final String TRIANGLE = String.join("\n",
            "NAME: triangle",
            "DIMENSION: 3",
            "EDGE_WEIGHT_SECTION",
            "0 1 5",
            "5 0 1",
            "1 5 0",
            "EOF",
            "");

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String input, String... args) {
        InputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        return Main.run(
                args,
                in,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8)
        );
    }

    private String[] outputLines() {
        return out.toString(StandardCharsets.UTF_8).split("\\R");
    }

    @Test
    @DisplayName("Reads standard input and prints the tour")
    void testStdin() {
        assertEquals(Main.EXIT_OK, run(TRIANGLE));
        assertArrayEquals(
                new String[]{"The shortest path is:", "0->1->2->0", " with a total distance of 3."},
                outputLines()
        );
    }

    @Test
    @DisplayName("Reads a matrix file with the shift engine")
    void testFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("triangle.atsp");
        Files.writeString(file, TRIANGLE, StandardCharsets.UTF_8);
        assertEquals(Main.EXIT_OK, run("", file.toString(), "shift"));
        assertEquals("0->1->2->0", outputLines()[1]);
    }

    @Test
    @DisplayName("Every engine keeps an already optimal tour")
    @Timeout(30)
    void testEngines() {
        for (String engine : new String[]{"3opt", "shift", "aco"}) {
            out.reset();
            assertEquals(Main.EXIT_OK, run(TRIANGLE, "-", engine), engine);
            assertEquals(" with a total distance of 3.", outputLines()[2], engine);
        }
    }

    @Test
    @DisplayName("Usage errors exit with 2")
    void testUsage() {
        assertEquals(Main.EXIT_USAGE, run(TRIANGLE, "-", "2opt"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("unknown engine: 2opt"));
        assertEquals(Main.EXIT_USAGE, run(TRIANGLE, "-", "3opt", "extra"));
        assertEquals(0, out.size());
    }

    @Test
    @DisplayName("Unreadable matrices exit with 3")
    void testBadInput(@TempDir Path dir) {
        assertEquals(Main.EXIT_INPUT, run("DIMENSION: 2\nEDGE_WEIGHT_SECTION\n0 1 x 0\n"));
        assertEquals(Main.EXIT_INPUT, run("", dir.resolve("missing.atsp").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("cannot read distance matrix"));
    }

    @Test
    @DisplayName("Integral lengths print without a fraction")
    void testFormatLength() {
        assertEquals("14", Main.formatLength(14.0d));
        assertEquals("6.5", Main.formatLength(6.5d));
        assertEquals("0", Main.formatLength(0.0d));
    }
}
