package org.Aayush.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Main Smoke-Run Tests")
class MainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(
                args,
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8)
        );
    }

    private Path metafile(String content) throws IOException {
        Path metafile = tempDir.resolve("series.txt");
        Files.writeString(metafile, content, StandardCharsets.UTF_8);
        return metafile;
    }

    @Test
    @DisplayName("Files without intrinsic time form an ordinal timeline")
    void testOrdinalTimeline() throws IOException {
        Path metafile = metafile("f0.dat f1.dat\nf2.dat\n");

        int exitCode = run(metafile.toString(), "1.0", "7.5");

        String output = outBuffer.toString(StandardCharsets.UTF_8);
        assertEquals(0, exitCode);
        assertTrue(output.contains("inputs=3"));
        assertTrue(output.contains("range=[0.0, 2.0]"));
        assertTrue(output.contains("steps=[0.0, 1.0, 2.0]"));
        assertTrue(output.contains("1.0 -> 1 " + tempDir.resolve("f1.dat")));
        assertTrue(output.contains("7.5 -> 2 " + tempDir.resolve("f2.dat")));
    }

    @Test
    @DisplayName("Single file reports a non-temporal timeline")
    void testSingleFile() throws IOException {
        Path metafile = metafile("only.dat");

        int exitCode = run(metafile.toString());

        assertEquals(0, exitCode);
        assertTrue(outBuffer.toString(StandardCharsets.UTF_8).contains("timeline=SINGLE_POINT"));
    }

    @Test
    @DisplayName("Missing arguments print usage")
    void testUsage() {
        assertEquals(2, run());
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).startsWith("usage:"));
    }

    @Test
    @DisplayName("Unreadable metafile fails with reason code")
    void testMissingMetafile() {
        int exitCode = run(tempDir.resolve("missing.txt").toString());

        assertEquals(1, exitCode);
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).contains("FS_METAFILE_UNREADABLE"));
    }

    @Test
    @DisplayName("Empty metafile fails with no inputs")
    void testEmptyMetafile() throws IOException {
        Path metafile = metafile("   \n");

        assertEquals(1, run(metafile.toString()));
        assertTrue(errBuffer.toString(StandardCharsets.UTF_8).contains("FS_NO_INPUTS"));
    }

    @Test
    @DisplayName("Non-numeric time argument fails")
    void testBadTimeArgument() throws IOException {
        Path metafile = metafile("a.dat b.dat");

        assertEquals(1, run(metafile.toString(), "soon"));
    }
}
