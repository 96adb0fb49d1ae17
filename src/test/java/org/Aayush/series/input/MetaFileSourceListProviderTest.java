package org.Aayush.series.input;

import org.Aayush.series.controller.SeriesController;
import org.Aayush.series.controller.SeriesException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MetaFileSourceListProvider Tests")
class MetaFileSourceListProviderTest {
    private final MetaFileSourceListProvider provider = new MetaFileSourceListProvider();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Relative names resolve against the metafile directory")
    void testRelativeNamesResolved() throws IOException {
        Path metafile = write("series.txt", "a.vtk\n  b.vtk\tc.vtk\n\n");
        String prefix = metafile.toString().substring(0, metafile.toString().lastIndexOf(metafile.getFileName().toString()));

        List<String> sources = provider.sources(metafile.toString());

        assertEquals(List.of(prefix + "a.vtk", prefix + "b.vtk", prefix + "c.vtk"), sources);
    }

    @Test
    @DisplayName("Absolute and drive-letter names are kept verbatim")
    void testAbsoluteNamesKept() throws IOException {
        Path metafile = write("series.txt", "/data/a.vtk C:\\data\\b.vtk");

        assertEquals(List.of("/data/a.vtk", "C:\\data\\b.vtk"), provider.sources(metafile.toString()));
    }

    @Test
    @DisplayName("At most maxSources names are returned")
    void testMaxSources() throws IOException {
        Path metafile = write("series.txt", "/a /b /c");

        assertEquals(List.of("/a"), provider.sources(metafile.toString(), 1));
        assertTrue(provider.sources(metafile.toString(), 0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> provider.sources(metafile.toString(), -1));
    }

    @Test
    @DisplayName("Empty metafile yields no sources")
    void testEmptyMetafile() throws IOException {
        Path metafile = write("empty.txt", "   \n");

        assertTrue(provider.sources(metafile.toString()).isEmpty());
    }

    @Test
    @DisplayName("Missing metafile fails with reason code")
    void testMissingMetafile() {
        SeriesException ex = assertThrows(
                SeriesException.class,
                () -> provider.sources(tempDir.resolve("missing.txt").toString())
        );
        assertEquals(SeriesController.REASON_METAFILE_UNREADABLE, ex.reasonCode());
    }

    @Test
    @DisplayName("Directory prefix handles both separator styles")
    void testDirectoryPrefix() {
        assertEquals("/data/", MetaFileSourceListProvider.directoryPrefix("/data/list.txt"));
        assertEquals("C:\\data\\", MetaFileSourceListProvider.directoryPrefix("C:\\data\\list.txt"));
        assertEquals("", MetaFileSourceListProvider.directoryPrefix("list.txt"));
        assertTrue(MetaFileSourceListProvider.isAbsolute("/x"));
        assertTrue(MetaFileSourceListProvider.isAbsolute("D:x"));
        assertFalse(MetaFileSourceListProvider.isAbsolute("x"));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
