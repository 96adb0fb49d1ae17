package org.Aayush.series.input;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.series.controller.SeriesController;
import org.Aayush.series.controller.SeriesException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads source names from a plain-text metafile.
 *
 * <p>Format: whitespace-separated tokens, one source name per token. Relative names are
 * prefixed with the metafile's directory. A name is absolute when it starts with {@code /}
 * or its second character is {@code :} (drive letter).</p>
 */
public final class MetaFileSourceListProvider implements SourceListProvider {

    @Override
    public List<String> sources(String manifest, int maxSources) {
        Objects.requireNonNull(manifest, "manifest");
        if (maxSources < 0) {
            throw new IllegalArgumentException("maxSources must be >= 0");
        }

        String content;
        try {
            content = Files.readString(Path.of(manifest), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException ex) {
            throw new SeriesException(
                    SeriesController.REASON_METAFILE_UNREADABLE,
                    "Could not open metafile " + manifest,
                    ex
            );
        }

        String directory = directoryPrefix(manifest);
        ObjectArrayList<String> sources = new ObjectArrayList<>();
        for (String token : content.split("\\s+")) {
            if (sources.size() >= maxSources) {
                break;
            }
            if (token.isEmpty()) {
                continue;
            }
            sources.add(isAbsolute(token) ? token : directory + token);
        }
        return sources;
    }

    static String directoryPrefix(String manifest) {
        int separator = Math.max(manifest.lastIndexOf('/'), manifest.lastIndexOf('\\'));
        return separator < 0 ? "" : manifest.substring(0, separator + 1);
    }

    static boolean isAbsolute(String name) {
        return name.charAt(0) == '/' || (name.length() >= 2 && name.charAt(1) == ':');
    }
}
