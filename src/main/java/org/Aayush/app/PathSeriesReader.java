package org.Aayush.app;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.Aayush.series.input.SeriesReader;
import org.Aayush.series.time.TimeSlot;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Reader for plain files that carry no intrinsic time; produces the resolved file path.
 */
final class PathSeriesReader implements SeriesReader<Path> {
    private Path current;

    @Override
    public void open(String source) {
        current = Path.of(source);
    }

    @Override
    public void reportTime(TimeSlot slot) {
        // Plain files carry no time; the series falls back to ordinal time.
    }

    @Override
    public Path produce(TimeSlot slot, DoubleList times) {
        return current;
    }

    @Override
    public boolean canRead(String source) {
        try {
            return Files.isReadable(Path.of(source));
        } catch (InvalidPathException ex) {
            return false;
        }
    }
}
