package org.Aayush.series.registry;

import lombok.Value;
import lombok.experimental.Accessors;
import org.Aayush.series.time.TimeInfo;

/**
 * Immutable pairing of one input index with its registered time info.
 */
@Value
@Accessors(fluent = true)
public class RegistryEntry {
    /** Ordinal input index. */
    int index;
    /** Time info reported (or synthesized) for the input. */
    TimeInfo timeInfo;

    /**
     * Returns registered range start, the by-start ordering key.
     */
    public double start() {
        return timeInfo.start();
    }

    /**
     * Returns registered range end.
     */
    public double end() {
        return timeInfo.end();
    }
}
