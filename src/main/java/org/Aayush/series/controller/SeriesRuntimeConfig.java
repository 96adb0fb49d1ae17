package org.Aayush.series.controller;

import lombok.Builder;
import lombok.Value;
import org.Aayush.series.registry.DuplicateStartPolicy;

/**
 * Runtime configuration bound once when a {@link SeriesController} is built.
 */
@Value
@Builder
public class SeriesRuntimeConfig {

    /**
     * When true, reader-reported time is ignored and every input is given its ordinal index
     * as its only time value.
     */
    boolean ignoreReaderTime;

    /**
     * Behavior when two inputs report the same range start.
     */
    @Builder.Default
    DuplicateStartPolicy duplicateStartPolicy = DuplicateStartPolicy.REPLACE;

    /**
     * When true, the source list is read from {@code metaFileName} before each describe
     * (re-read only when the name changed or a reload was requested).
     */
    boolean useMetaFile;

    /**
     * Metafile listing the series sources; required when {@code useMetaFile} is set.
     */
    String metaFileName;

    /**
     * Returns default configuration: reader time honored, duplicate starts replaced.
     */
    public static SeriesRuntimeConfig defaults() {
        return SeriesRuntimeConfig.builder().build();
    }

    /**
     * Returns configuration that synthesizes one ordinal time value per input.
     */
    public static SeriesRuntimeConfig ignoringReaderTime() {
        return SeriesRuntimeConfig.builder()
                .ignoreReaderTime(true)
                .build();
    }

    /**
     * Returns configuration that reads the source list from a metafile.
     *
     * @param metaFileName metafile path.
     */
    public static SeriesRuntimeConfig metaFile(String metaFileName) {
        return SeriesRuntimeConfig.builder()
                .useMetaFile(true)
                .metaFileName(metaFileName)
                .build();
    }
}
