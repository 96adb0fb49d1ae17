package org.Aayush.series.input;

import java.util.List;

/**
 * Produces the ordered source identifiers listed by one manifest.
 */
@FunctionalInterface
public interface SourceListProvider {

    /**
     * Reads at most {@code maxSources} source identifiers from a manifest.
     *
     * @param manifest manifest identifier.
     * @param maxSources upper bound on returned identifiers.
     * @return ordered source identifiers.
     * @throws org.Aayush.series.controller.SeriesException with {@code FS_METAFILE_UNREADABLE}
     * when the manifest cannot be retrieved.
     */
    List<String> sources(String manifest, int maxSources);

    /**
     * Reads every source identifier from a manifest.
     */
    default List<String> sources(String manifest) {
        return sources(manifest, Integer.MAX_VALUE);
    }
}
