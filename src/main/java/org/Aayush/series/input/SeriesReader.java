package org.Aayush.series.input;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.Aayush.series.time.TimeSlot;

/**
 * Capability contract implemented by the external component that actually reads one source.
 *
 * <p>The series controller points the reader at one source with {@link #open(String)},
 * then either asks it to report time metadata or to produce data. Implementations may read
 * and even modify the visible slot passed to {@link #produce(TimeSlot, DoubleList)}.</p>
 *
 * @param <D> produced data type.
 */
public interface SeriesReader<D> {

    /**
     * Points the reader at one source. Called before every probe of a different source.
     *
     * @param source source identifier from the {@link InputEnumerator}.
     */
    void open(String source);

    /**
     * Reports the supported time range and/or discrete steps of the current source.
     *
     * <p>Reporting nothing means the source has no intrinsic notion of time.</p>
     *
     * @param slot cleared slot to write into.
     */
    void reportTime(TimeSlot slot);

    /**
     * Produces data for the current source.
     *
     * @param slot slot holding the current source's local time info.
     * @param times requested times already clamped to the source's range; may be empty.
     * @return produced data.
     */
    D produce(TimeSlot slot, DoubleList times);

    /**
     * Returns whether this reader can read one source at all.
     *
     * @param source source identifier.
     */
    boolean canRead(String source);
}
