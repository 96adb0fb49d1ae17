package org.Aayush.series.controller;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import lombok.Value;

/**
 * Output of one {@link SeriesController#fetch(DoubleList)} call.
 *
 * @param <D> produced data type.
 */
@Value
public class FetchResult<D> {
    /** Input that produced the data. */
    int index;
    /** Source identifier of that input. */
    String source;
    /** Requested times owned by the input, clamped into its range. */
    DoubleList times;
    /** Data returned by the reader. */
    D data;
}
