package org.Aayush.series.testutil;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import org.Aayush.series.registry.TimeRangeRegistry;
import org.Aayush.series.time.TimeInfo;

/**
 * Shared registry layouts for aggregation and resolution tests.
 */
public final class SeriesFixtures {

    private SeriesFixtures() {
    }

    /**
     * Two disjoint inputs: {@code [0,1]} with steps {@code 0,0.5,1} and {@code [2,3]} with
     * steps {@code 2,2.5,3}.
     */
    public static TimeRangeRegistry twoDisjointInputs() {
        TimeRangeRegistry registry = new TimeRangeRegistry();
        registry.register(0, TimeInfo.of(0.0d, 1.0d, new double[]{0.0d, 0.5d, 1.0d}));
        registry.register(1, TimeInfo.of(2.0d, 3.0d, new double[]{2.0d, 2.5d, 3.0d}));
        return registry;
    }

    public static DoubleList times(double... values) {
        return DoubleArrayList.wrap(values.clone());
    }
}
