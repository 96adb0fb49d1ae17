package org.Aayush.series.resolve;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import org.Aayush.core.time.TimeUtils;
import org.Aayush.series.controller.SeriesController;
import org.Aayush.series.controller.SeriesException;
import org.Aayush.series.registry.RegistryEntry;
import org.Aayush.series.registry.TimeRangeRegistry;
import org.Aayush.series.time.TimeInfo;

import java.util.Objects;

/**
 * Read-only time-to-input resolution over the latest registry build.
 *
 * <p>Ownership contract: an input owns every time from its own start (inclusive) up to the
 * next input's start (exclusive). The earliest input also owns everything before its start,
 * and the latest input owns everything after its end.</p>
 */
public final class TimeIndexResolver {
    private final TimeRangeRegistry registry;

    /**
     * Creates a resolver bound to one registry.
     *
     * @param registry registry queried on every call.
     */
    public TimeIndexResolver(TimeRangeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Maps one requested time to the input that owns it.
     *
     * @param time requested time value.
     * @return owning input index; {@code 0} when the registry is empty.
     * @throws SeriesException with {@code FS_INVALID_TIME} for {@code NaN}.
     */
    public int indexForTime(double time) {
        requireComparable(time);
        if (registry.isEmpty()) {
            // Already reported as a missing-time warning by the aggregator.
            return 0;
        }
        RegistryEntry owner = registry.floorEntry(time);
        if (owner == null) {
            // Before every known start: clamp to the earliest input.
            owner = registry.firstEntry();
        }
        return owner.index();
    }

    /**
     * Resolves every requested time and collects the distinct owners.
     *
     * @param requestedTimes requested times; {@code null} or empty targets input {@code 0}.
     * @return ascending distinct input indices.
     */
    public InputSelection chooseInputs(DoubleList requestedTimes) {
        IntRBTreeSet indices = new IntRBTreeSet();
        if (requestedTimes == null || requestedTimes.isEmpty()) {
            indices.add(0);
        } else {
            for (int i = 0; i < requestedTimes.size(); i++) {
                indices.add(indexForTime(requestedTimes.getDouble(i)));
            }
        }
        return new InputSelection(indices);
    }

    /**
     * Returns the requested times one input is responsible for, clamped into its range.
     *
     * @param index input index.
     * @param requestedTimes requested times, in request order.
     * @return owned times clamped into the input's {@code [start, end]}, in request order.
     * @throws SeriesException with {@code FS_UNKNOWN_INPUT} when the input is not registered.
     */
    public DoubleList timesForInput(int index, DoubleList requestedTimes) {
        TimeInfo supported = registry.timeInfo(index);
        if (supported == null) {
            throw new SeriesException(
                    SeriesController.REASON_UNKNOWN_INPUT,
                    "input " + index + " has no registered time information"
            );
        }

        double allowedLower = registry.isEarliestStart(supported.start())
                ? Double.NEGATIVE_INFINITY
                : supported.start();
        double allowedUpper = registry.nextStartAfter(supported.start());

        DoubleArrayList times = new DoubleArrayList();
        if (requestedTimes == null) {
            return times;
        }
        for (int i = 0; i < requestedTimes.size(); i++) {
            double time = requestedTimes.getDouble(i);
            if (time >= allowedLower && time < allowedUpper) {
                // Clamp in case the reader clips on its own supported range.
                times.add(TimeUtils.clamp(time, supported.start(), supported.end()));
            }
        }
        return times;
    }

    private static void requireComparable(double time) {
        if (Double.isNaN(time)) {
            throw new SeriesException(SeriesController.REASON_INVALID_TIME, "requested time must not be NaN");
        }
    }
}
