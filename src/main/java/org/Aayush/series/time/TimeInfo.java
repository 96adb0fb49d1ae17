package org.Aayush.series.time;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.Aayush.core.time.TimeUtils;

/**
 * Immutable time description reported by one input.
 *
 * <p>Contract:</p>
 * <ul>
 * <li>{@code start} and {@code end} are finite and {@code start <= end}.</li>
 * <li>Discrete steps are optional; when present they are non-decreasing.</li>
 * <li>Steps are not required to lie inside {@code [start, end]}; readers that report both
 * are trusted verbatim.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode
public final class TimeInfo {
    /** Inclusive start of the supported interval. */
    private final double start;
    /** Inclusive end of the supported interval. */
    private final double end;
    /** Discrete steps, empty when the input only reports a range. */
    private final DoubleList steps;

    private TimeInfo(double start, double end, double[] steps) {
        this.start = TimeUtils.requireFinite(start, "start");
        this.end = TimeUtils.requireFinite(end, "end");
        if (start > end) {
            throw new IllegalArgumentException("start must be <= end, got [" + start + ", " + end + "]");
        }
        if (steps == null) {
            this.steps = DoubleLists.emptyList();
        } else {
            if (!TimeUtils.isNonDecreasing(steps)) {
                throw new IllegalArgumentException("time steps must be non-decreasing");
            }
            for (double step : steps) {
                TimeUtils.requireFinite(step, "step");
            }
            this.steps = DoubleLists.unmodifiable(new DoubleArrayList(steps));
        }
    }

    /**
     * Creates a range-only time description.
     *
     * @param start inclusive range start.
     * @param end inclusive range end.
     * @return immutable time info without discrete steps.
     */
    public static TimeInfo ofRange(double start, double end) {
        return new TimeInfo(start, end, null);
    }

    /**
     * Creates a time description from discrete steps, deriving range as {@code [first, last]}.
     *
     * @param steps non-empty non-decreasing steps.
     * @return immutable time info.
     */
    public static TimeInfo ofSteps(double... steps) {
        if (steps == null || steps.length == 0) {
            throw new IllegalArgumentException("steps must be non-empty");
        }
        return new TimeInfo(steps[0], steps[steps.length - 1], steps.clone());
    }

    /**
     * Creates a time description with both an explicit range and discrete steps.
     *
     * @param start inclusive range start.
     * @param end inclusive range end.
     * @param steps non-decreasing steps (nullable for range-only).
     * @return immutable time info.
     */
    public static TimeInfo of(double start, double end, double[] steps) {
        return new TimeInfo(start, end, steps == null ? null : steps.clone());
    }

    /**
     * Returns whether discrete steps were reported.
     */
    public boolean hasSteps() {
        return !steps.isEmpty();
    }

    /**
     * Returns range as a fresh two-element array.
     */
    public double[] range() {
        return new double[]{start, end};
    }
}
