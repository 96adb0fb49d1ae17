package org.Aayush.core.time;

import it.unimi.dsi.fastutil.doubles.DoubleArrays;

/**
 * Shared deterministic helpers for time values expressed as {@code double} coordinates.
 *
 * <p>Time values are opaque to this engine: they may be seconds, simulation cycles, or
 * plain ordinals. Only ordering and finiteness matter.</p>
 */
public final class TimeUtils {

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Clamps one time value into a closed interval.
     *
     * @param time time value to clamp.
     * @param lower inclusive lower bound.
     * @param upper inclusive upper bound.
     * @return {@code time} limited to {@code [lower, upper]}.
     */
    public static double clamp(double time, double lower, double upper) {
        return Math.max(lower, Math.min(upper, time));
    }

    /**
     * Validates monotonic ordering: time steps must be non-decreasing.
     *
     * @param timeSteps time steps to validate.
     * @return {@code true} when ordering is preserved; otherwise {@code false}.
     */
    public static boolean isNonDecreasing(double[] timeSteps) {
        if (timeSteps == null || timeSteps.length < 2) {
            return true;
        }

        for (int i = 1; i < timeSteps.length; i++) {
            if (timeSteps[i] < timeSteps[i - 1]) {
                return false;
            }
        }

        return true;
    }

    /**
     * Returns a sorted copy of the provided time steps.
     *
     * @param timeSteps source time steps (not modified).
     * @return ascending copy.
     */
    public static double[] sortedCopy(double[] timeSteps) {
        double[] copy = timeSteps.clone();
        DoubleArrays.quickSort(copy);
        return copy;
    }

    /**
     * Validates that a time coordinate is finite.
     *
     * @param time time value.
     * @param fieldName field name used in the failure message.
     * @return the validated value.
     */
    public static double requireFinite(double time, String fieldName) {
        if (!Double.isFinite(time)) {
            throw new IllegalArgumentException(fieldName + " must be finite, got " + time);
        }
        return time;
    }

    /**
     * Returns whether the closed interval {@code [start, end]} advances time.
     *
     * @param start interval start.
     * @param end interval end.
     * @return {@code true} when {@code start < end}.
     */
    public static boolean advances(double start, double end) {
        return start < end;
    }
}
