package org.Aayush.series.aggregate;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.Aayush.core.time.TimeUtils;

/**
 * Immutable global timeline merged from every registered input.
 *
 * <p>Only {@link Status#TEMPORAL} timelines carry a range. Steps are optional even then:
 * a series of range-only inputs has a global range but no discrete steps.</p>
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class AggregateTimeline {

    /**
     * Outcome of one aggregation pass.
     */
    public enum Status {
        /** Global range advances time; range (and optionally steps) are published. */
        TEMPORAL,
        /** Global start {@code >=} global end; dataset is presented as non-temporal. */
        SINGLE_POINT,
        /** No input contributed time information. */
        NO_TIME_INPUTS
    }

    private static final AggregateTimeline SINGLE_POINT =
            new AggregateTimeline(Status.SINGLE_POINT, Double.NaN, Double.NaN, DoubleLists.emptyList());
    private static final AggregateTimeline NO_TIME_INPUTS =
            new AggregateTimeline(Status.NO_TIME_INPUTS, Double.NaN, Double.NaN, DoubleLists.emptyList());

    /** Aggregation outcome. */
    private final Status status;
    /** Global start; NaN unless {@link Status#TEMPORAL}. */
    private final double start;
    /** Global end; NaN unless {@link Status#TEMPORAL}. */
    private final double end;
    /** Deduplicated ascending global steps; empty when none. */
    private final DoubleList steps;

    /**
     * Creates a temporal timeline.
     *
     * @param start global start.
     * @param end global end (must be greater than start).
     * @param steps global steps in ascending order.
     * @return immutable timeline.
     */
    public static AggregateTimeline temporal(double start, double end, DoubleList steps) {
        if (!TimeUtils.advances(start, end)) {
            throw new IllegalArgumentException("temporal timeline requires start < end");
        }
        return new AggregateTimeline(
                Status.TEMPORAL,
                start,
                end,
                DoubleLists.unmodifiable(new DoubleArrayList(steps))
        );
    }

    /**
     * Returns the suppressed single-point timeline.
     */
    public static AggregateTimeline singlePoint() {
        return SINGLE_POINT;
    }

    /**
     * Returns the suppressed timeline for a registry without time information.
     */
    public static AggregateTimeline noTimeInputs() {
        return NO_TIME_INPUTS;
    }

    /**
     * Returns whether a range is published.
     */
    public boolean temporal() {
        return status == Status.TEMPORAL;
    }

    /**
     * Returns whether discrete steps are published.
     */
    public boolean hasSteps() {
        return !steps.isEmpty();
    }

    /**
     * Returns range as a fresh two-element array, or {@code null} when suppressed.
     */
    public double[] range() {
        return temporal() ? new double[]{start, end} : null;
    }
}
