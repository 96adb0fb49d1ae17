package org.Aayush.series.time;

import org.Aayush.series.aggregate.AggregateTimeline;

import java.util.Arrays;

/**
 * Mutable time-metadata slot shared between the series controller and an external reader.
 *
 * <p>Readers write what they support into the slot while probing; the controller publishes
 * either one input's local time info or the aggregate timeline into it. Range and steps are
 * independently optional. Arrays are copied on the way in and on the way out.</p>
 */
public final class TimeSlot {
    private double[] range;
    private double[] steps;

    /**
     * Removes both range and steps.
     */
    public void clear() {
        range = null;
        steps = null;
    }

    /**
     * Sets the reported range.
     *
     * @param start inclusive start.
     * @param end inclusive end.
     */
    public void setRange(double start, double end) {
        range = new double[]{start, end};
    }

    /**
     * Sets the reported discrete steps.
     *
     * @param values discrete steps; {@code null} or empty removes them.
     */
    public void setSteps(double... values) {
        steps = values == null || values.length == 0 ? null : values.clone();
    }

    /**
     * Removes only the range.
     */
    public void removeRange() {
        range = null;
    }

    /**
     * Removes only the steps.
     */
    public void removeSteps() {
        steps = null;
    }

    public boolean hasRange() {
        return range != null;
    }

    public boolean hasSteps() {
        return steps != null;
    }

    /**
     * Returns whether the slot carries any time information.
     */
    public boolean hasTime() {
        return hasRange() || hasSteps();
    }

    /**
     * Returns a copy of the range, or {@code null} when absent.
     */
    public double[] range() {
        return range == null ? null : range.clone();
    }

    /**
     * Returns a copy of the steps, or {@code null} when absent.
     */
    public double[] steps() {
        return steps == null ? null : steps.clone();
    }

    /**
     * Replaces slot content with one input's local time info.
     *
     * @param timeInfo local time info; {@code null} clears the slot.
     */
    public void publish(TimeInfo timeInfo) {
        clear();
        if (timeInfo == null) {
            return;
        }
        setRange(timeInfo.start(), timeInfo.end());
        if (timeInfo.hasSteps()) {
            setSteps(timeInfo.steps().toDoubleArray());
        }
    }

    /**
     * Replaces slot content with an aggregate timeline.
     *
     * <p>Suppressed timelines clear the slot.</p>
     *
     * @param timeline aggregate timeline; {@code null} clears the slot.
     */
    public void publish(AggregateTimeline timeline) {
        clear();
        if (timeline == null || !timeline.temporal()) {
            return;
        }
        setRange(timeline.start(), timeline.end());
        if (timeline.hasSteps()) {
            setSteps(timeline.steps().toDoubleArray());
        }
    }

    @Override
    public String toString() {
        return "TimeSlot(range=" + Arrays.toString(range)
                + ", steps=" + Arrays.toString(steps) + ")";
    }
}
