package org.Aayush.series.aggregate;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import org.Aayush.core.time.TimeUtils;
import org.Aayush.series.registry.RegistryEntry;
import org.Aayush.series.registry.TimeRangeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Merges per-input time info into one {@link AggregateTimeline}.
 *
 * <p>Boundary ownership: walking inputs in ascending start order, each input contributes only
 * the steps strictly below the next input's start. A time value shared by two touching or
 * overlapping inputs is therefore emitted once, by the later input.</p>
 */
public final class TimelineAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(TimelineAggregator.class);

    /**
     * Computes the aggregate timeline from the latest registry build.
     *
     * @param registry populated time-range registry.
     * @return aggregate timeline; suppressed when the registry is empty or the global range
     * does not advance.
     */
    public AggregateTimeline aggregate(TimeRangeRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        if (registry.isEmpty()) {
            LOG.warn("No inputs with time information.");
            return AggregateTimeline.noTimeInputs();
        }

        double globalStart = registry.firstEntry().start();
        double globalEnd = registry.lastEntry().end();

        // A single time value is most likely a single file with no time at all.
        if (!TimeUtils.advances(globalStart, globalEnd)) {
            LOG.debug("Aggregate range [{}, {}] does not advance; suppressing timeline", globalStart, globalEnd);
            return AggregateTimeline.singlePoint();
        }

        return AggregateTimeline.temporal(globalStart, globalEnd, mergeSteps(registry.entriesByStart()));
    }

    private static DoubleList mergeSteps(ObjectList<RegistryEntry> entries) {
        DoubleArrayList merged = new DoubleArrayList();
        int size = entries.size();
        for (int i = 0; i < size; i++) {
            DoubleList localSteps = entries.get(i).timeInfo().steps();
            double localEnd = i + 1 < size ? entries.get(i + 1).start() : Double.POSITIVE_INFINITY;
            for (int s = 0; s < localSteps.size(); s++) {
                double step = localSteps.getDouble(s);
                if (step >= localEnd) {
                    break;
                }
                if (merged.isEmpty() || merged.getDouble(merged.size() - 1) != step) {
                    merged.add(step);
                }
            }
        }
        return merged;
    }
}
