package org.Aayush.series.registry;

import it.unimi.dsi.fastutil.doubles.Double2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.doubles.Double2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import it.unimi.dsi.fastutil.objects.ObjectLists;
import org.Aayush.core.time.TimeUtils;
import org.Aayush.series.controller.SeriesController;
import org.Aayush.series.controller.SeriesException;
import org.Aayush.series.time.TimeInfo;
import org.Aayush.series.time.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Per-input time-range store with an ordered by-start view.
 *
 * <p>Two views over one entry set:</p>
 * <ul>
 * <li>by input index: one entry per index, overwritten on re-registration;</li>
 * <li>by range start: ordered, used for interval queries. Start values are expected to be
 * unique across inputs; collisions follow the configured {@link DuplicateStartPolicy}.</li>
 * </ul>
 * <p>
 * Not thread-safe. The registry is owned by exactly one {@link SeriesController}.
 * </p>
 */
public final class TimeRangeRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(TimeRangeRegistry.class);

    private final Int2ObjectOpenHashMap<RegistryEntry> byIndex = new Int2ObjectOpenHashMap<>();
    private final Double2ObjectRBTreeMap<RegistryEntry> byStart = new Double2ObjectRBTreeMap<>();
    private final DuplicateStartPolicy duplicateStartPolicy;

    /**
     * Creates a registry with {@link DuplicateStartPolicy#REPLACE}.
     */
    public TimeRangeRegistry() {
        this(DuplicateStartPolicy.REPLACE);
    }

    /**
     * Creates a registry with an explicit duplicate-start policy.
     *
     * @param duplicateStartPolicy behavior on start-value collisions.
     */
    public TimeRangeRegistry(DuplicateStartPolicy duplicateStartPolicy) {
        this.duplicateStartPolicy = Objects.requireNonNull(duplicateStartPolicy, "duplicateStartPolicy");
    }

    /**
     * Clears both views.
     */
    public void reset() {
        byIndex.clear();
        byStart.clear();
    }

    /**
     * Registers the time metadata an input reported into a slot.
     *
     * <ul>
     * <li>steps and range: stored verbatim;</li>
     * <li>steps only: range derived as {@code [first, last]};</li>
     * <li>range only: stored without steps;</li>
     * <li>neither: warning, nothing registered.</li>
     * </ul>
     *
     * @param index input index.
     * @param reported slot the input's reader wrote into.
     * @return {@code true} when the input was registered.
     * @throws SeriesException with {@code FS_DUPLICATE_START} under {@link DuplicateStartPolicy#REJECT},
     * or {@code FS_READER_FAILURE} when the reported range is reversed or not finite.
     */
    public boolean addTimeRange(int index, TimeSlot reported) {
        Objects.requireNonNull(reported, "reported");
        removeIndex(index);

        double[] steps = reported.steps();
        if (steps != null && !TimeUtils.isNonDecreasing(steps)) {
            LOG.warn("Input with index {} reported unsorted time steps; sorting them", index);
            steps = TimeUtils.sortedCopy(steps);
        }

        if (steps == null && !reported.hasRange()) {
            LOG.warn("Input with index {} has no time information.", index);
            return false;
        }

        register(index, toTimeInfo(index, reported.range(), steps));
        return true;
    }

    /**
     * Registers already-built time info for one input.
     *
     * @param index input index.
     * @param timeInfo time info to store.
     * @throws SeriesException with {@code FS_DUPLICATE_START} under {@link DuplicateStartPolicy#REJECT}.
     */
    public void register(int index, TimeInfo timeInfo) {
        Objects.requireNonNull(timeInfo, "timeInfo");
        removeIndex(index);

        RegistryEntry entry = new RegistryEntry(index, timeInfo);
        double key = startKey(entry.start());
        RegistryEntry collision = byStart.get(key);
        if (collision != null) {
            if (duplicateStartPolicy == DuplicateStartPolicy.REJECT) {
                throw new SeriesException(
                        SeriesController.REASON_DUPLICATE_START,
                        "inputs " + collision.index() + " and " + index + " both start at " + entry.start()
                );
            }
            LOG.warn(
                    "Input {} starts at {} like input {}; input {} will no longer own any time",
                    index,
                    entry.start(),
                    collision.index(),
                    collision.index()
            );
        }

        byIndex.put(index, entry);
        byStart.put(key, entry);
    }

    /**
     * Returns registered time info for one input, or {@code null} when absent.
     */
    public TimeInfo timeInfo(int index) {
        RegistryEntry entry = byIndex.get(index);
        return entry == null ? null : entry.timeInfo();
    }

    /**
     * Returns whether one input index has registered time info.
     */
    public boolean contains(int index) {
        return byIndex.containsKey(index);
    }

    /**
     * Returns number of inputs registered by index.
     */
    public int size() {
        return byIndex.size();
    }

    /**
     * Returns whether nothing is registered.
     */
    public boolean isEmpty() {
        return byStart.isEmpty();
    }

    /**
     * Returns immutable snapshot of entries in ascending start order.
     */
    public ObjectList<RegistryEntry> entriesByStart() {
        return ObjectLists.unmodifiable(new ObjectArrayList<>(byStart.values()));
    }

    /**
     * Returns entry with the smallest start, or {@code null} when empty.
     */
    public RegistryEntry firstEntry() {
        return byStart.isEmpty() ? null : byStart.get(byStart.firstDoubleKey());
    }

    /**
     * Returns entry with the largest start, or {@code null} when empty.
     */
    public RegistryEntry lastEntry() {
        return byStart.isEmpty() ? null : byStart.get(byStart.lastDoubleKey());
    }

    /**
     * Returns entry with the greatest start {@code <= time}, or {@code null} when every start
     * is greater than {@code time}.
     */
    public RegistryEntry floorEntry(double time) {
        Double2ObjectSortedMap<RegistryEntry> head = byStart.headMap(Math.nextUp(startKey(time)));
        return head.isEmpty() ? null : head.get(head.lastDoubleKey());
    }

    /**
     * Returns the smallest registered start strictly greater than {@code start}, or
     * {@link Double#POSITIVE_INFINITY} when there is none.
     */
    public double nextStartAfter(double start) {
        Double2ObjectSortedMap<RegistryEntry> tail = byStart.tailMap(Math.nextUp(startKey(start)));
        return tail.isEmpty() ? Double.POSITIVE_INFINITY : tail.firstDoubleKey();
    }

    /**
     * Returns whether {@code start} is the smallest registered start.
     */
    public boolean isEarliestStart(double start) {
        return !byStart.isEmpty() && Double.compare(byStart.firstDoubleKey(), startKey(start)) == 0;
    }

    private void removeIndex(int index) {
        RegistryEntry previous = byIndex.remove(index);
        if (previous != null && byStart.get(startKey(previous.start())) == previous) {
            byStart.remove(startKey(previous.start()));
        }
    }

    private static TimeInfo toTimeInfo(int index, double[] range, double[] steps) {
        try {
            if (steps == null) {
                return TimeInfo.ofRange(range[0], range[1]);
            }
            return range == null ? TimeInfo.ofSteps(steps) : TimeInfo.of(range[0], range[1], steps);
        } catch (IllegalArgumentException ex) {
            throw new SeriesException(
                    SeriesController.REASON_READER_FAILURE,
                    "input " + index + " reported invalid time information: " + ex.getMessage(),
                    ex
            );
        }
    }

    /**
     * Folds {@code -0.0} onto {@code 0.0}; the tree map orders keys with {@link Double#compare}.
     */
    private static double startKey(double start) {
        return start == 0.0d ? 0.0d : start;
    }
}
