package org.Aayush.series.controller;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import lombok.Builder;
import org.Aayush.series.aggregate.AggregateTimeline;
import org.Aayush.series.aggregate.TimelineAggregator;
import org.Aayush.series.input.InputEnumerator;
import org.Aayush.series.input.MetaFileSourceListProvider;
import org.Aayush.series.input.SeriesReader;
import org.Aayush.series.input.SourceListProvider;
import org.Aayush.series.registry.TimeRangeRegistry;
import org.Aayush.series.resolve.InputSelection;
import org.Aayush.series.resolve.TimeIndexResolver;
import org.Aayush.series.time.TimeInfo;
import org.Aayush.series.time.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Presents an ordered list of time-tagged sources as one continuous time-varying dataset.
 *
 * <p>Request phases:</p>
 * <ul>
 * <li>{@link #describe()}: probe every input's time metadata, rebuild the registry, and
 * publish the aggregate timeline into the visible slot.</li>
 * <li>{@link #select(DoubleList)}: resolve requested times to exactly one input and make
 * sure the reader points at it.</li>
 * <li>{@link #onFetchBegin(int)} / {@link #onFetchEnd()}: bracket data production, swapping
 * the input's local time info into the visible slot and restoring the aggregate view after.</li>
 * </ul>
 * <p>
 * Failures are reported as {@link SeriesException} and only fail the current call; a later
 * {@link #describe()} always starts from a clean registry. Instances are single-threaded.
 * </p>
 *
 * @param <D> data type produced by the reader.
 */
public final class SeriesController<D> {
    public static final String REASON_NO_INPUTS = "FS_NO_INPUTS";
    public static final String REASON_MULTI_INPUT_SELECTION_UNSUPPORTED = "FS_MULTI_INPUT_SELECTION_UNSUPPORTED";
    public static final String REASON_NOT_DESCRIBED = "FS_NOT_DESCRIBED";
    public static final String REASON_ILLEGAL_STATE = "FS_ILLEGAL_STATE";
    public static final String REASON_UNKNOWN_INPUT = "FS_UNKNOWN_INPUT";
    public static final String REASON_DUPLICATE_START = "FS_DUPLICATE_START";
    public static final String REASON_INVALID_TIME = "FS_INVALID_TIME";
    public static final String REASON_METAFILE_UNREADABLE = "FS_METAFILE_UNREADABLE";
    public static final String REASON_READER_FAILURE = "FS_READER_FAILURE";

    private static final Logger LOG = LoggerFactory.getLogger(SeriesController.class);
    private static final int NO_INDEX = -1;

    private final SeriesReader<D> reader;
    private final InputEnumerator inputs;
    private final SourceListProvider sourceListProvider;
    private final SeriesRuntimeConfig config;

    private final TimeRangeRegistry registry;
    private final TimelineAggregator aggregator = new TimelineAggregator();
    private final TimeIndexResolver resolver;

    private final TimeSlot visibleSlot = new TimeSlot();
    private final TimeSlot probeSlot = new TimeSlot();
    private AggregateTimeline aggregateTimeline;

    private SeriesState state = SeriesState.IDLE;
    private int lastProbedIndex = NO_INDEX;
    private int selectedIndex = NO_INDEX;
    private String currentSourceName;
    private String lastReadMetaFileName;

    /**
     * Creates a series controller.
     *
     * @param reader external reader used for probing and data production.
     * @param inputs optional source list (defaults to an empty list).
     * @param sourceListProvider optional metafile reader (defaults to plain-text metafiles).
     * @param config optional runtime configuration (defaults to {@link SeriesRuntimeConfig#defaults()}).
     */
    @Builder
    public SeriesController(
            SeriesReader<D> reader,
            InputEnumerator inputs,
            SourceListProvider sourceListProvider,
            SeriesRuntimeConfig config
    ) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.inputs = inputs == null ? InputEnumerator.create() : inputs;
        this.sourceListProvider = sourceListProvider == null ? new MetaFileSourceListProvider() : sourceListProvider;
        this.config = config == null ? SeriesRuntimeConfig.defaults() : config;
        if (this.config.isUseMetaFile() && this.config.getMetaFileName() == null) {
            throw new IllegalArgumentException("metaFileName is required when useMetaFile is set");
        }
        this.registry = new TimeRangeRegistry(this.config.getDuplicateStartPolicy());
        this.resolver = new TimeIndexResolver(registry);
    }

    /**
     * Rebuilds the registry from every input and publishes the aggregate timeline.
     *
     * <p>When time is ignored, or input 0 reports neither range nor steps, every input is
     * registered with its ordinal index as its single time value.</p>
     *
     * @return aggregate timeline now visible in {@link #visibleSlot()}.
     * @throws SeriesException with {@code FS_NO_INPUTS} when there is nothing to describe.
     */
    public AggregateTimeline describe() {
        transition(SeriesState.DESCRIBING);
        try {
            AggregateTimeline timeline = describeInputs();
            transition(SeriesState.READY);
            return timeline;
        } catch (RuntimeException ex) {
            aggregateTimeline = null;
            selectedIndex = NO_INDEX;
            visibleSlot.clear();
            transition(SeriesState.IDLE);
            throw ex;
        }
    }

    /**
     * Resolves requested times to the single input that owns them.
     *
     * <p>The reader is re-pointed at the chosen input only when it differs from the last
     * probed one.</p>
     *
     * @param requestedTimes requested times; {@code null} or empty targets input 0.
     * @return selected input index.
     * @throws SeriesException with {@code FS_MULTI_INPUT_SELECTION_UNSUPPORTED} when the
     * request spans several inputs, {@code FS_NO_INPUTS} when there are no inputs, or
     * {@code FS_NOT_DESCRIBED} before a successful describe.
     */
    public int select(DoubleList requestedTimes) {
        requireReady();
        if (inputs.size() == 0) {
            throw new SeriesException(REASON_NO_INPUTS, "Inputs are not set.");
        }

        InputSelection selection = resolver.chooseInputs(requestedTimes);
        if (selection.size() > 1) {
            // Combining several inputs into one composite timestep is not supported.
            throw new SeriesException(
                    REASON_MULTI_INPUT_SELECTION_UNSUPPORTED,
                    "requested times span inputs " + selection.indices() + "; multi-input selection is not supported"
            );
        }
        if (selection.isEmpty()) {
            throw new SeriesException(REASON_NO_INPUTS, "Inputs are not set.");
        }

        int index = selection.single();
        if (index >= inputs.size()) {
            throw new SeriesException(
                    REASON_UNKNOWN_INPUT,
                    "input " + index + " is no longer listed; describe the series again"
            );
        }
        if (index != lastProbedIndex) {
            probe(index, probeSlot);
        } else {
            LOG.debug("Input {} already probed; skipping re-probe", index);
        }
        selectedIndex = index;
        return index;
    }

    /**
     * Returns the requested times one input is responsible for, clamped into its range.
     *
     * @param index input index.
     * @param requestedTimes requested times.
     * @return owned, clamped times in request order.
     */
    public DoubleList localWindow(int index, DoubleList requestedTimes) {
        return resolver.timesForInput(index, requestedTimes);
    }

    /**
     * Publishes one input's local time info into the visible slot before data production.
     *
     * @param index input about to produce data.
     */
    public void onFetchBegin(int index) {
        requireReady();
        TimeInfo local = registry.timeInfo(index);
        visibleSlot.publish(local);
        transition(SeriesState.FETCHING);
        LOG.debug("Fetch begin for input {}; visible slot {}", index, visibleSlot);
    }

    /**
     * Restores the aggregate timeline into the visible slot after data production.
     */
    public void onFetchEnd() {
        if (state != SeriesState.FETCHING) {
            throw new SeriesException(REASON_ILLEGAL_STATE, "onFetchEnd called in state " + state);
        }
        visibleSlot.publish(aggregateTimeline);
        transition(SeriesState.READY);
        LOG.debug("Fetch end; aggregate timeline restored");
    }

    /**
     * Selects the owning input and produces its data for the requested times.
     *
     * @param requestedTimes requested times; {@code null} or empty targets input 0.
     * @return selected index, owned times and produced data.
     */
    public FetchResult<D> fetch(DoubleList requestedTimes) {
        int index = select(requestedTimes);
        DoubleList localTimes = registry.contains(index)
                ? resolver.timesForInput(index, requestedTimes)
                : DoubleLists.emptyList();

        onFetchBegin(index);
        try {
            D data = reader.produce(visibleSlot, localTimes);
            return new FetchResult<>(index, inputs.source(index), localTimes, data);
        } catch (SeriesException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new SeriesException(
                    REASON_READER_FAILURE,
                    "reader failed to produce data for input " + index,
                    ex
            );
        } finally {
            onFetchEnd();
        }
    }

    /**
     * Returns whether the reader can read one file, or the first file of a metafile when
     * metafile mode is enabled.
     *
     * @param fileName file (or metafile) name.
     * @return {@code true} when the reader accepts the file.
     */
    public boolean canRead(String fileName) {
        Objects.requireNonNull(fileName, "fileName");
        if (!config.isUseMetaFile()) {
            return reader.canRead(fileName);
        }
        List<String> listed;
        try {
            listed = sourceListProvider.sources(fileName, 1);
        } catch (SeriesException ex) {
            LOG.debug("Metafile {} not readable: {}", fileName, ex.getMessage());
            return false;
        }
        return !listed.isEmpty() && reader.canRead(listed.get(0));
    }

    /**
     * Appends one source name.
     */
    public void addSourceName(String name) {
        inputs.append(name);
    }

    /**
     * Removes every source name.
     */
    public void removeAllSourceNames() {
        inputs.clear();
    }

    /**
     * Returns number of source names.
     */
    public int sourceCount() {
        return inputs.size();
    }

    /**
     * Returns source name at one index, or {@code null} when out of range.
     */
    public String sourceName(int index) {
        if (index < 0 || index >= inputs.size()) {
            return null;
        }
        return inputs.source(index);
    }

    /**
     * Forces the metafile to be re-read on the next describe.
     */
    public void reloadMetaFile() {
        lastReadMetaFileName = null;
    }

    /**
     * Returns the slot external consumers read the visible timeline from.
     */
    public TimeSlot visibleSlot() {
        return visibleSlot;
    }

    /**
     * Returns the last published aggregate timeline, or {@code null} before describe.
     */
    public AggregateTimeline aggregateTimeline() {
        return aggregateTimeline;
    }

    /**
     * Returns registered time info of one input, or {@code null} when absent.
     */
    public TimeInfo inputTimeInfo(int index) {
        return registry.timeInfo(index);
    }

    public SeriesState state() {
        return state;
    }

    public SeriesRuntimeConfig config() {
        return config;
    }

    /**
     * Returns last selected index, or {@code -1} when nothing is selected.
     */
    public int selectedIndex() {
        return selectedIndex;
    }

    /**
     * Returns last probed index, or {@code -1} when nothing is probed.
     */
    public int lastProbedIndex() {
        return lastProbedIndex;
    }

    /**
     * Returns the source the reader currently points at, or {@code null}.
     */
    public String currentSourceName() {
        return currentSourceName;
    }

    private AggregateTimeline describeInputs() {
        refreshSourcesFromMetaFile();

        int count = inputs.size();
        if (count < 1) {
            throw new SeriesException(REASON_NO_INPUTS, "Expecting at least 1 input. Cannot proceed.");
        }

        registry.reset();
        aggregateTimeline = null;
        selectedIndex = NO_INDEX;

        // Input 0 decides whether the series carries time at all.
        probe(0, visibleSlot);
        if (config.isIgnoreReaderTime() || !visibleSlot.hasTime()) {
            visibleSlot.clear();
            LOG.debug("Synthesizing ordinal time for {} inputs", count);
            for (int i = 0; i < count; i++) {
                registry.register(i, TimeInfo.ofSteps(i));
            }
        } else {
            registry.addTimeRange(0, visibleSlot);
            for (int i = 1; i < count; i++) {
                probe(i, visibleSlot);
                registry.addTimeRange(i, visibleSlot);
            }
        }

        aggregateTimeline = aggregator.aggregate(registry);
        visibleSlot.publish(aggregateTimeline);
        LOG.debug("Described {} inputs: {}", count, aggregateTimeline);
        return aggregateTimeline;
    }

    private void probe(int index, TimeSlot slot) {
        String source = inputs.source(index);
        slot.clear();
        try {
            reader.open(source);
            currentSourceName = source;
            lastProbedIndex = index;
            reader.reportTime(slot);
        } catch (SeriesException ex) {
            lastProbedIndex = NO_INDEX;
            throw ex;
        } catch (RuntimeException ex) {
            lastProbedIndex = NO_INDEX;
            throw new SeriesException(
                    REASON_READER_FAILURE,
                    "reader failed to report time for input " + index + " (" + source + ")",
                    ex
            );
        }
        LOG.debug("Probed input {} ({}): {}", index, source, slot);
    }

    private void refreshSourcesFromMetaFile() {
        if (!config.isUseMetaFile()) {
            return;
        }
        String metaFileName = config.getMetaFileName();
        if (metaFileName.equals(lastReadMetaFileName)) {
            return;
        }
        List<String> sources = sourceListProvider.sources(metaFileName);
        inputs.clear();
        for (String source : sources) {
            inputs.append(source);
        }
        lastReadMetaFileName = metaFileName;
        lastProbedIndex = NO_INDEX;
        LOG.debug("Read {} sources from metafile {}", sources.size(), metaFileName);
    }

    private void requireReady() {
        switch (state) {
            case READY -> {
                return;
            }
            case IDLE, DESCRIBING -> throw new SeriesException(
                    REASON_NOT_DESCRIBED,
                    "series must be described before selecting inputs"
            );
            case FETCHING -> throw new SeriesException(
                    REASON_ILLEGAL_STATE,
                    "a fetch is already in progress"
            );
            default -> throw new IllegalStateException("unhandled state " + state);
        }
    }

    private void transition(SeriesState target) {
        boolean allowed = switch (target) {
            case DESCRIBING -> state == SeriesState.IDLE || state == SeriesState.READY;
            case READY -> state == SeriesState.DESCRIBING || state == SeriesState.FETCHING;
            case FETCHING -> state == SeriesState.READY;
            case IDLE -> state == SeriesState.DESCRIBING;
        };
        if (!allowed) {
            throw new SeriesException(REASON_ILLEGAL_STATE, "cannot move from " + state + " to " + target);
        }
        state = target;
    }
}
