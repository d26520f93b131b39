package org.ptycho.diffraction.dataset;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.DiffractionArray;
import org.ptycho.diffraction.data.DiffractionDataset;
import org.ptycho.diffraction.data.DiffractionMetadata;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.mask.BadPixelsListener;
import org.ptycho.diffraction.mask.BadPixelsMask;
import org.ptycho.diffraction.processor.PatternProcessor;
import org.ptycho.diffraction.settings.DiffractionSettings;
import org.ptycho.diffraction.util.FileUtil;
import org.ptycho.diffraction.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered collection of {@link PatternArray} entries that are loaded and processed in the background.
 *
 * <p>Readers access an immutable copy-on-write snapshot of the entry list without locking.
 * All structural changes and all observer notifications happen while holding the state lock,
 * so observers see events in the order the changes were made.</p>
 *
 * <p>Lifecycle operations (reload, start, finish, clear, import) are serialized by a separate lock.
 * Each reload or clear starts a new generation. Loader results from an older generation are discarded,
 * so no event for a replaced dataset can follow its {@link DatasetObserver#handleDatasetReloaded}.</p>
 *
 * @author Diffraction Assembly Developers
 */
public class AssembledDataset
        implements BadPixelsListener {

    private enum LoadingPhase {
        IDLE, LOADING, FINISHED
    }

    private static final long WORKER_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final DiffractionSettings settings;
    private final BadPixelsMask badPixelsMask;
    private final List<DatasetObserver> observers;

    private final ReentrantLock stateLock;
    private final Condition pendingSettled;
    private final ReentrantLock lifecycleLock;
    private final AtomicLong generation;

    private volatile List<PatternArray> arrays;
    private volatile DiffractionMetadata metadata;

    // guarded by stateLock
    private LoadingPhase loadingPhase;
    private ExecutorService executor;
    private ScratchStore scratchStore;
    private PatternProcessor processor;
    private BadPixels processedBadPixels;
    private int exposureCounter;
    private int pendingCount;
    private ProcessTimer timer;

    public AssembledDataset(final DiffractionSettings settings,
                            final BadPixelsMask badPixelsMask) {
        this.settings = settings;
        this.badPixelsMask = badPixelsMask;
        this.observers = new CopyOnWriteArrayList<>();
        this.stateLock = new ReentrantLock();
        this.pendingSettled = stateLock.newCondition();
        this.lifecycleLock = new ReentrantLock();
        this.generation = new AtomicLong(0);
        this.arrays = Collections.emptyList();
        this.metadata = DiffractionMetadata.createNull(null);
        this.loadingPhase = LoadingPhase.IDLE;
        this.exposureCounter = 0;
        this.pendingCount = 0;
        badPixelsMask.addListener(this);
    }

    public void addObserver(final DatasetObserver observer) {
        if (! observers.contains(observer)) {
            observers.add(observer);
        }
    }

    public void removeObserver(final DatasetObserver observer) {
        observers.remove(observer);
    }

    public long getGeneration() {
        return generation.get();
    }

    public DatasetState getState() {
        return arrays.isEmpty() ? DatasetState.EMPTY : DatasetState.POPULATED;
    }

    public DiffractionMetadata getMetadata() {
        return metadata;
    }

    public int size() {
        return arrays.size();
    }

    /**
     * @return immutable snapshot of all entries.
     */
    public List<PatternArray> getArrays() {
        return arrays;
    }

    /**
     * @throws DiffractionDataException
     *   if the index is outside [0, size).
     */
    public PatternArray get(final int index)
            throws DiffractionDataException {
        final List<PatternArray> snapshot = arrays;
        if ((index < 0) || (index >= snapshot.size())) {
            throw new DiffractionDataException(DiffractionDataException.ErrorType.INDEX_OUT_OF_RANGE,
                                               "index " + index + " is outside [0, " + snapshot.size() + ")");
        }
        return snapshot.get(index);
    }

    /**
     * @return number of arrays that were submitted for loading but are not yet committed.
     */
    public int getQueueSize() {
        stateLock.lock();
        try {
            return pendingCount;
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isLoading() {
        stateLock.lock();
        try {
            return loadingPhase == LoadingPhase.LOADING;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Replaces the dataset with unloaded entries for every array of the specified dataset.
     *
     * @throws DiffractionDataException
     *   if the dataset metadata is missing or inconsistent (the current dataset is kept).
     */
    public void reload(final DiffractionDataset dataset)
            throws DiffractionDataException {
        validate(dataset);
        reload(dataset.getMetadata(), dataset.getArrays());
    }

    /**
     * Replaces the dataset with unloaded placeholder entries ("Array n") for every count in the metadata.
     * Data for the placeholders is expected to be appended later.
     *
     * @throws DiffractionDataException
     *   if the metadata is missing or inconsistent (the current dataset is kept).
     */
    public void reload(final DiffractionMetadata metadata)
            throws DiffractionDataException {
        reload(metadata, Collections.emptyList());
    }

    private void reload(final DiffractionMetadata newMetadata,
                        final List<DiffractionArray> sources)
            throws DiffractionDataException {

        validateMetadata(newMetadata, sources);

        final List<Integer> counts = newMetadata.getNumPatternsPerArray();

        LOG.info("reload: entry, metadata={}, arrayCount={}", newMetadata, counts.size());

        lifecycleLock.lock();
        try {
            cancelLoading();

            stateLock.lock();
            try {
                final List<PatternArray> entries = new ArrayList<>(counts.size());
                for (int i = 0; i < counts.size(); i++) {
                    if (sources.isEmpty()) {
                        entries.add(PatternArray.notLoaded(i, "Array " + i, counts.get(i), null));
                    } else {
                        final DiffractionArray source = sources.get(i);
                        entries.add(PatternArray.notLoaded(i, source.getLabel(), counts.get(i), source));
                    }
                }

                arrays = Collections.unmodifiableList(entries);
                metadata = newMetadata;
                exposureCounter = sources.size();
                processor = null;
                processedBadPixels = null;

                fireDatasetReloaded();
            } finally {
                stateLock.unlock();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Starts loading every unloaded entry that has a data source.
     * Calling this method while loading is already in progress has no effect.
     *
     * @throws DiffractionDataException
     *   if memory mapped scratch storage is enabled but cannot be created.
     */
    public void startLoading()
            throws DiffractionDataException {
        lifecycleLock.lock();
        try {
            stateLock.lock();
            try {
                if (loadingPhase == LoadingPhase.LOADING) {
                    LOG.debug("startLoading: already loading generation {}", generation.get());
                } else {
                    startLoadingLocked();
                }
            } finally {
                stateLock.unlock();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Submits an array for loading as the next exposure.
     * The array replaces the matching placeholder entry or, when there is none, is added at the end.
     * Loading is started implicitly when it has not been started yet.
     *
     * @throws IllegalStateException
     *   if loading has already been finished for this generation.
     */
    public void appendArray(final DiffractionArray array)
            throws IllegalStateException, DiffractionDataException {

        stateLock.lock();
        try {
            if (loadingPhase == LoadingPhase.FINISHED) {
                throw new IllegalStateException("loading is finished, reload or clear the dataset before appending");
            }
            if (loadingPhase == LoadingPhase.IDLE) {
                startLoadingLocked();
            }

            final int index = exposureCounter++;
            final List<PatternArray> entries = new ArrayList<>(arrays);
            final int expectedFrameCount;
            final boolean inserted = index >= entries.size();
            if (inserted) {
                final PatternArray entry = PatternArray.notLoaded(index, array.getLabel(), array.getNumPatterns(),
                                                                  array);
                entries.add(entry.toLoading(array));
                expectedFrameCount = array.getNumPatterns();
            } else {
                final PatternArray entry = entries.get(index);
                entries.set(index, entry.toLoading(array));
                expectedFrameCount = entry.getFrameCount();
            }
            arrays = Collections.unmodifiableList(entries);

            submitLocked(index, expectedFrameCount, array);

            if (inserted) {
                final long currentGeneration = generation.get();
                for (final DatasetObserver observer : observers) {
                    observer.handleArrayInserted(currentGeneration, index);
                }
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Stops accepting new arrays for this generation.
     *
     * @param  block  if true, wait until every submitted array has been committed.
     */
    public void finishLoading(final boolean block) {

        LOG.info("finishLoading: entry, block={}", block);

        lifecycleLock.lock();
        try {
            final ExecutorService toShutdown;
            stateLock.lock();
            try {
                if (loadingPhase != LoadingPhase.LOADING) {
                    LOG.debug("finishLoading: not loading, phase is {}", loadingPhase);
                    return;
                }
                loadingPhase = LoadingPhase.FINISHED;
                toShutdown = executor;
                executor = null;
                toShutdown.shutdown();

                if (block) {
                    while (pendingCount > 0) {
                        pendingSettled.await();
                    }
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while waiting for loaders to finish", e);
            } finally {
                stateLock.unlock();
            }

            if (block) {
                awaitTermination(toShutdown);
                LOG.info("finishLoading: exit, loaded generation {} in {}", generation.get(), timer);
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * @return statistics for the loaded arrays.
     *
     * @throws DiffractionDataException
     *   if any array is still loading.
     */
    public AssemblyStatistics assemblePatterns()
            throws DiffractionDataException {

        stateLock.lock();
        try {
            int loaded = 0;
            int failed = 0;
            int notLoaded = 0;
            long maxPatternCount = 0;
            final List<Integer> assembledIndexes = new ArrayList<>();

            for (final PatternArray array : arrays) {
                switch (array.getState()) {
                    case LOADING:
                        throw new DiffractionDataException(DiffractionDataException.ErrorType.INCOMPLETE_DATASET,
                                                           "array " + array.getArrayIndex() + " ('" +
                                                           array.getLabel() + "') is still loading");
                    case LOADED:
                        loaded++;
                        maxPatternCount = Math.max(maxPatternCount, array.getMaxPatternCount());
                        for (final int index : array.getIndexes()) {
                            if (index >= 0) {
                                assembledIndexes.add(index);
                            }
                        }
                        break;
                    case FAILED:
                        failed++;
                        break;
                    default:
                        notLoaded++;
                        break;
                }
            }

            final int[] indexes = new int[assembledIndexes.size()];
            for (int i = 0; i < indexes.length; i++) {
                indexes[i] = assembledIndexes.get(i);
            }

            final AssemblyStatistics statistics =
                    new AssemblyStatistics(loaded, failed, notLoaded, indexes.length, maxPatternCount, indexes);
            LOG.info("assemblePatterns: {}", statistics);
            return statistics;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Replaces (or with null clears) the detector bad pixels mask.
     * Loaded arrays are re-corrected through {@link #handleBadPixelsChanged}.
     *
     * @throws DiffractionDataException
     *   if the mask does not match the detector extent.
     */
    public void setBadPixels(final BadPixels badPixels)
            throws DiffractionDataException {
        if (badPixels == null) {
            badPixelsMask.clear();
        } else {
            badPixelsMask.set(badPixels);
        }
    }

    @Override
    public void handleBadPixelsChanged(final int badPixelCount) {
        stateLock.lock();
        try {
            final PatternProcessor currentProcessor = processor == null ?
                                                      settings.getPatternSizer().getProcessor() : processor;
            processedBadPixels = processBadPixels(currentProcessor, badPixelsMask.getBadPixels());

            final List<PatternArray> entries = new ArrayList<>(arrays.size());
            for (final PatternArray array : arrays) {
                if ((array.getState() == PatternState.LOADED) &&
                    array.getPatternExtent().equals(processedBadPixels.getExtent())) {
                    entries.add(array.withProcessedBadPixels(processedBadPixels));
                } else {
                    entries.add(array);
                }
            }
            arrays = Collections.unmodifiableList(entries);

            final long currentGeneration = generation.get();
            for (final DatasetObserver observer : observers) {
                observer.handleBadPixelsChanged(currentGeneration, badPixelCount);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return bad pixels aligned with processed patterns.
     */
    public BadPixels getProcessedBadPixels() {
        stateLock.lock();
        try {
            if (processedBadPixels != null) {
                return processedBadPixels;
            }
            return processBadPixels(settings.getPatternSizer().getProcessor(), badPixelsMask.getBadPixels());
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return largest good pixel sum of any assembled pattern (0 when nothing is loaded).
     */
    public long getMaximumPatternCounts() {
        long max = 0;
        for (final PatternArray array : arrays) {
            max = Math.max(max, array.getMaxPatternCount());
        }
        return max;
    }

    /**
     * @return one line summary such as "scan_001: 120 x 64W x 64H int32 [1.97MB]".
     */
    public String getInfoText() {
        final Path filePath = metadata.getFilePath();
        final String label = filePath == null ? "None" : FileUtil.getBaseName(filePath);
        long patternCount = 0;
        ImageExtent extent = null;
        for (final PatternArray array : arrays) {
            if (array.getState() == PatternState.LOADED) {
                patternCount += array.getFrameCount();
                extent = array.getPatternExtent();
            }
        }
        if (extent == null) {
            extent = settings.getPatternSizer().getProcessedImageExtent();
        }
        final double sizeMB = (double) patternCount * extent.getSize() * Integer.BYTES / BYTES_PER_MEGABYTE;
        return String.format("%s: %d x %dW x %dH int32 [%.2fMB]",
                             label, patternCount, extent.getWidthPx(), extent.getHeightPx(), sizeMB);
    }

    /**
     * Cancels all loading, releases scratch storage and removes all entries.
     */
    public void clear() {
        LOG.info("clear: entry");
        lifecycleLock.lock();
        try {
            cancelLoading();
            stateLock.lock();
            try {
                arrays = Collections.emptyList();
                metadata = DiffractionMetadata.createNull(null);
                exposureCounter = 0;
                processor = null;
                processedBadPixels = null;
                fireDatasetReloaded();
            } finally {
                stateLock.unlock();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * @return snapshot of all loaded arrays for export.
     */
    public AssembledPatterns getAssembledPatterns() {
        stateLock.lock();
        try {
            final List<PatternArray> loaded = new ArrayList<>();
            for (final PatternArray array : arrays) {
                if (array.getState() == PatternState.LOADED) {
                    loaded.add(array);
                }
            }
            return new AssembledPatterns(settings.getDetectorSettings().getExtent(),
                                         badPixelsMask.getBadPixels(),
                                         getProcessedBadPixels(),
                                         loaded);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Replaces the dataset with previously exported arrays (all LOADED).
     */
    public void importAssembledPatterns(final AssembledPatterns assembledPatterns,
                                        final Path filePath) {

        LOG.info("importAssembledPatterns: entry, filePath={}, arrayCount={}",
                 filePath, assembledPatterns.getArrays().size());

        lifecycleLock.lock();
        try {
            cancelLoading();
            stateLock.lock();
            try {
                final BadPixels importedBadPixels = assembledPatterns.getProcessedBadPixels();
                final List<PatternArray> entries = new ArrayList<>();
                final List<Integer> counts = new ArrayList<>();
                for (final PatternArray array : assembledPatterns.getArrays()) {
                    final int index = entries.size();
                    entries.add(PatternArray.loaded(index, array.getLabel(), array.getIndexes(),
                                                    array.getPatterns(), importedBadPixels));
                    counts.add(array.getFrameCount());
                }

                arrays = Collections.unmodifiableList(entries);
                metadata = new DiffractionMetadata.Builder()
                        .setNumPatternsPerArray(counts)
                        .setDetectorExtent(assembledPatterns.getDetectorExtent())
                        .setFilePath(filePath)
                        .build();
                exposureCounter = entries.size();
                processor = null;
                processedBadPixels = importedBadPixels;

                fireDatasetReloaded();
            } finally {
                stateLock.unlock();
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    void commitLoaded(final long loaderGeneration,
                      final int index,
                      final DiffractionArray source,
                      final IntPatternStack processedPatterns) {
        stateLock.lock();
        try {
            if (isStale(loaderGeneration, index)) {
                return;
            }

            PatternStack storedPatterns = processedPatterns;
            PatternArray entry;
            try {
                if (scratchStore != null) {
                    storedPatterns = scratchStore.store(processedPatterns);
                }
                entry = PatternArray.loaded(index, source.getLabel(), source.getIndexes(),
                                            storedPatterns, processedBadPixels);
            } catch (final IOException | RuntimeException e) {
                LOG.error("commitLoaded: failed to store arrayIndex " + index, e);
                entry = arrays.get(index).toFailed("failed to store patterns: " + e.getMessage());
            }

            commitLocked(index, entry);
        } finally {
            stateLock.unlock();
        }
    }

    void commitFailed(final long loaderGeneration,
                      final int index,
                      final DiffractionArray source,
                      final String reason) {
        stateLock.lock();
        try {
            if (isStale(loaderGeneration, index)) {
                return;
            }
            commitLocked(index, arrays.get(index).toFailed(reason));
        } finally {
            stateLock.unlock();
        }
    }

    private boolean isStale(final long loaderGeneration,
                            final int index) {
        final boolean stale = loaderGeneration != generation.get();
        if (stale) {
            LOG.debug("isStale: discarding arrayIndex {} from generation {}, current generation is {}",
                      index, loaderGeneration, generation.get());
        }
        return stale;
    }

    private void commitLocked(final int index,
                              final PatternArray entry) {

        final List<PatternArray> entries = new ArrayList<>(arrays);
        entries.set(index, entry);
        arrays = Collections.unmodifiableList(entries);

        pendingCount--;
        pendingSettled.signalAll();

        if ((timer != null) && timer.hasIntervalPassed()) {
            LOG.info("commitLocked: {} arrays pending after {}", pendingCount, timer);
        }

        final long currentGeneration = generation.get();
        for (final DatasetObserver observer : observers) {
            observer.handleArrayChanged(currentGeneration, index);
        }
    }

    private void startLoadingLocked()
            throws DiffractionDataException {

        final long currentGeneration = generation.get();

        processor = settings.getPatternSizer().getProcessor();
        processedBadPixels = processBadPixels(processor, badPixelsMask.getBadPixels());

        if (settings.isMemmapEnabled() && (scratchStore == null)) {
            final Path scratchDirectory = settings.getScratchDirectory();
            try {
                scratchStore = ScratchStore.create(scratchDirectory, currentGeneration);
            } catch (final IOException | IllegalArgumentException e) {
                throw DiffractionDataException.writeFailed(scratchDirectory, e);
            }
        }

        final int numDataThreads = settings.getNumDataThreads();
        executor = Executors.newFixedThreadPool(numDataThreads,
                                                new ThreadFactoryBuilder()
                                                        .setNameFormat("diffraction-loader-" +
                                                                       currentGeneration + "-%d")
                                                        .setDaemon(true)
                                                        .build());
        loadingPhase = LoadingPhase.LOADING;
        timer = new ProcessTimer();

        final List<PatternArray> entries = new ArrayList<>(arrays);
        int submitCount = 0;
        for (int i = 0; i < entries.size(); i++) {
            final PatternArray entry = entries.get(i);
            if ((entry.getState() == PatternState.NOT_LOADED) && (entry.getSource() != null)) {
                entries.set(i, entry.toLoading(entry.getSource()));
                submitLocked(i, entry.getFrameCount(), entry.getSource());
                submitCount++;
            }
        }
        arrays = Collections.unmodifiableList(entries);

        LOG.info("startLoadingLocked: generation {} submitted {} arrays to {} threads, processor={}, scratch={}",
                 currentGeneration, submitCount, numDataThreads, processor, scratchStore);
    }

    private void submitLocked(final int index,
                              final int expectedFrameCount,
                              final DiffractionArray source) {
        pendingCount++;
        executor.submit(new ArrayLoader(this, generation.get(), index, expectedFrameCount, source, processor));
    }

    /**
     * Starts a new generation, stops all workers of the previous one and deletes its scratch storage.
     * Must be called while holding the lifecycle lock but not the state lock.
     */
    private void cancelLoading() {

        final ExecutorService toStop;
        final ScratchStore toClose;

        stateLock.lock();
        try {
            final long newGeneration = generation.incrementAndGet();
            LOG.debug("cancelLoading: starting generation {}", newGeneration);
            toStop = executor;
            toClose = scratchStore;
            executor = null;
            scratchStore = null;
            loadingPhase = LoadingPhase.IDLE;
            pendingCount = 0;
            pendingSettled.signalAll();
        } finally {
            stateLock.unlock();
        }

        if (toStop != null) {
            toStop.shutdownNow();
            awaitTermination(toStop);
        }
        if (toClose != null) {
            toClose.close();
        }
    }

    /**
     * Checks that the specified dataset could be passed to {@link #reload(DiffractionDataset)}.
     *
     * @throws DiffractionDataException
     *   with INVALID_METADATA if the dataset or its metadata is missing or inconsistent.
     */
    public static void validate(final DiffractionDataset dataset)
            throws DiffractionDataException {
        if (dataset == null) {
            throw invalidMetadata("dataset must be specified");
        }
        validateMetadata(dataset.getMetadata(), dataset.getArrays());
    }

    /**
     * Checks that the specified metadata could be passed to {@link #reload(DiffractionMetadata)}.
     *
     * @throws DiffractionDataException
     *   with INVALID_METADATA if the metadata is missing or inconsistent.
     */
    public static void validate(final DiffractionMetadata metadata)
            throws DiffractionDataException {
        validateMetadata(metadata, Collections.emptyList());
    }

    private static void validateMetadata(final DiffractionMetadata metadata,
                                         final List<DiffractionArray> sources)
            throws DiffractionDataException {
        if (metadata == null) {
            throw invalidMetadata("metadata must be specified");
        }
        final List<Integer> counts = metadata.getNumPatternsPerArray();
        if (counts == null) {
            throw invalidMetadata("number of patterns per array must be specified");
        }
        for (int i = 0; i < counts.size(); i++) {
            final Integer count = counts.get(i);
            if ((count == null) || (count < 0)) {
                throw invalidMetadata("array " + i + " has invalid pattern count " + count);
            }
        }
        if ((! sources.isEmpty()) && (sources.size() != counts.size())) {
            throw invalidMetadata("metadata lists " + counts.size() + " arrays but dataset has " + sources.size());
        }
    }

    private static DiffractionDataException invalidMetadata(final String message) {
        return new DiffractionDataException(DiffractionDataException.ErrorType.INVALID_METADATA, message);
    }

    private void awaitTermination(final ExecutorService toStop) {
        try {
            if (! toStop.awaitTermination(WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("awaitTermination: loader workers did not stop within {} seconds",
                         WORKER_SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (final InterruptedException e) {
            LOG.warn("awaitTermination: interrupted while waiting for loader workers");
            Thread.currentThread().interrupt();
        }
    }

    private void fireDatasetReloaded() {
        final long currentGeneration = generation.get();
        for (final DatasetObserver observer : observers) {
            observer.handleDatasetReloaded(currentGeneration);
        }
    }

    private static BadPixels processBadPixels(final PatternProcessor processor,
                                              final BadPixels badPixels) {
        if ((badPixels == null) || (! processor.getInputExtent().equals(badPixels.getExtent()))) {
            return BadPixels.allGood(processor.getOutputExtent());
        }
        return processor.processBadPixels(badPixels);
    }

    private static final double BYTES_PER_MEGABYTE = 1024.0 * 1024.0;

    private static final Logger LOG = LoggerFactory.getLogger(AssembledDataset.class);
}
