package org.ptycho.diffraction.dataset;

import java.io.FileNotFoundException;
import java.io.IOException;

import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.DiffractionArray;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.processor.PatternProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and processes one array on a loader worker thread and commits the result to its dataset.
 * Every failure is reported as a FAILED array, loading of other arrays continues.
 *
 * @author Diffraction Assembly Developers
 */
class ArrayLoader
        implements Runnable {

    private final AssembledDataset dataset;
    private final long generation;
    private final int arrayIndex;
    private final int expectedFrameCount;
    private final DiffractionArray source;
    private final PatternProcessor processor;

    ArrayLoader(final AssembledDataset dataset,
                final long generation,
                final int arrayIndex,
                final int expectedFrameCount,
                final DiffractionArray source,
                final PatternProcessor processor) {
        this.dataset = dataset;
        this.generation = generation;
        this.arrayIndex = arrayIndex;
        this.expectedFrameCount = expectedFrameCount;
        this.source = source;
        this.processor = processor;
    }

    @Override
    public void run() {

        LOG.debug("run: entry, generation={}, arrayIndex={}, source={}", generation, arrayIndex, source);

        final IntPatternStack processedPatterns;
        try {
            final PatternStack patterns = source.getPatterns();
            final int[] indexes = source.getIndexes();
            if (patterns.getFrameCount() != expectedFrameCount) {
                throw new IllegalArgumentException("expected " + expectedFrameCount + " frames but read " +
                                                   patterns.getFrameCount());
            }
            if (indexes.length != patterns.getFrameCount()) {
                throw new IllegalArgumentException("read " + patterns.getFrameCount() + " frames but " +
                                                   indexes.length + " indexes");
            }
            processedPatterns = processor.process(patterns);
        } catch (final FileNotFoundException e) {
            LOG.warn("run: file not found for arrayIndex {}: {}", arrayIndex, e.getMessage());
            dataset.commitFailed(generation, arrayIndex, source, "file not found: " + e.getMessage());
            return;
        } catch (final IOException e) {
            LOG.error("run: I/O error while reading arrayIndex " + arrayIndex, e);
            dataset.commitFailed(generation, arrayIndex, source, "I/O error: " + e.getMessage());
            return;
        } catch (final DiffractionDataException | IllegalArgumentException e) {
            LOG.warn("run: failed to process arrayIndex {}: {}", arrayIndex, e.getMessage());
            dataset.commitFailed(generation, arrayIndex, source, e.getMessage());
            return;
        } catch (final RuntimeException | OutOfMemoryError e) {
            LOG.error("run: unexpected error while loading arrayIndex " + arrayIndex, e);
            dataset.commitFailed(generation, arrayIndex, source, String.valueOf(e));
            return;
        }

        dataset.commitLoaded(generation, arrayIndex, source, processedPatterns);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ArrayLoader.class);
}
