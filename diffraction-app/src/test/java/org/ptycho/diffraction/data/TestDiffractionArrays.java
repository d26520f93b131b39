package org.ptycho.diffraction.data;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;

/**
 * Array builders shared by tests.
 */
public class TestDiffractionArrays {

    /**
     * @return array whose pixel values are frame * 1000 + y * width + x.
     */
    public static SimpleDiffractionArray ramp(final String label,
                                              final int firstIndex,
                                              final int frameCount,
                                              final int width,
                                              final int height) {
        final IntPatternStack patterns = new IntPatternStack(frameCount, width, height);
        for (int frame = 0; frame < frameCount; frame++) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    patterns.set(frame, y, x, frame * 1000 + y * width + x);
                }
            }
        }
        return SimpleDiffractionArray.withSequentialIndexes(label, firstIndex, patterns);
    }

    /**
     * @return array whose pixels all have the specified value.
     */
    public static SimpleDiffractionArray constant(final String label,
                                                  final int firstIndex,
                                                  final int frameCount,
                                                  final int width,
                                                  final int height,
                                                  final int value) {
        final IntPatternStack patterns = new IntPatternStack(frameCount, width, height);
        Arrays.fill(patterns.getData(), value);
        return SimpleDiffractionArray.withSequentialIndexes(label, firstIndex, patterns);
    }

    /**
     * Array whose data is only returned after a latch is released.
     */
    public static class BlockingArray
            implements DiffractionArray {

        private final DiffractionArray delegate;
        private final CountDownLatch startedLatch;
        private final CountDownLatch releaseLatch;

        public BlockingArray(final DiffractionArray delegate,
                             final CountDownLatch startedLatch,
                             final CountDownLatch releaseLatch) {
            this.delegate = delegate;
            this.startedLatch = startedLatch;
            this.releaseLatch = releaseLatch;
        }

        @Override
        public String getLabel() {
            return delegate.getLabel();
        }

        @Override
        public int[] getIndexes() {
            return delegate.getIndexes();
        }

        @Override
        public PatternStack getPatterns()
                throws IOException {
            startedLatch.countDown();
            try {
                releaseLatch.await();
            } catch (final InterruptedException e) {
                throw new InterruptedIOException("interrupted while blocked");
            }
            return delegate.getPatterns();
        }
    }

    /**
     * Array whose data file is missing.
     */
    public static class MissingFileArray
            implements DiffractionArray {

        private final String label;
        private final int[] indexes;

        public MissingFileArray(final String label,
                                final int frameCount) {
            this.label = label;
            this.indexes = new int[frameCount];
        }

        @Override
        public String getLabel() {
            return label;
        }

        @Override
        public int[] getIndexes() {
            return indexes;
        }

        @Override
        public PatternStack getPatterns()
                throws IOException {
            throw new FileNotFoundException(label + ".tif");
        }
    }
}
