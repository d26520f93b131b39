package org.ptycho.diffraction.dataset;

import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.DiffractionArray;
import org.ptycho.diffraction.data.PatternAccessor;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.data.UnmodifiablePatternStack;
import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Immutable view of one array entry in an {@link AssembledDataset}.
 * State changes produce new instances, so a view obtained by a reader never changes underneath it.
 *
 * Processed patterns are stored uncorrected. Bad pixels are zeroed when patterns are read
 * through {@link #getPattern} and are excluded from all counts.
 *
 * @author Diffraction Assembly Developers
 */
public class PatternArray {

    private final int arrayIndex;
    private final String label;
    private final PatternState state;
    private final String failureReason;
    private final int frameCount;
    private final int[] indexes;
    private final DiffractionArray source;
    private final PatternStack patterns;
    private final BadPixels processedBadPixels;
    private final long[] patternCounts;

    private PatternArray(final int arrayIndex,
                         final String label,
                         final PatternState state,
                         final String failureReason,
                         final int frameCount,
                         final int[] indexes,
                         final DiffractionArray source,
                         final PatternStack patterns,
                         final BadPixels processedBadPixels) {
        this.arrayIndex = arrayIndex;
        this.label = label;
        this.state = state;
        this.failureReason = failureReason;
        this.frameCount = frameCount;
        this.indexes = indexes;
        this.source = source;
        this.patterns = UnmodifiablePatternStack.of(patterns);
        this.processedBadPixels = processedBadPixels;
        this.patternCounts = patterns == null ? new long[0] : countPatterns(patterns, processedBadPixels);
    }

    /**
     * @param  source  data handle for the array or null if data will be appended later.
     */
    public static PatternArray notLoaded(final int arrayIndex,
                                         final String label,
                                         final int frameCount,
                                         final DiffractionArray source) {
        return new PatternArray(arrayIndex, label, PatternState.NOT_LOADED, null, frameCount,
                                null, source, null, null);
    }

    public static PatternArray loaded(final int arrayIndex,
                                      final String label,
                                      final int[] indexes,
                                      final PatternStack patterns,
                                      final BadPixels processedBadPixels)
            throws IllegalArgumentException {
        if (indexes.length != patterns.getFrameCount()) {
            throw new IllegalArgumentException("array '" + label + "' has " + indexes.length + " indexes but " +
                                               patterns.getFrameCount() + " patterns");
        }
        if (! processedBadPixels.getExtent().equals(patterns.getFrameExtent())) {
            throw DiffractionDataException.shapeMismatch(processedBadPixels.getExtent(), patterns.getFrameExtent());
        }
        return new PatternArray(arrayIndex, label, PatternState.LOADED, null, patterns.getFrameCount(),
                                indexes.clone(), null, patterns, processedBadPixels);
    }

    public PatternArray toLoading(final DiffractionArray source) {
        return new PatternArray(arrayIndex, source.getLabel(), PatternState.LOADING, null, frameCount,
                                null, source, null, null);
    }

    public PatternArray toFailed(final String reason) {
        return new PatternArray(arrayIndex, label, PatternState.FAILED, reason, frameCount,
                                null, source, null, null);
    }

    /**
     * @return copy of this (loaded) array with counts derived from the specified mask.
     */
    public PatternArray withProcessedBadPixels(final BadPixels processedBadPixels) {
        if (state != PatternState.LOADED) {
            return this;
        }
        return loaded(arrayIndex, label, indexes, patterns, processedBadPixels);
    }

    public int getArrayIndex() {
        return arrayIndex;
    }

    public String getLabel() {
        return label;
    }

    public PatternState getState() {
        return state;
    }

    /**
     * @return reason for a FAILED state, otherwise null.
     */
    public String getFailureReason() {
        return failureReason;
    }

    public int getFrameCount() {
        return frameCount;
    }

    /**
     * @return scan indexes of loaded patterns (empty unless LOADED).
     */
    public int[] getIndexes() {
        return indexes == null ? new int[0] : indexes.clone();
    }

    DiffractionArray getSource() {
        return source;
    }

    /**
     * @return read only processed (uncorrected) patterns, or null unless LOADED.
     */
    public PatternStack getPatterns() {
        return patterns;
    }

    public BadPixels getProcessedBadPixels() {
        return processedBadPixels;
    }

    public ImageExtent getPatternExtent() {
        return patterns == null ? null : patterns.getFrameExtent();
    }

    /**
     * @return bad pixel corrected values of the selected frame or of the mean of all frames, row major.
     *
     * @throws IllegalStateException
     *   if the array is not loaded.
     *
     * @throws DiffractionDataException
     *   if the selected frame does not exist.
     */
    public double[] getPattern(final PatternAccessor accessor)
            throws IllegalStateException, DiffractionDataException {

        if (state != PatternState.LOADED) {
            throw new IllegalStateException("array '" + label + "' is " + state);
        }

        final int width = patterns.getWidth();
        final int height = patterns.getHeight();
        final double[] pattern = new double[width * height];

        if (accessor.isMean()) {
            for (int frame = 0; frame < frameCount; frame++) {
                addFrame(frame, pattern);
            }
            if (frameCount > 0) {
                for (int i = 0; i < pattern.length; i++) {
                    pattern[i] /= frameCount;
                }
            }
        } else {
            final int frame = accessor.getFrameIndex();
            if (frame >= frameCount) {
                throw new DiffractionDataException(DiffractionDataException.ErrorType.INDEX_OUT_OF_RANGE,
                                                   "frame " + frame + " is outside [0, " + frameCount +
                                                   ") for array '" + label + "'");
            }
            addFrame(frame, pattern);
        }

        return pattern;
    }

    /**
     * @return sum of good pixel values for each frame (empty unless LOADED).
     */
    public long[] getPatternCounts() {
        return patternCounts.clone();
    }

    /**
     * @return largest good pixel sum of all assembled (non-negative index) frames.
     */
    public long getMaxPatternCount() {
        long max = 0;
        for (int i = 0; i < patternCounts.length; i++) {
            if (indexes[i] >= 0) {
                max = Math.max(max, patternCounts[i]);
            }
        }
        return max;
    }

    /**
     * @return mean good pixel sum of all assembled (non-negative index) frames.
     */
    public double getMeanPatternCount() {
        long total = 0;
        int count = 0;
        for (int i = 0; i < patternCounts.length; i++) {
            if (indexes[i] >= 0) {
                total += patternCounts[i];
                count++;
            }
        }
        return count == 0 ? 0.0 : (double) total / count;
    }

    private void addFrame(final int frame,
                          final double[] pattern) {
        final int width = patterns.getWidth();
        final int height = patterns.getHeight();
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (! processedBadPixels.isBad(x, y)) {
                    pattern[i] += patterns.get(frame, y, x);
                }
                i++;
            }
        }
    }

    private static long[] countPatterns(final PatternStack patterns,
                                        final BadPixels badPixels) {
        final long[] counts = new long[patterns.getFrameCount()];
        for (int frame = 0; frame < counts.length; frame++) {
            long sum = 0;
            for (int y = 0; y < patterns.getHeight(); y++) {
                for (int x = 0; x < patterns.getWidth(); x++) {
                    if (! badPixels.isBad(x, y)) {
                        sum += patterns.get(frame, y, x);
                    }
                }
            }
            counts[frame] = sum;
        }
        return counts;
    }

    @Override
    public String toString() {
        return "{arrayIndex: " + arrayIndex + ", label: '" + label + "', state: " + state +
               (failureReason == null ? "" : ", failureReason: '" + failureReason + "'") +
               ", frameCount: " + frameCount + '}';
    }
}
