package org.ptycho.diffraction.data;

/**
 * Selects either the mean of all frames or a single frame of a pattern array.
 *
 * @author Diffraction Assembly Developers
 */
public final class PatternAccessor {

    private static final PatternAccessor MEAN = new PatternAccessor(-1);

    private final int frameIndex;

    private PatternAccessor(final int frameIndex) {
        this.frameIndex = frameIndex;
    }

    public static PatternAccessor mean() {
        return MEAN;
    }

    public static PatternAccessor frame(final int frameIndex)
            throws IllegalArgumentException {
        if (frameIndex < 0) {
            throw new IllegalArgumentException("frame index must not be negative, got " + frameIndex);
        }
        return new PatternAccessor(frameIndex);
    }

    public boolean isMean() {
        return this == MEAN;
    }

    public int getFrameIndex()
            throws IllegalStateException {
        if (isMean()) {
            throw new IllegalStateException("mean accessor does not reference a frame");
        }
        return frameIndex;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (! (o instanceof PatternAccessor)) {
            return false;
        }
        return frameIndex == ((PatternAccessor) o).frameIndex;
    }

    @Override
    public int hashCode() {
        return frameIndex;
    }

    @Override
    public String toString() {
        return isMean() ? "Mean" : "Frame(" + frameIndex + ")";
    }
}
