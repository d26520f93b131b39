package org.ptycho.diffraction.processor;

import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Sums bins of binSizeX x binSizeY pixels.
 * Trailing rows and columns that do not fill a complete bin are discarded.
 * Sums larger than {@link Integer#MAX_VALUE} saturate.
 *
 * @author Diffraction Assembly Developers
 */
public class PatternBinning
        implements PatternTransform {

    private final int binSizeX;
    private final int binSizeY;

    public PatternBinning(final int binSizeX,
                          final int binSizeY)
            throws IllegalArgumentException {
        if ((binSizeX < 1) || (binSizeY < 1)) {
            throw new IllegalArgumentException("bin sizes must be at least 1, got " + binSizeX + "x" + binSizeY);
        }
        this.binSizeX = binSizeX;
        this.binSizeY = binSizeY;
    }

    @Override
    public IntPatternStack process(final PatternStack patterns) {
        final int binnedWidth = patterns.getWidth() / binSizeX;
        final int binnedHeight = patterns.getHeight() / binSizeY;
        final int frameCount = patterns.getFrameCount();
        final IntPatternStack result = new IntPatternStack(frameCount, binnedWidth, binnedHeight);
        for (int frame = 0; frame < frameCount; frame++) {
            for (int by = 0; by < binnedHeight; by++) {
                for (int bx = 0; bx < binnedWidth; bx++) {
                    long sum = 0;
                    for (int y = by * binSizeY; y < (by + 1) * binSizeY; y++) {
                        for (int x = bx * binSizeX; x < (bx + 1) * binSizeX; x++) {
                            sum += patterns.get(frame, y, x);
                        }
                    }
                    result.set(frame, by, bx, (int) Math.min(sum, Integer.MAX_VALUE));
                }
            }
        }
        return result;
    }

    /**
     * A binned pixel is only bad when every pixel in its bin is bad.
     */
    @Override
    public BadPixels processBadPixels(final BadPixels badPixels) {
        final int binnedWidth = badPixels.getWidth() / binSizeX;
        final int binnedHeight = badPixels.getHeight() / binSizeY;
        final boolean[] mask = new boolean[binnedWidth * binnedHeight];
        for (int by = 0; by < binnedHeight; by++) {
            for (int bx = 0; bx < binnedWidth; bx++) {
                boolean allBad = true;
                for (int y = by * binSizeY; allBad && (y < (by + 1) * binSizeY); y++) {
                    for (int x = bx * binSizeX; allBad && (x < (bx + 1) * binSizeX); x++) {
                        allBad = badPixels.isBad(x, y);
                    }
                }
                mask[by * binnedWidth + bx] = allBad;
            }
        }
        return new BadPixels(new ImageExtent(binnedWidth, binnedHeight), mask);
    }

    @Override
    public String toString() {
        return "PatternBinning{binSizeX: " + binSizeX + ", binSizeY: " + binSizeY + '}';
    }
}
