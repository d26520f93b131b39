package org.ptycho.diffraction.processor;

import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Adds padX zero columns on the left and right and padY zero rows on the top and bottom of each pattern.
 * Padded mask pixels are good.
 *
 * @author Diffraction Assembly Developers
 */
public class PatternPadding
        implements PatternTransform {

    private final int padX;
    private final int padY;

    public PatternPadding(final int padX,
                          final int padY)
            throws IllegalArgumentException {
        if ((padX < 0) || (padY < 0)) {
            throw new IllegalArgumentException("pad sizes must not be negative, got " + padX + "x" + padY);
        }
        this.padX = padX;
        this.padY = padY;
    }

    @Override
    public IntPatternStack process(final PatternStack patterns) {
        final int width = patterns.getWidth();
        final int height = patterns.getHeight();
        final int frameCount = patterns.getFrameCount();
        final IntPatternStack result = new IntPatternStack(frameCount, width + 2 * padX, height + 2 * padY);
        for (int frame = 0; frame < frameCount; frame++) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    result.set(frame, y + padY, x + padX, patterns.get(frame, y, x));
                }
            }
        }
        return result;
    }

    @Override
    public BadPixels processBadPixels(final BadPixels badPixels) {
        final int width = badPixels.getWidth();
        final int paddedWidth = width + 2 * padX;
        final int paddedHeight = badPixels.getHeight() + 2 * padY;
        final boolean[] mask = new boolean[paddedWidth * paddedHeight];
        for (int y = 0; y < badPixels.getHeight(); y++) {
            for (int x = 0; x < width; x++) {
                mask[(y + padY) * paddedWidth + x + padX] = badPixels.isBad(x, y);
            }
        }
        return new BadPixels(new ImageExtent(paddedWidth, paddedHeight), mask);
    }

    @Override
    public String toString() {
        return "PatternPadding{padX: " + padX + ", padY: " + padY + '}';
    }
}
