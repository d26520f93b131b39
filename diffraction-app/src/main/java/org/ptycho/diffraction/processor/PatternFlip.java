package org.ptycho.diffraction.processor;

import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Mirrors patterns horizontally, vertically, or swaps their axes (transpose).
 *
 * @author Diffraction Assembly Developers
 */
public class PatternFlip
        implements PatternTransform {

    public enum Operation {
        HORIZONTAL, VERTICAL, TRANSPOSE
    }

    private final Operation operation;

    public PatternFlip(final Operation operation) {
        this.operation = operation;
    }

    public Operation getOperation() {
        return operation;
    }

    @Override
    public IntPatternStack process(final PatternStack patterns) {
        final int width = patterns.getWidth();
        final int height = patterns.getHeight();
        final int frameCount = patterns.getFrameCount();
        final boolean transpose = operation == Operation.TRANSPOSE;
        final IntPatternStack result = transpose ?
                                       new IntPatternStack(frameCount, height, width) :
                                       new IntPatternStack(frameCount, width, height);
        for (int frame = 0; frame < frameCount; frame++) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    final int value = patterns.get(frame, y, x);
                    switch (operation) {
                        case HORIZONTAL:
                            result.set(frame, y, width - 1 - x, value);
                            break;
                        case VERTICAL:
                            result.set(frame, height - 1 - y, x, value);
                            break;
                        case TRANSPOSE:
                            result.set(frame, x, y, value);
                            break;
                    }
                }
            }
        }
        return result;
    }

    @Override
    public BadPixels processBadPixels(final BadPixels badPixels) {
        final int width = badPixels.getWidth();
        final int height = badPixels.getHeight();
        final boolean transpose = operation == Operation.TRANSPOSE;
        final int resultWidth = transpose ? height : width;
        final boolean[] mask = new boolean[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final boolean isBad = badPixels.isBad(x, y);
                switch (operation) {
                    case HORIZONTAL:
                        mask[y * resultWidth + (width - 1 - x)] = isBad;
                        break;
                    case VERTICAL:
                        mask[(height - 1 - y) * resultWidth + x] = isBad;
                        break;
                    case TRANSPOSE:
                        mask[x * resultWidth + y] = isBad;
                        break;
                }
            }
        }
        final int resultHeight = transpose ? width : height;
        return new BadPixels(new ImageExtent(resultWidth, resultHeight), mask);
    }

    @Override
    public String toString() {
        return "PatternFlip{operation: " + operation + '}';
    }
}
