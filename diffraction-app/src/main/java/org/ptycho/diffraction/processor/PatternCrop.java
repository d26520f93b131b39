package org.ptycho.diffraction.processor;

import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Extracts a fixed window from each pattern.
 * The window must already lie inside the pattern (see {@link org.ptycho.diffraction.sizer.PatternAxisSizer}).
 *
 * @author Diffraction Assembly Developers
 */
public class PatternCrop
        implements PatternTransform {

    private final int minX;
    private final int minY;
    private final int width;
    private final int height;

    public PatternCrop(final int minX,
                       final int minY,
                       final int width,
                       final int height) {
        this.minX = minX;
        this.minY = minY;
        this.width = width;
        this.height = height;
    }

    public ImageExtent getExtent() {
        return new ImageExtent(width, height);
    }

    @Override
    public IntPatternStack process(final PatternStack patterns)
            throws IllegalArgumentException {
        checkFits(patterns.getWidth(), patterns.getHeight());
        final int frameCount = patterns.getFrameCount();
        final IntPatternStack result = new IntPatternStack(frameCount, width, height);
        for (int frame = 0; frame < frameCount; frame++) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    result.set(frame, y, x, patterns.get(frame, minY + y, minX + x));
                }
            }
        }
        return result;
    }

    @Override
    public BadPixels processBadPixels(final BadPixels badPixels) {
        checkFits(badPixels.getWidth(), badPixels.getHeight());
        final boolean[] mask = new boolean[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                mask[y * width + x] = badPixels.isBad(minX + x, minY + y);
            }
        }
        return new BadPixels(getExtent(), mask);
    }

    private void checkFits(final int sourceWidth,
                           final int sourceHeight)
            throws IllegalArgumentException {
        if ((minX < 0) || (minY < 0) || (minX + width > sourceWidth) || (minY + height > sourceHeight)) {
            throw new IllegalArgumentException("crop window " + this + " does not fit inside " +
                                               sourceWidth + "x" + sourceHeight + " pattern");
        }
    }

    @Override
    public String toString() {
        return "PatternCrop{minX: " + minX + ", minY: " + minY + ", width: " + width + ", height: " + height + '}';
    }
}
