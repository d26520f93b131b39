package org.ptycho.diffraction.data;

import java.util.Arrays;

import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Immutable row major boolean defect map (true = bad pixel).
 *
 * @author Diffraction Assembly Developers
 */
public class BadPixels {

    private final ImageExtent extent;
    private final boolean[] mask;
    private final int count;

    /**
     * @param  extent  extent of the mask.
     * @param  mask    row major values, copied by this constructor.
     */
    public BadPixels(final ImageExtent extent,
                     final boolean[] mask)
            throws IllegalArgumentException {
        if (mask.length != extent.getSize()) {
            throw new IllegalArgumentException("mask length " + mask.length + " does not match extent " + extent);
        }
        this.extent = extent;
        this.mask = mask.clone();
        int badCount = 0;
        for (final boolean isBad : this.mask) {
            if (isBad) {
                badCount++;
            }
        }
        this.count = badCount;
    }

    /**
     * @return mask with no bad pixels.
     */
    public static BadPixels allGood(final ImageExtent extent) {
        return new BadPixels(extent, new boolean[extent.getSize()]);
    }

    public ImageExtent getExtent() {
        return extent;
    }

    public int getWidth() {
        return extent.getWidthPx();
    }

    public int getHeight() {
        return extent.getHeightPx();
    }

    public boolean isBad(final int x,
                         final int y) {
        return mask[y * extent.getWidthPx() + x];
    }

    /**
     * @return number of bad pixels.
     */
    public int getCount() {
        return count;
    }

    public boolean[] copyMask() {
        return mask.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (! (o instanceof BadPixels)) {
            return false;
        }
        final BadPixels that = (BadPixels) o;
        return extent.equals(that.extent) && Arrays.equals(mask, that.mask);
    }

    @Override
    public int hashCode() {
        return 31 * extent.hashCode() + Arrays.hashCode(mask);
    }

    @Override
    public String toString() {
        return "{extent: " + extent + ", count: " + count + '}';
    }
}
