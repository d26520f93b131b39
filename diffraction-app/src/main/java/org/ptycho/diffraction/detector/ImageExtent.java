package org.ptycho.diffraction.detector;

import java.io.Serializable;

/**
 * Width and height of an image in pixels.
 *
 * @author Diffraction Assembly Developers
 */
public class ImageExtent
        implements Serializable {

    private final int widthPx;
    private final int heightPx;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ImageExtent() {
        this.widthPx = 0;
        this.heightPx = 0;
    }

    public ImageExtent(final int widthPx,
                       final int heightPx) {
        if ((widthPx < 0) || (heightPx < 0)) {
            throw new IllegalArgumentException("negative extent " + widthPx + "x" + heightPx);
        }
        this.widthPx = widthPx;
        this.heightPx = heightPx;
    }

    public int getWidthPx() {
        return widthPx;
    }

    public int getHeightPx() {
        return heightPx;
    }

    /**
     * @return number of pixels covered by this extent.
     */
    public int getSize() {
        return widthPx * heightPx;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (! (o instanceof ImageExtent)) {
            return false;
        }
        final ImageExtent that = (ImageExtent) o;
        return (widthPx == that.widthPx) && (heightPx == that.heightPx);
    }

    @Override
    public int hashCode() {
        return 31 * widthPx + heightPx;
    }

    @Override
    public String toString() {
        return widthPx + "Wx" + heightPx + "H";
    }
}
