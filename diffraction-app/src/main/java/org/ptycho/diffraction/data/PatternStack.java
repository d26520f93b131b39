package org.ptycho.diffraction.data;

import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Read access to a block of diffraction patterns laid out as frames x height x width integer counts.
 *
 * @author Diffraction Assembly Developers
 */
public interface PatternStack {

    int getFrameCount();

    int getWidth();

    int getHeight();

    int get(final int frame,
            final int y,
            final int x);

    /**
     * @return row major copy of the specified frame.
     */
    default int[] getFrame(final int frame) {
        final int width = getWidth();
        final int height = getHeight();
        final int[] pixels = new int[width * height];
        int i = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[i++] = get(frame, y, x);
            }
        }
        return pixels;
    }

    default ImageExtent getFrameExtent() {
        return new ImageExtent(getWidth(), getHeight());
    }

    default long getPixelCount() {
        return (long) getFrameCount() * getWidth() * getHeight();
    }
}
