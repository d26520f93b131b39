package org.ptycho.diffraction.loader;

import java.io.IOException;
import java.nio.file.Path;

import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.IntPatternStack;

/**
 * Reads the first page of a TIFF file as a bad pixels mask (non-zero = bad).
 *
 * @author Diffraction Assembly Developers
 */
public class TiffBadPixelsReader
        implements BadPixelsFileReader {

    @Override
    public BadPixels read(final Path path)
            throws IOException {
        final IntPatternStack stack = TiffStacks.read(path);
        final int[] pixels = stack.getFrame(0);
        final boolean[] mask = new boolean[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            mask[i] = pixels[i] != 0;
        }
        return new BadPixels(stack.getFrameExtent(), mask);
    }
}
