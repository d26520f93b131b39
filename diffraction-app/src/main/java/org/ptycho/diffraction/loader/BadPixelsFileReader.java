package org.ptycho.diffraction.loader;

import java.io.IOException;
import java.nio.file.Path;

import org.ptycho.diffraction.data.BadPixels;

/**
 * @author Diffraction Assembly Developers
 */
public interface BadPixelsFileReader {

    BadPixels read(final Path path)
            throws IOException;

}
