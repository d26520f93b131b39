package org.ptycho.diffraction.loader;

import java.io.IOException;
import java.nio.file.Path;

import org.ptycho.diffraction.data.DiffractionDataset;

/**
 * Reads diffraction datasets in a specific file format.
 * Implementations may return arrays that defer reading pattern data until it is needed.
 *
 * @author Diffraction Assembly Developers
 */
public interface DiffractionFileReader {

    DiffractionDataset read(final Path path)
            throws IOException;

}
