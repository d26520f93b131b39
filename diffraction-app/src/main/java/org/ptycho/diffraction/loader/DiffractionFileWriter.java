package org.ptycho.diffraction.loader;

import java.io.IOException;
import java.nio.file.Path;

import org.ptycho.diffraction.data.DiffractionDataset;

/**
 * @author Diffraction Assembly Developers
 */
public interface DiffractionFileWriter {

    void write(final Path path,
               final DiffractionDataset dataset)
            throws IOException;

}
