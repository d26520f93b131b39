package org.ptycho.diffraction.data;

import java.util.List;

/**
 * Ordered arrays plus metadata, as produced by file readers and consumed by file writers.
 *
 * @author Diffraction Assembly Developers
 */
public interface DiffractionDataset {

    DiffractionMetadata getMetadata();

    List<DiffractionArray> getArrays();

    /**
     * @return raw detector bad pixels stored with the dataset or null if none were stored.
     */
    BadPixels getBadPixels();

    default int size() {
        return getArrays().size();
    }

    default DiffractionArray get(final int index) {
        return getArrays().get(index);
    }
}
