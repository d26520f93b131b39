package org.ptycho.diffraction.data;

import java.io.IOException;

/**
 * One exposure set (possibly multi-frame) produced by a reader or a streaming source.
 * Implementations may defer reading pattern data until {@link #getPatterns()} is called.
 *
 * @author Diffraction Assembly Developers
 */
public interface DiffractionArray {

    String getLabel();

    /**
     * @return scan point index for each pattern (negative values identify patterns that should not be assembled).
     */
    int[] getIndexes();

    /**
     * @return the patterns for this array, possibly reading them from storage.
     *
     * @throws IOException
     *   if the patterns cannot be read.
     */
    PatternStack getPatterns()
            throws IOException;

    /**
     * @return number of patterns in this array (derived from the indexes so that no data is loaded).
     */
    default int getNumPatterns() {
        return getIndexes().length;
    }
}
