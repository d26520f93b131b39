package org.ptycho.diffraction.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Snapshot of loaded arrays together with the masks needed to interpret them.
 * This is the unit of {@link AssembledPatternsFile} import and export.
 *
 * @author Diffraction Assembly Developers
 */
public class AssembledPatterns {

    private final ImageExtent detectorExtent;
    private final BadPixels rawBadPixels;
    private final BadPixels processedBadPixels;
    private final List<PatternArray> arrays;

    /**
     * @param  detectorExtent      extent of the raw detector.
     * @param  rawBadPixels        (optional) detector mask.
     * @param  processedBadPixels  mask aligned with the processed patterns.
     * @param  arrays              loaded arrays.
     */
    public AssembledPatterns(final ImageExtent detectorExtent,
                             final BadPixels rawBadPixels,
                             final BadPixels processedBadPixels,
                             final List<PatternArray> arrays)
            throws IllegalArgumentException {
        for (final PatternArray array : arrays) {
            if (array.getState() != PatternState.LOADED) {
                throw new IllegalArgumentException("array " + array + " is not loaded");
            }
        }
        this.detectorExtent = detectorExtent;
        this.rawBadPixels = rawBadPixels;
        this.processedBadPixels = processedBadPixels;
        this.arrays = Collections.unmodifiableList(new ArrayList<>(arrays));
    }

    public ImageExtent getDetectorExtent() {
        return detectorExtent;
    }

    public BadPixels getRawBadPixels() {
        return rawBadPixels;
    }

    public BadPixels getProcessedBadPixels() {
        return processedBadPixels;
    }

    public List<PatternArray> getArrays() {
        return arrays;
    }

    public long getPatternCount() {
        long count = 0;
        for (final PatternArray array : arrays) {
            count += array.getFrameCount();
        }
        return count;
    }
}
