package org.ptycho.diffraction.api;

import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.sizer.CropCenter;

/**
 * Optional settings applied before a pattern file is loaded.
 * Null values leave the current settings unchanged.
 *
 * @author Diffraction Assembly Developers
 */
public class OpenPatternsOverrides {

    public static final OpenPatternsOverrides NONE = new OpenPatternsOverrides(null, null, null);

    private final CropCenter cropCenter;
    private final ImageExtent cropExtent;
    private final ImageExtent detectorExtent;

    public OpenPatternsOverrides(final CropCenter cropCenter,
                                 final ImageExtent cropExtent,
                                 final ImageExtent detectorExtent) {
        this.cropCenter = cropCenter;
        this.cropExtent = cropExtent;
        this.detectorExtent = detectorExtent;
    }

    public CropCenter getCropCenter() {
        return cropCenter;
    }

    public ImageExtent getCropExtent() {
        return cropExtent;
    }

    public ImageExtent getDetectorExtent() {
        return detectorExtent;
    }

    @Override
    public String toString() {
        return "{cropCenter: " + cropCenter + ", cropExtent: " + cropExtent + ", detectorExtent: " +
               detectorExtent + '}';
    }
}
