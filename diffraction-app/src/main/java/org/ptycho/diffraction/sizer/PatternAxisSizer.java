package org.ptycho.diffraction.sizer;

/**
 * Derives legal ranges and processed size for one axis from a detector extent and an {@link AxisProcessingConfig}.
 * All out of range configuration values are clamped, never rejected.
 *
 * @author Diffraction Assembly Developers
 */
public class PatternAxisSizer {

    /** Largest processed extent per axis; keeps width x height within int range. */
    public static final int MAX_PROCESSED_EXTENT_PX = 46340;

    private final int detectorExtentPx;
    private final AxisProcessingConfig config;
    private final int cropSizePx;
    private final int binSizePx;
    private final int padPx;

    public PatternAxisSizer(final int detectorExtentPx,
                            final AxisProcessingConfig config)
            throws IllegalArgumentException {

        if (detectorExtentPx < 1) {
            throw new IllegalArgumentException("detector extent must be at least 1, got " + detectorExtentPx);
        }

        this.detectorExtentPx = detectorExtentPx;
        this.config = config;
        this.cropSizePx = config.isCropEnabled() ? getCropSizeLimits().clamp(config.getCropSizePx()) : detectorExtentPx;
        this.binSizePx = config.isBinEnabled() ? getBinSizeLimits().clamp(config.getBinSizePx()) : 1;
        this.padPx = config.isPadEnabled() ? getPadSizeLimits().clamp(config.getPadPx()) : 0;
    }

    public int getDetectorExtentPx() {
        return detectorExtentPx;
    }

    public Interval getCropSizeLimits() {
        return new Interval(1, detectorExtentPx);
    }

    /**
     * @return effective crop size (the full extent when cropping is disabled).
     */
    public int getCropSizePx() {
        return cropSizePx;
    }

    /**
     * @return center positions that keep the whole crop window on the detector.
     */
    public Interval getCropCenterLimits() {
        final int halfSize = cropSizePx / 2;
        return new Interval(halfSize, detectorExtentPx - cropSizePx + halfSize);
    }

    public long getCropCenterPx() {
        return config.isCropEnabled() ?
               getCropCenterLimits().clamp(config.getCropCenterPx()) : detectorExtentPx / 2;
    }

    /**
     * @return first detector pixel of the crop window.
     */
    public int getCropMinPx() {
        return (int) (getCropCenterPx() - cropSizePx / 2);
    }

    public Interval getBinSizeLimits() {
        return new Interval(1, cropSizePx);
    }

    public int getBinSizePx() {
        return binSizePx;
    }

    /**
     * @return pad sizes that keep the processed extent within {@link #MAX_PROCESSED_EXTENT_PX}.
     */
    public Interval getPadSizeLimits() {
        return new Interval(0, Math.max(0, (MAX_PROCESSED_EXTENT_PX - getBinnedExtentPx()) / 2));
    }

    public int getPadPx() {
        return padPx;
    }

    public boolean isFlip() {
        return config.isFlip();
    }

    /**
     * @return size after binning, trailing pixels that do not fill a whole bin are dropped.
     */
    public int getBinnedExtentPx() {
        return cropSizePx / binSizePx;
    }

    public int getProcessedExtentPx() {
        return getBinnedExtentPx() + 2 * padPx;
    }

    public double getProcessedPixelSizeM(final double detectorPixelSizeM) {
        return detectorPixelSizeM * binSizePx;
    }

    @Override
    public String toString() {
        return "{detectorExtentPx: " + detectorExtentPx + ", cropSizePx: " + cropSizePx +
               ", cropCenterPx: " + getCropCenterPx() + ", binSizePx: " + binSizePx + ", padPx: " + padPx +
               ", processedExtentPx: " + getProcessedExtentPx() + '}';
    }
}
