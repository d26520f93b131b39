package org.ptycho.diffraction.sizer;

import java.io.Serializable;

/**
 * Crop, bin, pad and flip configuration for one spatial axis.
 * The crop center is kept exactly as configured (for persistence), the {@link PatternAxisSizer}
 * derived from it clamps the effective value.
 *
 * @author Diffraction Assembly Developers
 */
public class AxisProcessingConfig
        implements Serializable {

    public static final long DEFAULT_CROP_CENTER_PX = 32;
    public static final int DEFAULT_CROP_SIZE_PX = 64;

    private final boolean cropEnabled;
    private final long cropCenterPx;
    private final int cropSizePx;
    private final boolean binEnabled;
    private final int binSizePx;
    private final boolean padEnabled;
    private final int padPx;
    private final boolean flip;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private AxisProcessingConfig() {
        this(true, DEFAULT_CROP_CENTER_PX, DEFAULT_CROP_SIZE_PX, false, 1, false, 0, false);
    }

    public AxisProcessingConfig(final boolean cropEnabled,
                                final long cropCenterPx,
                                final int cropSizePx,
                                final boolean binEnabled,
                                final int binSizePx,
                                final boolean padEnabled,
                                final int padPx,
                                final boolean flip)
            throws IllegalArgumentException {

        if (cropSizePx < 1) {
            throw new IllegalArgumentException("crop size must be at least 1, got " + cropSizePx);
        }
        if (binSizePx < 1) {
            throw new IllegalArgumentException("bin size must be at least 1, got " + binSizePx);
        }
        if (padPx < 0) {
            throw new IllegalArgumentException("pad size must not be negative, got " + padPx);
        }

        this.cropEnabled = cropEnabled;
        this.cropCenterPx = cropCenterPx;
        this.cropSizePx = cropSizePx;
        this.binEnabled = binEnabled;
        this.binSizePx = binSizePx;
        this.padEnabled = padEnabled;
        this.padPx = padPx;
        this.flip = flip;
    }

    public static AxisProcessingConfig withDefaults() {
        return new AxisProcessingConfig();
    }

    public boolean isCropEnabled() {
        return cropEnabled;
    }

    public long getCropCenterPx() {
        return cropCenterPx;
    }

    public int getCropSizePx() {
        return cropSizePx;
    }

    public boolean isBinEnabled() {
        return binEnabled;
    }

    public int getBinSizePx() {
        return binSizePx;
    }

    public boolean isPadEnabled() {
        return padEnabled;
    }

    public int getPadPx() {
        return padPx;
    }

    public boolean isFlip() {
        return flip;
    }

    public AxisProcessingConfig withCrop(final boolean enabled,
                                         final long centerPx,
                                         final int sizePx) {
        return new AxisProcessingConfig(enabled, centerPx, sizePx, binEnabled, binSizePx, padEnabled, padPx, flip);
    }

    public AxisProcessingConfig withCropCenter(final long centerPx) {
        return withCrop(cropEnabled, centerPx, cropSizePx);
    }

    public AxisProcessingConfig withCropSize(final int sizePx) {
        return withCrop(cropEnabled, cropCenterPx, sizePx);
    }

    public AxisProcessingConfig withBinning(final boolean enabled,
                                            final int sizePx) {
        return new AxisProcessingConfig(cropEnabled, cropCenterPx, cropSizePx, enabled, sizePx, padEnabled, padPx, flip);
    }

    public AxisProcessingConfig withPadding(final boolean enabled,
                                            final int px) {
        return new AxisProcessingConfig(cropEnabled, cropCenterPx, cropSizePx, binEnabled, binSizePx, enabled, px, flip);
    }

    public AxisProcessingConfig withFlip(final boolean flip) {
        return new AxisProcessingConfig(cropEnabled, cropCenterPx, cropSizePx, binEnabled, binSizePx, padEnabled, padPx, flip);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (! (o instanceof AxisProcessingConfig)) {
            return false;
        }
        final AxisProcessingConfig that = (AxisProcessingConfig) o;
        return (cropEnabled == that.cropEnabled) && (cropCenterPx == that.cropCenterPx) &&
               (cropSizePx == that.cropSizePx) && (binEnabled == that.binEnabled) &&
               (binSizePx == that.binSizePx) && (padEnabled == that.padEnabled) &&
               (padPx == that.padPx) && (flip == that.flip);
    }

    @Override
    public int hashCode() {
        int result = Boolean.hashCode(cropEnabled);
        result = 31 * result + Long.hashCode(cropCenterPx);
        result = 31 * result + cropSizePx;
        result = 31 * result + Boolean.hashCode(binEnabled);
        result = 31 * result + binSizePx;
        result = 31 * result + Boolean.hashCode(padEnabled);
        result = 31 * result + padPx;
        result = 31 * result + Boolean.hashCode(flip);
        return result;
    }

    @Override
    public String toString() {
        return "{cropEnabled: " + cropEnabled +
               ", cropCenterPx: " + cropCenterPx +
               ", cropSizePx: " + cropSizePx +
               ", binEnabled: " + binEnabled +
               ", binSizePx: " + binSizePx +
               ", padEnabled: " + padEnabled +
               ", padPx: " + padPx +
               ", flip: " + flip +
               '}';
    }
}
