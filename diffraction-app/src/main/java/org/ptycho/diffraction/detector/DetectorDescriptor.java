package org.ptycho.diffraction.detector;

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.ptycho.diffraction.json.JsonUtils;

/**
 * Physical detector description at a point in time.
 * Instances are immutable, changes are made by replacing the descriptor held by
 * {@link org.ptycho.diffraction.settings.DetectorSettings}.
 *
 * @author Diffraction Assembly Developers
 */
public class DetectorDescriptor
        implements Serializable {

    public static final int DEFAULT_EXTENT_PX = 1024;
    public static final double DEFAULT_PIXEL_SIZE_M = 75e-6;
    public static final int DEFAULT_BIT_DEPTH = 8;

    private final int widthPx;
    private final int heightPx;
    private final double pixelWidthM;
    private final double pixelHeightM;
    private final int bitDepth;
    private final String badPixelsFile;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DetectorDescriptor() {
        this.widthPx = DEFAULT_EXTENT_PX;
        this.heightPx = DEFAULT_EXTENT_PX;
        this.pixelWidthM = DEFAULT_PIXEL_SIZE_M;
        this.pixelHeightM = DEFAULT_PIXEL_SIZE_M;
        this.bitDepth = DEFAULT_BIT_DEPTH;
        this.badPixelsFile = null;
    }

    public DetectorDescriptor(final int widthPx,
                              final int heightPx,
                              final double pixelWidthM,
                              final double pixelHeightM,
                              final int bitDepth,
                              final Path badPixelsFile)
            throws IllegalArgumentException {

        if ((widthPx < 1) || (heightPx < 1)) {
            throw new IllegalArgumentException("detector extent must be at least 1x1, got " +
                                               widthPx + "x" + heightPx);
        }
        if (bitDepth < 1) {
            throw new IllegalArgumentException("bit depth must be at least 1, got " + bitDepth);
        }
        if ((pixelWidthM < 0) || (pixelHeightM < 0)) {
            throw new IllegalArgumentException("pixel size must not be negative, got " +
                                               pixelWidthM + "x" + pixelHeightM);
        }

        this.widthPx = widthPx;
        this.heightPx = heightPx;
        this.pixelWidthM = pixelWidthM;
        this.pixelHeightM = pixelHeightM;
        this.bitDepth = bitDepth;
        this.badPixelsFile = badPixelsFile == null ? null : badPixelsFile.toString();
    }

    public static DetectorDescriptor withDefaults() {
        return new DetectorDescriptor();
    }

    public int getWidthPx() {
        return widthPx;
    }

    public int getHeightPx() {
        return heightPx;
    }

    public ImageExtent getExtent() {
        return new ImageExtent(widthPx, heightPx);
    }

    public double getPixelWidthM() {
        return pixelWidthM;
    }

    public double getPixelHeightM() {
        return pixelHeightM;
    }

    public PixelGeometry getPixelGeometry() {
        return new PixelGeometry(pixelWidthM, pixelHeightM);
    }

    public int getBitDepth() {
        return bitDepth;
    }

    public Path getBadPixelsFile() {
        return badPixelsFile == null ? null : Paths.get(badPixelsFile);
    }

    public DetectorDescriptor withExtent(final ImageExtent extent) {
        return new DetectorDescriptor(extent.getWidthPx(), extent.getHeightPx(),
                                      pixelWidthM, pixelHeightM, bitDepth, getBadPixelsFile());
    }

    public DetectorDescriptor withPixelGeometry(final PixelGeometry pixelGeometry) {
        return new DetectorDescriptor(widthPx, heightPx,
                                      pixelGeometry.getWidthM(), pixelGeometry.getHeightM(),
                                      bitDepth, getBadPixelsFile());
    }

    public DetectorDescriptor withBitDepth(final int bitDepth) {
        return new DetectorDescriptor(widthPx, heightPx, pixelWidthM, pixelHeightM, bitDepth, getBadPixelsFile());
    }

    public DetectorDescriptor withBadPixelsFile(final Path badPixelsFile) {
        return new DetectorDescriptor(widthPx, heightPx, pixelWidthM, pixelHeightM, bitDepth, badPixelsFile);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static DetectorDescriptor fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<DetectorDescriptor> JSON_HELPER =
            new JsonUtils.Helper<>(DetectorDescriptor.class);
}
