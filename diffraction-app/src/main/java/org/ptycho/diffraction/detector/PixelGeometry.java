package org.ptycho.diffraction.detector;

import java.io.Serializable;

/**
 * Physical size of one pixel in meters.
 *
 * @author Diffraction Assembly Developers
 */
public class PixelGeometry
        implements Serializable {

    private final double widthM;
    private final double heightM;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private PixelGeometry() {
        this(0.0, 0.0);
    }

    public PixelGeometry(final double widthM,
                         final double heightM) {
        this.widthM = widthM;
        this.heightM = heightM;
    }

    public double getWidthM() {
        return widthM;
    }

    public double getHeightM() {
        return heightM;
    }

    public double getAreaM2() {
        return widthM * heightM;
    }

    public double getAspectRatio() {
        return widthM / heightM;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (! (o instanceof PixelGeometry)) {
            return false;
        }
        final PixelGeometry that = (PixelGeometry) o;
        return (Double.compare(widthM, that.widthM) == 0) && (Double.compare(heightM, that.heightM) == 0);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(widthM) + Double.hashCode(heightM);
    }

    @Override
    public String toString() {
        return "{widthM: " + widthM + ", heightM: " + heightM + '}';
    }
}
