package org.ptycho.diffraction.sizer;

import java.io.Serializable;

/**
 * Crop window center position on the detector.
 *
 * @author Diffraction Assembly Developers
 */
public class CropCenter
        implements Serializable {

    private final long positionXPx;
    private final long positionYPx;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private CropCenter() {
        this(0, 0);
    }

    public CropCenter(final long positionXPx,
                      final long positionYPx) {
        this.positionXPx = positionXPx;
        this.positionYPx = positionYPx;
    }

    public long getPositionXPx() {
        return positionXPx;
    }

    public long getPositionYPx() {
        return positionYPx;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (! (o instanceof CropCenter)) {
            return false;
        }
        final CropCenter that = (CropCenter) o;
        return (positionXPx == that.positionXPx) && (positionYPx == that.positionYPx);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(positionXPx) + Long.hashCode(positionYPx);
    }

    @Override
    public String toString() {
        return "(" + positionXPx + ", " + positionYPx + ")";
    }
}
