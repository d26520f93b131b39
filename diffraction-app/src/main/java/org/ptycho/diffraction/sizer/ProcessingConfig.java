package org.ptycho.diffraction.sizer;

import java.io.Serializable;
import java.util.Objects;

import org.ptycho.diffraction.json.JsonUtils;

/**
 * Complete pattern processing configuration: one {@link AxisProcessingConfig} per axis,
 * a shared transpose flag and optional value bounds applied to every pattern.
 *
 * @author Diffraction Assembly Developers
 */
public class ProcessingConfig
        implements Serializable {

    private final AxisProcessingConfig x;
    private final AxisProcessingConfig y;
    private final boolean transpose;
    private final Integer valueLowerBound;
    private final Integer valueUpperBound;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ProcessingConfig() {
        this(AxisProcessingConfig.withDefaults(), AxisProcessingConfig.withDefaults(), false, null, null);
    }

    /**
     * @param  x                 horizontal axis configuration (flip = horizontal flip).
     * @param  y                 vertical axis configuration (flip = vertical flip).
     * @param  transpose         swap axes after all other steps.
     * @param  valueLowerBound   (optional) values below this bound are zeroed.
     * @param  valueUpperBound   (optional) values at or above this bound are zeroed.
     */
    public ProcessingConfig(final AxisProcessingConfig x,
                            final AxisProcessingConfig y,
                            final boolean transpose,
                            final Integer valueLowerBound,
                            final Integer valueUpperBound) {
        if ((x == null) || (y == null)) {
            throw new IllegalArgumentException("both axis configurations must be specified");
        }
        this.x = x;
        this.y = y;
        this.transpose = transpose;
        this.valueLowerBound = valueLowerBound;
        this.valueUpperBound = valueUpperBound;
    }

    public static ProcessingConfig withDefaults() {
        return new ProcessingConfig();
    }

    public AxisProcessingConfig getX() {
        return x;
    }

    public AxisProcessingConfig getY() {
        return y;
    }

    public boolean isTranspose() {
        return transpose;
    }

    public Integer getValueLowerBound() {
        return valueLowerBound;
    }

    public Integer getValueUpperBound() {
        return valueUpperBound;
    }

    public ProcessingConfig withX(final AxisProcessingConfig x) {
        return new ProcessingConfig(x, y, transpose, valueLowerBound, valueUpperBound);
    }

    public ProcessingConfig withY(final AxisProcessingConfig y) {
        return new ProcessingConfig(x, y, transpose, valueLowerBound, valueUpperBound);
    }

    public ProcessingConfig withTranspose(final boolean transpose) {
        return new ProcessingConfig(x, y, transpose, valueLowerBound, valueUpperBound);
    }

    public ProcessingConfig withValueBounds(final Integer lowerBound,
                                            final Integer upperBound) {
        return new ProcessingConfig(x, y, transpose, lowerBound, upperBound);
    }

    public ProcessingConfig withCropCenter(final CropCenter center) {
        return new ProcessingConfig(x.withCropCenter(center.getPositionXPx()),
                                    y.withCropCenter(center.getPositionYPx()),
                                    transpose, valueLowerBound, valueUpperBound);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (! (o instanceof ProcessingConfig)) {
            return false;
        }
        final ProcessingConfig that = (ProcessingConfig) o;
        return x.equals(that.x) && y.equals(that.y) && (transpose == that.transpose) &&
               Objects.equals(valueLowerBound, that.valueLowerBound) &&
               Objects.equals(valueUpperBound, that.valueUpperBound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, transpose, valueLowerBound, valueUpperBound);
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static ProcessingConfig fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<ProcessingConfig> JSON_HELPER =
            new JsonUtils.Helper<>(ProcessingConfig.class);
}
