package org.ptycho.diffraction.processor;

import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;

/**
 * Zeroes values below a lower bound and values at or above an upper bound.
 * Either bound may be null (disabled).
 *
 * @author Diffraction Assembly Developers
 */
public class ValueBoundsFilter
        implements PatternTransform {

    private final Integer lowerBound;
    private final Integer upperBound;

    public ValueBoundsFilter(final Integer lowerBound,
                             final Integer upperBound) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public boolean isEnabled() {
        return (lowerBound != null) || (upperBound != null);
    }

    @Override
    public IntPatternStack process(final PatternStack patterns) {
        final IntPatternStack result = IntPatternStack.copyOf(patterns);
        final int[] data = result.getData();
        for (int i = 0; i < data.length; i++) {
            final int value = data[i];
            if (((lowerBound != null) && (value < lowerBound)) ||
                ((upperBound != null) && (value >= upperBound))) {
                data[i] = 0;
            }
        }
        return result;
    }

    @Override
    public BadPixels processBadPixels(final BadPixels badPixels) {
        return badPixels;
    }

    @Override
    public String toString() {
        return "ValueBoundsFilter{lowerBound: " + lowerBound + ", upperBound: " + upperBound + '}';
    }
}
