package org.ptycho.diffraction.sizer;

import java.io.Serializable;

/**
 * Closed integer interval [lower, upper] used to report legal configuration ranges.
 *
 * @author Diffraction Assembly Developers
 */
public class Interval
        implements Serializable {

    private final long lower;
    private final long upper;

    public Interval(final long lower,
                    final long upper) {
        if (upper < lower) {
            throw new IllegalArgumentException("upper bound " + upper + " is less than lower bound " + lower);
        }
        this.lower = lower;
        this.upper = upper;
    }

    public long getLower() {
        return lower;
    }

    public long getUpper() {
        return upper;
    }

    public long clamp(final long value) {
        return Math.max(lower, Math.min(upper, value));
    }

    public int clamp(final int value) {
        return (int) clamp((long) value);
    }

    public boolean contains(final long value) {
        return (value >= lower) && (value <= upper);
    }

    public long getLength() {
        return upper - lower;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (! (o instanceof Interval)) {
            return false;
        }
        final Interval that = (Interval) o;
        return (lower == that.lower) && (upper == that.upper);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(lower) + Long.hashCode(upper);
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
