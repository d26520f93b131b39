package org.ptycho.diffraction.processor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Applies an ordered list of {@link PatternTransform} steps to raw detector patterns.
 * Instances are immutable so a single processor snapshot can be shared by all loader threads.
 *
 * @author Diffraction Assembly Developers
 */
public class PatternProcessor
        implements Serializable {

    private final ImageExtent inputExtent;
    private final ImageExtent outputExtent;
    private final List<PatternTransform> transformList;

    /**
     * @param  inputExtent    extent every raw pattern must have.
     * @param  outputExtent   extent of processed patterns.
     * @param  transformList  steps to apply in order.
     */
    public PatternProcessor(final ImageExtent inputExtent,
                            final ImageExtent outputExtent,
                            final List<PatternTransform> transformList) {
        this.inputExtent = inputExtent;
        this.outputExtent = outputExtent;
        this.transformList = Collections.unmodifiableList(new ArrayList<>(transformList));
    }

    public ImageExtent getInputExtent() {
        return inputExtent;
    }

    public ImageExtent getOutputExtent() {
        return outputExtent;
    }

    public List<PatternTransform> getTransformList() {
        return transformList;
    }

    /**
     * @return processed copy of the specified patterns.
     *
     * @throws DiffractionDataException
     *   if the pattern extent does not match the detector extent.
     */
    public IntPatternStack process(final PatternStack patterns)
            throws DiffractionDataException {

        if (! inputExtent.equals(patterns.getFrameExtent())) {
            throw DiffractionDataException.shapeMismatch(patterns.getFrameExtent(), inputExtent);
        }

        IntPatternStack result = IntPatternStack.copyOf(patterns);
        for (final PatternTransform transform : transformList) {
            result = transform.process(result);
        }
        return result;
    }

    /**
     * @return processed mask aligned with processed patterns (or an all good mask if badPixels is null).
     *
     * @throws DiffractionDataException
     *   if the mask extent does not match the detector extent.
     */
    public BadPixels processBadPixels(final BadPixels badPixels)
            throws DiffractionDataException {

        if (badPixels == null) {
            return BadPixels.allGood(outputExtent);
        }
        if (! inputExtent.equals(badPixels.getExtent())) {
            throw DiffractionDataException.shapeMismatch(badPixels.getExtent(), inputExtent);
        }

        BadPixels result = badPixels;
        for (final PatternTransform transform : transformList) {
            result = transform.processBadPixels(result);
        }
        return result;
    }

    @Override
    public String toString() {
        return "{inputExtent: " + inputExtent + ", outputExtent: " + outputExtent + ", transformList: " +
               transformList + '}';
    }
}
