package org.ptycho.diffraction.processor;

import java.io.Serializable;

import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;

/**
 * Common interface for all steps of a {@link PatternProcessor}.
 *
 * @author Diffraction Assembly Developers
 */
public interface PatternTransform extends Serializable {

    /**
     * Apply this step to every frame of a stack.
     *
     * @param  patterns  patterns to process (not modified).
     *
     * @return newly allocated processed patterns.
     */
    IntPatternStack process(final PatternStack patterns);

    /**
     * Apply the geometric part of this step to a defect mask so that it stays aligned with processed patterns.
     *
     * @param  badPixels  mask to process (not modified).
     *
     * @return processed mask.
     */
    BadPixels processBadPixels(final BadPixels badPixels);

}
