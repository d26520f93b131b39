package org.ptycho.diffraction.mask;

/**
 * Notified after the active bad pixels mask is replaced or cleared.
 *
 * @author Diffraction Assembly Developers
 */
public interface BadPixelsListener {

    /**
     * @param  badPixelCount  number of bad pixels in the new mask (0 after clear).
     */
    void handleBadPixelsChanged(final int badPixelCount);

}
