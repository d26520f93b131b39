package org.ptycho.diffraction.dataset;

/**
 * Load state of a {@link PatternArray}.
 * Arrays move from NOT_LOADED to LOADING and then to LOADED or FAILED.
 * Only a dataset reload or clear resets an array.
 *
 * @author Diffraction Assembly Developers
 */
public enum PatternState {
    NOT_LOADED,
    LOADING,
    LOADED,
    FAILED
}
