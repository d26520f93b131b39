package org.ptycho.diffraction.dataset;

/**
 * @author Diffraction Assembly Developers
 */
public enum DatasetState {
    EMPTY,
    POPULATED
}
