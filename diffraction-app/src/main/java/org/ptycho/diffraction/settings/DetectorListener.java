package org.ptycho.diffraction.settings;

import org.ptycho.diffraction.detector.DetectorDescriptor;

/**
 * Notified after the current {@link DetectorDescriptor} of a {@link DetectorSettings} instance is replaced.
 *
 * @author Diffraction Assembly Developers
 */
public interface DetectorListener {

    void handleDetectorChanged(final DetectorDescriptor previousDetector,
                               final DetectorDescriptor currentDetector);

}
