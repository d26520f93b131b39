package org.ptycho.diffraction.settings;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.ptycho.diffraction.detector.DetectorDescriptor;
import org.ptycho.diffraction.detector.ImageExtent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current {@link DetectorDescriptor} and notifies listeners when it changes.
 *
 * @author Diffraction Assembly Developers
 */
public class DetectorSettings {

    private final List<DetectorListener> listeners;
    private DetectorDescriptor detector;

    public DetectorSettings() {
        this(DetectorDescriptor.withDefaults());
    }

    public DetectorSettings(final DetectorDescriptor detector) {
        this.listeners = new CopyOnWriteArrayList<>();
        this.detector = detector;
    }

    public synchronized DetectorDescriptor getDetector() {
        return detector;
    }

    public ImageExtent getExtent() {
        return getDetector().getExtent();
    }

    /**
     * Replaces the current detector and notifies listeners if it differs from the previous one.
     */
    public void setDetector(final DetectorDescriptor detector)
            throws IllegalArgumentException {

        if (detector == null) {
            throw new IllegalArgumentException("detector must be specified");
        }

        final DetectorDescriptor previousDetector;
        synchronized (this) {
            previousDetector = this.detector;
            this.detector = detector;
        }

        if (! previousDetector.toJson().equals(detector.toJson())) {
            LOG.debug("setDetector: changed from {} to {}", previousDetector.getExtent(), detector.getExtent());
            for (final DetectorListener listener : listeners) {
                listener.handleDetectorChanged(previousDetector, detector);
            }
        }
    }

    public void setExtent(final ImageExtent extent) {
        setDetector(getDetector().withExtent(extent));
    }

    public void addListener(final DetectorListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final DetectorListener listener) {
        listeners.remove(listener);
    }

    private static final Logger LOG = LoggerFactory.getLogger(DetectorSettings.class);
}
