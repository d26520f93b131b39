package org.ptycho.diffraction.mask;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.detector.DetectorDescriptor;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.settings.DetectorListener;
import org.ptycho.diffraction.settings.DetectorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Active detector defect mask.
 * The mask is either absent (all pixels good) or has exactly the current detector extent.
 * When the detector extent changes so that the mask no longer fits, the mask clears itself.
 *
 * @author Diffraction Assembly Developers
 */
public class BadPixelsMask
        implements DetectorListener {

    private final DetectorSettings detectorSettings;
    private final List<BadPixelsListener> listeners;
    private BadPixels badPixels;

    public BadPixelsMask(final DetectorSettings detectorSettings) {
        this.detectorSettings = detectorSettings;
        this.listeners = new CopyOnWriteArrayList<>();
        this.badPixels = null;
        detectorSettings.addListener(this);
    }

    /**
     * @return current mask or null if no mask is set.
     */
    public synchronized BadPixels getBadPixels() {
        return badPixels;
    }

    public synchronized int getCount() {
        return badPixels == null ? 0 : badPixels.getCount();
    }

    public synchronized boolean isBad(final int x,
                                      final int y) {
        return (badPixels != null) && badPixels.isBad(x, y);
    }

    /**
     * @return copy of the current mask values (all false when no mask is set).
     */
    public synchronized boolean[] copyMask() {
        return badPixels == null ? new boolean[detectorSettings.getExtent().getSize()] : badPixels.copyMask();
    }

    /**
     * Replaces the current mask.
     *
     * @throws DiffractionDataException
     *   if the mask extent differs from the detector extent (the previous mask is kept).
     */
    public void set(final BadPixels badPixels)
            throws DiffractionDataException {

        if (badPixels == null) {
            clear();
            return;
        }

        final ImageExtent detectorExtent = detectorSettings.getExtent();
        if (! detectorExtent.equals(badPixels.getExtent())) {
            throw DiffractionDataException.shapeMismatch(badPixels.getExtent(), detectorExtent);
        }

        synchronized (this) {
            this.badPixels = badPixels;
        }

        LOG.info("set: {} bad pixels", badPixels.getCount());
        notifyListeners(badPixels.getCount());
    }

    public void clear() {
        synchronized (this) {
            this.badPixels = null;
        }
        notifyListeners(0);
    }

    @Override
    public void handleDetectorChanged(final DetectorDescriptor previousDetector,
                                      final DetectorDescriptor currentDetector) {
        final boolean cleared;
        synchronized (this) {
            cleared = (badPixels != null) && (! badPixels.getExtent().equals(currentDetector.getExtent()));
            if (cleared) {
                badPixels = null;
            }
        }
        if (cleared) {
            LOG.info("handleDetectorChanged: cleared mask that does not fit detector extent {}",
                     currentDetector.getExtent());
            notifyListeners(0);
        }
    }

    public void addListener(final BadPixelsListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final BadPixelsListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(final int badPixelCount) {
        for (final BadPixelsListener listener : listeners) {
            listener.handleBadPixelsChanged(badPixelCount);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(BadPixelsMask.class);
}
