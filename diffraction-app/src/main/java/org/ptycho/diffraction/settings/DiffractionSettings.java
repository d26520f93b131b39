package org.ptycho.diffraction.settings;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.ptycho.diffraction.detector.DetectorDescriptor;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.sizer.AxisProcessingConfig;
import org.ptycho.diffraction.sizer.CropCenter;
import org.ptycho.diffraction.sizer.Interval;
import org.ptycho.diffraction.sizer.PatternSizer;
import org.ptycho.diffraction.sizer.ProcessingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed, bounded configuration for dataset assembly.
 * Out of range values are clamped to their legal ranges.
 * Every change increments a version counter that keys the cached {@link PatternSizer}.
 *
 * @author Diffraction Assembly Developers
 */
public class DiffractionSettings
        implements DetectorListener {

    public static final Interval NUM_DATA_THREADS_LIMITS = new Interval(1, 64);
    public static final int DEFAULT_NUM_DATA_THREADS = 8;
    public static final String DEFAULT_FILE_TYPE = "TIFF";
    public static final String DEFAULT_BAD_PIXELS_FILE_TYPE = "TIFF_Bad_Pixels";

    public static Path getDefaultScratchDirectory() {
        return Paths.get(System.getProperty("user.home"), ".diffraction-assembly");
    }

    private final DetectorSettings detectorSettings;
    private final List<Runnable> listeners;

    private ProcessingConfig processingConfig;
    private int numDataThreads;
    private boolean memmapEnabled;
    private Path scratchDirectory;
    private String fileType;
    private String badPixelsFileType;

    private long version;
    private long sizerVersion;
    private PatternSizer sizer;

    public DiffractionSettings() {
        this(new DetectorSettings());
    }

    public DiffractionSettings(final DetectorSettings detectorSettings) {
        this.detectorSettings = detectorSettings;
        this.listeners = new CopyOnWriteArrayList<>();
        this.processingConfig = ProcessingConfig.withDefaults();
        this.numDataThreads = DEFAULT_NUM_DATA_THREADS;
        this.memmapEnabled = false;
        this.scratchDirectory = getDefaultScratchDirectory();
        this.fileType = DEFAULT_FILE_TYPE;
        this.badPixelsFileType = DEFAULT_BAD_PIXELS_FILE_TYPE;
        this.version = 0;
        this.sizerVersion = -1;
        this.sizer = null;
        detectorSettings.addListener(this);
    }

    public DetectorSettings getDetectorSettings() {
        return detectorSettings;
    }

    public synchronized ProcessingConfig getProcessingConfig() {
        return processingConfig;
    }

    public void setProcessingConfig(final ProcessingConfig processingConfig)
            throws IllegalArgumentException {
        if (processingConfig == null) {
            throw new IllegalArgumentException("processing config must be specified");
        }
        synchronized (this) {
            this.processingConfig = processingConfig;
            version++;
        }
        notifyListeners();
    }

    public void setCropCenter(final CropCenter cropCenter) {
        setProcessingConfig(getProcessingConfig().withCropCenter(cropCenter));
    }

    /**
     * Enables cropping on both axes with the specified window size.
     */
    public void setCropExtent(final ImageExtent cropExtent) {
        final ProcessingConfig config = getProcessingConfig();
        final AxisProcessingConfig x = config.getX();
        final AxisProcessingConfig y = config.getY();
        setProcessingConfig(config.withX(x.withCrop(true, x.getCropCenterPx(), cropExtent.getWidthPx()))
                                  .withY(y.withCrop(true, y.getCropCenterPx(), cropExtent.getHeightPx())));
    }

    public synchronized int getNumDataThreads() {
        return numDataThreads;
    }

    /**
     * Sets the loader pool size, clamped to {@link #NUM_DATA_THREADS_LIMITS}.
     */
    public void setNumDataThreads(final int numDataThreads) {
        final int clamped = NUM_DATA_THREADS_LIMITS.clamp(numDataThreads);
        if (clamped != numDataThreads) {
            LOG.warn("setNumDataThreads: clamped {} to {}", numDataThreads, clamped);
        }
        synchronized (this) {
            this.numDataThreads = clamped;
            version++;
        }
        notifyListeners();
    }

    public synchronized boolean isMemmapEnabled() {
        return memmapEnabled;
    }

    public void setMemmapEnabled(final boolean memmapEnabled) {
        synchronized (this) {
            this.memmapEnabled = memmapEnabled;
            version++;
        }
        notifyListeners();
    }

    public synchronized Path getScratchDirectory() {
        return scratchDirectory;
    }

    public void setScratchDirectory(final Path scratchDirectory) {
        synchronized (this) {
            this.scratchDirectory = scratchDirectory == null ? getDefaultScratchDirectory() : scratchDirectory;
            version++;
        }
        notifyListeners();
    }

    public synchronized String getFileType() {
        return fileType;
    }

    public void setFileType(final String fileType) {
        synchronized (this) {
            this.fileType = fileType == null ? DEFAULT_FILE_TYPE : fileType;
            version++;
        }
        notifyListeners();
    }

    public synchronized String getBadPixelsFileType() {
        return badPixelsFileType;
    }

    public void setBadPixelsFileType(final String badPixelsFileType) {
        synchronized (this) {
            this.badPixelsFileType = badPixelsFileType == null ? DEFAULT_BAD_PIXELS_FILE_TYPE : badPixelsFileType;
            version++;
        }
        notifyListeners();
    }

    public synchronized long getVersion() {
        return version;
    }

    /**
     * @return sizer for the current detector and processing configuration (rebuilt only after changes).
     */
    public PatternSizer getPatternSizer() {
        final DetectorDescriptor detector = detectorSettings.getDetector();
        synchronized (this) {
            if ((sizer == null) || (sizerVersion != version) || (sizer.getDetector() != detector)) {
                sizer = new PatternSizer(detector, processingConfig);
                sizerVersion = version;
            }
            return sizer;
        }
    }

    @Override
    public void handleDetectorChanged(final DetectorDescriptor previousDetector,
                                      final DetectorDescriptor currentDetector) {
        synchronized (this) {
            version++;
        }
        notifyListeners();
    }

    /**
     * Adds a listener that is run after every settings change.
     */
    public void addListener(final Runnable listener) {
        listeners.add(listener);
    }

    public void removeListener(final Runnable listener) {
        listeners.remove(listener);
    }

    /**
     * Applies all values from the specified snapshot.
     */
    public void apply(final SettingsSnapshot snapshot) {
        LOG.info("apply: entry, snapshot={}", snapshot);
        if (snapshot.getDetector() != null) {
            detectorSettings.setDetector(snapshot.getDetector());
        }
        if (snapshot.getProcessingConfig() != null) {
            setProcessingConfig(snapshot.getProcessingConfig());
        }
        setNumDataThreads(snapshot.getNumDataThreads());
        setMemmapEnabled(snapshot.isMemmapEnabled());
        setScratchDirectory(snapshot.getScratchDirectory());
        setFileType(snapshot.getFileType());
        setBadPixelsFileType(snapshot.getBadPixelsFileType());
    }

    public SettingsSnapshot toSnapshot() {
        synchronized (this) {
            return new SettingsSnapshot(detectorSettings.getDetector(),
                                        processingConfig,
                                        numDataThreads,
                                        memmapEnabled,
                                        scratchDirectory,
                                        fileType,
                                        badPixelsFileType);
        }
    }

    private void notifyListeners() {
        for (final Runnable listener : listeners) {
            listener.run();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(DiffractionSettings.class);
}
