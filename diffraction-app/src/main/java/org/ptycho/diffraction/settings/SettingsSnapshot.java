package org.ptycho.diffraction.settings;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.ptycho.diffraction.detector.DetectorDescriptor;
import org.ptycho.diffraction.json.JsonUtils;
import org.ptycho.diffraction.sizer.ProcessingConfig;

/**
 * JSON persistable copy of {@link DiffractionSettings} values.
 *
 * @author Diffraction Assembly Developers
 */
public class SettingsSnapshot
        implements Serializable {

    private final DetectorDescriptor detector;
    private final ProcessingConfig processingConfig;
    private final int numDataThreads;
    private final boolean memmapEnabled;
    private final String scratchDirectory;
    private final String fileType;
    private final String badPixelsFileType;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private SettingsSnapshot() {
        this(null, null, DiffractionSettings.DEFAULT_NUM_DATA_THREADS, false, null, null, null);
    }

    public SettingsSnapshot(final DetectorDescriptor detector,
                            final ProcessingConfig processingConfig,
                            final int numDataThreads,
                            final boolean memmapEnabled,
                            final Path scratchDirectory,
                            final String fileType,
                            final String badPixelsFileType) {
        this.detector = detector;
        this.processingConfig = processingConfig;
        this.numDataThreads = numDataThreads;
        this.memmapEnabled = memmapEnabled;
        this.scratchDirectory = scratchDirectory == null ? null : scratchDirectory.toString();
        this.fileType = fileType;
        this.badPixelsFileType = badPixelsFileType;
    }

    public DetectorDescriptor getDetector() {
        return detector;
    }

    public ProcessingConfig getProcessingConfig() {
        return processingConfig;
    }

    public int getNumDataThreads() {
        return numDataThreads;
    }

    public boolean isMemmapEnabled() {
        return memmapEnabled;
    }

    public Path getScratchDirectory() {
        return scratchDirectory == null ? null : Paths.get(scratchDirectory);
    }

    public String getFileType() {
        return fileType;
    }

    public String getBadPixelsFileType() {
        return badPixelsFileType;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return toJson();
    }

    public static SettingsSnapshot fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    public static SettingsSnapshot fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    public static SettingsSnapshot load(final String path)
            throws IllegalArgumentException {
        try {
            return JSON_HELPER.readFile(Paths.get(path));
        } catch (final IOException e) {
            throw new IllegalArgumentException("failed to load settings from " + path, e);
        }
    }

    public void save(final Path path)
            throws IOException {
        JSON_HELPER.writeFile(this, path);
    }

    private static final JsonUtils.Helper<SettingsSnapshot> JSON_HELPER =
            new JsonUtils.Helper<>(SettingsSnapshot.class);
}
