package org.ptycho.diffraction.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.nio.file.Paths;

import org.ptycho.diffraction.settings.DiffractionSettings;
import org.ptycho.diffraction.settings.SettingsSnapshot;

/**
 * Parameters for building {@link DiffractionSettings}.
 * Values given on the command line override values loaded from the settings file.
 *
 * @author Diffraction Assembly Developers
 */
public class DiffractionSettingsParameters
        implements Serializable {

    @Parameter(
            names = "--settings",
            description = "JSON file with detector, processing and loader settings")
    public String settingsFile;

    @Parameter(
            names = "--numDataThreads",
            description = "Number of threads used to load and process arrays (1 to 64)")
    public Integer numDataThreads;

    @Parameter(
            names = "--memmap",
            description = "Store processed patterns in a memory mapped scratch file",
            arity = 0)
    public boolean memmap = false;

    @Parameter(
            names = "--scratchDirectory",
            description = "Directory for memory mapped scratch files")
    public String scratchDirectory;

    public DiffractionSettings buildSettings()
            throws IllegalArgumentException {

        final DiffractionSettings settings = new DiffractionSettings();

        if (settingsFile != null) {
            settings.apply(SettingsSnapshot.load(settingsFile));
        }
        if (numDataThreads != null) {
            settings.setNumDataThreads(numDataThreads);
        }
        if (memmap) {
            settings.setMemmapEnabled(true);
        }
        if (scratchDirectory != null) {
            settings.setScratchDirectory(Paths.get(scratchDirectory));
        }

        return settings;
    }
}
