package org.ptycho.diffraction.api;

import org.ptycho.diffraction.loader.BadPixelsFileReader;
import org.ptycho.diffraction.loader.DiffractionFileReader;
import org.ptycho.diffraction.loader.DiffractionFileWriter;
import org.ptycho.diffraction.loader.JsonBadPixelsReader;
import org.ptycho.diffraction.loader.TiffBadPixelsReader;
import org.ptycho.diffraction.loader.TiffDirectoryReader;
import org.ptycho.diffraction.loader.TiffFileReader;
import org.ptycho.diffraction.loader.TiffFileWriter;

/**
 * Keys and default registries for the supported file formats.
 *
 * @author Diffraction Assembly Developers
 */
public class FileTypes {

    public static final String TIFF = "TIFF";
    public static final String TIFF_DIRECTORY = "TIFF_DIRECTORY";
    public static final String TIFF_BAD_PIXELS = "TIFF_Bad_Pixels";
    public static final String JSON_BAD_PIXELS = "JSON_Bad_Pixels";

    public static StrategyRegistry<DiffractionFileReader> buildPatternReaders() {
        return new StrategyRegistry<DiffractionFileReader>()
                .register(TIFF, "Tagged Image File Format (*.tif *.tiff)", new TiffFileReader())
                .register(TIFF_DIRECTORY, "Directory of TIFF files", new TiffDirectoryReader());
    }

    public static StrategyRegistry<DiffractionFileWriter> buildPatternWriters() {
        return new StrategyRegistry<DiffractionFileWriter>()
                .register(TIFF, "Tagged Image File Format (*.tif *.tiff)", new TiffFileWriter());
    }

    public static StrategyRegistry<BadPixelsFileReader> buildBadPixelsReaders() {
        return new StrategyRegistry<BadPixelsFileReader>()
                .register(TIFF_BAD_PIXELS, "TIFF Bad Pixels (*.tif *.tiff)", new TiffBadPixelsReader())
                .register(JSON_BAD_PIXELS, "JSON Bad Pixels (*.json)", new JsonBadPixelsReader());
    }

    private FileTypes() {
    }
}
