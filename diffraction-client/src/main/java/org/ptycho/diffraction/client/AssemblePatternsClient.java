package org.ptycho.diffraction.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.ptycho.diffraction.api.DiffractionApi;
import org.ptycho.diffraction.api.OpenPatternsOverrides;
import org.ptycho.diffraction.client.parameter.CommandLineParameters;
import org.ptycho.diffraction.client.parameter.DiffractionSettingsParameters;
import org.ptycho.diffraction.data.DiffractionMetadata;
import org.ptycho.diffraction.dataset.AssemblyStatistics;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.sizer.CropCenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for opening a pattern file, assembling it and writing the processed patterns.
 *
 * @author Diffraction Assembly Developers
 */
public class AssemblePatternsClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public DiffractionSettingsParameters settings = new DiffractionSettingsParameters();

        @Parameter(
                names = "--input",
                description = "Pattern file (or directory) to open",
                required = true)
        public String input;

        @Parameter(
                names = "--fileType",
                description = "Reader key for the input (e.g. TIFF or TIFF_DIRECTORY), default is the configured type")
        public String fileType;

        @Parameter(
                names = "--badPixels",
                description = "Bad pixels file to apply")
        public String badPixels;

        @Parameter(
                names = "--badPixelsFileType",
                description = "Reader key for the bad pixels file (e.g. TIFF_Bad_Pixels or JSON_Bad_Pixels)")
        public String badPixelsFileType;

        @Parameter(
                names = "--cropCenterX",
                description = "Crop center x position override (requires --cropCenterY)")
        public Long cropCenterX;

        @Parameter(
                names = "--cropCenterY",
                description = "Crop center y position override (requires --cropCenterX)")
        public Long cropCenterY;

        @Parameter(
                names = "--cropWidth",
                description = "Crop width override (requires --cropHeight)")
        public Integer cropWidth;

        @Parameter(
                names = "--cropHeight",
                description = "Crop height override (requires --cropWidth)")
        public Integer cropHeight;

        @Parameter(
                names = "--export",
                description = "Write assembled patterns in bulk binary form to this file (.gz names are compressed)")
        public String export;

        @Parameter(
                names = "--save",
                description = "Write processed patterns to this file")
        public String save;

        @Parameter(
                names = "--saveFileType",
                description = "Writer key for --save, default is the configured type")
        public String saveFileType;

        @Override
        public void validate()
                throws IllegalArgumentException {
            buildOverrides();
        }

        public OpenPatternsOverrides buildOverrides()
                throws IllegalArgumentException {

            if ((cropCenterX == null) != (cropCenterY == null)) {
                throw new IllegalArgumentException("--cropCenterX and --cropCenterY must be specified together");
            }
            if ((cropWidth == null) != (cropHeight == null)) {
                throw new IllegalArgumentException("--cropWidth and --cropHeight must be specified together");
            }

            final CropCenter cropCenter = cropCenterX == null ? null : new CropCenter(cropCenterX, cropCenterY);
            final ImageExtent cropExtent = cropWidth == null ? null : new ImageExtent(cropWidth, cropHeight);
            return new OpenPatternsOverrides(cropCenter, cropExtent, null);
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final AssemblePatternsClient client = new AssemblePatternsClient(parameters);
                client.assemble();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final DiffractionApi api;

    public AssemblePatternsClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.parameters = parameters;
        this.api = new DiffractionApi(parameters.settings.buildSettings());
    }

    public DiffractionApi getApi() {
        return api;
    }

    public AssemblyStatistics assemble()
            throws IllegalArgumentException {

        final OpenPatternsOverrides overrides = parameters.buildOverrides();
        final DiffractionMetadata metadata = api.openPatterns(Paths.get(parameters.input),
                                                              parameters.fileType,
                                                              overrides);

        LOG.info("assemble: opened {}", metadata);

        if (parameters.badPixels != null) {
            final int badPixelCount = api.openBadPixels(Paths.get(parameters.badPixels),
                                                        parameters.badPixelsFileType);
            LOG.info("assemble: applied {} bad pixels", badPixelCount);
        }

        api.startAssemblingPatterns();
        final AssemblyStatistics statistics = api.finishAssemblingPatterns(true);

        LOG.info("assemble: {}", api.getDataset().getInfoText());

        if (parameters.export != null) {
            final Path exportPath = Paths.get(parameters.export);
            api.exportAssembledPatterns(exportPath);
            LOG.info("assemble: exported assembled patterns to {}", exportPath);
        }

        if (parameters.save != null) {
            final Path savePath = Paths.get(parameters.save);
            api.savePatterns(savePath, parameters.saveFileType);
            LOG.info("assemble: saved processed patterns to {}", savePath);
        }

        return statistics;
    }

    private static final Logger LOG = LoggerFactory.getLogger(AssemblePatternsClient.class);
}
