package org.ptycho.diffraction.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.ptycho.diffraction.api.DiffractionApi;
import org.ptycho.diffraction.client.parameter.CommandLineParameters;
import org.ptycho.diffraction.client.parameter.DiffractionSettingsParameters;
import org.ptycho.diffraction.data.DiffractionMetadata;
import org.ptycho.diffraction.dataset.AssemblyStatistics;
import org.ptycho.diffraction.loader.TiffDirectoryReader;
import org.ptycho.diffraction.loader.TiffStacks;
import org.ptycho.diffraction.stream.StreamingIngestSession;
import org.ptycho.diffraction.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client that replays the TIFF files of a directory through a streaming ingest session,
 * pausing whenever the session reports that too many arrays are pending.
 *
 * @author Diffraction Assembly Developers
 */
public class StreamPatternsClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public DiffractionSettingsParameters settings = new DiffractionSettingsParameters();

        @Parameter(
                names = "--directory",
                description = "Directory with one TIFF file per array",
                required = true)
        public String directory;

        @Parameter(
                names = "--highWaterMark",
                description = "Pause appending while more than this many arrays are pending")
        public int highWaterMark = StreamingIngestSession.DEFAULT_HIGH_WATER_MARK;

        @Parameter(
                names = "--pauseMilliseconds",
                description = "Time to wait before checking a full queue again")
        public long pauseMilliseconds = 100;

        @Parameter(
                names = "--export",
                description = "Write assembled patterns in bulk binary form to this file (.gz names are compressed)")
        public String export;
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final StreamPatternsClient client = new StreamPatternsClient(parameters);
                client.stream();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final DiffractionApi api;

    public StreamPatternsClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.parameters = parameters;
        this.api = new DiffractionApi(parameters.settings.buildSettings());
    }

    public DiffractionApi getApi() {
        return api;
    }

    public AssemblyStatistics stream()
            throws IOException, InterruptedException {

        final Path directory = Paths.get(parameters.directory);
        final List<Path> tiffPaths = TiffDirectoryReader.listTiffFiles(directory);

        final List<Integer> counts = new ArrayList<>(tiffPaths.size());
        for (final Path tiffPath : tiffPaths) {
            counts.add(TiffStacks.readPageCount(tiffPath));
        }

        final DiffractionMetadata metadata = new DiffractionMetadata.Builder()
                .setNumPatternsPerArray(counts)
                .setDetectorExtent(tiffPaths.isEmpty() ? null : TiffStacks.readExtent(tiffPaths.get(0)))
                .setFilePath(directory)
                .build();

        final StreamingIngestSession session = api.createStreamingSession(metadata, parameters.highWaterMark);
        session.start();

        final ProcessTimer timer = new ProcessTimer();
        int firstIndex = 0;
        for (int i = 0; i < tiffPaths.size(); i++) {
            while (session.isAboveHighWaterMark()) {
                Thread.sleep(parameters.pauseMilliseconds);
            }
            session.appendArray(new TiffDirectoryReader.TiffFileArray(tiffPaths.get(i), firstIndex, counts.get(i)));
            firstIndex += counts.get(i);

            if (timer.hasIntervalPassed()) {
                LOG.info("stream: appended {} of {} arrays, {} pending", i + 1, tiffPaths.size(),
                         session.getQueueSize());
            }
        }

        final AssemblyStatistics statistics = session.stop();

        LOG.info("stream: {}", api.getDataset().getInfoText());

        if (parameters.export != null) {
            final Path exportPath = Paths.get(parameters.export);
            api.exportAssembledPatterns(exportPath);
            LOG.info("stream: exported assembled patterns to {}", exportPath);
        }

        return statistics;
    }

    private static final Logger LOG = LoggerFactory.getLogger(StreamPatternsClient.class);
}
