package org.ptycho.diffraction.loader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;

import org.ptycho.diffraction.data.DiffractionDataset;
import org.ptycho.diffraction.data.DiffractionMetadata;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.SimpleDiffractionArray;
import org.ptycho.diffraction.data.SimpleDiffractionDataset;
import org.ptycho.diffraction.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a (multi-page) TIFF file as a dataset with a single array.
 *
 * @author Diffraction Assembly Developers
 */
public class TiffFileReader
        implements DiffractionFileReader {

    @Override
    public DiffractionDataset read(final Path path)
            throws IOException {

        LOG.info("read: entry, path={}", path);

        final IntPatternStack patterns = TiffStacks.read(path);
        final SimpleDiffractionArray array =
                SimpleDiffractionArray.withSequentialIndexes(FileUtil.getBaseName(path), 0, patterns);

        final DiffractionMetadata metadata = new DiffractionMetadata.Builder()
                .setNumPatternsPerArray(Collections.singletonList(patterns.getFrameCount()))
                .setDetectorExtent(patterns.getFrameExtent())
                .setFilePath(path)
                .build();

        LOG.info("read: exit, read {} patterns of {}", patterns.getFrameCount(), patterns.getFrameExtent());

        return new SimpleDiffractionDataset(metadata, Collections.singletonList(array));
    }

    private static final Logger LOG = LoggerFactory.getLogger(TiffFileReader.class);
}
