package org.ptycho.diffraction.loader;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.ptycho.diffraction.data.DiffractionArray;
import org.ptycho.diffraction.data.DiffractionDataset;
import org.ptycho.diffraction.data.DiffractionMetadata;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.data.SimpleDiffractionDataset;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads every TIFF file in a directory (sorted by name) as one array.
 * Only TIFF headers are read up front, pattern data is read when an array is loaded.
 * Scan indexes are assigned sequentially across all files.
 *
 * @author Diffraction Assembly Developers
 */
public class TiffDirectoryReader
        implements DiffractionFileReader {

    @Override
    public DiffractionDataset read(final Path directory)
            throws IOException {

        LOG.info("read: entry, directory={}", directory);

        if (! Files.isDirectory(directory)) {
            throw new FileNotFoundException(directory + " is not a directory");
        }

        final List<Path> tiffPaths = listTiffFiles(directory);
        final List<DiffractionArray> arrays = new ArrayList<>(tiffPaths.size());

        ImageExtent detectorExtent = null;
        int firstIndex = 0;
        for (final Path tiffPath : tiffPaths) {
            final int pageCount = TiffStacks.readPageCount(tiffPath);
            if (detectorExtent == null) {
                detectorExtent = TiffStacks.readExtent(tiffPath);
            }
            arrays.add(new TiffFileArray(tiffPath, firstIndex, pageCount));
            firstIndex += pageCount;
        }

        final DiffractionMetadata.Builder metadataBuilder = new DiffractionMetadata.Builder()
                .setDetectorExtent(detectorExtent)
                .setFilePath(directory);

        LOG.info("read: exit, found {} TIFF files with {} patterns", arrays.size(), firstIndex);

        return SimpleDiffractionDataset.fromArrays(metadataBuilder, arrays);
    }

    /**
     * @return sorted paths of all .tif and .tiff files in the specified directory.
     */
    public static List<Path> listTiffFiles(final Path directory)
            throws IOException {
        final List<Path> tiffPaths = new ArrayList<>();
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.{tif,tiff,TIF,TIFF}")) {
            for (final Path path : stream) {
                if (Files.isRegularFile(path)) {
                    tiffPaths.add(path);
                }
            }
        }
        tiffPaths.sort(null);
        return tiffPaths;
    }

    /**
     * Lazily loaded array backed by one TIFF file.
     */
    public static class TiffFileArray
            implements DiffractionArray {

        private final Path path;
        private final int[] indexes;

        public TiffFileArray(final Path path,
                             final int firstIndex,
                             final int pageCount) {
            this.path = path;
            this.indexes = new int[pageCount];
            for (int i = 0; i < pageCount; i++) {
                this.indexes[i] = firstIndex + i;
            }
        }

        @Override
        public String getLabel() {
            return FileUtil.getBaseName(path);
        }

        @Override
        public int[] getIndexes() {
            return indexes;
        }

        @Override
        public PatternStack getPatterns()
                throws IOException {
            return TiffStacks.read(path);
        }

        @Override
        public String toString() {
            return path.toString();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(TiffDirectoryReader.class);
}
