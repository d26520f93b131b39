package org.ptycho.diffraction.dataset;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binary bulk format for {@link AssembledPatterns}.
 * Files whose name ends with .gz are gzip compressed.
 *
 * <pre>
 *   int     magic ("PTYA")
 *   int     version
 *   int     detector width, int detector height
 *   boolean has raw mask, [raw mask bytes]
 *   int     processed width, int processed height, processed mask bytes
 *   int     array count
 *   per array:
 *     UTF   label
 *     int   frame count, int width, int height
 *     int[] indexes
 *     int[] frames x height x width values
 * </pre>
 *
 * @author Diffraction Assembly Developers
 */
public class AssembledPatternsFile {

    public static final int MAGIC = 0x50545941;
    public static final int VERSION = 1;

    private final FileUtil fileUtil;

    public AssembledPatternsFile() {
        this(FileUtil.DEFAULT_INSTANCE);
    }

    public AssembledPatternsFile(final FileUtil fileUtil) {
        this.fileUtil = fileUtil;
    }

    public void write(final Path path,
                      final AssembledPatterns patterns)
            throws IOException {

        LOG.info("write: entry, path={}, arrayCount={}", path, patterns.getArrays().size());

        try (final DataOutputStream out = fileUtil.getExtensionBasedDataOutputStream(path.toString())) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);
            writeExtent(out, patterns.getDetectorExtent());

            final BadPixels rawBadPixels = patterns.getRawBadPixels();
            out.writeBoolean(rawBadPixels != null);
            if (rawBadPixels != null) {
                writeMask(out, rawBadPixels.copyMask());
            }

            final BadPixels processedBadPixels = patterns.getProcessedBadPixels();
            writeExtent(out, processedBadPixels.getExtent());
            writeMask(out, processedBadPixels.copyMask());

            out.writeInt(patterns.getArrays().size());
            for (final PatternArray array : patterns.getArrays()) {
                writeArray(out, array);
            }
        }

        LOG.info("write: exit, wrote {} patterns", patterns.getPatternCount());
    }

    /**
     * @throws IOException
     *   if the file cannot be read or is not in this format.
     */
    public AssembledPatterns read(final Path path)
            throws IOException {

        LOG.info("read: entry, path={}", path);

        try (final DataInputStream in = fileUtil.getExtensionBasedDataInputStream(path.toString())) {
            final int magic = in.readInt();
            if (magic != MAGIC) {
                throw new IOException(path + " is not an assembled patterns file");
            }
            final int version = in.readInt();
            if (version != VERSION) {
                throw new IOException(path + " has unsupported version " + version);
            }

            final ImageExtent detectorExtent = readExtent(in);
            final BadPixels rawBadPixels = in.readBoolean() ? readMask(in, detectorExtent) : null;
            final ImageExtent processedExtent = readExtent(in);
            final BadPixels processedBadPixels = readMask(in, processedExtent);

            final int arrayCount = in.readInt();
            final List<PatternArray> arrays = new ArrayList<>(arrayCount);
            for (int i = 0; i < arrayCount; i++) {
                arrays.add(readArray(in, i, processedBadPixels));
            }

            final AssembledPatterns patterns =
                    new AssembledPatterns(detectorExtent, rawBadPixels, processedBadPixels, arrays);

            LOG.info("read: exit, read {} patterns in {} arrays", patterns.getPatternCount(), arrayCount);

            return patterns;
        }
    }

    private static void writeArray(final DataOutputStream out,
                                   final PatternArray array)
            throws IOException {
        final PatternStack patterns = array.getPatterns();
        out.writeUTF(array.getLabel());
        out.writeInt(patterns.getFrameCount());
        out.writeInt(patterns.getWidth());
        out.writeInt(patterns.getHeight());
        for (final int index : array.getIndexes()) {
            out.writeInt(index);
        }
        for (int frame = 0; frame < patterns.getFrameCount(); frame++) {
            for (final int value : patterns.getFrame(frame)) {
                out.writeInt(value);
            }
        }
    }

    private static PatternArray readArray(final DataInputStream in,
                                          final int arrayIndex,
                                          final BadPixels processedBadPixels)
            throws IOException {
        final String label = in.readUTF();
        final int frameCount = in.readInt();
        final int width = in.readInt();
        final int height = in.readInt();
        final int[] indexes = new int[frameCount];
        for (int i = 0; i < frameCount; i++) {
            indexes[i] = in.readInt();
        }
        final IntPatternStack patterns = new IntPatternStack(frameCount, width, height);
        final int[] data = patterns.getData();
        for (int i = 0; i < data.length; i++) {
            data[i] = in.readInt();
        }
        try {
            return PatternArray.loaded(arrayIndex, label, indexes, patterns, processedBadPixels);
        } catch (final IllegalArgumentException | DiffractionDataException e) {
            throw new IOException("array " + arrayIndex + " is inconsistent", e);
        }
    }

    private static void writeExtent(final DataOutputStream out,
                                    final ImageExtent extent)
            throws IOException {
        out.writeInt(extent.getWidthPx());
        out.writeInt(extent.getHeightPx());
    }

    private static ImageExtent readExtent(final DataInputStream in)
            throws IOException {
        final int width = in.readInt();
        final int height = in.readInt();
        try {
            return new ImageExtent(width, height);
        } catch (final IllegalArgumentException e) {
            throw new IOException("invalid extent " + width + "x" + height, e);
        }
    }

    private static void writeMask(final DataOutputStream out,
                                  final boolean[] mask)
            throws IOException {
        for (final boolean isBad : mask) {
            out.writeBoolean(isBad);
        }
    }

    private static BadPixels readMask(final DataInputStream in,
                                      final ImageExtent extent)
            throws IOException {
        final boolean[] mask = new boolean[extent.getSize()];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = in.readBoolean();
        }
        return new BadPixels(extent, mask);
    }

    private static final Logger LOG = LoggerFactory.getLogger(AssembledPatternsFile.class);
}
