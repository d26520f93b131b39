package org.ptycho.diffraction.dataset;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.ptycho.diffraction.data.MappedPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memory mapped scratch file that holds the processed patterns of one dataset generation.
 * Each stored array occupies its own mapped region appended to the end of the file.
 * The file is deleted when the store is closed.
 *
 * @author Diffraction Assembly Developers
 */
public class ScratchStore
        implements Closeable {

    private final Path path;
    private final FileChannel channel;
    private long nextOffset;

    private ScratchStore(final Path path,
                         final FileChannel channel) {
        this.path = path;
        this.channel = channel;
        this.nextOffset = 0;
    }

    /**
     * Creates a new scratch file for the specified generation in the specified directory.
     */
    public static ScratchStore create(final Path scratchDirectory,
                                      final long generation)
            throws IOException {
        FileUtil.ensureWritableDirectory(scratchDirectory.toFile());
        final Path path = Files.createTempFile(scratchDirectory, "assembled-" + generation + "-", ".bin");
        final FileChannel channel = FileChannel.open(path,
                                                     StandardOpenOption.READ,
                                                     StandardOpenOption.WRITE);
        LOG.info("create: created scratch file {}", path);
        return new ScratchStore(path, channel);
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return number of bytes mapped so far.
     */
    public synchronized long getSize() {
        return nextOffset;
    }

    /**
     * Copies the specified patterns into a newly mapped region of the scratch file.
     *
     * @return mapped copy of the patterns.
     */
    public synchronized MappedPatternStack store(final PatternStack patterns)
            throws IOException {

        final long byteCount = patterns.getPixelCount() * Integer.BYTES;
        if (byteCount > Integer.MAX_VALUE) {
            throw new IOException("array of " + patterns.getFrameCount() + " frames of " +
                                  patterns.getFrameExtent() + " exceeds the maximum mapped region size");
        }

        final MappedByteBuffer region = channel.map(FileChannel.MapMode.READ_WRITE, nextOffset, byteCount);
        region.order(ByteOrder.nativeOrder());
        nextOffset += byteCount;

        final MappedPatternStack mappedPatterns = new MappedPatternStack(patterns.getFrameCount(),
                                                                         patterns.getWidth(),
                                                                         patterns.getHeight(),
                                                                         region.asIntBuffer());
        mappedPatterns.copyFrom(patterns);
        return mappedPatterns;
    }

    /**
     * Closes the channel and deletes the scratch file.
     * Regions that are still referenced stay readable until they are garbage collected.
     */
    @Override
    public synchronized void close() {
        try {
            channel.close();
        } catch (final IOException e) {
            LOG.warn("close: failed to close channel for " + path, e);
        }
        FileUtil.deleteQuietly(path);
    }

    @Override
    public String toString() {
        return path.toString();
    }

    private static final Logger LOG = LoggerFactory.getLogger(ScratchStore.class);
}
