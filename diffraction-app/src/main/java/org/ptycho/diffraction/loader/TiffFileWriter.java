package org.ptycho.diffraction.loader;

import java.io.IOException;
import java.nio.file.Path;

import org.ptycho.diffraction.data.DiffractionArray;
import org.ptycho.diffraction.data.DiffractionDataset;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes all patterns of all arrays (in array order) to one multi-page 32-bit float TIFF file.
 *
 * @author Diffraction Assembly Developers
 */
public class TiffFileWriter
        implements DiffractionFileWriter {

    @Override
    public void write(final Path path,
                      final DiffractionDataset dataset)
            throws IOException {

        LOG.info("write: entry, path={}, arrayCount={}", path, dataset.size());

        int frameCount = 0;
        int width = 0;
        int height = 0;
        for (final DiffractionArray array : dataset.getArrays()) {
            final PatternStack patterns = array.getPatterns();
            if ((frameCount > 0) && ((patterns.getWidth() != width) || (patterns.getHeight() != height))) {
                throw new IOException("array " + array.getLabel() + " has extent " + patterns.getFrameExtent() +
                                      " but previous arrays have " + width + "x" + height);
            }
            width = patterns.getWidth();
            height = patterns.getHeight();
            frameCount += patterns.getFrameCount();
        }

        if (frameCount == 0) {
            throw new IOException("dataset has no patterns to write");
        }

        final IntPatternStack allPatterns = new IntPatternStack(frameCount, width, height);
        final int frameSize = width * height;
        int frame = 0;
        for (final DiffractionArray array : dataset.getArrays()) {
            final PatternStack patterns = array.getPatterns();
            for (int arrayFrame = 0; arrayFrame < patterns.getFrameCount(); arrayFrame++) {
                System.arraycopy(patterns.getFrame(arrayFrame), 0, allPatterns.getData(), frame * frameSize,
                                 frameSize);
                frame++;
            }
        }

        TiffStacks.write(path, allPatterns);

        LOG.info("write: exit, wrote {} patterns", frameCount);
    }

    private static final Logger LOG = LoggerFactory.getLogger(TiffFileWriter.class);
}
