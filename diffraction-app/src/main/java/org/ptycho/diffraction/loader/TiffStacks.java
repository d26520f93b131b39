package org.ptycho.diffraction.loader;

import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileInfo;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.io.TiffDecoder;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.detector.ImageExtent;

/**
 * ImageJ based TIFF stack access shared by the TIFF strategies.
 * Each TIFF page is one pattern; pixel values are rounded to the nearest integer count.
 *
 * @author Diffraction Assembly Developers
 */
public class TiffStacks {

    /**
     * @return all pages of the specified TIFF file.
     *
     * @throws FileNotFoundException
     *   if the file does not exist.
     *
     * @throws IOException
     *   if ImageJ cannot open the file.
     */
    public static IntPatternStack read(final Path path)
            throws IOException {

        if (! Files.isRegularFile(path)) {
            throw new FileNotFoundException(path + " does not exist");
        }

        // openers keep state about the file being opened, so we need to create a new opener for each load
        final Opener opener = new Opener();
        opener.setSilentMode(true);

        final ImagePlus imagePlus;
        try {
            imagePlus = opener.openImage(path.toString());
        } catch (final RuntimeException e) {
            throw new IOException("failed to open " + path, e);
        }

        if (imagePlus == null) {
            throw new IOException("failed to create imagePlus instance for '" + path + "'");
        }

        final ImageStack stack = imagePlus.getStack();
        final int width = stack.getWidth();
        final int height = stack.getHeight();
        final IntPatternStack patterns = new IntPatternStack(stack.getSize(), width, height);

        // ImageJ slices are indexed 1 .. N
        for (int slice = 1; slice <= stack.getSize(); slice++) {
            final ImageProcessor processor = stack.getProcessor(slice);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    patterns.set(slice - 1, y, x, Math.round(processor.getf(x, y)));
                }
            }
        }

        return patterns;
    }

    /**
     * Reads only the TIFF header.
     *
     * @return number of pages in the specified file.
     */
    public static int readPageCount(final Path path)
            throws IOException {
        final FileInfo[] info = readInfo(path);
        // ImageJ stacks describe all pages in a single info record
        return info.length == 1 ? Math.max(1, info[0].nImages) : info.length;
    }

    /**
     * Reads only the TIFF header.
     *
     * @return extent of the first page of the specified file.
     */
    public static ImageExtent readExtent(final Path path)
            throws IOException {
        final FileInfo info = readInfo(path)[0];
        return new ImageExtent(info.width, info.height);
    }

    /**
     * Writes the specified patterns as a 32-bit float TIFF (multi-page when there is more than one frame).
     */
    public static void write(final Path path,
                             final PatternStack patterns)
            throws IOException {

        final int width = patterns.getWidth();
        final int height = patterns.getHeight();
        final ImageStack stack = new ImageStack(width, height);
        for (int frame = 0; frame < patterns.getFrameCount(); frame++) {
            final int[] values = patterns.getFrame(frame);
            final float[] pixels = new float[values.length];
            for (int i = 0; i < values.length; i++) {
                pixels[i] = values[i];
            }
            stack.addSlice("frame-" + frame, new FloatProcessor(width, height, pixels));
        }

        final ImagePlus imagePlus = new ImagePlus(path.getFileName().toString(), stack);
        final FileSaver fileSaver = new FileSaver(imagePlus);
        final boolean saved = stack.getSize() > 1 ?
                              fileSaver.saveAsTiffStack(path.toString()) :
                              fileSaver.saveAsTiff(path.toString());
        if (! saved) {
            throw new IOException("failed to save " + path);
        }
    }

    private static FileInfo[] readInfo(final Path path)
            throws IOException {

        if (! Files.isRegularFile(path)) {
            throw new FileNotFoundException(path + " does not exist");
        }

        final Path parent = path.toAbsolutePath().getParent();
        final String directory = parent == null ? "" : parent.toString() + File.separator;
        final TiffDecoder decoder = new TiffDecoder(directory, path.getFileName().toString());
        final FileInfo[] info = decoder.getTiffInfo();
        if ((info == null) || (info.length == 0)) {
            throw new IOException("failed to read TIFF header of " + path);
        }
        return info;
    }

}
