package org.ptycho.diffraction.loader;

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.DiffractionDataset;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.data.PatternStack;
import org.ptycho.diffraction.data.SimpleDiffractionArray;
import org.ptycho.diffraction.data.TestDiffractionArrays;
import org.ptycho.diffraction.detector.ImageExtent;

/**
 * Tests the {@link TiffStacks} class and the TIFF strategies built on it.
 */
public class TiffStacksTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testWriteAndReadStack() throws Exception {

        final Path path = temporaryFolder.getRoot().toPath().resolve("stack.tif");
        final SimpleDiffractionArray array = TestDiffractionArrays.ramp("stack", 0, 3, 5, 4);

        TiffStacks.write(path, array.getPatterns());

        Assert.assertEquals("invalid page count", 3, TiffStacks.readPageCount(path));
        Assert.assertEquals("invalid extent", new ImageExtent(5, 4), TiffStacks.readExtent(path));

        final IntPatternStack read = TiffStacks.read(path);
        assertSamePatterns(array.getPatterns(), read);
    }

    @Test
    public void testWriteAndReadSinglePage() throws Exception {

        final Path path = temporaryFolder.getRoot().toPath().resolve("single.tif");
        final SimpleDiffractionArray array = TestDiffractionArrays.ramp("single", 0, 1, 3, 2);

        TiffStacks.write(path, array.getPatterns());

        Assert.assertEquals("invalid page count", 1, TiffStacks.readPageCount(path));
        assertSamePatterns(array.getPatterns(), TiffStacks.read(path));
    }

    @Test(expected = FileNotFoundException.class)
    public void testReadMissingFile() throws Exception {
        TiffStacks.read(temporaryFolder.getRoot().toPath().resolve("missing.tif"));
    }

    @Test
    public void testFileReaderAndWriter() throws Exception {

        final Path sourcePath = temporaryFolder.getRoot().toPath().resolve("scan_001.tif");
        TiffStacks.write(sourcePath, TestDiffractionArrays.ramp("scan", 0, 2, 4, 4).getPatterns());

        final DiffractionDataset dataset = new TiffFileReader().read(sourcePath);
        Assert.assertEquals("invalid array count", 1, dataset.size());
        Assert.assertEquals("invalid label", "scan_001", dataset.get(0).getLabel());
        Assert.assertArrayEquals("invalid indexes", new int[] { 0, 1 }, dataset.get(0).getIndexes());
        Assert.assertEquals("invalid detector extent",
                            new ImageExtent(4, 4), dataset.getMetadata().getDetectorExtent());

        final Path savedPath = temporaryFolder.getRoot().toPath().resolve("saved.tif");
        new TiffFileWriter().write(savedPath, dataset);
        assertSamePatterns(dataset.get(0).getPatterns(), TiffStacks.read(savedPath));
    }

    @Test
    public void testDirectoryReader() throws Exception {

        final Path directory = temporaryFolder.newFolder("scans").toPath();
        TiffStacks.write(directory.resolve("b.tif"), TestDiffractionArrays.ramp("b", 0, 1, 4, 4).getPatterns());
        TiffStacks.write(directory.resolve("a.tif"), TestDiffractionArrays.ramp("a", 0, 2, 4, 4).getPatterns());
        Files.write(directory.resolve("notes.txt"), "not a tiff".getBytes());

        final List<Path> tiffPaths = TiffDirectoryReader.listTiffFiles(directory);
        Assert.assertEquals("invalid number of TIFF files", 2, tiffPaths.size());
        Assert.assertEquals("files should be sorted", "a.tif", tiffPaths.get(0).getFileName().toString());

        final DiffractionDataset dataset = new TiffDirectoryReader().read(directory);
        Assert.assertEquals("invalid array count", 2, dataset.size());
        Assert.assertEquals("invalid pattern counts",
                            Arrays.asList(2, 1), dataset.getMetadata().getNumPatternsPerArray());
        Assert.assertArrayEquals("indexes should continue across files",
                                 new int[] { 2 }, dataset.get(1).getIndexes());
        Assert.assertEquals("invalid second frame value",
                            1000, dataset.get(0).getPatterns().get(1, 0, 0));
    }

    @Test
    public void testBadPixelsReader() throws Exception {

        final Path path = temporaryFolder.getRoot().toPath().resolve("bad_pixels.tif");
        final int[] pixels = new int[12];
        pixels[4] = 1;
        pixels[11] = 255;
        TiffStacks.write(path, IntPatternStack.forFrame(4, 3, pixels));

        final BadPixels badPixels = new TiffBadPixelsReader().read(path);

        Assert.assertEquals("invalid extent", new ImageExtent(4, 3), badPixels.getExtent());
        Assert.assertEquals("invalid count", 2, badPixels.getCount());
        Assert.assertTrue("pixel (0, 1) should be bad", badPixels.isBad(0, 1));
        Assert.assertTrue("pixel (3, 2) should be bad", badPixels.isBad(3, 2));
    }

    private static void assertSamePatterns(final PatternStack expected,
                                           final PatternStack actual) {
        Assert.assertEquals("invalid frame count", expected.getFrameCount(), actual.getFrameCount());
        Assert.assertEquals("invalid frame extent", expected.getFrameExtent(), actual.getFrameExtent());
        for (int frame = 0; frame < expected.getFrameCount(); frame++) {
            Assert.assertArrayEquals("invalid values for frame " + frame,
                                     expected.getFrame(frame), actual.getFrame(frame));
        }
    }
}
