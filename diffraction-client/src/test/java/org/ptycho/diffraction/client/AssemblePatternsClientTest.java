package org.ptycho.diffraction.client;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.ptycho.diffraction.client.parameter.CommandLineParameters;
import org.ptycho.diffraction.data.IntPatternStack;
import org.ptycho.diffraction.dataset.AssembledPatterns;
import org.ptycho.diffraction.dataset.AssembledPatternsFile;
import org.ptycho.diffraction.dataset.AssemblyStatistics;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.loader.TiffStacks;

/**
 * Tests the {@link AssemblePatternsClient} class.
 */
public class AssemblePatternsClientTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new AssemblePatternsClient.Parameters());
    }

    @Test
    public void testOverrideValidation() {

        final AssemblePatternsClient.Parameters parameters = new AssemblePatternsClient.Parameters();
        Assert.assertFalse("parse should fail validation",
                           parameters.parse(new String[] { "--input", "scan.tif", "--cropCenterX", "5" },
                                            AssemblePatternsClient.class,
                                            false));
        try {
            parameters.buildOverrides();
            Assert.fail("crop center x without y should cause exception");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("invalid message " + e.getMessage(), e.getMessage().contains("--cropCenterY"));
        }
    }

    @Test
    public void testAssemble() throws Exception {

        final Path inputPath = temporaryFolder.getRoot().toPath().resolve("scan_001.tif");
        TiffStacks.write(inputPath, buildPatterns(3, 10, 8));

        final Path badPixelsPath = temporaryFolder.getRoot().toPath().resolve("bad_pixels.json");
        Files.write(badPixelsPath,
                    "{ \"width\": 10, \"height\": 8, \"badPixels\": [ [ 5, 4 ] ] }".getBytes(StandardCharsets.UTF_8));

        final File exportFile = new File(temporaryFolder.getRoot(), "assembled.bin");
        final File saveFile = new File(temporaryFolder.getRoot(), "processed.tif");

        final AssemblePatternsClient.Parameters parameters = new AssemblePatternsClient.Parameters();
        final boolean parsed = parameters.parse(new String[] {
                "--input", inputPath.toString(),
                "--numDataThreads", "2",
                "--badPixels", badPixelsPath.toString(),
                "--badPixelsFileType", "JSON_Bad_Pixels",
                "--cropCenterX", "5",
                "--cropCenterY", "4",
                "--cropWidth", "4",
                "--cropHeight", "4",
                "--export", exportFile.getAbsolutePath(),
                "--save", saveFile.getAbsolutePath()
        }, AssemblePatternsClient.class, false);
        Assert.assertTrue("parse failed", parsed);

        final AssemblePatternsClient client = new AssemblePatternsClient(parameters);
        final AssemblyStatistics statistics = client.assemble();

        Assert.assertEquals("invalid loaded count", 1, statistics.getLoadedArrayCount());
        Assert.assertEquals("invalid assembled pattern count", 3, statistics.getAssembledPatternCount());
        Assert.assertEquals("invalid thread count", 2, client.getApi().getSettings().getNumDataThreads());

        final AssembledPatterns exported = new AssembledPatternsFile().read(exportFile.toPath());
        Assert.assertEquals("invalid exported array count", 1, exported.getArrays().size());
        Assert.assertEquals("invalid exported mask extent",
                            new ImageExtent(4, 4), exported.getProcessedBadPixels().getExtent());
        // crop window starts at (3, 2) so detector pixel (5, 4) is processed pixel (2, 2)
        Assert.assertTrue("bad pixel should be cropped into processed mask",
                          exported.getProcessedBadPixels().isBad(2, 2));
        Assert.assertNotNull("raw mask should be exported", exported.getRawBadPixels());

        final IntPatternStack saved = TiffStacks.read(saveFile.toPath());
        Assert.assertEquals("invalid saved frame count", 3, saved.getFrameCount());
        Assert.assertEquals("invalid saved extent", new ImageExtent(4, 4), saved.getFrameExtent());
        Assert.assertEquals("invalid saved value", 1000 + 2 * 10 + 3, saved.get(1, 0, 0));
    }

    static IntPatternStack buildPatterns(final int frameCount,
                                         final int width,
                                         final int height) {
        final IntPatternStack patterns = new IntPatternStack(frameCount, width, height);
        for (int frame = 0; frame < frameCount; frame++) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    patterns.set(frame, y, x, frame * 1000 + y * width + x);
                }
            }
        }
        return patterns;
    }
}
