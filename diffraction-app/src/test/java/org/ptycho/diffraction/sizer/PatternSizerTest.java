package org.ptycho.diffraction.sizer;

import org.junit.Assert;
import org.junit.Test;
import org.ptycho.diffraction.detector.DetectorDescriptor;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.detector.PixelGeometry;
import org.ptycho.diffraction.processor.PatternProcessor;

/**
 * Tests the {@link PatternSizer} class.
 */
public class PatternSizerTest {

    private static final double PIXEL_SIZE_M = 75e-6;

    @Test
    public void testCropAndBin() {

        final AxisProcessingConfig axis = AxisProcessingConfig.withDefaults()
                .withCrop(true, 512, 64)
                .withBinning(true, 2);
        final PatternSizer sizer = new PatternSizer(buildDetector(1024, 1024),
                                                    new ProcessingConfig(axis, axis, false, null, null));

        Assert.assertEquals("invalid processed extent",
                            new ImageExtent(32, 32), sizer.getProcessedImageExtent());

        final PixelGeometry geometry = sizer.getProcessedPixelGeometry();
        Assert.assertEquals("invalid processed pixel width", 2 * PIXEL_SIZE_M, geometry.getWidthM(), 1e-12);
        Assert.assertEquals("invalid processed pixel height", 2 * PIXEL_SIZE_M, geometry.getHeightM(), 1e-12);
        Assert.assertEquals("invalid processed width", 32 * 2 * PIXEL_SIZE_M, sizer.getProcessedWidthM(), 1e-12);

        Assert.assertEquals("invalid crop min", 480, sizer.getAxisX().getCropMinPx());

        final PatternProcessor processor = sizer.getProcessor();
        Assert.assertEquals("invalid processor output extent",
                            sizer.getProcessedImageExtent(), processor.getOutputExtent());
        Assert.assertEquals("crop and bin steps should be the only steps",
                            2, processor.getTransformList().size());
    }

    @Test
    public void testCropWindowStaysOnDetector() {

        final int[] extents = { 1, 2, 7, 64, 100, 1024 };
        final int[] cropSizes = { 1, 3, 16, 64, 99, 5000 };
        final long[] centers = { -1000, -1, 0, 1, 31, 32, 50, 511, 512, 1023, 1024, 100000 };

        for (final int extent : extents) {
            for (final int cropSize : cropSizes) {
                for (final long center : centers) {
                    final AxisProcessingConfig config =
                            AxisProcessingConfig.withDefaults().withCrop(true, center, cropSize);
                    final PatternAxisSizer sizer = new PatternAxisSizer(extent, config);
                    final String context = "extent " + extent + ", crop " + cropSize + ", center " + center;
                    final int cropMin = sizer.getCropMinPx();
                    Assert.assertTrue("window starts before detector for " + context, cropMin >= 0);
                    Assert.assertTrue("window ends after detector for " + context,
                                      cropMin + sizer.getCropSizePx() <= extent);
                    Assert.assertTrue("crop size out of range for " + context,
                                      sizer.getCropSizeLimits().contains(sizer.getCropSizePx()));
                }
            }
        }
    }

    @Test
    public void testProcessedExtentFormula() {

        for (int cropSize = 1; cropSize <= 40; cropSize += 3) {
            for (int binSize = 1; binSize <= 8; binSize++) {
                for (int pad = 0; pad <= 5; pad += 2) {
                    final AxisProcessingConfig config = AxisProcessingConfig.withDefaults()
                            .withCrop(true, 20, cropSize)
                            .withBinning(true, binSize)
                            .withPadding(true, pad);
                    final PatternAxisSizer sizer = new PatternAxisSizer(40, config);
                    final int expectedBin = Math.min(binSize, cropSize);
                    Assert.assertEquals("invalid bin size for crop " + cropSize + ", bin " + binSize,
                                        expectedBin, sizer.getBinSizePx());
                    Assert.assertEquals("invalid processed extent for crop " + cropSize + ", bin " + binSize +
                                        ", pad " + pad,
                                        cropSize / expectedBin + 2 * pad, sizer.getProcessedExtentPx());
                }
            }
        }
    }

    @Test
    public void testDisabledStepsUseFullDetector() {

        final AxisProcessingConfig config = AxisProcessingConfig.withDefaults()
                .withCrop(false, 3, 10)
                .withBinning(false, 4)
                .withPadding(false, 6);
        final PatternAxisSizer sizer = new PatternAxisSizer(256, config);

        Assert.assertEquals("invalid crop size", 256, sizer.getCropSizePx());
        Assert.assertEquals("invalid crop center", 128, sizer.getCropCenterPx());
        Assert.assertEquals("invalid crop min", 0, sizer.getCropMinPx());
        Assert.assertEquals("invalid bin size", 1, sizer.getBinSizePx());
        Assert.assertEquals("invalid pad", 0, sizer.getPadPx());
        Assert.assertEquals("invalid processed extent", 256, sizer.getProcessedExtentPx());
    }

    @Test
    public void testClampingKeepsConfiguredValues() {

        final AxisProcessingConfig config = AxisProcessingConfig.withDefaults()
                .withCrop(true, 5000, 5000)
                .withBinning(true, 5000);
        final PatternAxisSizer sizer = new PatternAxisSizer(128, config);

        Assert.assertEquals("crop size should be clamped", 128, sizer.getCropSizePx());
        Assert.assertEquals("crop center should be clamped", 64, sizer.getCropCenterPx());
        Assert.assertEquals("bin size should be clamped", 128, sizer.getBinSizePx());

        Assert.assertEquals("configured crop size should not change", 5000, config.getCropSizePx());
        Assert.assertEquals("configured crop center should not change", 5000, config.getCropCenterPx());
    }

    @Test
    public void testPaddingIsClamped() {

        final AxisProcessingConfig axis = AxisProcessingConfig.withDefaults()
                .withCrop(true, 512, 64)
                .withPadding(true, 1_100_000_000);
        final PatternSizer sizer = new PatternSizer(buildDetector(1024, 1024),
                                                    new ProcessingConfig(axis, axis, false, null, null));

        final PatternAxisSizer axisX = sizer.getAxisX();
        Assert.assertEquals("invalid pad limits",
                            new Interval(0, (PatternAxisSizer.MAX_PROCESSED_EXTENT_PX - 64) / 2),
                            axisX.getPadSizeLimits());
        Assert.assertEquals("pad should be clamped", axisX.getPadSizeLimits().getUpper(), axisX.getPadPx());
        Assert.assertTrue("processed extent should stay within limit",
                          axisX.getProcessedExtentPx() <= PatternAxisSizer.MAX_PROCESSED_EXTENT_PX);

        final ImageExtent extent = sizer.getProcessedImageExtent();
        Assert.assertTrue("processed size should be positive", extent.getSize() > 0);
        Assert.assertEquals("configured pad should not change", 1_100_000_000, axis.getPadPx());
    }

    @Test
    public void testTransposeSwapsAxes() {

        final AxisProcessingConfig x = AxisProcessingConfig.withDefaults().withCrop(true, 50, 40);
        final AxisProcessingConfig y = AxisProcessingConfig.withDefaults().withCrop(true, 50, 20).withBinning(true, 2);
        final DetectorDescriptor detector =
                new DetectorDescriptor(100, 100, PIXEL_SIZE_M, 2 * PIXEL_SIZE_M, 16, null);

        final PatternSizer sizer = new PatternSizer(detector, new ProcessingConfig(x, y, true, null, null));

        Assert.assertEquals("invalid transposed extent", new ImageExtent(10, 40), sizer.getProcessedImageExtent());
        Assert.assertEquals("invalid transposed pixel width",
                            4 * PIXEL_SIZE_M, sizer.getProcessedPixelGeometry().getWidthM(), 1e-12);
        Assert.assertEquals("invalid transposed pixel height",
                            PIXEL_SIZE_M, sizer.getProcessedPixelGeometry().getHeightM(), 1e-12);
    }

    static DetectorDescriptor buildDetector(final int width,
                                            final int height) {
        return new DetectorDescriptor(width, height, PIXEL_SIZE_M, PIXEL_SIZE_M, 16, null);
    }
}
