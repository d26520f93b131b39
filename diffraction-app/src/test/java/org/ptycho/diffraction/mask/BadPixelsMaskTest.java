package org.ptycho.diffraction.mask;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.detector.DetectorDescriptor;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.settings.DetectorSettings;

/**
 * Tests the {@link BadPixelsMask} class.
 */
public class BadPixelsMaskTest {

    private DetectorSettings detectorSettings;
    private BadPixelsMask mask;
    private List<Integer> events;

    @Before
    public void setup() {
        detectorSettings = new DetectorSettings(new DetectorDescriptor(4, 3, 75e-6, 75e-6, 16, null));
        mask = new BadPixelsMask(detectorSettings);
        events = new ArrayList<>();
        mask.addListener(events::add);
    }

    @Test
    public void testSetAndClear() {

        Assert.assertNull("mask should start empty", mask.getBadPixels());
        Assert.assertEquals("empty mask should have no bad pixels", 0, mask.getCount());
        Assert.assertEquals("empty mask copy has wrong size", 12, mask.copyMask().length);

        mask.set(buildMask(4, 3, 1, 5));

        Assert.assertEquals("invalid count", 2, mask.getCount());
        Assert.assertTrue("pixel (1, 1) should be bad", mask.isBad(1, 1));
        Assert.assertFalse("pixel (0, 0) should be good", mask.isBad(0, 0));

        mask.clear();

        Assert.assertNull("mask should be cleared", mask.getBadPixels());

        final List<Integer> expected = new ArrayList<>();
        expected.add(2);
        expected.add(0);
        Assert.assertEquals("invalid events", expected, events);
    }

    @Test
    public void testShapeMismatchKeepsPreviousMask() {

        final BadPixels original = buildMask(4, 3, 0);
        mask.set(original);
        events.clear();

        try {
            mask.set(buildMask(3, 4, 0, 1));
            Assert.fail("mismatched mask should cause exception");
        } catch (final DiffractionDataException e) {
            Assert.assertEquals("invalid error type",
                                DiffractionDataException.ErrorType.SHAPE_MISMATCH, e.getErrorType());
        }

        Assert.assertSame("previous mask should be kept", original, mask.getBadPixels());
        Assert.assertTrue("no events should be emitted for rejected mask", events.isEmpty());
    }

    @Test
    public void testDetectorChangeClearsMask() {

        mask.set(buildMask(4, 3, 0, 11));
        events.clear();

        detectorSettings.setExtent(new ImageExtent(5, 3));

        Assert.assertNull("mask should be cleared after extent change", mask.getBadPixels());
        Assert.assertEquals("exactly one cleared event should be emitted", 1, events.size());
        Assert.assertEquals("cleared event should report zero bad pixels", Integer.valueOf(0), events.get(0));

        detectorSettings.setExtent(new ImageExtent(6, 3));
        Assert.assertEquals("no further events should be emitted once mask is empty", 1, events.size());
    }

    @Test
    public void testMatchingDetectorChangeKeepsMask() {

        final BadPixels original = buildMask(4, 3, 7);
        mask.set(original);
        events.clear();

        detectorSettings.setDetector(detectorSettings.getDetector().withBitDepth(32));

        Assert.assertSame("mask should be kept", original, mask.getBadPixels());
        Assert.assertTrue("no events should be emitted", events.isEmpty());
    }

    static BadPixels buildMask(final int width,
                               final int height,
                               final int... badOffsets) {
        final boolean[] values = new boolean[width * height];
        for (final int offset : badOffsets) {
            values[offset] = true;
        }
        return new BadPixels(new ImageExtent(width, height), values);
    }
}
