package org.ptycho.diffraction.dataset;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.DiffractionArray;
import org.ptycho.diffraction.data.DiffractionMetadata;
import org.ptycho.diffraction.data.PatternAccessor;
import org.ptycho.diffraction.data.SimpleDiffractionArray;
import org.ptycho.diffraction.data.SimpleDiffractionDataset;
import org.ptycho.diffraction.data.TestDiffractionArrays;
import org.ptycho.diffraction.detector.DetectorDescriptor;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.mask.BadPixelsMask;
import org.ptycho.diffraction.settings.DetectorSettings;
import org.ptycho.diffraction.settings.DiffractionSettings;

/**
 * Tests the {@link AssembledDataset} class.
 */
public class AssembledDatasetTest {

    private static final int EXTENT_PX = 8;

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private DiffractionSettings settings;
    private BadPixelsMask badPixelsMask;
    private AssembledDataset dataset;
    private RecordingObserver observer;

    @Before
    public void setup() {
        final DetectorSettings detectorSettings =
                new DetectorSettings(new DetectorDescriptor(EXTENT_PX, EXTENT_PX, 75e-6, 75e-6, 16, null));
        settings = new DiffractionSettings(detectorSettings);
        settings.setNumDataThreads(2);
        badPixelsMask = new BadPixelsMask(detectorSettings);
        dataset = new AssembledDataset(settings, badPixelsMask);
        observer = new RecordingObserver();
        dataset.addObserver(observer);
    }

    @Test
    public void testLoadAndAssemble() {

        dataset.reload(buildDataset(rampArrays(3, 2)));

        Assert.assertEquals("invalid size after reload", 3, dataset.size());
        Assert.assertEquals("invalid state after reload", DatasetState.POPULATED, dataset.getState());
        for (final PatternArray array : dataset.getArrays()) {
            Assert.assertEquals("arrays should not be loaded before start",
                                PatternState.NOT_LOADED, array.getState());
        }

        dataset.startLoading();
        dataset.finishLoading(true);

        Assert.assertEquals("queue should be empty after blocking finish", 0, dataset.getQueueSize());
        Assert.assertFalse("dataset should not be loading after finish", dataset.isLoading());

        for (final PatternArray array : dataset.getArrays()) {
            Assert.assertEquals("invalid state for " + array, PatternState.LOADED, array.getState());
            Assert.assertEquals("invalid frame count for " + array, 2, array.getFrameCount());
            Assert.assertEquals("invalid extent for " + array,
                                new ImageExtent(EXTENT_PX, EXTENT_PX), array.getPatternExtent());
        }

        final AssemblyStatistics statistics = dataset.assemblePatterns();
        Assert.assertEquals("invalid loaded count", 3, statistics.getLoadedArrayCount());
        Assert.assertEquals("invalid failed count", 0, statistics.getFailedArrayCount());
        Assert.assertEquals("invalid assembled pattern count", 6, statistics.getAssembledPatternCount());
        Assert.assertArrayEquals("invalid assembled indexes",
                                 new int[] { 0, 1, 2, 3, 4, 5 }, statistics.getAssembledIndexes());

        final long frameOneSum = sumRange(1000, EXTENT_PX * EXTENT_PX);
        Assert.assertEquals("invalid maximum pattern count", frameOneSum, dataset.getMaximumPatternCounts());

        Assert.assertTrue("invalid info text " + dataset.getInfoText(),
                          dataset.getInfoText().startsWith("None: 6 x 8W x 8H int32"));

        Assert.assertEquals("invalid reload event count", 1, observer.count("reloaded"));
        Assert.assertEquals("invalid change event count", 3, observer.count("changed"));
        Assert.assertEquals("no insert events expected", 0, observer.count("inserted"));
    }

    @Test
    public void testStartTwiceIsIdempotent() {

        dataset.reload(buildDataset(rampArrays(4, 1)));

        dataset.startLoading();
        dataset.startLoading();
        dataset.finishLoading(true);

        Assert.assertEquals("each array should be committed exactly once", 4, observer.count("changed"));
        Assert.assertEquals("invalid loaded count", 4, dataset.assemblePatterns().getLoadedArrayCount());
    }

    @Test
    public void testReloadWhileLoadingDiscardsStaleResults() throws Exception {

        final CountDownLatch startedLatch = new CountDownLatch(2);
        final CountDownLatch releaseLatch = new CountDownLatch(1);

        final List<DiffractionArray> blockingArrays = new ArrayList<>();
        for (final SimpleDiffractionArray array : rampArrays(5, 1)) {
            blockingArrays.add(new TestDiffractionArrays.BlockingArray(array, startedLatch, releaseLatch));
        }

        try {
            dataset.reload(buildDataset(blockingArrays));
            dataset.startLoading();

            Assert.assertTrue("loaders did not start", startedLatch.await(10, TimeUnit.SECONDS));
            Assert.assertTrue("dataset should be loading", dataset.isLoading());

            final long staleGeneration = dataset.getGeneration();

            dataset.reload(buildDataset(rampArrays(2, 1)));
            final long currentGeneration = dataset.getGeneration();
            Assert.assertTrue("generation should increase", currentGeneration > staleGeneration);

            releaseLatch.countDown();

            dataset.startLoading();
            dataset.finishLoading(true);

            final List<String> events = observer.getEvents();
            final List<Long> generations = observer.getGenerations();
            final int reloadedIndex = events.indexOf("reloaded:" + currentGeneration + ":0");
            Assert.assertTrue("missing reload event in " + events, reloadedIndex >= 0);
            for (int i = reloadedIndex; i < events.size(); i++) {
                Assert.assertEquals("stale event " + events.get(i) + " after reload in " + events,
                                    Long.valueOf(currentGeneration), generations.get(i));
            }

            Assert.assertEquals("invalid size", 2, dataset.size());
            for (final PatternArray array : dataset.getArrays()) {
                Assert.assertEquals("invalid state for " + array, PatternState.LOADED, array.getState());
            }
        } finally {
            releaseLatch.countDown();
        }
    }

    @Test
    public void testIndexOutOfRange() {

        dataset.reload(buildDataset(rampArrays(2, 1)));

        for (final int index : new int[] { -1, 2 }) {
            try {
                dataset.get(index);
                Assert.fail("index " + index + " should cause exception");
            } catch (final DiffractionDataException e) {
                Assert.assertEquals("invalid error type for index " + index,
                                    DiffractionDataException.ErrorType.INDEX_OUT_OF_RANGE, e.getErrorType());
            }
        }

        Assert.assertEquals("invalid label", "array-1", dataset.get(1).getLabel());
    }

    @Test
    public void testIncompleteDataset() throws Exception {

        final CountDownLatch startedLatch = new CountDownLatch(1);
        final CountDownLatch releaseLatch = new CountDownLatch(1);
        final DiffractionArray blocked = new TestDiffractionArrays.BlockingArray(rampArrays(1, 1).get(0),
                                                                                 startedLatch,
                                                                                 releaseLatch);
        try {
            dataset.reload(buildDataset(Collections.singletonList(blocked)));
            dataset.startLoading();
            Assert.assertTrue("loader did not start", startedLatch.await(10, TimeUnit.SECONDS));

            try {
                dataset.assemblePatterns();
                Assert.fail("assembling while loading should cause exception");
            } catch (final DiffractionDataException e) {
                Assert.assertEquals("invalid error type",
                                    DiffractionDataException.ErrorType.INCOMPLETE_DATASET, e.getErrorType());
            }
        } finally {
            releaseLatch.countDown();
        }

        dataset.finishLoading(true);
        Assert.assertEquals("invalid loaded count", 1, dataset.assemblePatterns().getLoadedArrayCount());
    }

    @Test
    public void testInvalidMetadataKeepsDataset() {

        dataset.reload(buildDataset(rampArrays(2, 1)));
        final List<PatternArray> before = dataset.getArrays();
        observer.clear();

        final List<DiffractionMetadata> invalidList = Arrays.asList(
                null,
                new DiffractionMetadata.Builder().build(),
                new DiffractionMetadata.Builder().setNumPatternsPerArray(Arrays.asList(1, -1)).build(),
                new DiffractionMetadata.Builder().setNumPatternsPerArray(Arrays.asList(1, null)).build());

        for (final DiffractionMetadata metadata : invalidList) {
            try {
                dataset.reload(metadata);
                Assert.fail("metadata " + metadata + " should cause exception");
            } catch (final DiffractionDataException e) {
                Assert.assertEquals("invalid error type for " + metadata,
                                    DiffractionDataException.ErrorType.INVALID_METADATA, e.getErrorType());
            }
        }

        final DiffractionMetadata mismatched =
                new DiffractionMetadata.Builder().setNumPatternsPerArray(Arrays.asList(1, 1, 1)).build();
        try {
            dataset.reload(new SimpleDiffractionDataset(mismatched, rampArrays(2, 1)));
            Assert.fail("array count mismatch should cause exception");
        } catch (final DiffractionDataException e) {
            Assert.assertEquals("invalid error type",
                                DiffractionDataException.ErrorType.INVALID_METADATA, e.getErrorType());
        }

        Assert.assertSame("dataset should not change", before, dataset.getArrays());
        Assert.assertTrue("no events expected", observer.getEvents().isEmpty());
    }

    @Test
    public void testFailuresAreIsolated() {

        final DiffractionMetadata metadata =
                new DiffractionMetadata.Builder().setNumPatternsPerArray(Arrays.asList(2, 3, 1)).build();
        final List<DiffractionArray> arrays = new ArrayList<>();
        arrays.add(TestDiffractionArrays.ramp("good", 0, 2, EXTENT_PX, EXTENT_PX));
        arrays.add(TestDiffractionArrays.ramp("short", 2, 2, EXTENT_PX, EXTENT_PX));
        arrays.add(new TestDiffractionArrays.MissingFileArray("missing", 1));

        dataset.reload(new SimpleDiffractionDataset(metadata, arrays));
        dataset.startLoading();
        dataset.finishLoading(true);

        Assert.assertEquals("good array should load", PatternState.LOADED, dataset.get(0).getState());

        final PatternArray shortArray = dataset.get(1);
        Assert.assertEquals("frame count mismatch should fail", PatternState.FAILED, shortArray.getState());
        Assert.assertNotNull("failure reason should be recorded", shortArray.getFailureReason());

        final PatternArray missingArray = dataset.get(2);
        Assert.assertEquals("missing file should fail", PatternState.FAILED, missingArray.getState());
        Assert.assertTrue("invalid failure reason " + missingArray.getFailureReason(),
                          missingArray.getFailureReason().startsWith("file not found"));

        final AssemblyStatistics statistics = dataset.assemblePatterns();
        Assert.assertEquals("invalid loaded count", 1, statistics.getLoadedArrayCount());
        Assert.assertEquals("invalid failed count", 2, statistics.getFailedArrayCount());
        Assert.assertEquals("invalid assembled pattern count", 2, statistics.getAssembledPatternCount());
    }

    @Test
    public void testShapeMismatchFailsArray() {

        final List<DiffractionArray> arrays = new ArrayList<>();
        arrays.add(TestDiffractionArrays.ramp("wrong-shape", 0, 1, EXTENT_PX + 1, EXTENT_PX));

        dataset.reload(buildDataset(arrays));
        dataset.startLoading();
        dataset.finishLoading(true);

        Assert.assertEquals("mismatched array should fail", PatternState.FAILED, dataset.get(0).getState());
    }

    @Test
    public void testAppendArrays() {

        dataset.reload(new DiffractionMetadata.Builder().setNumPatternsPerArray(Arrays.asList(2, 2)).build());

        Assert.assertEquals("invalid placeholder count", 2, dataset.size());
        Assert.assertEquals("invalid placeholder label", "Array 0", dataset.get(0).getLabel());

        // loading starts implicitly
        dataset.appendArray(TestDiffractionArrays.ramp("first", 0, 2, EXTENT_PX, EXTENT_PX));
        dataset.appendArray(TestDiffractionArrays.ramp("second", 2, 2, EXTENT_PX, EXTENT_PX));
        dataset.appendArray(TestDiffractionArrays.ramp("extra", 4, 1, EXTENT_PX, EXTENT_PX));

        Assert.assertEquals("invalid size after append", 3, dataset.size());
        Assert.assertEquals("extra array should be inserted", 1, observer.count("inserted"));

        dataset.finishLoading(true);

        Assert.assertEquals("invalid label", "second", dataset.get(1).getLabel());
        for (final PatternArray array : dataset.getArrays()) {
            Assert.assertEquals("invalid state for " + array, PatternState.LOADED, array.getState());
        }
        Assert.assertEquals("invalid change event count", 3, observer.count("changed"));

        try {
            dataset.appendArray(TestDiffractionArrays.ramp("late", 5, 1, EXTENT_PX, EXTENT_PX));
            Assert.fail("append after finish should cause exception");
        } catch (final IllegalStateException e) {
            Assert.assertNotNull("exception should have a message", e.getMessage());
        }
    }

    @Test
    public void testMemmapScratchStorage() throws Exception {

        final File scratchDirectory = temporaryFolder.newFolder("scratch");
        settings.setMemmapEnabled(true);
        settings.setScratchDirectory(scratchDirectory.toPath());

        final List<SimpleDiffractionArray> arrays = rampArrays(3, 2);
        dataset.reload(buildDataset(arrays));
        dataset.startLoading();
        dataset.finishLoading(true);

        final File[] scratchFiles = scratchDirectory.listFiles();
        Assert.assertNotNull("scratch directory should be listable", scratchFiles);
        Assert.assertEquals("expected one scratch file", 1, scratchFiles.length);
        Assert.assertTrue("invalid scratch file name " + scratchFiles[0].getName(),
                          scratchFiles[0].getName().startsWith("assembled-"));

        for (int i = 0; i < arrays.size(); i++) {
            final PatternArray loaded = dataset.get(i);
            Assert.assertEquals("invalid state", PatternState.LOADED, loaded.getState());
            Assert.assertArrayEquals("mapped values differ for array " + i,
                                     arrays.get(i).getPatterns().getFrame(1),
                                     loaded.getPatterns().getFrame(1));
        }

        dataset.clear();

        final File[] remainingFiles = scratchDirectory.listFiles();
        Assert.assertNotNull("scratch directory should be listable", remainingFiles);
        Assert.assertEquals("scratch file should be deleted", 0, remainingFiles.length);
        Assert.assertEquals("invalid state after clear", DatasetState.EMPTY, dataset.getState());
    }

    @Test
    public void testBadPixelsChangeRecomputesCounts() {

        final List<DiffractionArray> arrays = new ArrayList<>();
        arrays.add(TestDiffractionArrays.constant("flat", 0, 1, EXTENT_PX, EXTENT_PX, 1));
        dataset.reload(buildDataset(arrays));
        dataset.startLoading();
        dataset.finishLoading(true);

        final int pixelCount = EXTENT_PX * EXTENT_PX;
        Assert.assertEquals("invalid count without mask", pixelCount, dataset.getMaximumPatternCounts());

        final boolean[] mask = new boolean[pixelCount];
        mask[0] = true;
        mask[9] = true;
        mask[63] = true;
        dataset.setBadPixels(new BadPixels(new ImageExtent(EXTENT_PX, EXTENT_PX), mask));

        Assert.assertEquals("invalid count with mask", pixelCount - 3, dataset.getMaximumPatternCounts());
        Assert.assertEquals("invalid processed bad pixel count", 3, dataset.getProcessedBadPixels().getCount());

        final double[] pattern = dataset.get(0).getPattern(PatternAccessor.frame(0));
        Assert.assertEquals("bad pixel should be zeroed", 0.0, pattern[9], 0.0);
        Assert.assertEquals("good pixel should be kept", 1.0, pattern[10], 0.0);

        dataset.setBadPixels(null);

        Assert.assertEquals("correction should be reversible", pixelCount, dataset.getMaximumPatternCounts());
        Assert.assertEquals("invalid bad pixel events", 2, observer.count("badPixels"));
    }

    @Test
    public void testClear() {

        dataset.reload(buildDataset(rampArrays(2, 1)));
        dataset.startLoading();
        dataset.finishLoading(true);
        final long generation = dataset.getGeneration();

        dataset.clear();

        Assert.assertEquals("dataset should be empty", 0, dataset.size());
        Assert.assertTrue("generation should increase", dataset.getGeneration() > generation);
        Assert.assertEquals("invalid reload event count", 2, observer.count("reloaded"));
        Assert.assertEquals("invalid statistics after clear", 0, dataset.assemblePatterns().getLoadedArrayCount());
    }

    static List<SimpleDiffractionArray> rampArrays(final int arrayCount,
                                                   final int framesPerArray) {
        final List<SimpleDiffractionArray> arrays = new ArrayList<>();
        for (int i = 0; i < arrayCount; i++) {
            arrays.add(TestDiffractionArrays.ramp("array-" + i, i * framesPerArray, framesPerArray,
                                                  EXTENT_PX, EXTENT_PX));
        }
        return arrays;
    }

    static SimpleDiffractionDataset buildDataset(final List<? extends DiffractionArray> arrays) {
        return SimpleDiffractionDataset.fromArrays(new DiffractionMetadata.Builder(), arrays);
    }

    private static long sumRange(final int first,
                                 final int count) {
        long sum = 0;
        for (int i = 0; i < count; i++) {
            sum += first + i;
        }
        return sum;
    }
}
