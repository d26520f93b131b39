package org.ptycho.diffraction.stream;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.DiffractionMetadata;
import org.ptycho.diffraction.data.TestDiffractionArrays;
import org.ptycho.diffraction.dataset.AssembledDataset;
import org.ptycho.diffraction.dataset.AssemblyStatistics;
import org.ptycho.diffraction.dataset.PatternArray;
import org.ptycho.diffraction.dataset.PatternState;
import org.ptycho.diffraction.detector.DetectorDescriptor;
import org.ptycho.diffraction.mask.BadPixelsMask;
import org.ptycho.diffraction.settings.DetectorSettings;
import org.ptycho.diffraction.settings.DiffractionSettings;
import org.ptycho.diffraction.util.LogbackTestTools;

import ch.qos.logback.classic.Level;

/**
 * Tests the {@link StreamingIngestSession} class.
 */
public class StreamingIngestSessionTest {

    private static final int EXTENT_PX = 4;

    private AssembledDataset dataset;
    private ExecutorService producers;

    @BeforeClass
    public static void setupLogging() {
        // per array loader messages are not useful for a hundred arrays
        LogbackTestTools.setLogLevel("org.ptycho.diffraction.dataset", Level.WARN);
    }

    @Before
    public void setup() {
        final DetectorSettings detectorSettings =
                new DetectorSettings(new DetectorDescriptor(EXTENT_PX, EXTENT_PX, 75e-6, 75e-6, 16, null));
        final DiffractionSettings settings = new DiffractionSettings(detectorSettings);
        settings.setNumDataThreads(3);
        dataset = new AssembledDataset(settings, new BadPixelsMask(detectorSettings));
        producers = Executors.newFixedThreadPool(4);
    }

    @After
    public void tearDown() {
        producers.shutdownNow();
        dataset.clear();
    }

    @Test
    public void testConcurrentAppend() throws Exception {

        final StreamingIngestSession session = new StreamingIngestSession(dataset, emptyMetadata(), 8);
        session.start();

        final int producerCount = 4;
        final int arraysPerProducer = 25;
        final List<Callable<Void>> tasks = new ArrayList<>();
        for (int p = 0; p < producerCount; p++) {
            final int producer = p;
            tasks.add(() -> {
                for (int i = 0; i < arraysPerProducer; i++) {
                    final int firstIndex = (producer * arraysPerProducer + i) * 2;
                    session.appendArray(TestDiffractionArrays.ramp("p" + producer + "-" + i, firstIndex, 2,
                                                                   EXTENT_PX, EXTENT_PX));
                }
                return null;
            });
        }

        for (final Future<Void> future : producers.invokeAll(tasks, 60, TimeUnit.SECONDS)) {
            future.get();
        }

        final AssemblyStatistics statistics = session.stop();

        Assert.assertEquals("invalid dataset size", 100, dataset.size());
        for (final PatternArray array : dataset.getArrays()) {
            Assert.assertTrue("array should be loaded or failed: " + array,
                              (array.getState() == PatternState.LOADED) ||
                              (array.getState() == PatternState.FAILED));
        }
        Assert.assertEquals("invalid loaded count", 100, statistics.getLoadedArrayCount());
        Assert.assertEquals("invalid assembled pattern count", 200, statistics.getAssembledPatternCount());
        Assert.assertEquals("invalid session state", StreamingIngestSession.State.STOPPED, session.getState());
    }

    @Test
    public void testAppendBeforeStart() {

        final StreamingIngestSession session = new StreamingIngestSession(dataset, emptyMetadata());

        try {
            session.appendArray(TestDiffractionArrays.ramp("early", 0, 1, EXTENT_PX, EXTENT_PX));
            Assert.fail("append before start should cause exception");
        } catch (final IllegalStateException e) {
            Assert.assertEquals("dataset should not change", 0, dataset.size());
        }
    }

    @Test
    public void testStartTwice() {

        final StreamingIngestSession session = new StreamingIngestSession(dataset, emptyMetadata());
        session.start();

        try {
            session.start();
            Assert.fail("second start should cause exception");
        } catch (final IllegalStateException e) {
            Assert.assertEquals("invalid session state",
                                StreamingIngestSession.State.STARTED, session.getState());
        }
    }

    @Test
    public void testCallsAfterStop() {

        final StreamingIngestSession session = new StreamingIngestSession(dataset, emptyMetadata());
        session.start();
        session.appendArray(TestDiffractionArrays.ramp("only", 0, 1, EXTENT_PX, EXTENT_PX));
        session.stop();

        final List<Runnable> calls = new ArrayList<>();
        calls.add(session::start);
        calls.add(() -> session.appendArray(TestDiffractionArrays.ramp("late", 1, 1, EXTENT_PX, EXTENT_PX)));
        calls.add(session::getQueueSize);
        calls.add(session::isAboveHighWaterMark);
        calls.add(session::stop);

        for (int i = 0; i < calls.size(); i++) {
            try {
                calls.get(i).run();
                Assert.fail("call " + i + " after stop should cause exception");
            } catch (final DiffractionDataException e) {
                Assert.assertEquals("invalid error type for call " + i,
                                    DiffractionDataException.ErrorType.SESSION_CLOSED, e.getErrorType());
            }
        }

        Assert.assertEquals("invalid dataset size", 1, dataset.size());
    }

    @Test
    public void testQueueQueriesDoNotWaitForStop() throws Exception {

        final StreamingIngestSession session = new StreamingIngestSession(dataset, emptyMetadata());
        session.start();

        final CountDownLatch startedLatch = new CountDownLatch(1);
        final CountDownLatch releaseLatch = new CountDownLatch(1);
        session.appendArray(new TestDiffractionArrays.BlockingArray(
                TestDiffractionArrays.ramp("slow", 0, 1, EXTENT_PX, EXTENT_PX), startedLatch, releaseLatch));
        Assert.assertTrue("load did not start", startedLatch.await(10, TimeUnit.SECONDS));
        Assert.assertEquals("invalid queue size while loading", 1, session.getQueueSize());

        final Future<AssemblyStatistics> stopResult = producers.submit(session::stop);
        final long deadline = System.currentTimeMillis() + 10000;
        while ((session.getState() != StreamingIngestSession.State.STOPPED) &&
               (System.currentTimeMillis() < deadline)) {
            Thread.sleep(5);
        }
        Assert.assertEquals("stop was not called", StreamingIngestSession.State.STOPPED, session.getState());

        final Future<Object> queryResult = producers.submit(() -> {
            try {
                return session.getQueueSize();
            } catch (final DiffractionDataException e) {
                return e.getErrorType();
            }
        });

        Assert.assertEquals("queue query should fail fast while stop waits",
                            DiffractionDataException.ErrorType.SESSION_CLOSED,
                            queryResult.get(2, TimeUnit.SECONDS));
        Assert.assertFalse("stop should still wait for the blocked load", stopResult.isDone());

        releaseLatch.countDown();
        final AssemblyStatistics statistics = stopResult.get(10, TimeUnit.SECONDS);
        Assert.assertEquals("invalid loaded count", 1, statistics.getLoadedArrayCount());
    }

    @Test
    public void testPlaceholdersAreReplaced() {

        final DiffractionMetadata metadata = new DiffractionMetadata.Builder()
                .setNumPatternsPerArray(Arrays.asList(1, 1))
                .build();
        final StreamingIngestSession session = new StreamingIngestSession(dataset, metadata);
        session.start();

        Assert.assertEquals("invalid placeholder count", 2, dataset.size());
        Assert.assertFalse("empty queue should not be above high water mark", session.isAboveHighWaterMark());

        session.appendArray(TestDiffractionArrays.ramp("a", 0, 1, EXTENT_PX, EXTENT_PX));
        session.appendArray(TestDiffractionArrays.ramp("b", 1, 1, EXTENT_PX, EXTENT_PX));
        session.stop();

        Assert.assertEquals("placeholders should be replaced in place", 2, dataset.size());
        Assert.assertEquals("invalid label", "b", dataset.get(1).getLabel());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidHighWaterMark() {
        new StreamingIngestSession(dataset, emptyMetadata(), 0);
    }

    private static DiffractionMetadata emptyMetadata() {
        return new DiffractionMetadata.Builder().setNumPatternsPerArray(Collections.emptyList()).build();
    }
}
