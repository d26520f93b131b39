package org.ptycho.diffraction.stream;

import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.DiffractionArray;
import org.ptycho.diffraction.data.DiffractionMetadata;
import org.ptycho.diffraction.dataset.AssembledDataset;
import org.ptycho.diffraction.dataset.AssemblyStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds arrays from a live source into an {@link AssembledDataset}.
 * A session is started once, receives any number of arrays and is stopped once.
 * The high water mark is only a signal for producers, appending never blocks.
 * Queue queries never wait for the session monitor, so producers can poll them while another thread stops the session.
 *
 * @author Diffraction Assembly Developers
 */
public class StreamingIngestSession {

    public enum State {
        CREATED, STARTED, STOPPED
    }

    public static final int DEFAULT_HIGH_WATER_MARK = 64;

    private final AssembledDataset dataset;
    private final DiffractionMetadata metadata;
    private final int highWaterMark;
    private volatile State state;
    private long appendCount;

    public StreamingIngestSession(final AssembledDataset dataset,
                                  final DiffractionMetadata metadata) {
        this(dataset, metadata, DEFAULT_HIGH_WATER_MARK);
    }

    public StreamingIngestSession(final AssembledDataset dataset,
                                  final DiffractionMetadata metadata,
                                  final int highWaterMark)
            throws IllegalArgumentException {
        if (highWaterMark < 1) {
            throw new IllegalArgumentException("high water mark must be at least 1, got " + highWaterMark);
        }
        this.dataset = dataset;
        this.metadata = metadata;
        this.highWaterMark = highWaterMark;
        this.state = State.CREATED;
        this.appendCount = 0;
    }

    public State getState() {
        return state;
    }

    public int getHighWaterMark() {
        return highWaterMark;
    }

    /**
     * Reloads the dataset with this session's metadata and starts loading.
     *
     * @throws DiffractionDataException
     *   if the session is stopped or the metadata is invalid.
     *
     * @throws IllegalStateException
     *   if the session has already been started.
     */
    public synchronized void start()
            throws DiffractionDataException, IllegalStateException {
        checkNotStopped("start");
        if (state == State.STARTED) {
            throw new IllegalStateException("session has already been started");
        }
        LOG.info("start: entry, metadata={}, highWaterMark={}", metadata, highWaterMark);
        dataset.reload(metadata);
        dataset.startLoading();
        state = State.STARTED;
    }

    /**
     * @throws DiffractionDataException
     *   if the session is stopped.
     *
     * @throws IllegalStateException
     *   if the session has not been started.
     */
    public synchronized void appendArray(final DiffractionArray array)
            throws DiffractionDataException, IllegalStateException {
        checkNotStopped("appendArray");
        if (state != State.STARTED) {
            throw new IllegalStateException("session must be started before arrays are appended");
        }
        dataset.appendArray(array);
        appendCount++;
    }

    /**
     * @return number of appended arrays that are not yet committed to the dataset.
     */
    public int getQueueSize()
            throws DiffractionDataException {
        checkNotStopped("getQueueSize");
        return dataset.getQueueSize();
    }

    public boolean isAboveHighWaterMark()
            throws DiffractionDataException {
        return getQueueSize() > highWaterMark;
    }

    /**
     * Closes the session, waits for all appended arrays and assembles the dataset.
     * Calls made by other threads while this method waits fail with SESSION_CLOSED instead of blocking.
     *
     * @throws DiffractionDataException
     *   if the session is already stopped.
     */
    public AssemblyStatistics stop()
            throws DiffractionDataException {
        synchronized (this) {
            checkNotStopped("stop");
            LOG.info("stop: entry, appendCount={}", appendCount);
            state = State.STOPPED;
        }
        dataset.finishLoading(true);
        return dataset.assemblePatterns();
    }

    private void checkNotStopped(final String operation)
            throws DiffractionDataException {
        if (state == State.STOPPED) {
            throw new DiffractionDataException(DiffractionDataException.ErrorType.SESSION_CLOSED,
                                               operation + " called after session was stopped");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StreamingIngestSession.class);
}
