package org.ptycho.diffraction.client;

import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line tool wrapper that logs unexpected exceptions
 * and overall process completion events.
 *
 * Exit codes: 0 for success, 2 for data errors (missing or unreadable files, shape mismatches, ...),
 * and 1 for everything else.
 * Absence of the standard exit log message indicates that the tool was terminated abnormally.
 *
 * @author Diffraction Assembly Developers
 */
public abstract class ClientRunner {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_DATA_ERROR = 2;

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the client and exits the JVM with the resulting exit code.
     */
    public void run() {
        System.exit(runWithoutExit());
    }

    /**
     * Wraps a run with consistent log statements.
     *
     * @return the process exit code.
     */
    public int runWithoutExit() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int exitCode;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", processTimer);
            exitCode = EXIT_SUCCESS;
        } catch (final DiffractionDataException e) {
            LOG.error("run: caught {} data error", e.getErrorType(), e);
            LOG.info("run: exit, processing failed after {}", processTimer);
            exitCode = EXIT_DATA_ERROR;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
            exitCode = EXIT_FAILURE;
        }

        return exitCode;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
