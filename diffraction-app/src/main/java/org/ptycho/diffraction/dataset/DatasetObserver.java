package org.ptycho.diffraction.dataset;

/**
 * Receives {@link AssembledDataset} change events.
 * Every event carries the dataset generation that produced it so that observers can ignore events
 * for a dataset they have already replaced.
 * Events are delivered on the thread that caused the change (often a loader worker thread).
 *
 * @author Diffraction Assembly Developers
 */
public interface DatasetObserver {

    /**
     * A new array entry was added at the end of the dataset.
     */
    void handleArrayInserted(final long generation,
                             final int index);

    /**
     * The array entry at the specified index was loaded, failed, or had its bad pixel correction updated.
     */
    void handleArrayChanged(final long generation,
                            final int index);

    /**
     * The whole array list was replaced (reload, clear or import).
     */
    void handleDatasetReloaded(final long generation);

    void handleBadPixelsChanged(final long generation,
                                final int badPixelCount);

}
