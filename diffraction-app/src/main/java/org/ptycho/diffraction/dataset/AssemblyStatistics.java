package org.ptycho.diffraction.dataset;

import java.util.Arrays;

import org.ptycho.diffraction.json.JsonUtils;

/**
 * Summary of an assembled dataset.
 *
 * @author Diffraction Assembly Developers
 */
public class AssemblyStatistics {

    private final int loadedArrayCount;
    private final int failedArrayCount;
    private final int notLoadedArrayCount;
    private final long assembledPatternCount;
    private final long maxPatternCount;
    private final int[] assembledIndexes;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private AssemblyStatistics() {
        this(0, 0, 0, 0, 0, new int[0]);
    }

    public AssemblyStatistics(final int loadedArrayCount,
                              final int failedArrayCount,
                              final int notLoadedArrayCount,
                              final long assembledPatternCount,
                              final long maxPatternCount,
                              final int[] assembledIndexes) {
        this.loadedArrayCount = loadedArrayCount;
        this.failedArrayCount = failedArrayCount;
        this.notLoadedArrayCount = notLoadedArrayCount;
        this.assembledPatternCount = assembledPatternCount;
        this.maxPatternCount = maxPatternCount;
        this.assembledIndexes = assembledIndexes;
    }

    public int getLoadedArrayCount() {
        return loadedArrayCount;
    }

    public int getFailedArrayCount() {
        return failedArrayCount;
    }

    public int getNotLoadedArrayCount() {
        return notLoadedArrayCount;
    }

    /**
     * @return number of loaded patterns with a non-negative scan index.
     */
    public long getAssembledPatternCount() {
        return assembledPatternCount;
    }

    public long getMaxPatternCount() {
        return maxPatternCount;
    }

    /**
     * @return non-negative scan indexes of all loaded patterns in array order.
     */
    public int[] getAssembledIndexes() {
        return assembledIndexes.clone();
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{loadedArrayCount: " + loadedArrayCount + ", failedArrayCount: " + failedArrayCount +
               ", notLoadedArrayCount: " + notLoadedArrayCount + ", assembledPatternCount: " +
               assembledPatternCount + ", maxPatternCount: " + maxPatternCount +
               ", assembledIndexes: " + (assembledIndexes.length > 10 ?
                                         assembledIndexes.length + " values" :
                                         Arrays.toString(assembledIndexes)) + '}';
    }

    private static final JsonUtils.Helper<AssemblyStatistics> JSON_HELPER =
            new JsonUtils.Helper<>(AssemblyStatistics.class);
}
