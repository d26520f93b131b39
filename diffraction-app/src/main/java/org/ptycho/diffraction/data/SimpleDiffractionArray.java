package org.ptycho.diffraction.data;

/**
 * {@link DiffractionArray} for patterns that are already in memory.
 *
 * @author Diffraction Assembly Developers
 */
public class SimpleDiffractionArray
        implements DiffractionArray {

    private final String label;
    private final int[] indexes;
    private final PatternStack patterns;

    public SimpleDiffractionArray(final String label,
                                  final int[] indexes,
                                  final PatternStack patterns)
            throws IllegalArgumentException {
        if (indexes.length != patterns.getFrameCount()) {
            throw new IllegalArgumentException("array '" + label + "' has " + indexes.length +
                                               " indexes but " + patterns.getFrameCount() + " patterns");
        }
        this.label = label;
        this.indexes = indexes;
        this.patterns = patterns;
    }

    /**
     * @return array whose indexes are consecutive starting at firstIndex.
     */
    public static SimpleDiffractionArray withSequentialIndexes(final String label,
                                                               final int firstIndex,
                                                               final PatternStack patterns) {
        final int[] indexes = new int[patterns.getFrameCount()];
        for (int i = 0; i < indexes.length; i++) {
            indexes[i] = firstIndex + i;
        }
        return new SimpleDiffractionArray(label, indexes, patterns);
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public int[] getIndexes() {
        return indexes;
    }

    @Override
    public PatternStack getPatterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return label + " (" + indexes.length + " patterns)";
    }
}
