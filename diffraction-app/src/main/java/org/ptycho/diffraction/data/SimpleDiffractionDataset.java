package org.ptycho.diffraction.data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Basic {@link DiffractionDataset} implementation.
 *
 * @author Diffraction Assembly Developers
 */
public class SimpleDiffractionDataset
        implements DiffractionDataset {

    private final DiffractionMetadata metadata;
    private final List<DiffractionArray> arrays;
    private final BadPixels badPixels;

    public SimpleDiffractionDataset(final DiffractionMetadata metadata,
                                    final List<? extends DiffractionArray> arrays) {
        this(metadata, arrays, null);
    }

    public SimpleDiffractionDataset(final DiffractionMetadata metadata,
                                    final List<? extends DiffractionArray> arrays,
                                    final BadPixels badPixels) {
        this.metadata = metadata;
        this.arrays = Collections.unmodifiableList(new ArrayList<>(arrays));
        this.badPixels = badPixels;
    }

    public static SimpleDiffractionDataset createNull(final Path filePath) {
        return new SimpleDiffractionDataset(DiffractionMetadata.createNull(filePath), Collections.emptyList());
    }

    /**
     * @return dataset whose metadata pattern counts are derived from the specified arrays.
     */
    public static SimpleDiffractionDataset fromArrays(final DiffractionMetadata.Builder metadataBuilder,
                                                      final List<? extends DiffractionArray> arrays) {
        final List<Integer> counts = new ArrayList<>(arrays.size());
        for (final DiffractionArray array : arrays) {
            counts.add(array.getNumPatterns());
        }
        return new SimpleDiffractionDataset(metadataBuilder.setNumPatternsPerArray(counts).build(), arrays);
    }

    @Override
    public DiffractionMetadata getMetadata() {
        return metadata;
    }

    @Override
    public List<DiffractionArray> getArrays() {
        return arrays;
    }

    @Override
    public BadPixels getBadPixels() {
        return badPixels;
    }
}
