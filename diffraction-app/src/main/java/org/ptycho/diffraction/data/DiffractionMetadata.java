package org.ptycho.diffraction.data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.detector.PixelGeometry;
import org.ptycho.diffraction.sizer.CropCenter;

/**
 * Metadata produced by readers (or supplied by streaming sources).
 * Only the pattern counts are required, every other field is optional and
 * can be tested with the corresponding has method before it is synchronized to settings upstream.
 *
 * @author Diffraction Assembly Developers
 */
public class DiffractionMetadata {

    private final List<Integer> numPatternsPerArray;
    private final Double detectorDistanceM;
    private final ImageExtent detectorExtent;
    private final PixelGeometry detectorPixelGeometry;
    private final Integer detectorBitDepth;
    private final CropCenter cropCenter;
    private final Double probeEnergyEV;
    private final Long probePhotonCount;
    private final Double exposureTimeS;
    private final Double tomographyAngleDeg;
    private final Path filePath;

    private DiffractionMetadata(final Builder builder) {
        this.numPatternsPerArray = builder.numPatternsPerArray == null ?
                                   null : Collections.unmodifiableList(new ArrayList<>(builder.numPatternsPerArray));
        this.detectorDistanceM = builder.detectorDistanceM;
        this.detectorExtent = builder.detectorExtent;
        this.detectorPixelGeometry = builder.detectorPixelGeometry;
        this.detectorBitDepth = builder.detectorBitDepth;
        this.cropCenter = builder.cropCenter;
        this.probeEnergyEV = builder.probeEnergyEV;
        this.probePhotonCount = builder.probePhotonCount;
        this.exposureTimeS = builder.exposureTimeS;
        this.tomographyAngleDeg = builder.tomographyAngleDeg;
        this.filePath = builder.filePath;
    }

    /**
     * @return metadata for an empty dataset.
     */
    public static DiffractionMetadata createNull(final Path filePath) {
        return new Builder().setNumPatternsPerArray(Collections.emptyList()).setFilePath(filePath).build();
    }

    /**
     * @return pattern counts for each array or null if the reader did not provide them.
     */
    public List<Integer> getNumPatternsPerArray() {
        return numPatternsPerArray;
    }

    public int getTotalNumberOfPatterns() {
        int total = 0;
        if (numPatternsPerArray != null) {
            for (final Integer count : numPatternsPerArray) {
                total += count;
            }
        }
        return total;
    }

    public boolean hasDetectorDistance() {
        return detectorDistanceM != null;
    }

    public Double getDetectorDistanceM() {
        return detectorDistanceM;
    }

    public boolean hasDetectorExtent() {
        return detectorExtent != null;
    }

    public ImageExtent getDetectorExtent() {
        return detectorExtent;
    }

    public boolean hasDetectorPixelGeometry() {
        return detectorPixelGeometry != null;
    }

    public PixelGeometry getDetectorPixelGeometry() {
        return detectorPixelGeometry;
    }

    public boolean hasDetectorBitDepth() {
        return detectorBitDepth != null;
    }

    public Integer getDetectorBitDepth() {
        return detectorBitDepth;
    }

    public boolean hasCropCenter() {
        return cropCenter != null;
    }

    public CropCenter getCropCenter() {
        return cropCenter;
    }

    public boolean hasProbeEnergy() {
        return probeEnergyEV != null;
    }

    public Double getProbeEnergyEV() {
        return probeEnergyEV;
    }

    public boolean hasProbePhotonCount() {
        return probePhotonCount != null;
    }

    public Long getProbePhotonCount() {
        return probePhotonCount;
    }

    public boolean hasExposureTime() {
        return exposureTimeS != null;
    }

    public Double getExposureTimeS() {
        return exposureTimeS;
    }

    public boolean hasTomographyAngle() {
        return tomographyAngleDeg != null;
    }

    public Double getTomographyAngleDeg() {
        return tomographyAngleDeg;
    }

    public Path getFilePath() {
        return filePath;
    }

    public Builder toBuilder() {
        return new Builder()
                .setNumPatternsPerArray(numPatternsPerArray)
                .setDetectorDistanceM(detectorDistanceM)
                .setDetectorExtent(detectorExtent)
                .setDetectorPixelGeometry(detectorPixelGeometry)
                .setDetectorBitDepth(detectorBitDepth)
                .setCropCenter(cropCenter)
                .setProbeEnergyEV(probeEnergyEV)
                .setProbePhotonCount(probePhotonCount)
                .setExposureTimeS(exposureTimeS)
                .setTomographyAngleDeg(tomographyAngleDeg)
                .setFilePath(filePath);
    }

    @Override
    public String toString() {
        return "{numPatternsPerArray: " + numPatternsPerArray +
               (detectorExtent == null ? "" : ", detectorExtent: " + detectorExtent) +
               (cropCenter == null ? "" : ", cropCenter: " + cropCenter) +
               (filePath == null ? "" : ", filePath: " + filePath) +
               '}';
    }

    public static class Builder {

        private List<Integer> numPatternsPerArray;
        private Double detectorDistanceM;
        private ImageExtent detectorExtent;
        private PixelGeometry detectorPixelGeometry;
        private Integer detectorBitDepth;
        private CropCenter cropCenter;
        private Double probeEnergyEV;
        private Long probePhotonCount;
        private Double exposureTimeS;
        private Double tomographyAngleDeg;
        private Path filePath;

        public Builder setNumPatternsPerArray(final List<Integer> numPatternsPerArray) {
            this.numPatternsPerArray = numPatternsPerArray;
            return this;
        }

        public Builder setDetectorDistanceM(final Double detectorDistanceM) {
            this.detectorDistanceM = detectorDistanceM;
            return this;
        }

        public Builder setDetectorExtent(final ImageExtent detectorExtent) {
            this.detectorExtent = detectorExtent;
            return this;
        }

        public Builder setDetectorPixelGeometry(final PixelGeometry detectorPixelGeometry) {
            this.detectorPixelGeometry = detectorPixelGeometry;
            return this;
        }

        public Builder setDetectorBitDepth(final Integer detectorBitDepth) {
            this.detectorBitDepth = detectorBitDepth;
            return this;
        }

        public Builder setCropCenter(final CropCenter cropCenter) {
            this.cropCenter = cropCenter;
            return this;
        }

        public Builder setProbeEnergyEV(final Double probeEnergyEV) {
            this.probeEnergyEV = probeEnergyEV;
            return this;
        }

        public Builder setProbePhotonCount(final Long probePhotonCount) {
            this.probePhotonCount = probePhotonCount;
            return this;
        }

        public Builder setExposureTimeS(final Double exposureTimeS) {
            this.exposureTimeS = exposureTimeS;
            return this;
        }

        public Builder setTomographyAngleDeg(final Double tomographyAngleDeg) {
            this.tomographyAngleDeg = tomographyAngleDeg;
            return this;
        }

        public Builder setFilePath(final Path filePath) {
            this.filePath = filePath;
            return this;
        }

        public DiffractionMetadata build() {
            return new DiffractionMetadata(this);
        }
    }
}
