package org.ptycho.diffraction.sizer;

import java.util.ArrayList;
import java.util.List;

import org.ptycho.diffraction.detector.DetectorDescriptor;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.detector.PixelGeometry;
import org.ptycho.diffraction.processor.PatternBinning;
import org.ptycho.diffraction.processor.PatternCrop;
import org.ptycho.diffraction.processor.PatternFlip;
import org.ptycho.diffraction.processor.PatternPadding;
import org.ptycho.diffraction.processor.PatternProcessor;
import org.ptycho.diffraction.processor.PatternTransform;
import org.ptycho.diffraction.processor.ValueBoundsFilter;

/**
 * Processed pattern geometry for a detector and processing configuration.
 * Instances are immutable and side effect free.
 *
 * @author Diffraction Assembly Developers
 */
public class PatternSizer {

    private final DetectorDescriptor detector;
    private final ProcessingConfig config;
    private final PatternAxisSizer axisX;
    private final PatternAxisSizer axisY;

    public PatternSizer(final DetectorDescriptor detector,
                        final ProcessingConfig config) {
        this.detector = detector;
        this.config = config;
        this.axisX = new PatternAxisSizer(detector.getWidthPx(), config.getX());
        this.axisY = new PatternAxisSizer(detector.getHeightPx(), config.getY());
    }

    public DetectorDescriptor getDetector() {
        return detector;
    }

    public ProcessingConfig getConfig() {
        return config;
    }

    public PatternAxisSizer getAxisX() {
        return axisX;
    }

    public PatternAxisSizer getAxisY() {
        return axisY;
    }

    /**
     * @return processed extent before the optional transpose.
     */
    private ImageExtent getUntransposedExtent() {
        return new ImageExtent(axisX.getProcessedExtentPx(), axisY.getProcessedExtentPx());
    }

    public ImageExtent getProcessedImageExtent() {
        final ImageExtent extent = getUntransposedExtent();
        return config.isTranspose() ? new ImageExtent(extent.getHeightPx(), extent.getWidthPx()) : extent;
    }

    public PixelGeometry getProcessedPixelGeometry() {
        final double widthM = axisX.getProcessedPixelSizeM(detector.getPixelWidthM());
        final double heightM = axisY.getProcessedPixelSizeM(detector.getPixelHeightM());
        return config.isTranspose() ? new PixelGeometry(heightM, widthM) : new PixelGeometry(widthM, heightM);
    }

    public double getProcessedWidthM() {
        return getProcessedImageExtent().getWidthPx() * getProcessedPixelGeometry().getWidthM();
    }

    public double getProcessedHeightM() {
        return getProcessedImageExtent().getHeightPx() * getProcessedPixelGeometry().getHeightM();
    }

    /**
     * @return processor that converts raw detector patterns into patterns with {@link #getProcessedImageExtent()}.
     */
    public PatternProcessor getProcessor() {

        final List<PatternTransform> transformList = new ArrayList<>();

        final ValueBoundsFilter valueBoundsFilter =
                new ValueBoundsFilter(config.getValueLowerBound(), config.getValueUpperBound());
        if (valueBoundsFilter.isEnabled()) {
            transformList.add(valueBoundsFilter);
        }

        if ((axisX.getCropSizePx() < axisX.getDetectorExtentPx()) ||
            (axisY.getCropSizePx() < axisY.getDetectorExtentPx())) {
            transformList.add(new PatternCrop(axisX.getCropMinPx(),
                                              axisY.getCropMinPx(),
                                              axisX.getCropSizePx(),
                                              axisY.getCropSizePx()));
        }

        if ((axisX.getBinSizePx() > 1) || (axisY.getBinSizePx() > 1)) {
            transformList.add(new PatternBinning(axisX.getBinSizePx(), axisY.getBinSizePx()));
        }

        if ((axisX.getPadPx() > 0) || (axisY.getPadPx() > 0)) {
            transformList.add(new PatternPadding(axisX.getPadPx(), axisY.getPadPx()));
        }

        if (axisX.isFlip()) {
            transformList.add(new PatternFlip(PatternFlip.Operation.HORIZONTAL));
        }
        if (axisY.isFlip()) {
            transformList.add(new PatternFlip(PatternFlip.Operation.VERTICAL));
        }
        if (config.isTranspose()) {
            transformList.add(new PatternFlip(PatternFlip.Operation.TRANSPOSE));
        }

        return new PatternProcessor(detector.getExtent(), getProcessedImageExtent(), transformList);
    }

    @Override
    public String toString() {
        return "{detector: " + detector.getExtent() + ", x: " + axisX + ", y: " + axisY +
               ", transpose: " + config.isTranspose() + '}';
    }
}
