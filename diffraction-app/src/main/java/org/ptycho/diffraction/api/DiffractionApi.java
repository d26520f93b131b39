package org.ptycho.diffraction.api;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.ptycho.diffraction.DiffractionDataException;
import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.data.DiffractionArray;
import org.ptycho.diffraction.data.DiffractionDataset;
import org.ptycho.diffraction.data.DiffractionMetadata;
import org.ptycho.diffraction.data.SimpleDiffractionArray;
import org.ptycho.diffraction.data.SimpleDiffractionDataset;
import org.ptycho.diffraction.dataset.AssembledDataset;
import org.ptycho.diffraction.dataset.AssembledPatterns;
import org.ptycho.diffraction.dataset.AssembledPatternsFile;
import org.ptycho.diffraction.dataset.AssemblyStatistics;
import org.ptycho.diffraction.dataset.PatternArray;
import org.ptycho.diffraction.dataset.PatternState;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.loader.BadPixelsFileReader;
import org.ptycho.diffraction.loader.DiffractionFileReader;
import org.ptycho.diffraction.loader.DiffractionFileWriter;
import org.ptycho.diffraction.mask.BadPixelsMask;
import org.ptycho.diffraction.settings.DetectorSettings;
import org.ptycho.diffraction.settings.DiffractionSettings;
import org.ptycho.diffraction.sizer.CropCenter;
import org.ptycho.diffraction.stream.StreamingIngestSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for loading, assembling, saving and streaming diffraction patterns.
 * All file level failures are reported as {@link DiffractionDataException} instances
 * and leave the current dataset unchanged.
 *
 * @author Diffraction Assembly Developers
 */
public class DiffractionApi {

    private final DiffractionSettings settings;
    private final BadPixelsMask badPixelsMask;
    private final AssembledDataset dataset;
    private final StrategyRegistry<DiffractionFileReader> patternReaders;
    private final StrategyRegistry<DiffractionFileWriter> patternWriters;
    private final StrategyRegistry<BadPixelsFileReader> badPixelsReaders;
    private final AssembledPatternsFile assembledPatternsFile;

    public DiffractionApi(final DiffractionSettings settings) {
        this(settings,
             FileTypes.buildPatternReaders(),
             FileTypes.buildPatternWriters(),
             FileTypes.buildBadPixelsReaders());
    }

    public DiffractionApi(final DiffractionSettings settings,
                          final StrategyRegistry<DiffractionFileReader> patternReaders,
                          final StrategyRegistry<DiffractionFileWriter> patternWriters,
                          final StrategyRegistry<BadPixelsFileReader> badPixelsReaders) {
        this.settings = settings;
        this.badPixelsMask = new BadPixelsMask(settings.getDetectorSettings());
        this.dataset = new AssembledDataset(settings, badPixelsMask);
        this.patternReaders = patternReaders;
        this.patternWriters = patternWriters;
        this.badPixelsReaders = badPixelsReaders;
        this.assembledPatternsFile = new AssembledPatternsFile();
    }

    public DiffractionSettings getSettings() {
        return settings;
    }

    public BadPixelsMask getBadPixelsMask() {
        return badPixelsMask;
    }

    public AssembledDataset getDataset() {
        return dataset;
    }

    public StrategyRegistry<DiffractionFileReader> getPatternReaders() {
        return patternReaders;
    }

    public StrategyRegistry<DiffractionFileWriter> getPatternWriters() {
        return patternWriters;
    }

    public StrategyRegistry<BadPixelsFileReader> getBadPixelsReaders() {
        return badPixelsReaders;
    }

    /**
     * Reads a pattern file and reloads the dataset with its (not yet loaded) arrays.
     *
     * @param  path       file or directory to read.
     * @param  fileType   reader key or null for the configured file type.
     * @param  overrides  (optional) settings to apply before the dataset is reloaded.
     *
     * @return metadata of the opened file.
     *
     * @throws DiffractionDataException
     *   with UNKNOWN_FILE_TYPE, FILE_NOT_FOUND, READ_FAILED or INVALID_METADATA.
     */
    public DiffractionMetadata openPatterns(final Path path,
                                            final String fileType,
                                            final OpenPatternsOverrides overrides)
            throws DiffractionDataException {

        LOG.info("openPatterns: entry, path={}, fileType={}, overrides={}", path, fileType, overrides);

        final String resolvedFileType = fileType == null ? settings.getFileType() : fileType;
        final DiffractionFileReader reader = patternReaders.get(resolvedFileType);

        if ((path == null) || (! Files.exists(path))) {
            throw DiffractionDataException.fileNotFound(path);
        }

        final DiffractionDataset diffractionDataset;
        try {
            diffractionDataset = reader.read(path);
        } catch (final FileNotFoundException e) {
            throw new DiffractionDataException(DiffractionDataException.ErrorType.FILE_NOT_FOUND,
                                               e.getMessage(), e);
        } catch (final IOException | RuntimeException e) {
            throw DiffractionDataException.readFailed(path, e);
        }

        // settings must not change when the reader output cannot be reloaded
        AssembledDataset.validate(diffractionDataset);
        final DiffractionMetadata metadata = diffractionDataset.getMetadata();

        applyOverrides(metadata, overrides == null ? OpenPatternsOverrides.NONE : overrides);

        dataset.reload(diffractionDataset);
        settings.setFileType(resolvedFileType);

        LOG.info("openPatterns: exit, opened {} arrays with {} patterns",
                 dataset.size(), metadata.getTotalNumberOfPatterns());

        return metadata;
    }

    public void startAssemblingPatterns()
            throws DiffractionDataException {
        dataset.startLoading();
    }

    /**
     * @param  block  if true, wait for all loads to settle and assemble the dataset.
     *
     * @return statistics when blocking, otherwise null.
     */
    public AssemblyStatistics finishAssemblingPatterns(final boolean block)
            throws DiffractionDataException {
        dataset.finishLoading(block);
        return block ? dataset.assemblePatterns() : null;
    }

    /**
     * Reads a bad pixels file and makes it the active mask.
     *
     * @return number of bad pixels.
     *
     * @throws DiffractionDataException
     *   with UNKNOWN_FILE_TYPE, FILE_NOT_FOUND, READ_FAILED or SHAPE_MISMATCH.
     */
    public int openBadPixels(final Path path,
                             final String fileType)
            throws DiffractionDataException {

        LOG.info("openBadPixels: entry, path={}, fileType={}", path, fileType);

        final String resolvedFileType = fileType == null ? settings.getBadPixelsFileType() : fileType;
        final BadPixelsFileReader reader = badPixelsReaders.get(resolvedFileType);

        if ((path == null) || (! Files.exists(path))) {
            throw DiffractionDataException.fileNotFound(path);
        }

        final BadPixels badPixels;
        try {
            badPixels = reader.read(path);
        } catch (final FileNotFoundException e) {
            throw new DiffractionDataException(DiffractionDataException.ErrorType.FILE_NOT_FOUND,
                                               e.getMessage(), e);
        } catch (final IOException | RuntimeException e) {
            throw DiffractionDataException.readFailed(path, e);
        }

        dataset.setBadPixels(badPixels);

        final DetectorSettings detectorSettings = settings.getDetectorSettings();
        detectorSettings.setDetector(detectorSettings.getDetector().withBadPixelsFile(path));
        settings.setBadPixelsFileType(resolvedFileType);

        return badPixels.getCount();
    }

    public void clearBadPixels() {
        dataset.setBadPixels(null);
        final DetectorSettings detectorSettings = settings.getDetectorSettings();
        detectorSettings.setDetector(detectorSettings.getDetector().withBadPixelsFile(null));
    }

    /**
     * Writes the processed patterns of all loaded arrays.
     *
     * @throws DiffractionDataException
     *   with UNKNOWN_FILE_TYPE or WRITE_FAILED.
     */
    public void savePatterns(final Path path,
                             final String fileType)
            throws DiffractionDataException {

        LOG.info("savePatterns: entry, path={}, fileType={}", path, fileType);

        final DiffractionFileWriter writer = patternWriters.get(fileType == null ? settings.getFileType() : fileType);

        final List<DiffractionArray> loadedArrays = new ArrayList<>();
        for (final PatternArray array : dataset.getArrays()) {
            if (array.getState() == PatternState.LOADED) {
                loadedArrays.add(new SimpleDiffractionArray(array.getLabel(),
                                                            array.getIndexes(),
                                                            array.getPatterns()));
            }
        }

        final DiffractionMetadata.Builder metadataBuilder = dataset.getMetadata().toBuilder().setFilePath(path);
        try {
            writer.write(path, SimpleDiffractionDataset.fromArrays(metadataBuilder, loadedArrays));
        } catch (final IOException | RuntimeException e) {
            throw DiffractionDataException.writeFailed(path, e);
        }
    }

    public void closePatterns() {
        dataset.clear();
    }

    public StreamingIngestSession createStreamingSession(final DiffractionMetadata metadata) {
        return createStreamingSession(metadata, StreamingIngestSession.DEFAULT_HIGH_WATER_MARK);
    }

    /**
     * Detector geometry and crop center found in the metadata are applied to the settings immediately.
     *
     * @throws DiffractionDataException
     *   with INVALID_METADATA if the metadata is missing or inconsistent (settings are not changed).
     *
     * @throws IllegalArgumentException
     *   if the high water mark is less than 1 (settings are not changed).
     */
    public StreamingIngestSession createStreamingSession(final DiffractionMetadata metadata,
                                                         final int highWaterMark)
            throws DiffractionDataException, IllegalArgumentException {
        AssembledDataset.validate(metadata);
        final StreamingIngestSession session = new StreamingIngestSession(dataset, metadata, highWaterMark);
        applyOverrides(metadata, OpenPatternsOverrides.NONE);
        return session;
    }

    /**
     * Replaces the dataset with previously exported patterns.
     * The stored detector mask is restored when it matches the current detector.
     *
     * @throws DiffractionDataException
     *   with FILE_NOT_FOUND or READ_FAILED.
     */
    public void importAssembledPatterns(final Path path)
            throws DiffractionDataException {

        if ((path == null) || (! Files.isRegularFile(path))) {
            throw DiffractionDataException.fileNotFound(path);
        }

        final AssembledPatterns assembledPatterns;
        try {
            assembledPatterns = assembledPatternsFile.read(path);
        } catch (final IOException | RuntimeException e) {
            throw DiffractionDataException.readFailed(path, e);
        }

        final BadPixels rawBadPixels = assembledPatterns.getRawBadPixels();
        final ImageExtent detectorExtent = settings.getDetectorSettings().getExtent();
        if ((rawBadPixels != null) && rawBadPixels.getExtent().equals(detectorExtent)) {
            dataset.setBadPixels(rawBadPixels);
        } else if (rawBadPixels != null) {
            LOG.warn("importAssembledPatterns: ignoring stored {} mask because detector extent is {}",
                     rawBadPixels.getExtent(), detectorExtent);
        }

        dataset.importAssembledPatterns(assembledPatterns, path);
    }

    /**
     * Writes all loaded arrays and both bad pixel masks.
     *
     * @throws DiffractionDataException
     *   with WRITE_FAILED.
     */
    public void exportAssembledPatterns(final Path path)
            throws DiffractionDataException {
        try {
            assembledPatternsFile.write(path, dataset.getAssembledPatterns());
        } catch (final IOException | RuntimeException e) {
            throw DiffractionDataException.writeFailed(path, e);
        }
    }

    private void applyOverrides(final DiffractionMetadata metadata,
                                final OpenPatternsOverrides overrides) {

        final ImageExtent detectorExtent = overrides.getDetectorExtent() != null ?
                                           overrides.getDetectorExtent() : metadata.getDetectorExtent();
        if (detectorExtent != null) {
            settings.getDetectorSettings().setExtent(detectorExtent);
        }
        if (metadata.hasDetectorPixelGeometry()) {
            final DetectorSettings detectorSettings = settings.getDetectorSettings();
            detectorSettings.setDetector(
                    detectorSettings.getDetector().withPixelGeometry(metadata.getDetectorPixelGeometry()));
        }
        if (metadata.hasDetectorBitDepth()) {
            final DetectorSettings detectorSettings = settings.getDetectorSettings();
            detectorSettings.setDetector(detectorSettings.getDetector().withBitDepth(metadata.getDetectorBitDepth()));
        }

        final CropCenter cropCenter = overrides.getCropCenter() != null ?
                                      overrides.getCropCenter() : metadata.getCropCenter();
        if (cropCenter != null) {
            settings.setCropCenter(cropCenter);
        }
        if (overrides.getCropExtent() != null) {
            settings.setCropExtent(overrides.getCropExtent());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(DiffractionApi.class);
}
