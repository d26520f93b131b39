package org.ptycho.diffraction;

/**
 * Structural or I/O failure reported by the dataset assembly components.
 * Configuration range violations are never reported this way (they are clamped instead).
 *
 * @author Diffraction Assembly Developers
 */
public class DiffractionDataException
        extends RuntimeException {

    public enum ErrorType {
        FILE_NOT_FOUND,
        UNKNOWN_FILE_TYPE,
        READ_FAILED,
        WRITE_FAILED,
        SHAPE_MISMATCH,
        INVALID_METADATA,
        INCOMPLETE_DATASET,
        INDEX_OUT_OF_RANGE,
        SESSION_CLOSED
    }

    private final ErrorType errorType;

    public DiffractionDataException(final ErrorType errorType,
                                    final String message) {
        this(errorType, message, null);
    }

    public DiffractionDataException(final ErrorType errorType,
                                    final String message,
                                    final Throwable cause) {
        super(errorType + ": " + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public static DiffractionDataException fileNotFound(final Object path) {
        return new DiffractionDataException(ErrorType.FILE_NOT_FOUND, path + " does not exist");
    }

    public static DiffractionDataException unknownFileType(final String fileType,
                                                           final Iterable<String> knownFileTypes) {
        return new DiffractionDataException(ErrorType.UNKNOWN_FILE_TYPE,
                                            "file type '" + fileType + "' is not registered, known types are " +
                                            knownFileTypes);
    }

    public static DiffractionDataException readFailed(final Object path,
                                                      final Throwable cause) {
        return new DiffractionDataException(ErrorType.READ_FAILED, "failed to read " + path, cause);
    }

    public static DiffractionDataException writeFailed(final Object path,
                                                       final Throwable cause) {
        return new DiffractionDataException(ErrorType.WRITE_FAILED, "failed to write " + path, cause);
    }

    public static DiffractionDataException shapeMismatch(final Object actual,
                                                         final Object expected) {
        return new DiffractionDataException(ErrorType.SHAPE_MISMATCH,
                                            "extent " + actual + " does not match expected extent " + expected);
    }
}
