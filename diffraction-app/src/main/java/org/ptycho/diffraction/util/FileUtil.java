package org.ptycho.diffraction.util;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 *
 * @author Diffraction Assembly Developers
 */
public class FileUtil {

    public static final FileUtil DEFAULT_INSTANCE = new FileUtil();

    private final int bufferSize;

    public FileUtil() {
        this(DEFAULT_BUFFER_SIZE);
    }

    public FileUtil(final int bufferSize) {
        this.bufferSize = bufferSize;
    }

    public Reader getExtensionBasedReader(final String fullPathName)
            throws IOException {
        return new InputStreamReader(getExtensionBasedInputStream(fullPathName), StandardCharsets.UTF_8);
    }

    public Writer getExtensionBasedWriter(final String fullPathName)
            throws IOException {
        return new OutputStreamWriter(getExtensionBasedDataOutputStream(fullPathName), StandardCharsets.UTF_8);
    }

    /**
     * @return buffered data stream for the specified file, gunzipping the content when the name ends with .gz.
     */
    public DataInputStream getExtensionBasedDataInputStream(final String fullPathName)
            throws IOException {
        return new DataInputStream(getExtensionBasedInputStream(fullPathName));
    }

    /**
     * @return buffered data stream for the specified file, gzipping the content when the name ends with .gz.
     */
    public DataOutputStream getExtensionBasedDataOutputStream(final String fullPathName)
            throws IOException {

        final OutputStream outputStream;

        if (fullPathName.endsWith(".gz")) {
            outputStream = new GZIPOutputStream(new FileOutputStream(fullPathName), bufferSize);
        } else {
            outputStream = new BufferedOutputStream(new FileOutputStream(fullPathName), bufferSize);
        }

        return new DataOutputStream(outputStream);
    }

    private InputStream getExtensionBasedInputStream(final String fullPathName)
            throws IOException {

        final InputStream inputStream;

        if (fullPathName.endsWith(".gz")) {
            inputStream = new GZIPInputStream(new FileInputStream(fullPathName), bufferSize);
        } else {
            inputStream = new BufferedInputStream(new FileInputStream(fullPathName), bufferSize);
        }

        return inputStream;
    }

    public static void ensureWritableDirectory(final File directory) {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    // last try
                    if (! directory.mkdirs()) {
                        if (! directory.exists()) {
                            throw new IllegalArgumentException("failed to create " + directory);
                        }
                    }
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    /**
     * Deletes the specified file, logging (but otherwise ignoring) failures.
     *
     * @return true if the file no longer exists.
     */
    public static boolean deleteQuietly(final Path path) {
        boolean deleted;
        try {
            Files.deleteIfExists(path);
            LOG.info("deleteQuietly: deleted {}", path);
            deleted = true;
        } catch (final IOException e) {
            LOG.warn("deleteQuietly: failed to delete " + path, e);
            deleted = false;
        }
        return deleted;
    }

    /**
     * @return the file name of the specified path without its last extension (e.g. "scan_001" for "scan_001.tif").
     */
    public static String getBaseName(final Path path) {
        final String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        final int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(0, dotIndex) : name;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

    private static final int DEFAULT_BUFFER_SIZE = 65536;

}
