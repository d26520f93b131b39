package org.ptycho.diffraction.loader;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.ptycho.diffraction.data.BadPixels;
import org.ptycho.diffraction.detector.ImageExtent;
import org.ptycho.diffraction.json.JsonUtils;

/**
 * Reads bad pixels from JSON documents like:
 * <pre>
 *   { "width": 1024, "height": 1024, "badPixels": [ [ 10, 20 ], [ 11, 20 ] ] }
 * </pre>
 * where each bad pixel is an [x, y] pair.
 *
 * @author Diffraction Assembly Developers
 */
public class JsonBadPixelsReader
        implements BadPixelsFileReader {

    @Override
    public BadPixels read(final Path path)
            throws IOException {

        if (! Files.isRegularFile(path)) {
            throw new FileNotFoundException(path + " does not exist");
        }

        return JSON_HELPER.readFile(path).toBadPixels();
    }

    /**
     * JSON representation of a bad pixels mask.
     */
    public static class BadPixelsDocument {

        private final int width;
        private final int height;
        private final List<int[]> badPixels;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private BadPixelsDocument() {
            this(0, 0, new ArrayList<>());
        }

        public BadPixelsDocument(final int width,
                                 final int height,
                                 final List<int[]> badPixels) {
            this.width = width;
            this.height = height;
            this.badPixels = badPixels;
        }

        public static BadPixelsDocument fromBadPixels(final BadPixels badPixels) {
            final List<int[]> positions = new ArrayList<>(badPixels.getCount());
            for (int y = 0; y < badPixels.getHeight(); y++) {
                for (int x = 0; x < badPixels.getWidth(); x++) {
                    if (badPixels.isBad(x, y)) {
                        positions.add(new int[] { x, y });
                    }
                }
            }
            return new BadPixelsDocument(badPixels.getWidth(), badPixels.getHeight(), positions);
        }

        public BadPixels toBadPixels()
                throws IOException {
            if ((width < 1) || (height < 1)) {
                throw new IOException("invalid bad pixels extent " + width + "x" + height);
            }
            final boolean[] mask = new boolean[width * height];
            if (badPixels != null) {
                for (final int[] position : badPixels) {
                    if ((position == null) || (position.length != 2) ||
                        (position[0] < 0) || (position[0] >= width) ||
                        (position[1] < 0) || (position[1] >= height)) {
                        throw new IOException("invalid bad pixel position in " + width + "x" + height + " mask");
                    }
                    mask[position[1] * width + position[0]] = true;
                }
            }
            return new BadPixels(new ImageExtent(width, height), mask);
        }

        public String toJson() {
            return JSON_HELPER.toJson(this);
        }

        public void writeFile(final Path path)
                throws IOException {
            JSON_HELPER.writeFile(this, path);
        }
    }

    private static final JsonUtils.Helper<BadPixelsDocument> JSON_HELPER =
            new JsonUtils.Helper<>(BadPixelsDocument.class);
}
