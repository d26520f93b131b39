package org.ptycho.diffraction.data;

import java.util.Arrays;

/**
 * Heap backed {@link PatternStack}.
 *
 * @author Diffraction Assembly Developers
 */
public class IntPatternStack
        implements PatternStack {

    private final int frameCount;
    private final int width;
    private final int height;
    private final int[] data;

    public IntPatternStack(final int frameCount,
                           final int width,
                           final int height) {
        this(frameCount, width, height, new int[checkedSize(frameCount, width, height)]);
    }

    public IntPatternStack(final int frameCount,
                           final int width,
                           final int height,
                           final int[] data)
            throws IllegalArgumentException {
        if (data.length != checkedSize(frameCount, width, height)) {
            throw new IllegalArgumentException("data length " + data.length + " does not match " +
                                               frameCount + " frames of " + width + "x" + height);
        }
        this.frameCount = frameCount;
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * @return a single frame stack wrapping the specified row major pixels.
     */
    public static IntPatternStack forFrame(final int width,
                                           final int height,
                                           final int[] pixels) {
        return new IntPatternStack(1, width, height, pixels);
    }

    public static IntPatternStack copyOf(final PatternStack source) {
        final IntPatternStack copy = new IntPatternStack(source.getFrameCount(), source.getWidth(), source.getHeight());
        final int frameSize = source.getWidth() * source.getHeight();
        for (int frame = 0; frame < source.getFrameCount(); frame++) {
            System.arraycopy(source.getFrame(frame), 0, copy.data, frame * frameSize, frameSize);
        }
        return copy;
    }

    @Override
    public int getFrameCount() {
        return frameCount;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int get(final int frame,
                   final int y,
                   final int x) {
        return data[offset(frame, y, x)];
    }

    public void set(final int frame,
                    final int y,
                    final int x,
                    final int value) {
        data[offset(frame, y, x)] = value;
    }

    @Override
    public int[] getFrame(final int frame) {
        final int frameSize = width * height;
        final int from = frame * frameSize;
        return Arrays.copyOfRange(data, from, from + frameSize);
    }

    /**
     * @return the backing array (not a copy).
     */
    public int[] getData() {
        return data;
    }

    private int offset(final int frame,
                       final int y,
                       final int x) {
        return (frame * height + y) * width + x;
    }

    private static int checkedSize(final int frameCount,
                                   final int width,
                                   final int height)
            throws IllegalArgumentException {
        if ((frameCount < 0) || (width < 0) || (height < 0)) {
            throw new IllegalArgumentException("negative stack dimension " + frameCount + "x" + width + "x" + height);
        }
        final long size = (long) frameCount * width * height;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(frameCount + " frames of " + width + "x" + height +
                                               " are too large for an in-memory stack, enable memory mapping");
        }
        return (int) size;
    }
}
