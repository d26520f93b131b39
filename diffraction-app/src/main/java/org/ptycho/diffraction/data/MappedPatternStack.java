package org.ptycho.diffraction.data;

import java.nio.IntBuffer;

/**
 * {@link PatternStack} backed by a region of a memory mapped scratch file.
 * Only absolute buffer operations are used so instances can be read concurrently.
 *
 * @author Diffraction Assembly Developers
 */
public class MappedPatternStack
        implements PatternStack {

    private final int frameCount;
    private final int width;
    private final int height;
    private final IntBuffer buffer;

    public MappedPatternStack(final int frameCount,
                              final int width,
                              final int height,
                              final IntBuffer buffer)
            throws IllegalArgumentException {
        final long expectedCapacity = (long) frameCount * width * height;
        if (buffer.capacity() != expectedCapacity) {
            throw new IllegalArgumentException("buffer capacity " + buffer.capacity() + " does not match " +
                                               frameCount + " frames of " + width + "x" + height);
        }
        this.frameCount = frameCount;
        this.width = width;
        this.height = height;
        this.buffer = buffer;
    }

    /**
     * Copies every value of the source stack into this stack's mapped region.
     */
    public void copyFrom(final PatternStack source)
            throws IllegalArgumentException {
        if ((source.getFrameCount() != frameCount) || (source.getWidth() != width) || (source.getHeight() != height)) {
            throw new IllegalArgumentException("source stack " + source.getFrameCount() + "x" +
                                               source.getFrameExtent() + " does not match mapped stack " +
                                               frameCount + "x" + getFrameExtent());
        }
        final int frameSize = width * height;
        for (int frame = 0; frame < frameCount; frame++) {
            final int[] pixels = source.getFrame(frame);
            final int offset = frame * frameSize;
            for (int i = 0; i < frameSize; i++) {
                buffer.put(offset + i, pixels[i]);
            }
        }
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
        return buffer.get((frame * height + y) * width + x);
    }
}
