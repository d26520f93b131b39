package org.ptycho.diffraction.data;

/**
 * Read only wrapper that hides the mutators of the wrapped stack.
 *
 * @author Diffraction Assembly Developers
 */
public class UnmodifiablePatternStack
        implements PatternStack {

    private final PatternStack delegate;

    private UnmodifiablePatternStack(final PatternStack delegate) {
        this.delegate = delegate;
    }

    /**
     * @return the specified stack if it is already read only, otherwise a read only wrapper for it.
     */
    public static PatternStack of(final PatternStack patterns) {
        if ((patterns == null) || (patterns instanceof UnmodifiablePatternStack)) {
            return patterns;
        }
        return new UnmodifiablePatternStack(patterns);
    }

    @Override
    public int getFrameCount() {
        return delegate.getFrameCount();
    }

    @Override
    public int getWidth() {
        return delegate.getWidth();
    }

    @Override
    public int getHeight() {
        return delegate.getHeight();
    }

    @Override
    public int get(final int frame,
                   final int y,
                   final int x) {
        return delegate.get(frame, y, x);
    }

    @Override
    public int[] getFrame(final int frame) {
        return delegate.getFrame(frame);
    }

    @Override
    public String toString() {
        return "UnmodifiablePatternStack{" + getFrameCount() + " x " + getFrameExtent() + '}';
    }
}
