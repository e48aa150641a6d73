package org.janelia.spectral2d.kernel;

import net.imglib2.RandomAccessibleInterval;

/**
 * A 1D transform bound to a buffer length.
 *
 * @param <T> buffer element type
 */
public interface TransformKernel<T> {

    int length();

    /**
     * Transform input into output. Both buffers are 1D intervals of {@link #length()} elements;
     * the input is left unchanged.
     */
    void process(RandomAccessibleInterval<T> input, RandomAccessibleInterval<T> output);
}
