package org.janelia.spectral2d.kernel;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.util.Intervals;
import org.janelia.spectral2d.TransformKind;

abstract class AbstractTransformKernel<T> implements TransformKernel<T> {

    final TransformKind kind;
    final int length;

    AbstractTransformKernel(TransformKind kind, int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Kernel length must be a positive integer - current value is " + length);
        }
        this.kind = kind;
        this.length = length;
    }

    @Override
    public int length() {
        return length;
    }

    void checkBuffers(RandomAccessibleInterval<T> input, RandomAccessibleInterval<T> output) {
        checkBuffer("input", input);
        checkBuffer("output", output);
    }

    private void checkBuffer(String name, RandomAccessibleInterval<T> buffer) {
        if (buffer.numDimensions() != 1 || Intervals.numElements(buffer) != length) {
            throw new IllegalArgumentException(kind + " kernel of length " + length
                    + " cannot process " + name + " buffer of shape " + Arrays.toString(buffer.dimensionsAsLongArray()));
        }
    }

    @Override
    public String toString() {
        return kind + "[" + length + "]";
    }
}
