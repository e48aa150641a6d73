package org.janelia.spectral2d.kernel;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.view.Views;
import org.janelia.spectral2d.TransformKind;
import org.jtransforms.fft.DoubleFFT_1D;

/**
 * Unnormalized complex DFT backed by JTransforms.
 * Forward uses exp(-2 pi i n k / N), inverse uses exp(+2 pi i n k / N); neither divides by N.
 */
public class FourierTransformKernel extends AbstractTransformKernel<ComplexDoubleType> {

    private final DoubleFFT_1D fft; // null for length 1

    FourierTransformKernel(TransformKind kind, int length) {
        super(kind, length);
        if (!kind.isFourier()) {
            throw new IllegalArgumentException(kind + " is not a Fourier transform");
        }
        this.fft = length > 1 ? new DoubleFFT_1D(length) : null;
    }

    @Override
    public void process(RandomAccessibleInterval<ComplexDoubleType> input, RandomAccessibleInterval<ComplexDoubleType> output) {
        checkBuffers(input, output);
        // interleaved re, im pairs as expected by JTransforms
        double[] buffer = new double[2 * length];
        Cursor<ComplexDoubleType> inputCursor = Views.flatIterable(input).cursor();
        for (int i = 0; i < length; i++) {
            ComplexDoubleType v = inputCursor.next();
            buffer[2 * i] = v.getRealDouble();
            buffer[2 * i + 1] = v.getImaginaryDouble();
        }
        if (fft != null) {
            if (kind == TransformKind.FOURIER_FORWARD) {
                fft.complexForward(buffer);
            } else {
                fft.complexInverse(buffer, false);
            }
        }
        Cursor<ComplexDoubleType> outputCursor = Views.flatIterable(output).cursor();
        for (int i = 0; i < length; i++) {
            outputCursor.next().set(buffer[2 * i], buffer[2 * i + 1]);
        }
    }
}
