package org.janelia.spectral2d.kernel;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import org.janelia.spectral2d.TransformKind;

/**
 * Unnormalized DCT of types I-IV evaluated directly from a precomputed coefficient table.
 * The kernel computes in double precision and writes the result back through {@link RealType#setReal(double)},
 * so the same table serves every real element type and the kernel can be shared between threads.
 *
 * <pre>
 * DCT-I:   X[k] = (x[0] + (-1)^k x[N-1]) / 2 + sum_{n=1}^{N-2} x[n] cos(pi n k / (N-1))
 * DCT-II:  X[k] = sum_{n=0}^{N-1} x[n] cos(pi (n + 1/2) k / N)
 * DCT-III: X[k] = x[0] / 2 + sum_{n=1}^{N-1} x[n] cos(pi n (k + 1/2) / N)
 * DCT-IV:  X[k] = sum_{n=0}^{N-1} x[n] cos(pi (n + 1/2) (k + 1/2) / N)
 * </pre>
 *
 * @param <T> element type
 */
public class CosineTransformKernel<T extends RealType<T>> extends AbstractTransformKernel<T> {

    private final double[][] coefficients; // [k][n]

    CosineTransformKernel(TransformKind kind, int length) {
        super(kind, length);
        this.coefficients = createCoefficients(kind, length);
    }

    @Override
    public void process(RandomAccessibleInterval<T> input, RandomAccessibleInterval<T> output) {
        checkBuffers(input, output);
        double[] x = new double[length];
        Cursor<T> inputCursor = Views.flatIterable(input).cursor();
        for (int n = 0; n < length; n++) {
            x[n] = inputCursor.next().getRealDouble();
        }
        Cursor<T> outputCursor = Views.flatIterable(output).cursor();
        for (int k = 0; k < length; k++) {
            double[] kCoefficients = coefficients[k];
            double sum = 0;
            for (int n = 0; n < length; n++) {
                sum += kCoefficients[n] * x[n];
            }
            outputCursor.next().setReal(sum);
        }
    }

    private static double[][] createCoefficients(TransformKind kind, int n) {
        double[][] c = new double[n][n];
        switch (kind) {
            case COSINE_TYPE1:
                if (n == 1) {
                    c[0][0] = 1;
                    break;
                }
                for (int k = 0; k < n; k++) {
                    c[k][0] = 0.5;
                    for (int i = 1; i < n - 1; i++) {
                        c[k][i] = Math.cos(Math.PI * i * k / (n - 1));
                    }
                    c[k][n - 1] = k % 2 == 0 ? 0.5 : -0.5;
                }
                break;
            case COSINE_TYPE2:
                for (int k = 0; k < n; k++) {
                    for (int i = 0; i < n; i++) {
                        c[k][i] = Math.cos(Math.PI * (i + 0.5) * k / n);
                    }
                }
                break;
            case COSINE_TYPE3:
                for (int k = 0; k < n; k++) {
                    c[k][0] = 0.5;
                    for (int i = 1; i < n; i++) {
                        c[k][i] = Math.cos(Math.PI * i * (k + 0.5) / n);
                    }
                }
                break;
            case COSINE_TYPE4:
                for (int k = 0; k < n; k++) {
                    for (int i = 0; i < n; i++) {
                        c[k][i] = Math.cos(Math.PI * (i + 0.5) * (k + 0.5) / n);
                    }
                }
                break;
            default:
                throw new IllegalArgumentException(kind + " is not a cosine transform");
        }
        return c;
    }
}
