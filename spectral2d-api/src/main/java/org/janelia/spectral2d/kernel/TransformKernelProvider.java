package org.janelia.spectral2d.kernel;

import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import org.janelia.spectral2d.TransformKind;

/**
 * Plans the 1D kernels used by the separable transforms.
 * Kernels returned by a provider must not keep state between {@link TransformKernel#process} calls
 * because the same kernel instance may be used concurrently for different rows.
 */
public interface TransformKernelProvider {

    /**
     * @param kind   one of the cosine kinds
     * @param length buffer length, at least 1
     * @throws IllegalArgumentException if kind is not a cosine transform or length is not positive
     */
    <T extends RealType<T>> TransformKernel<T> planRealKernel(TransformKind kind, int length);

    /**
     * @param kind   {@link TransformKind#FOURIER_FORWARD} or {@link TransformKind#FOURIER_INVERSE}
     * @param length buffer length, at least 1
     * @throws IllegalArgumentException if kind is not a Fourier transform or length is not positive
     */
    TransformKernel<ComplexDoubleType> planComplexKernel(TransformKind kind, int length);
}
