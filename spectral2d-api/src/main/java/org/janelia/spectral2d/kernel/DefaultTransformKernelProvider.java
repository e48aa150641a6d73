package org.janelia.spectral2d.kernel;

import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import org.janelia.spectral2d.TransformKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plans a new kernel on every call: direct-sum cosine kernels and JTransforms Fourier kernels.
 */
public class DefaultTransformKernelProvider implements TransformKernelProvider {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultTransformKernelProvider.class);

    @Override
    public <T extends RealType<T>> TransformKernel<T> planRealKernel(TransformKind kind, int length) {
        if (!kind.isCosine()) {
            throw new IllegalArgumentException("Cannot plan a real kernel for " + kind);
        }
        LOG.trace("Plan {} kernel of length {}", kind, length);
        return new CosineTransformKernel<>(kind, length);
    }

    @Override
    public TransformKernel<ComplexDoubleType> planComplexKernel(TransformKind kind, int length) {
        if (!kind.isFourier()) {
            throw new IllegalArgumentException("Cannot plan a complex kernel for " + kind);
        }
        LOG.trace("Plan {} kernel of length {}", kind, length);
        return new FourierTransformKernel(kind, length);
    }
}
