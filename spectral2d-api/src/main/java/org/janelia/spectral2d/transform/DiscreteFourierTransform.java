package org.janelia.spectral2d.transform;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import org.janelia.spectral2d.matrix.Matrix;

/**
 * Forward DFT of a real matrix.
 *
 * @param <T> element type
 */
public class DiscreteFourierTransform<T extends RealType<T> & NativeType<T>> implements ForwardTransform<Matrix<ComplexDoubleType>> {

    private final Matrix<T> matrix;
    private final SpectralTransforms spectralTransforms;

    public DiscreteFourierTransform(Matrix<T> matrix) {
        this(matrix, SpectralTransforms.createDefault());
    }

    public DiscreteFourierTransform(Matrix<T> matrix, SpectralTransforms spectralTransforms) {
        this.matrix = matrix;
        this.spectralTransforms = spectralTransforms;
    }

    @Override
    public Matrix<ComplexDoubleType> transform() {
        return spectralTransforms.fourier(matrix);
    }
}
