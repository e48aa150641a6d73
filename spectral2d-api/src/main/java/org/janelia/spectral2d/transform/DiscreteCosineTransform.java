package org.janelia.spectral2d.transform;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import org.janelia.spectral2d.TransformKind;
import org.janelia.spectral2d.matrix.Matrix;

/**
 * DCT of a real matrix: forward is type II, inverse is type III.
 *
 * @param <T> element type
 */
public class DiscreteCosineTransform<T extends RealType<T> & NativeType<T>> implements ForwardTransform<Matrix<T>>, InverseTransform<Matrix<T>> {

    private final Matrix<T> matrix;
    private final SpectralTransforms spectralTransforms;

    public DiscreteCosineTransform(Matrix<T> matrix) {
        this(matrix, SpectralTransforms.createDefault());
    }

    public DiscreteCosineTransform(Matrix<T> matrix, SpectralTransforms spectralTransforms) {
        this.matrix = matrix;
        this.spectralTransforms = spectralTransforms;
    }

    @Override
    public Matrix<T> transform() {
        return perform(TransformKind.COSINE_TYPE2);
    }

    @Override
    public Matrix<T> inverse() {
        return perform(TransformKind.COSINE_TYPE3);
    }

    /**
     * @param kind one of the cosine kinds
     */
    public Matrix<T> perform(TransformKind kind) {
        return spectralTransforms.cosine(matrix, kind);
    }
}
