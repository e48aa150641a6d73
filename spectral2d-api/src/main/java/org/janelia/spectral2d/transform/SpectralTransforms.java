package org.janelia.spectral2d.transform;

import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import org.janelia.spectral2d.TransformKind;
import org.janelia.spectral2d.kernel.DefaultTransformKernelProvider;
import org.janelia.spectral2d.matrix.Matrix;
import org.janelia.spectral2d.shift.SpectrumShift;

/**
 * Entry point for all 2D transforms. Every call returns a new matrix and leaves its argument unchanged.
 */
public class SpectralTransforms {

    private final SeparableTransformEngine engine;

    public SpectralTransforms(SeparableTransformEngine engine) {
        this.engine = engine;
    }

    /**
     * Single threaded transforms that plan their kernels on every call.
     */
    public static SpectralTransforms createDefault() {
        return new SpectralTransforms(new SeparableTransformEngine(new DefaultTransformKernelProvider()));
    }

    /**
     * Apply any transform kind.
     *
     * @param matrix real matrix for cosine and forward Fourier transforms,
     *               {@link ComplexDoubleType} matrix for the inverse Fourier transform
     * @return a matrix with the input's element type for cosine kinds, a {@link ComplexDoubleType} matrix for Fourier kinds
     * @throws IllegalArgumentException if the element type does not match the kind
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public <T extends NativeType<T>> Matrix<?> transform(Matrix<T> matrix, TransformKind kind) {
        switch (kind) {
            case COSINE_TYPE1:
            case COSINE_TYPE2:
            case COSINE_TYPE3:
            case COSINE_TYPE4:
                return cosine((Matrix) asRealMatrix(matrix, kind), kind);
            case FOURIER_FORWARD:
                return fourier((Matrix) asRealMatrix(matrix, kind));
            case FOURIER_INVERSE:
                return inverseFourier(asComplexMatrix(matrix, kind));
            default:
                throw new UnsupportedOperationException(kind + " transform is not implemented");
        }
    }

    public <T extends RealType<T> & NativeType<T>> Matrix<T> cosine(Matrix<T> matrix, TransformKind kind) {
        return new Matrix<>(engine.applyCosine(matrix.asImg(), kind));
    }

    public <T extends RealType<T> & NativeType<T>> Matrix<ComplexDoubleType> fourier(Matrix<T> matrix) {
        return new Matrix<>(engine.applyFourier(matrix.asImg()));
    }

    public Matrix<ComplexDoubleType> inverseFourier(Matrix<ComplexDoubleType> matrix) {
        return new Matrix<>(engine.applyInverseFourier(matrix.asImg()));
    }

    public <T extends NativeType<T>> Matrix<T> shift(Matrix<T> matrix) {
        return SpectrumShift.shift(matrix);
    }

    public <T extends NativeType<T>> void shiftInPlace(Matrix<T> matrix) {
        SpectrumShift.shiftInPlace(matrix);
    }

    @SuppressWarnings("unchecked")
    private static <R extends RealType<R> & NativeType<R>> Matrix<R> asRealMatrix(Matrix<?> matrix, TransformKind kind) {
        if (!(matrix.elementType() instanceof RealType)) {
            throw new IllegalArgumentException(kind + " requires real elements - found "
                    + matrix.elementType().getClass().getSimpleName());
        }
        return (Matrix<R>) matrix;
    }

    @SuppressWarnings("unchecked")
    private static Matrix<ComplexDoubleType> asComplexMatrix(Matrix<?> matrix, TransformKind kind) {
        if (!(matrix.elementType() instanceof ComplexDoubleType)) {
            throw new IllegalArgumentException(kind + " requires ComplexDoubleType elements - found "
                    + matrix.elementType().getClass().getSimpleName());
        }
        return (Matrix<ComplexDoubleType>) matrix;
    }
}
