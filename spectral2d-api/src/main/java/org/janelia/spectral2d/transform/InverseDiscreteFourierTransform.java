package org.janelia.spectral2d.transform;

import net.imglib2.type.numeric.complex.ComplexDoubleType;
import org.janelia.spectral2d.matrix.Matrix;

/**
 * Inverse DFT of a complex frequency domain matrix.
 */
public class InverseDiscreteFourierTransform implements InverseTransform<Matrix<ComplexDoubleType>> {

    private final Matrix<ComplexDoubleType> frequencies;
    private final SpectralTransforms spectralTransforms;

    public InverseDiscreteFourierTransform(Matrix<ComplexDoubleType> frequencies) {
        this(frequencies, SpectralTransforms.createDefault());
    }

    public InverseDiscreteFourierTransform(Matrix<ComplexDoubleType> frequencies, SpectralTransforms spectralTransforms) {
        this.frequencies = frequencies;
        this.spectralTransforms = spectralTransforms;
    }

    @Override
    public Matrix<ComplexDoubleType> inverse() {
        return spectralTransforms.inverseFourier(frequencies);
    }
}
