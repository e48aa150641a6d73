package org.janelia.spectral2d.transform;

import java.util.Random;

import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.spectral2d.TestUtils;
import org.janelia.spectral2d.TransformKind;
import org.janelia.spectral2d.matrix.Matrices;
import org.janelia.spectral2d.matrix.Matrix;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class DiscreteTransformsTest {

    private final SpectralTransforms spectralTransforms = SpectralTransforms.createDefault();

    @Test
    public void cosineTransformUsesTypes2And3() {
        Matrix<DoubleType> m = Matrices.ofDoubles(SeparableTransformEngineTest.randomValues(new Random(3), 4, 5));
        DiscreteCosineTransform<DoubleType> dct = new DiscreteCosineTransform<>(m);

        assertEquals(spectralTransforms.cosine(m, TransformKind.COSINE_TYPE2), dct.transform());
        assertEquals(spectralTransforms.cosine(m, TransformKind.COSINE_TYPE3), dct.inverse());
        assertEquals(spectralTransforms.cosine(m, TransformKind.COSINE_TYPE4), dct.perform(TransformKind.COSINE_TYPE4));
    }

    @Test
    public void fourierRoundTrip() {
        double[][] values = SeparableTransformEngineTest.randomValues(new Random(5), 6, 3);
        ForwardTransform<Matrix<ComplexDoubleType>> forward = new DiscreteFourierTransform<>(Matrices.ofDoubles(values), spectralTransforms);
        Matrix<ComplexDoubleType> frequencies = forward.transform();

        InverseTransform<Matrix<ComplexDoubleType>> inverse = new InverseDiscreteFourierTransform(frequencies, spectralTransforms);
        TestUtils.assertComplexMatrixEquals(values, TestUtils.zeros(6, 3), inverse.inverse(), 1e-6);
    }
}
