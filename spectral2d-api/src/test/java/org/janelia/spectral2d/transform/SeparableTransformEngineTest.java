package org.janelia.spectral2d.transform;

import java.util.Random;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;
import org.janelia.spectral2d.TestUtils;
import org.janelia.spectral2d.TransformKind;
import org.janelia.spectral2d.kernel.DefaultTransformKernelProvider;
import org.janelia.spectral2d.matrix.InvalidShapeException;
import org.janelia.spectral2d.matrix.Matrices;
import org.janelia.spectral2d.matrix.Matrix;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class SeparableTransformEngineTest {

    private final SeparableTransformEngine engine = new SeparableTransformEngine(new DefaultTransformKernelProvider());

    @Test
    public void cosineScale() {
        assertEquals(4, SeparableTransformEngine.cosineScale(3, 3), 0);
        assertEquals(5.5, SeparableTransformEngine.cosineScale(3, 4), 0);
        assertEquals(0, SeparableTransformEngine.cosineScale(1, 1), 0);
    }

    @Test
    public void forwardFourierMatchesDirectSums() {
        double[][] values = randomValues(new Random(17), 5, 6);
        Matrix<DoubleType> m = Matrices.ofDoubles(values);

        Img<ComplexDoubleType> result = engine.applyFourier(m.asImg());

        double[][][] expected = TestUtils.directDft(values, TestUtils.zeros(5, 6), false);
        TestUtils.assertComplexMatrixEquals(expected[0], expected[1], new Matrix<>(result), 1e-9);
    }

    @Test
    public void inverseFourierMatchesScaledDirectSums() {
        Random random = new Random(23);
        double[][] re = randomValues(random, 4, 3);
        double[][] im = randomValues(random, 4, 3);

        Img<ComplexDoubleType> result = engine.applyInverseFourier(Matrices.ofComplex(re, im).asImg());

        double[][][] expected = TestUtils.directDft(re, im, true);
        for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 3; c++) {
                expected[0][r][c] /= 12;
                expected[1][r][c] /= 12;
            }
        }
        TestUtils.assertComplexMatrixEquals(expected[0], expected[1], new Matrix<>(result), 1e-9);
    }

    @Test
    public void degenerateShapesUseSingleAxisTransform() {
        class TestData {
            final double[][] values;

            TestData(double[][] values) {
                this.values = values;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(new double[][] {{1}, {-2}, {5}, {0.5}}),
                new TestData(new double[][] {{1, -2, 5, 0.5, 3}}),
                new TestData(new double[][] {{7}}),
        };
        for (TestData td : testData) {
            int rows = td.values.length;
            int cols = td.values[0].length;
            double[][][] expected = TestUtils.directDft(td.values, TestUtils.zeros(rows, cols), false);
            Matrix<ComplexDoubleType> forward = new Matrix<>(engine.applyFourier(Matrices.ofDoubles(td.values).asImg()));
            TestUtils.assertComplexMatrixEquals(expected[0], expected[1], forward, 1e-9);

            Matrix<ComplexDoubleType> back = new Matrix<>(engine.applyInverseFourier(forward.asImg()));
            TestUtils.assertComplexMatrixEquals(td.values, TestUtils.zeros(rows, cols), back, 1e-9);
        }
    }

    @Test
    public void cosineKindsMatchSeparableDefinition() {
        class TestData {
            final int rows;
            final int cols;

            TestData(int rows, int cols) {
                this.rows = rows;
                this.cols = cols;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(1, 4),
                new TestData(5, 1),
                new TestData(1, 2),
                new TestData(2, 1),
                new TestData(3, 4),
                new TestData(4, 2),
        };
        Random random = new Random(11);
        for (TestData td : testData) {
            double[][] values = randomValues(random, td.rows, td.cols);
            double scale = (td.rows * td.cols - 1) / 2.0;
            for (TransformKind kind : new TransformKind[] {TransformKind.COSINE_TYPE1, TransformKind.COSINE_TYPE2,
                    TransformKind.COSINE_TYPE3, TransformKind.COSINE_TYPE4}) {
                double[][] expected = new double[td.rows][td.cols];
                for (int k = 0; k < td.rows; k++) {
                    for (int l = 0; l < td.cols; l++) {
                        double sum = 0;
                        for (int r = 0; r < td.rows; r++) {
                            for (int c = 0; c < td.cols; c++) {
                                sum += cosineCoefficient(kind, td.rows, k, r) * cosineCoefficient(kind, td.cols, l, c) * values[r][c];
                            }
                        }
                        expected[k][l] = sum * scale;
                    }
                }
                Matrix<DoubleType> result = new Matrix<>(engine.applyCosine(Matrices.ofDoubles(values).asImg(), kind));
                TestUtils.assertMatrixEquals(expected, result, 1e-9);
            }
        }
    }

    @Test
    public void cosineOfSingleRowRunsLengthOneColumnKernel() {
        // a length 1 DCT-III halves its input and a length 1 DCT-IV scales it by cos(pi / 4)
        Matrix<DoubleType> row = Matrices.ofDoubles(new double[][] {{1, 2}});
        Matrix<DoubleType> column = Matrices.ofDoubles(new double[][] {{1}, {2}});
        double c = Math.cos(Math.PI / 4);

        double[] dct3 = new double[] {0.5 + 2 * c, 0.5 - 2 * c};
        double[] dct4 = new double[] {Math.cos(Math.PI / 8) + 2 * Math.cos(3 * Math.PI / 8), Math.cos(3 * Math.PI / 8) - 2 * Math.cos(Math.PI / 8)};

        Matrix<DoubleType> rowDct3 = new Matrix<>(engine.applyCosine(row.asImg(), TransformKind.COSINE_TYPE3));
        TestUtils.assertMatrixEquals(new double[][] {{dct3[0] * 0.25, dct3[1] * 0.25}}, rowDct3, 1e-12);
        assertEquals(0.4785533905932738, rowDct3.get(0, 0).get(), 1e-12);

        Matrix<DoubleType> columnDct3 = new Matrix<>(engine.applyCosine(column.asImg(), TransformKind.COSINE_TYPE3));
        TestUtils.assertMatrixEquals(new double[][] {{dct3[0] * 0.25}, {dct3[1] * 0.25}}, columnDct3, 1e-12);

        Matrix<DoubleType> rowDct4 = new Matrix<>(engine.applyCosine(row.asImg(), TransformKind.COSINE_TYPE4));
        TestUtils.assertMatrixEquals(new double[][] {{dct4[0] * c * 0.5, dct4[1] * c * 0.5}}, rowDct4, 1e-12);

        Matrix<DoubleType> columnDct4 = new Matrix<>(engine.applyCosine(column.asImg(), TransformKind.COSINE_TYPE4));
        TestUtils.assertMatrixEquals(new double[][] {{dct4[0] * c * 0.5}, {dct4[1] * c * 0.5}}, columnDct4, 1e-12);
    }

    @Test
    public void nonFiniteElementsBecomeZero() {
        Matrix<DoubleType> m = Matrices.ofDoubles(new double[][] {{Double.NaN, 1}, {Double.POSITIVE_INFINITY, 0}});
        Matrix<ComplexDoubleType> result = new Matrix<>(engine.applyFourier(m.asImg()));
        TestUtils.assertComplexMatrixEquals(
                new double[][] {{1, -1}, {1, -1}},
                TestUtils.zeros(2, 2),
                result,
                1e-12);
    }

    @Test
    public void inputIsNotModified() {
        double[][] values = new double[][] {{1, 2, 3}, {4, 5, 6}};
        Matrix<DoubleType> m = Matrices.ofDoubles(values);
        engine.applyCosine(m.asImg(), TransformKind.COSINE_TYPE4);
        engine.applyFourier(m.asImg());
        TestUtils.assertMatrixEquals(values, m, 0);
    }

    @Test
    public void rejectsInvalidInputs() {
        Img<DoubleType> img = ArrayImgs.doubles(3, 3);
        try {
            engine.applyFourier(Views.interval(img, Intervals.createMinMax(0, 0, -1, 2)));
            fail("Empty interval must be rejected");
        } catch (InvalidShapeException expected) {
            // ok
        }
        try {
            engine.applyCosine(ArrayImgs.doubles(2, 2, 2), TransformKind.COSINE_TYPE1);
            fail("3D image must be rejected");
        } catch (InvalidShapeException expected) {
            // ok
        }
        try {
            engine.applyCosine(img, TransformKind.FOURIER_FORWARD);
            fail("Fourier kind must be rejected for a cosine transform");
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }

    /**
     * Coefficient of x[n] in X[k] for a 1D cosine transform of length len.
     */
    private static double cosineCoefficient(TransformKind kind, int len, int k, int n) {
        switch (kind) {
            case COSINE_TYPE1: {
                double coefficient = 0;
                if (n == 0) {
                    coefficient += 0.5;
                }
                if (n == len - 1) {
                    coefficient += k % 2 == 0 ? 0.5 : -0.5;
                }
                if (n > 0 && n < len - 1) {
                    coefficient += Math.cos(Math.PI * n * k / (len - 1));
                }
                return coefficient;
            }
            case COSINE_TYPE2:
                return Math.cos(Math.PI * (n + 0.5) * k / len);
            case COSINE_TYPE3:
                return n == 0 ? 0.5 : Math.cos(Math.PI * n * (k + 0.5) / len);
            case COSINE_TYPE4:
                return Math.cos(Math.PI * (n + 0.5) * (k + 0.5) / len);
            default:
                throw new IllegalArgumentException(kind + " is not a cosine transform");
        }
    }

    static double[][] randomValues(Random random, int rows, int cols) {
        double[][] values = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                values[r][c] = random.nextDouble() * 20 - 10;
            }
        }
        return values;
    }
}
