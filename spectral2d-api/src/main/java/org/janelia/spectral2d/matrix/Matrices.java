package org.janelia.spectral2d.matrix;

import java.util.function.IntUnaryOperator;

import net.imglib2.Cursor;
import net.imglib2.IterableInterval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.ImgFactory;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.integer.LongType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

public class Matrices {

    public static <T extends NativeType<T>> Matrix<T> create(long rows, long cols, T elementType) {
        MatrixShapes.checkShape(rows, cols);
        ImgFactory<T> imgFactory = new ArrayImgFactory<>(elementType);
        return new Matrix<>(imgFactory.create(cols, rows));
    }

    /**
     * Copy the content of a 2D interval into a new array backed matrix.
     *
     * @param source      dimension 0 of the source indexes columns and dimension 1 indexes rows
     * @param elementType target element type
     */
    public static <T extends NativeType<T>> Matrix<T> wrap(RandomAccessibleInterval<T> source, T elementType) {
        MatrixShapes.checkShape(source);
        Matrix<T> m = create(MatrixShapes.rows(source), MatrixShapes.cols(source), elementType);
        final IterableInterval<T> sourceIterable = Views.flatIterable(source);
        final IterableInterval<T> targetIterable = Views.flatIterable(m.asImg());
        final Cursor<T> sourceCursor = sourceIterable.cursor();
        final Cursor<T> targetCursor = targetIterable.cursor();
        while (sourceCursor.hasNext()) {
            targetCursor.next().set(sourceCursor.next());
        }
        return m;
    }

    public static Matrix<DoubleType> ofDoubles(double[][] values) {
        return fromRows(values.length, r -> values[r].length, new DoubleType(),
                (row, col, t) -> t.set(values[row][col]));
    }

    public static Matrix<FloatType> ofFloats(float[][] values) {
        return fromRows(values.length, r -> values[r].length, new FloatType(),
                (row, col, t) -> t.set(values[row][col]));
    }

    public static Matrix<IntType> ofInts(int[][] values) {
        return fromRows(values.length, r -> values[r].length, new IntType(),
                (row, col, t) -> t.set(values[row][col]));
    }

    public static Matrix<LongType> ofLongs(long[][] values) {
        return fromRows(values.length, r -> values[r].length, new LongType(),
                (row, col, t) -> t.set(values[row][col]));
    }

    /**
     * @param re real parts, one array per row
     * @param im imaginary parts with the same shape as re
     */
    public static Matrix<ComplexDoubleType> ofComplex(double[][] re, double[][] im) {
        if (re.length != im.length) {
            throw new IllegalArgumentException("Real and imaginary parts must have the same number of rows - "
                    + re.length + " vs " + im.length);
        }
        for (int r = 0; r < re.length; r++) {
            if (re[r].length != im[r].length) {
                throw new IllegalArgumentException("Real and imaginary parts of row " + r
                        + " must have the same length - " + re[r].length + " vs " + im[r].length);
            }
        }
        return fromRows(re.length, r -> re[r].length, new ComplexDoubleType(),
                (row, col, t) -> t.set(re[row][col], im[row][col]));
    }

    public static <T extends RealType<T> & NativeType<T>> double[][] toDoubleArray(Matrix<T> m) {
        return extract(m, RealType::getRealDouble);
    }

    public static double[][] realParts(Matrix<ComplexDoubleType> m) {
        return extract(m, ComplexDoubleType::getRealDouble);
    }

    public static double[][] imaginaryParts(Matrix<ComplexDoubleType> m) {
        return extract(m, ComplexDoubleType::getImaginaryDouble);
    }

    private interface ElementSetter<T> {
        void set(int row, int col, T target);
    }

    private interface ElementGetter<T> {
        double get(T source);
    }

    private static <T extends NativeType<T>> Matrix<T> fromRows(int nrows,
                                                                 IntUnaryOperator rowLength,
                                                                 T elementType,
                                                                 ElementSetter<T> setter) {
        int ncols = nrows > 0 ? rowLength.applyAsInt(0) : 0;
        for (int r = 1; r < nrows; r++) {
            if (rowLength.applyAsInt(r) != ncols) {
                throw new IllegalArgumentException("All rows must have the same length - row " + r + " has "
                        + rowLength.applyAsInt(r) + " elements instead of " + ncols);
            }
        }
        Matrix<T> m = create(nrows, ncols, elementType);
        RandomAccess<T> ra = m.asImg().randomAccess();
        for (int r = 0; r < nrows; r++) {
            for (int c = 0; c < ncols; c++) {
                setter.set(r, c, ra.setPositionAndGet(c, r));
            }
        }
        return m;
    }

    private static <T extends NativeType<T>> double[][] extract(Matrix<T> m, ElementGetter<T> getter) {
        Img<T> img = m.asImg();
        double[][] values = new double[(int) m.rows()][(int) m.cols()];
        RandomAccess<T> ra = img.randomAccess();
        for (int r = 0; r < values.length; r++) {
            for (int c = 0; c < values[r].length; c++) {
                values[r][c] = getter.get(ra.setPositionAndGet(c, r));
            }
        }
        return values;
    }
}
