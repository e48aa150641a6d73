package org.janelia.spectral2d.shift;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.view.Views;
import org.janelia.spectral2d.matrix.Matrices;
import org.janelia.spectral2d.matrix.Matrix;
import org.janelia.spectral2d.matrix.MatrixShapes;

/**
 * Circular quadrant rotation that moves the zero frequency component from the corner to the center.
 * Row i moves to row (i + floor(rows / 2)) mod rows and column j moves to column (j + floor(cols / 2)) mod cols.
 * For an odd dimension a second shift does not restore the original matrix.
 */
public class SpectrumShift {

    /**
     * @return a new shifted matrix; the argument is not modified
     */
    public static <T extends NativeType<T>> Matrix<T> shift(Matrix<T> m) {
        return Matrices.wrap(shiftedView(m.asImg()), m.elementType());
    }

    public static <T extends NativeType<T>> void shiftInPlace(Matrix<T> m) {
        Img<T> img = m.asImg();
        Img<T> snapshot = img.copy();
        Cursor<T> shiftedCursor = Views.flatIterable(shiftedView(snapshot)).cursor();
        Cursor<T> targetCursor = Views.flatIterable(img).cursor();
        while (targetCursor.hasNext()) {
            targetCursor.next().set(shiftedCursor.next());
        }
    }

    /**
     * A lazy shifted view of a 2D interval.
     *
     * @param img dimension 0 indexes columns and dimension 1 indexes rows
     */
    public static <T> RandomAccessibleInterval<T> shiftedView(RandomAccessibleInterval<T> img) {
        MatrixShapes.checkShape(img);
        long rowOffset = MatrixShapes.rows(img) / 2;
        long colOffset = MatrixShapes.cols(img) / 2;
        long[] offsets = new long[2];
        offsets[MatrixShapes.COL_AXIS] = colOffset;
        offsets[MatrixShapes.ROW_AXIS] = rowOffset;
        return Views.interval(Views.translate(Views.extendPeriodic(img), offsets), img);
    }
}
