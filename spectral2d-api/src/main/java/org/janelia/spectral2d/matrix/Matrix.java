package org.janelia.spectral2d.matrix;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.NativeType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Dense row-major 2D matrix backed by an imglib2 image.
 * The shape is fixed at construction and always has at least one row and one column.
 *
 * @param <T> element type
 */
public class Matrix<T extends NativeType<T>> {

    private final Img<T> img;

    /**
     * Wrap an existing image without copying it.
     *
     * @param img 2D image where dimension 0 indexes columns and dimension 1 indexes rows
     */
    public Matrix(Img<T> img) {
        MatrixShapes.checkShape(img);
        this.img = img;
    }

    public long rows() {
        return MatrixShapes.rows(img);
    }

    public long cols() {
        return MatrixShapes.cols(img);
    }

    /**
     * @return a copy of the element at the given position
     */
    public T get(long row, long col) {
        RandomAccess<T> ra = img.randomAccess();
        return ra.setPositionAndGet(col, row).copy();
    }

    public void set(long row, long col, T value) {
        RandomAccess<T> ra = img.randomAccess();
        ra.setPositionAndGet(col, row).set(value);
    }

    /**
     * @return a new variable of this matrix' element type
     */
    public T elementType() {
        return img.firstElement().createVariable();
    }

    public Img<T> asImg() {
        return img;
    }

    public Matrix<T> copy() {
        return new Matrix<>(img.copy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        Matrix<?> that = (Matrix<?>) o;
        if (rows() != that.rows() || cols() != that.cols()) {
            return false;
        }
        Cursor<T> thisCursor = Views.flatIterable(img).cursor();
        Cursor<?> thatCursor = Views.flatIterable(that.img).cursor();
        while (thisCursor.hasNext()) {
            T thisValue = thisCursor.next();
            Object thatValue = thatCursor.next();
            if (thisValue.getClass() != thatValue.getClass()) {
                return false;
            }
            @SuppressWarnings("unchecked")
            T thatTypedValue = (T) thatValue;
            if (!thisValue.valueEquals(thatTypedValue)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(rows())
                .append(cols())
                .toHashCode();
    }

    @Override
    public String toString() {
        StringBuilder values = new StringBuilder("[");
        RandomAccess<T> ra = img.randomAccess();
        for (long r = 0; r < rows(); r++) {
            values.append(r == 0 ? "[" : ", [");
            for (long c = 0; c < cols(); c++) {
                if (c > 0) values.append(", ");
                values.append(ra.setPositionAndGet(c, r));
            }
            values.append("]");
        }
        values.append("]");
        return new ToStringBuilder(this)
                .append("rows", rows())
                .append("cols", cols())
                .append("values", values)
                .toString();
    }
}
