package org.janelia.spectral2d.transform;

import java.util.OptionalDouble;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.view.Views;

/**
 * Converts matrix elements into the representation a transform works on.
 * Conversions never fail: an element that cannot be represented as a finite double becomes 0
 * and a scale constant outside the element type's range becomes 1.
 */
public class ElementCasts {

    public static <T extends RealType<T>> OptionalDouble toDouble(T value) {
        double v = value.getRealDouble();
        return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
    }

    /**
     * @return value converted to the element type, or the multiplicative identity if it cannot be represented
     */
    public static <T extends RealType<T>> T castOrOne(double value, T elementType) {
        T result = elementType.createVariable();
        if (Double.isFinite(value) && value >= result.getMinValue() && value <= result.getMaxValue()) {
            result.setReal(value);
        } else {
            result.setOne();
        }
        return result;
    }

    /**
     * Copy a real matrix into a new complex image with zero imaginary parts.
     */
    public static <T extends RealType<T>> Img<ComplexDoubleType> toComplex(RandomAccessibleInterval<T> source) {
        Img<ComplexDoubleType> target = new ArrayImgFactory<>(new ComplexDoubleType()).create(source.dimensionsAsLongArray());
        Cursor<T> sourceCursor = Views.flatIterable(source).cursor();
        Cursor<ComplexDoubleType> targetCursor = Views.flatIterable(target).cursor();
        while (sourceCursor.hasNext()) {
            targetCursor.next().set(toDouble(sourceCursor.next()).orElse(0.0), 0.0);
        }
        return target;
    }
}
