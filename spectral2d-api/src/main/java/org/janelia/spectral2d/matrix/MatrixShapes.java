package org.janelia.spectral2d.matrix;

import java.util.Arrays;

import net.imglib2.Dimensions;

/**
 * Axis conventions and shape checks shared by matrices and transforms.
 * Dimension 0 of the backing image is the column index and dimension 1 is the row index.
 */
public class MatrixShapes {

    public static final int COL_AXIS = 0;
    public static final int ROW_AXIS = 1;

    public static long rows(Dimensions dims) {
        return dims.dimension(ROW_AXIS);
    }

    public static long cols(Dimensions dims) {
        return dims.dimension(COL_AXIS);
    }

    /**
     * @param dims matrix dimensions
     * @throws InvalidShapeException if dims is not 2D or any dimension is empty
     */
    public static void checkShape(Dimensions dims) {
        if (dims.numDimensions() != 2) {
            throw new InvalidShapeException("Matrix must have exactly 2 dimensions - current shape is "
                    + Arrays.toString(dims.dimensionsAsLongArray()));
        }
        checkShape(rows(dims), cols(dims));
    }

    public static void checkShape(long rows, long cols) {
        if (rows < 1 || cols < 1) {
            throw new InvalidShapeException("Matrix must have at least one row and one column - current shape is "
                    + rows + "x" + cols);
        }
        if (rows * cols > Integer.MAX_VALUE) {
            throw new InvalidShapeException("Matrix is too large for an array backed image - current shape is "
                    + rows + "x" + cols);
        }
    }
}
