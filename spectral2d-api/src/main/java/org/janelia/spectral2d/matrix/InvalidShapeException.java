package org.janelia.spectral2d.matrix;

/**
 * Raised when a matrix is not two dimensional or has an empty dimension.
 */
public class InvalidShapeException extends IllegalArgumentException {

    public InvalidShapeException(String message) {
        super(message);
    }
}
