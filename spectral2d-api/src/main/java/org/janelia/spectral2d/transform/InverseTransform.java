package org.janelia.spectral2d.transform;

/**
 * Moves a matrix from the frequency domain back into the spatial domain.
 *
 * @param <O> spatial domain representation
 */
@FunctionalInterface
public interface InverseTransform<O> {
    O inverse();
}
