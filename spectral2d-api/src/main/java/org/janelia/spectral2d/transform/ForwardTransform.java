package org.janelia.spectral2d.transform;

/**
 * Moves a matrix into the frequency domain.
 *
 * @param <O> frequency domain representation
 */
@FunctionalInterface
public interface ForwardTransform<O> {
    O transform();
}
