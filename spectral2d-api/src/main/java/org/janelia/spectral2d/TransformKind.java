package org.janelia.spectral2d;

/**
 * Selects the 1D kernel family used along each axis and the normalization applied to the 2D result.
 */
public enum TransformKind {
    COSINE_TYPE1,
    COSINE_TYPE2,
    COSINE_TYPE3,
    COSINE_TYPE4,
    FOURIER_FORWARD,
    FOURIER_INVERSE;

    public boolean isCosine() {
        return this == COSINE_TYPE1 || this == COSINE_TYPE2 || this == COSINE_TYPE3 || this == COSINE_TYPE4;
    }

    public boolean isFourier() {
        return this == FOURIER_FORWARD || this == FOURIER_INVERSE;
    }
}
