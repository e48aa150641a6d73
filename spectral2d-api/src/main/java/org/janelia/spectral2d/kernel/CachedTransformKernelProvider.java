package org.janelia.spectral2d.kernel;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.spectral2d.TransformKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps planned kernels keyed by (kind, length) so repeated transforms of the same shape plan each kernel once.
 * Real kernels of the delegate must not depend on the element type since one cached instance is returned
 * for every real type.
 */
public class CachedTransformKernelProvider implements TransformKernelProvider {

    private static final Logger LOG = LoggerFactory.getLogger(CachedTransformKernelProvider.class);

    private static class KernelKey {
        private final TransformKind kind;
        private final int length;

        KernelKey(TransformKind kind, int length) {
            this.kind = kind;
            this.length = length;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;

            if (o == null || getClass() != o.getClass()) return false;

            KernelKey that = (KernelKey) o;

            return new EqualsBuilder()
                    .append(kind, that.kind)
                    .append(length, that.length)
                    .isEquals();
        }

        @Override
        public int hashCode() {
            return new HashCodeBuilder(17, 37)
                    .append(kind)
                    .append(length)
                    .toHashCode();
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this)
                    .append("kind", kind)
                    .append("length", length)
                    .toString();
        }
    }

    private final TransformKernelProvider delegate;
    private final LoadingCache<KernelKey, TransformKernel<?>> kernelsCache;

    public CachedTransformKernelProvider(TransformKernelProvider delegate, long maxSize) {
        LOG.info("Initialize kernel cache: size={}", maxSize);
        this.delegate = delegate;
        this.kernelsCache = CacheBuilder.newBuilder()
                .maximumSize(maxSize)
                .build(new CacheLoader<KernelKey, TransformKernel<?>>() {
                    @Override
                    public TransformKernel<?> load(KernelKey key) {
                        LOG.debug("Kernel cache miss for {}", key);
                        if (key.kind.isCosine()) {
                            return delegate.<DoubleType>planRealKernel(key.kind, key.length);
                        } else {
                            return delegate.planComplexKernel(key.kind, key.length);
                        }
                    }
                });
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T extends RealType<T>> TransformKernel<T> planRealKernel(TransformKind kind, int length) {
        if (!kind.isCosine()) {
            throw new IllegalArgumentException("Cannot plan a real kernel for " + kind);
        }
        return (TransformKernel<T>) getKernel(new KernelKey(kind, length));
    }

    @SuppressWarnings("unchecked")
    @Override
    public TransformKernel<ComplexDoubleType> planComplexKernel(TransformKind kind, int length) {
        if (!kind.isFourier()) {
            throw new IllegalArgumentException("Cannot plan a complex kernel for " + kind);
        }
        return (TransformKernel<ComplexDoubleType>) getKernel(new KernelKey(kind, length));
    }

    public long size() {
        return kernelsCache.size();
    }

    public void invalidateAll() {
        kernelsCache.invalidateAll();
    }

    private TransformKernel<?> getKernel(KernelKey key) {
        try {
            return kernelsCache.getUnchecked(key);
        } catch (UncheckedExecutionException e) {
            // surface planning errors, e.g. an invalid length, with their original type
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
