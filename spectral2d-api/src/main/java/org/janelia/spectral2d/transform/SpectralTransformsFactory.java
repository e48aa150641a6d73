package org.janelia.spectral2d.transform;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;

import javax.annotation.Nullable;

import net.imglib2.parallel.TaskExecutor;
import net.imglib2.parallel.TaskExecutors;
import org.janelia.spectral2d.kernel.CachedTransformKernelProvider;
import org.janelia.spectral2d.kernel.DefaultTransformKernelProvider;
import org.janelia.spectral2d.kernel.TransformKernelProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link SpectralTransforms} configured from {@link TransformParams}.
 */
public class SpectralTransformsFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SpectralTransformsFactory.class);

    static final int DEFAULT_NUM_TASKS = 1;
    static final long DEFAULT_KERNEL_CACHE_SIZE = 64;

    public static SpectralTransforms createSpectralTransforms(TransformParams params) {
        return createSpectralTransforms(params, null);
    }

    /**
     * @param params          transform settings
     * @param executorService executor for the row and column passes when numTasks is greater than 1;
     *                        if null the common fork-join pool is used
     * @return configured transforms
     */
    public static SpectralTransforms createSpectralTransforms(TransformParams params,
                                                              @Nullable ExecutorService executorService) {
        int numTasks = params.getIntParam(TransformParams.NUM_TASKS, DEFAULT_NUM_TASKS);
        boolean cacheKernels = params.getBoolParam(TransformParams.CACHE_KERNELS, false);
        long kernelCacheSize = params.getLongParam(TransformParams.KERNEL_CACHE_SIZE, DEFAULT_KERNEL_CACHE_SIZE);
        if (numTasks < 1) {
            throw new IllegalArgumentException("The number of tasks must be a positive integer - current value is " + numTasks);
        }
        if (cacheKernels && kernelCacheSize < 1) {
            throw new IllegalArgumentException("The kernel cache size must be a positive integer - current value is " + kernelCacheSize);
        }
        LOG.info("Create spectral transforms with numTasks={}, cacheKernels={}, kernelCacheSize={}",
                numTasks, cacheKernels, kernelCacheSize);

        TransformKernelProvider kernelProvider = new DefaultTransformKernelProvider();
        if (cacheKernels) {
            kernelProvider = new CachedTransformKernelProvider(kernelProvider, kernelCacheSize);
        }
        TaskExecutor taskExecutor;
        if (numTasks == 1) {
            taskExecutor = TaskExecutors.singleThreaded();
        } else {
            taskExecutor = TaskExecutors.forExecutorServiceAndNumTasks(
                    executorService != null ? executorService : ForkJoinPool.commonPool(),
                    numTasks);
        }
        return new SpectralTransforms(new SeparableTransformEngine(kernelProvider, taskExecutor));
    }
}
