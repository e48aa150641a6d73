package org.janelia.spectral2d.transform;

import java.util.List;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.ImgFactory;
import net.imglib2.img.array.ArrayImgFactory;
import net.imglib2.parallel.TaskExecutor;
import net.imglib2.parallel.TaskExecutors;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.NumericType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.util.Util;
import net.imglib2.view.Views;
import org.janelia.spectral2d.TransformKind;
import org.janelia.spectral2d.kernel.TransformKernel;
import org.janelia.spectral2d.kernel.TransformKernelProvider;
import org.janelia.spectral2d.matrix.MatrixShapes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a 2D transform as two passes of 1D kernels: one kernel per row, then one kernel per column
 * of the row pass result. Columns are processed as the rows of a transposed view, and the results are
 * written through the transposed view of the output, so the output keeps the input's orientation.
 *
 * All rows of a pass may run concurrently on the configured {@link TaskExecutor}; a pass only
 * starts after every task of the previous pass completed. A Fourier pass with lines of length 1 is the
 * identity and is skipped; cosine passes always run their kernel because a length 1 DCT-III or DCT-IV
 * scales its input.
 */
public class SeparableTransformEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SeparableTransformEngine.class);

    private final TransformKernelProvider kernelProvider;
    private final TaskExecutor taskExecutor;

    public SeparableTransformEngine(TransformKernelProvider kernelProvider) {
        this(kernelProvider, TaskExecutors.singleThreaded());
    }

    public SeparableTransformEngine(TransformKernelProvider kernelProvider, TaskExecutor taskExecutor) {
        this.kernelProvider = kernelProvider;
        this.taskExecutor = taskExecutor;
    }

    /**
     * DCT of the given type along rows then columns, scaled once by (rows * cols - 1) / 2.
     *
     * @param input matrix where dimension 0 indexes columns and dimension 1 indexes rows
     * @param kind  one of the cosine kinds
     * @return a new image with the input's element type and shape
     */
    public <T extends RealType<T> & NativeType<T>> Img<T> applyCosine(RandomAccessibleInterval<T> input, TransformKind kind) {
        MatrixShapes.checkShape(input);
        if (!kind.isCosine()) {
            throw new IllegalArgumentException(kind + " is not a cosine transform");
        }
        long rows = MatrixShapes.rows(input);
        long cols = MatrixShapes.cols(input);
        long startTime = System.currentTimeMillis();

        T elementType = Util.getTypeFromInterval(input).createVariable();
        ImgFactory<T> factory = new ArrayImgFactory<>(elementType);
        IntFunction<TransformKernel<T>> kernelPlanner = length -> kernelProvider.planRealKernel(kind, length);

        Img<T> rowsTransformed = transformRows(input, factory, kernelPlanner, false);
        Img<T> result = transformColumns(rowsTransformed, factory, kernelPlanner, false);
        multiply(result, ElementCasts.castOrOne(cosineScale(rows, cols), elementType));

        long endTime = System.currentTimeMillis();
        LOG.debug("Completed {} of {}x{} matrix in {} secs", kind, rows, cols, (endTime - startTime) / 1000.);
        return result;
    }

    /**
     * Unnormalized forward DFT along rows then columns. Elements are converted to complex values
     * with zero imaginary parts.
     */
    public <T extends RealType<T>> Img<ComplexDoubleType> applyFourier(RandomAccessibleInterval<T> input) {
        MatrixShapes.checkShape(input);
        long rows = MatrixShapes.rows(input);
        long cols = MatrixShapes.cols(input);
        long startTime = System.currentTimeMillis();

        ImgFactory<ComplexDoubleType> factory = new ArrayImgFactory<>(new ComplexDoubleType());
        IntFunction<TransformKernel<ComplexDoubleType>> kernelPlanner =
                length -> kernelProvider.planComplexKernel(TransformKind.FOURIER_FORWARD, length);

        Img<ComplexDoubleType> working = ElementCasts.toComplex(input);
        Img<ComplexDoubleType> rowsTransformed = transformRows(working, factory, kernelPlanner, true);
        Img<ComplexDoubleType> result = transformColumns(rowsTransformed, factory, kernelPlanner, true);

        long endTime = System.currentTimeMillis();
        LOG.debug("Completed {} of {}x{} matrix in {} secs", TransformKind.FOURIER_FORWARD, rows, cols, (endTime - startTime) / 1000.);
        return result;
    }

    /**
     * Inverse DFT scaled by 1 / (rows * cols). The input is transposed first, so the first pass runs
     * along the input's columns and the second pass along its rows; the result has the input's orientation.
     */
    public Img<ComplexDoubleType> applyInverseFourier(RandomAccessibleInterval<ComplexDoubleType> input) {
        MatrixShapes.checkShape(input);
        long rows = MatrixShapes.rows(input);
        long cols = MatrixShapes.cols(input);
        long startTime = System.currentTimeMillis();

        ImgFactory<ComplexDoubleType> factory = new ArrayImgFactory<>(new ComplexDoubleType());
        IntFunction<TransformKernel<ComplexDoubleType>> kernelPlanner =
                length -> kernelProvider.planComplexKernel(TransformKind.FOURIER_INVERSE, length);

        RandomAccessibleInterval<ComplexDoubleType> transposedInput = transpose(input);
        Img<ComplexDoubleType> transposedResult = transformRows(transposedInput, factory, kernelPlanner, true);
        Img<ComplexDoubleType> result = transformRows(transpose(transposedResult), factory, kernelPlanner, true);
        multiply(result, new ComplexDoubleType(1.0 / (rows * cols), 0));

        long endTime = System.currentTimeMillis();
        LOG.debug("Completed {} of {}x{} matrix in {} secs", TransformKind.FOURIER_INVERSE, rows, cols, (endTime - startTime) / 1000.);
        return result;
    }

    static double cosineScale(long rows, long cols) {
        return (rows * cols - 1) / 2.0;
    }

    private static <W> RandomAccessibleInterval<W> transpose(RandomAccessibleInterval<W> img) {
        return Views.permute(img, MatrixShapes.COL_AXIS, MatrixShapes.ROW_AXIS);
    }

    /**
     * Run a length-cols kernel over every row of source.
     *
     * @return a new image with the source's shape
     */
    private <W extends NativeType<W>> Img<W> transformRows(RandomAccessibleInterval<W> source,
                                                           ImgFactory<W> factory,
                                                           IntFunction<TransformKernel<W>> kernelPlanner,
                                                           boolean skipUnitLength) {
        Img<W> target = factory.create(source.dimensionsAsLongArray());
        transformLines(source, target, kernelPlanner, skipUnitLength);
        return target;
    }

    /**
     * Run a length-rows kernel over every column of source, through transposed views of source and target.
     *
     * @return a new image with the source's shape
     */
    private <W extends NativeType<W>> Img<W> transformColumns(RandomAccessibleInterval<W> source,
                                                              ImgFactory<W> factory,
                                                              IntFunction<TransformKernel<W>> kernelPlanner,
                                                              boolean skipUnitLength) {
        Img<W> target = factory.create(source.dimensionsAsLongArray());
        transformLines(transpose(source), transpose(target), kernelPlanner, skipUnitLength);
        return target;
    }

    private <W extends NativeType<W>> void transformLines(RandomAccessibleInterval<W> source,
                                                          RandomAccessibleInterval<W> target,
                                                          IntFunction<TransformKernel<W>> kernelPlanner,
                                                          boolean skipUnitLength) {
        int length = (int) MatrixShapes.cols(source);
        long nLines = MatrixShapes.rows(source);
        if (length == 1 && skipUnitLength) {
            LOG.trace("Skip pass over {} lines of length 1", nLines);
            copy(source, target);
            return;
        }
        TransformKernel<W> kernel = kernelPlanner.apply(length);
        long sourceMin = source.min(MatrixShapes.ROW_AXIS);
        long targetMin = target.min(MatrixShapes.ROW_AXIS);
        List<Long> lines = LongStream.range(0, nLines).boxed().collect(Collectors.toList());
        taskExecutor.forEach(lines, line -> kernel.process(
                Views.hyperSlice(source, MatrixShapes.ROW_AXIS, sourceMin + line),
                Views.hyperSlice(target, MatrixShapes.ROW_AXIS, targetMin + line)
        ));
    }

    private static <W extends NativeType<W>> void copy(RandomAccessibleInterval<W> source, RandomAccessibleInterval<W> target) {
        Cursor<W> sourceCursor = Views.flatIterable(source).cursor();
        Cursor<W> targetCursor = Views.flatIterable(target).cursor();
        while (sourceCursor.hasNext()) {
            targetCursor.next().set(sourceCursor.next());
        }
    }

    private static <W extends NumericType<W>> void multiply(Img<W> img, W scale) {
        for (W v : img) {
            v.mul(scale);
        }
    }
}
