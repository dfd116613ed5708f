package au.org.ala.scalers.kernel;

import au.org.ala.scalers.Downscaler;
import au.org.ala.scalers.Resampler;
import au.org.ala.scalers.color.ColorPipeline;
import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Decode;
import au.org.ala.scalers.color.Encode;
import au.org.ala.scalers.color.Project;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Runs scaling kernels over whole rasters.
 * <p>
 * Each band of output rows decodes only the source rows its kernel reads into its own {@link NeighborFrame}, a
 * window that slides down as the band advances, so memory grows with the image width rather than its area. Every
 * output pixel is produced by the kernel and encoded straight into the target. Large images are split into bands
 * that run on the configured executor; each band writes a disjoint part of the target.
 */
public class ScalerPipeline {

    private static final Logger log = LoggerFactory.getLogger(ScalerPipeline.class);

    private final ScalerPipelineConfig config;

    public ScalerPipeline() {
        this(new ScalerPipelineConfig());
    }

    public ScalerPipeline(ScalerPipelineConfig config) {
        this.config = Preconditions.checkNotNull(config, "config");
    }

    public ScalerPipelineConfig getConfig() {
        return config;
    }

    /**
     * Decodes and projects every row of {@code source} through {@code pipeline} into one frame that can be read at
     * any coordinate. The scaling operations below do not use this; they keep a window of rows per band.
     */
    public <W, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>>
    NeighborFrame<W, K> decode(PixelRaster<P> source, ColorPipeline<W, K, P, D, J, E> pipeline) {
        pipeline.requirePixelType(source.getPixelType());
        return NeighborFrame.decode(source, pipeline.getDecoder(), pipeline.getProjector(),
                config.getHorizontalMode(), config.getVerticalMode());
    }

    /**
     * Expands every source pixel into a block of {@code target}, which must be exactly the kernel's scale times the
     * source size.
     */
    public <W, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>, T extends PixelScaleKernel<W, K, P, E>>
    void upscale(PixelRaster<P> source, PixelRaster<P> target, ColorPipeline<W, K, P, D, J, E> pipeline, T kernel) {
        requireTarget(target, (long) source.getWidth() * kernel.getScaleX(), (long) source.getHeight() * kernel.getScaleY());
        requireSource(source, pipeline);
        pipeline.requirePixelType(target.getPixelType());

        E encoder = pipeline.getEncoder();
        int width = source.getWidth();
        int margin = PixelScaleKernel.NEIGHBOR_ROWS;
        forEachBand(source.getHeight(), (long) target.getWidth() * target.getHeight(), (from, to) -> {
            NeighborFrame<W, K> frame = window(source, pipeline, 2 * margin + 1);
            for (int y = from; y < to; y++) {
                frame.slide(y - margin, y + margin);
                for (int x = 0; x < width; x++) {
                    kernel.scale(frame, x, y, target, encoder);
                }
            }
        });
    }

    /**
     * Reduces {@code ratioX x ratioY} blocks of {@code source} to single pixels of {@code target}. Blocks that would
     * run past the right or bottom edge are dropped, so the target is {@code floor(source / ratio)} on each axis.
     *
     * @throws IllegalArgumentException if the source is smaller than one block on either axis
     */
    public <W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>, T extends DownscaleKernel<W, K, P, E>>
    void downscale(PixelRaster<P> source, PixelRaster<P> target, ColorPipeline<W, K, P, D, J, E> pipeline, T kernel) {
        int ratioX = kernel.getRatioX();
        int ratioY = kernel.getRatioY();
        Preconditions.checkArgument(source.getWidth() >= ratioX && source.getHeight() >= ratioY,
                "a %sx%s source is smaller than one %sx%s block", source.getWidth(), source.getHeight(), ratioX, ratioY);
        requireTarget(target, source.getWidth() / ratioX, source.getHeight() / ratioY);
        requireSource(source, pipeline);
        pipeline.requirePixelType(target.getPixelType());

        E encoder = pipeline.getEncoder();
        int width = target.getWidth();
        forEachBand(target.getHeight(), (long) width * target.getHeight(), (from, to) -> {
            NeighborFrame<W, K> frame = window(source, pipeline, ratioY);
            for (int y = from; y < to; y++) {
                frame.slide(y * ratioY, y * ratioY + ratioY - 1);
                for (int x = 0; x < width; x++) {
                    target.set(x, y, kernel.average(frame, x * ratioX, y * ratioY, encoder));
                }
            }
        });
    }

    /**
     * Fills every pixel of {@code target} from {@code source}; the scale on each axis is the ratio of their sizes.
     */
    public <W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>, T extends ResampleKernel<W, K, P, D, J, E>>
    void resample(PixelRaster<P> source, PixelRaster<P> target, ColorPipeline<W, K, P, D, J, E> pipeline, T kernel) {
        Preconditions.checkArgument(target.getWidth() > 0 && target.getHeight() > 0,
                "cannot resample into an empty %sx%s target", target.getWidth(), target.getHeight());
        requireSource(source, pipeline);
        pipeline.requirePixelType(target.getPixelType());

        E encoder = pipeline.getEncoder();
        int width = target.getWidth();
        int height = target.getHeight();
        int radius = kernel.getRadius();
        forEachBand(height, (long) width * height, (from, to) -> {
            NeighborFrame<W, K> frame = window(source, pipeline, 2 * radius + 1);
            for (int y = from; y < to; y++) {
                int centre = (int) Math.floor(ResampleKernel.sourceCoordinate(y, source.getHeight(), height));
                frame.slide(centre - radius, centre + radius);
                for (int x = 0; x < width; x++) {
                    target.set(x, y, kernel.resample(frame, x, y, width, height, encoder));
                }
            }
        });
    }

    /**
     * Resamples through whatever kernel {@code resampler} hands back. The kernel's concrete type is only known inside
     * the callback, and every per-pixel call made from there goes to that one class.
     */
    public <W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>>
    void resample(Resampler resampler, PixelRaster<P> source, PixelRaster<P> target, ColorPipeline<W, K, P, D, J, E> pipeline) {
        resampler.invokeKernel(new ResampleCallback<W, K, P, D, J, E>(source, target, pipeline));
    }

    /**
     * Downscales through the kernel {@code downscaler} hands back.
     */
    public <W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>>
    void downscale(Downscaler downscaler, PixelRaster<P> source, PixelRaster<P> target, ColorPipeline<W, K, P, D, J, E> pipeline) {
        downscaler.invokeKernel(new DownscaleCallback<W, K, P, D, J, E>(source, target, pipeline));
    }

    private static void requireSource(PixelRaster<?> source, ColorPipeline<?, ?, ?, ?, ?, ?> pipeline) {
        pipeline.requirePixelType(source.getPixelType());
        Preconditions.checkArgument(source.getWidth() > 0 && source.getHeight() > 0,
                "cannot scale an empty %sx%s source", source.getWidth(), source.getHeight());
    }

    private <W, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>>
    NeighborFrame<W, K> window(PixelRaster<P> source, ColorPipeline<W, K, P, D, J, E> pipeline, int rows) {
        return NeighborFrame.window(source, pipeline.getDecoder(), pipeline.getProjector(),
                config.getHorizontalMode(), config.getVerticalMode(), rows);
    }

    private static void requireTarget(PixelRaster<?> target, long width, long height) {
        Preconditions.checkArgument(target.getWidth() == width && target.getHeight() == height,
                "target is %sx%s but must be %sx%s", target.getWidth(), target.getHeight(), width, height);
    }

    void forEachBand(int rows, long pixels, RowBand band) {
        ExecutorService executor = config.getExecutor();
        int minRows = config.getMinRowsPerBand();
        if (executor == null || pixels <= config.getParallelPixelThreshold() || rows < 2 * minRows) {
            band.run(0, rows);
            return;
        }

        int rowsPerBand = Math.max(minRows, rows / (Runtime.getRuntime().availableProcessors() * 4));
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int from = 0; from < rows; from += rowsPerBand) {
            int start = from;
            int end = Math.min(rows, from + rowsPerBand);
            futures.add(CompletableFuture.runAsync(() -> band.run(start, end), executor));
        }
        log.trace("forEachBand: {} rows in {} bands", rows, futures.size());

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            Throwables.throwIfUnchecked(cause);
            throw e;
        }
    }

    @FunctionalInterface
    interface RowBand {
        void run(int fromRow, int toRow);
    }

    private final class ResampleCallback<W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>>
            implements ResampleKernelCallback<W, K, P, D, J, E, PixelRaster<P>> {

        private final PixelRaster<P> source;
        private final PixelRaster<P> target;
        private final ColorPipeline<W, K, P, D, J, E> pipeline;

        ResampleCallback(PixelRaster<P> source, PixelRaster<P> target, ColorPipeline<W, K, P, D, J, E> pipeline) {
            this.source = source;
            this.target = target;
            this.pipeline = pipeline;
        }

        @Override
        public <T extends ResampleKernel<W, K, P, D, J, E>> PixelRaster<P> invoke(T kernel) {
            resample(source, target, pipeline, kernel);
            return target;
        }
    }

    private final class DownscaleCallback<W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>>
            implements DownscaleKernelCallback<W, K, P, E, PixelRaster<P>> {

        private final PixelRaster<P> source;
        private final PixelRaster<P> target;
        private final ColorPipeline<W, K, P, D, J, E> pipeline;

        DownscaleCallback(PixelRaster<P> source, PixelRaster<P> target, ColorPipeline<W, K, P, D, J, E> pipeline) {
            this.source = source;
            this.target = target;
            this.pipeline = pipeline;
        }

        @Override
        public <T extends DownscaleKernel<W, K, P, E>> PixelRaster<P> invoke(T kernel) {
            downscale(source, target, pipeline, kernel);
            return target;
        }
    }
}
