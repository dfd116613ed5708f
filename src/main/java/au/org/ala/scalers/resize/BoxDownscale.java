package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.Downscaler;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.ScalerQuality;
import au.org.ala.scalers.UnsupportedScaleException;
import au.org.ala.scalers.color.Argb8888;
import au.org.ala.scalers.color.ColorPipeline;
import au.org.ala.scalers.color.ColorPipelines;
import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Decode;
import au.org.ala.scalers.color.Encode;
import au.org.ala.scalers.color.Project;
import au.org.ala.scalers.kernel.Accum4F;
import au.org.ala.scalers.kernel.Argb8888Raster;
import au.org.ala.scalers.kernel.DownscaleKernel;
import au.org.ala.scalers.kernel.DownscaleKernelCallback;
import au.org.ala.scalers.kernel.NeighborFrame;
import au.org.ala.scalers.kernel.ScalerPipeline;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Box filter downscaling: every output pixel is the unweighted mean of one {@code ratioX x ratioY} block.
 * Partial blocks at the right and bottom edges are dropped.
 */
public final class BoxDownscale implements Downscaler {

    public static final List<Integer> SUPPORTED_RATIOS = ImmutableList.of(2, 3, 4, 5);

    public static final DownscalerDescriptor<BoxDownscale> DESCRIPTOR = new DownscalerDescriptor<>(BoxDownscale.class,
            "BoxDownscale", null, 0, null, "Box filter downscaling with configurable ratio",
            SUPPORTED_RATIOS, BoxDownscale::supportsRatio, BoxDownscale::possibleTargets, BoxDownscale::new,
            BoxDownscale::dispatch);

    private final int ratioX;
    private final int ratioY;

    public BoxDownscale() {
        this(2);
    }

    public BoxDownscale(int ratio) {
        this(ratio, ratio);
    }

    /**
     * @throws UnsupportedScaleException unless both ratios are between 2 and 5
     */
    public BoxDownscale(int ratioX, int ratioY) {
        if (!supportsRatio(ratioX) || !supportsRatio(ratioY)) {
            throw UnsupportedScaleException.forRatio("BoxDownscale", ratioX, ratioY);
        }
        this.ratioX = ratioX;
        this.ratioY = ratioY;
    }

    public static boolean supportsRatio(int ratio) {
        return ratio >= 2 && ratio <= 5;
    }

    /**
     * Lists the targets of the uniform ratios only. Mixed ratios such as {@code (2, 3)} are still accepted by
     * {@link #BoxDownscale(int, int)} but are never picked when fitting an image to a size.
     */
    public static List<Dimension> possibleTargets(int sourceWidth, int sourceHeight) {
        ImmutableList.Builder<Dimension> targets = ImmutableList.builder();
        for (int ratio : SUPPORTED_RATIOS) {
            if (sourceWidth >= ratio && sourceHeight >= ratio) {
                targets.add(new Dimension(sourceWidth / ratio, sourceHeight / ratio));
            }
        }
        return targets.build();
    }

    @Override
    public int getRatioX() {
        return ratioX;
    }

    @Override
    public int getRatioY() {
        return ratioY;
    }

    @Override
    public ScaleFactor getScale() {
        return ScaleFactor.of(1.0 / ratioX, 1.0 / ratioY);
    }

    @Override
    public <W extends ColorSpace4F<W>, K, P, E extends Encode<W, P>, R> R invokeKernel(DownscaleKernelCallback<W, K, P, E, R> callback) {
        if (ratioX == 2 && ratioY == 2) {
            return callback.invoke(new Box2x2Kernel<W, K, P, E>());
        }
        return callback.invoke(new BoxKernel<W, K, P, E>(ratioX, ratioY));
    }

    ScalerDispatch dispatch(ScalerPipeline pipeline) {
        return (source, quality) -> quality == ScalerQuality.HIGH_QUALITY
                ? downscale(pipeline, source, ColorPipelines.linearOklab())
                : downscale(pipeline, source, ColorPipelines.gammaFloat());
    }

    private <W extends ColorSpace4F<W>, K, D extends Decode<Argb8888, W>, J extends Project<W, K>, E extends Encode<W, Argb8888>>
    BufferedImage downscale(ScalerPipeline pipeline, BufferedImage image, ColorPipeline<W, K, Argb8888, D, J, E> colors) {
        Argb8888Raster source = Argb8888Raster.wrap(image);
        if (source.getWidth() < ratioX || source.getHeight() < ratioY) {
            throw new IllegalArgumentException(String.format("a %dx%d image is smaller than one %dx%d block",
                    source.getWidth(), source.getHeight(), ratioX, ratioY));
        }
        Argb8888Raster target = Argb8888Raster.create(source.getWidth() / ratioX, source.getHeight() / ratioY);
        pipeline.downscale(this, source, target, colors);
        return target.getImage();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("ratioX", ratioX).add("ratioY", ratioY).toString();
    }

    static final class Box2x2Kernel<W extends ColorSpace4F<W>, K, P, E extends Encode<W, P>> implements DownscaleKernel<W, K, P, E> {

        @Override
        public int getRatioX() {
            return 2;
        }

        @Override
        public int getRatioY() {
            return 2;
        }

        @Override
        public P average(NeighborFrame<W, K> frame, int sourceX, int sourceY, E encoder) {
            Accum4F<W> acc = new Accum4F<>();
            acc.addMul(frame.work(sourceX, sourceY), 1f);
            acc.addMul(frame.work(sourceX + 1, sourceY), 1f);
            acc.addMul(frame.work(sourceX, sourceY + 1), 1f);
            acc.addMul(frame.work(sourceX + 1, sourceY + 1), 1f);
            return encoder.encode(acc.result());
        }
    }

    static final class BoxKernel<W extends ColorSpace4F<W>, K, P, E extends Encode<W, P>> implements DownscaleKernel<W, K, P, E> {

        private final int ratioX;
        private final int ratioY;

        BoxKernel(int ratioX, int ratioY) {
            this.ratioX = ratioX;
            this.ratioY = ratioY;
        }

        @Override
        public int getRatioX() {
            return ratioX;
        }

        @Override
        public int getRatioY() {
            return ratioY;
        }

        @Override
        public P average(NeighborFrame<W, K> frame, int sourceX, int sourceY, E encoder) {
            Accum4F<W> acc = new Accum4F<>();
            for (int dy = 0; dy < ratioY; dy++) {
                for (int dx = 0; dx < ratioX; dx++) {
                    acc.addMul(frame.work(sourceX + dx, sourceY + dy), 1f);
                }
            }
            return encoder.encode(acc.result());
        }
    }
}
