package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.Resampler;
import au.org.ala.scalers.ScalerQuality;
import au.org.ala.scalers.color.Argb8888;
import au.org.ala.scalers.color.ColorPipeline;
import au.org.ala.scalers.color.ColorPipelines;
import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Decode;
import au.org.ala.scalers.color.Encode;
import au.org.ala.scalers.color.Project;
import au.org.ala.scalers.kernel.Argb8888Raster;
import au.org.ala.scalers.kernel.ScalerPipeline;
import com.google.common.base.Preconditions;

import java.awt.image.BufferedImage;

final class ScalerDispatches {

    private ScalerDispatches() {
    }

    /**
     * Resamples to the resampler's own scale, accumulating in gamma encoded float for {@link ScalerQuality#FAST}
     * and in linear light otherwise.
     */
    static ScalerDispatch resampling(Resampler resampler, ScalerPipeline pipeline) {
        return (source, quality) -> quality == ScalerQuality.HIGH_QUALITY
                ? resample(resampler, pipeline, source, ColorPipelines.linearOklab())
                : resample(resampler, pipeline, source, ColorPipelines.gammaFloat());
    }

    private static <W extends ColorSpace4F<W>, K, D extends Decode<Argb8888, W>, J extends Project<W, K>, E extends Encode<W, Argb8888>>
    BufferedImage resample(Resampler resampler, ScalerPipeline pipeline, BufferedImage image,
                           ColorPipeline<W, K, Argb8888, D, J, E> colors) {
        Argb8888Raster source = Argb8888Raster.wrap(image);
        Dimension size = resampler.getScale().apply(source.getWidth(), source.getHeight());
        Preconditions.checkArgument(size.width > 0 && size.height > 0,
                "scaling %dx%d by %s leaves no pixels", source.getWidth(), source.getHeight(), resampler.getScale());
        Argb8888Raster target = Argb8888Raster.create(size.width, size.height);
        pipeline.resample(resampler, source, target, colors);
        return target.getImage();
    }
}
