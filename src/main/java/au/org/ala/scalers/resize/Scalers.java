package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.Downscaler;
import au.org.ala.scalers.PixelScaler;
import au.org.ala.scalers.Resampler;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.ScalerInfo;
import au.org.ala.scalers.ScalerQuality;
import au.org.ala.scalers.kernel.ScalerPipeline;
import au.org.ala.scalers.kernel.ScalerPipelineConfig;
import au.org.ala.scalers.util.ImageUtils;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * Applies scalers to {@link BufferedImage}s. Input images of any type are converted to
 * {@link BufferedImage#TYPE_INT_ARGB}; results are always {@code TYPE_INT_ARGB}.
 */
public class Scalers {

    private static final Logger log = LoggerFactory.getLogger(Scalers.class);

    private final ScalerPipeline pipeline;

    public Scalers() {
        this(new ScalerPipelineConfig());
    }

    public Scalers(ScalerPipelineConfig config) {
        this.pipeline = new ScalerPipeline(config);
    }

    /**
     * Applies any registered scaler at its configured scale.
     *
     * @throws IllegalArgumentException if the scaler's class is not registered in {@link ScalerRegistry}
     */
    public BufferedImage scale(BufferedImage image, ScalerInfo scaler, ScalerQuality quality) {
        return apply(image, ScalerRegistry.forScaler(scaler), scaler, quality);
    }

    public BufferedImage upscale(BufferedImage image, PixelScaler scaler, ScalerQuality quality) {
        return apply(image, ScalerRegistry.forScaler(scaler), scaler, quality);
    }

    public BufferedImage downscale(BufferedImage image, Downscaler downscaler, ScalerQuality quality) {
        return apply(image, ScalerRegistry.forScaler(downscaler), downscaler, quality);
    }

    /**
     * Resamples by the resampler's own scale.
     */
    public BufferedImage resample(BufferedImage image, Resampler resampler, ScalerQuality quality) {
        return apply(image, ScalerRegistry.forScaler(resampler), resampler, quality);
    }

    /**
     * Resamples to exactly {@code targetWidth x targetHeight}.
     *
     * @throws au.org.ala.scalers.UnsupportedScaleException if the implied scale is outside the resampler's range
     */
    public BufferedImage resample(BufferedImage image, ResamplerDescriptor<?> descriptor, int targetWidth, int targetHeight, ScalerQuality quality) {
        Preconditions.checkArgument(targetWidth > 0 && targetHeight > 0, "invalid target size %sx%s", targetWidth, targetHeight);
        ScaleFactor scale = ScaleFactor.of((double) targetWidth / image.getWidth(), (double) targetHeight / image.getHeight());
        return apply(image, descriptor, descriptor.create(scale), quality);
    }

    /**
     * Scales {@code image} to {@code targetWidth x targetHeight} using the candidate that gets closest from above:
     * the smallest output any candidate can produce that still covers the target. Whatever size difference remains is
     * closed with an imgscalr resize, which also does the whole job when no candidate can cover the target.
     */
    public BufferedImage scaleToFit(BufferedImage image, int targetWidth, int targetHeight,
                                    List<? extends ScalerDescriptor<?>> candidates, ScalerQuality quality) {
        Preconditions.checkArgument(targetWidth > 0 && targetHeight > 0, "invalid target size %sx%s", targetWidth, targetHeight);
        int width = image.getWidth();
        int height = image.getHeight();

        ScalerDescriptor<?> best = null;
        Dimension bestTarget = null;
        for (ScalerDescriptor<?> candidate : candidates) {
            Optional<Dimension> reachable = candidate.smallestTargetCovering(width, height, targetWidth, targetHeight);
            if (reachable.isPresent() && (bestTarget == null || reachable.get().area() < bestTarget.area())) {
                best = candidate;
                bestTarget = reachable.get();
            }
        }

        if (best == null) {
            log.warn("scaleToFit: no scaler reaches {}x{} from {}x{}, using imgscalr", targetWidth, targetHeight, width, height);
            return ImageUtils.scale(image, targetWidth, targetHeight);
        }

        log.debug("scaleToFit: {} reaches {}x{} for a {}x{} target", best.getName(), bestTarget.width, bestTarget.height, targetWidth, targetHeight);
        BufferedImage scaled = apply(image, best, best.createForTarget(width, height, bestTarget), quality);
        if (scaled.getWidth() != targetWidth || scaled.getHeight() != targetHeight) {
            scaled = ImageUtils.scale(scaled, targetWidth, targetHeight);
        }
        return scaled;
    }

    private BufferedImage apply(BufferedImage image, ScalerDescriptor<?> descriptor, ScalerInfo scaler, ScalerQuality quality) {
        Preconditions.checkNotNull(image, "image");
        Preconditions.checkNotNull(quality, "quality");

        Stopwatch sw = Stopwatch.createStarted();
        BufferedImage source = ImageUtils.toIntArgb(image);
        BufferedImage result = descriptor.dispatch(scaler, pipeline).apply(source, quality);
        log.debug("{} ({}): {}x{} -> {}x{} in {}", scaler, quality,
                image.getWidth(), image.getHeight(), result.getWidth(), result.getHeight(), sw);
        return result;
    }
}
