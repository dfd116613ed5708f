package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.Resampler;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.ScalerCategory;
import au.org.ala.scalers.kernel.ScalerPipeline;
import com.google.common.base.Preconditions;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Describes a {@link Resampler}, which reaches any target size whose scale lies in {@code [minScale, maxScale]}
 * on both axes.
 */
public final class ResamplerDescriptor<T extends Resampler> extends ScalerDescriptor<T> {

    private final double minScale;
    private final double maxScale;
    private final ScaleFactor defaultScale;

    ResamplerDescriptor(Class<T> type, String name, String author, int year, String url, String description,
                        double minScale, double maxScale, ScaleFactor defaultScale,
                        Function<ScaleFactor, T> factory, BiFunction<T, ScalerPipeline, ScalerDispatch> dispatcher) {
        super(type, name, author, year, url, description, factory, dispatcher);
        Preconditions.checkArgument(minScale > 0 && minScale <= maxScale, "invalid scale range [%s, %s]", minScale, maxScale);
        this.minScale = minScale;
        this.maxScale = maxScale;
        this.defaultScale = defaultScale;
    }

    @Override
    public ScalerCategory getCategory() {
        return ScalerCategory.RESAMPLER;
    }

    public double getMinScale() {
        return minScale;
    }

    public double getMaxScale() {
        return maxScale;
    }

    @Override
    public ScaleFactor getDefaultScale() {
        return defaultScale;
    }

    @Override
    public boolean supports(ScaleFactor scale) {
        return inRange(scale.getX()) && inRange(scale.getY());
    }

    private boolean inRange(double scale) {
        return scale >= minScale && scale <= maxScale;
    }

    @Override
    public Optional<Dimension> smallestTargetCovering(int sourceWidth, int sourceHeight, int targetWidth, int targetHeight) {
        if (sourceWidth <= 0 || sourceHeight <= 0 || targetWidth <= 0 || targetHeight <= 0) {
            return Optional.empty();
        }
        if (inRange((double) targetWidth / sourceWidth) && inRange((double) targetHeight / sourceHeight)) {
            return Optional.of(new Dimension(targetWidth, targetHeight));
        }
        return Optional.empty();
    }

    @Override
    public T createForTarget(int sourceWidth, int sourceHeight, Dimension target) {
        return create(ScaleFactor.of((double) target.width / sourceWidth, (double) target.height / sourceHeight));
    }
}
