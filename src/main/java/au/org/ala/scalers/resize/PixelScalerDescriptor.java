package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.PixelScaler;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.ScalerCategory;
import au.org.ala.scalers.kernel.ScalerPipeline;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

public final class PixelScalerDescriptor<T extends PixelScaler> extends ScalerDescriptor<T> {

    private final List<ScaleFactor> supportedScales;
    private final Predicate<ScaleFactor> supportsScale;
    private final TargetSizes targetSizes;

    PixelScalerDescriptor(Class<T> type, String name, String author, int year, String url, String description,
                          List<ScaleFactor> supportedScales, Predicate<ScaleFactor> supportsScale, TargetSizes targetSizes,
                          Function<ScaleFactor, T> factory, BiFunction<T, ScalerPipeline, ScalerDispatch> dispatcher) {
        super(type, name, author, year, url, description, factory, dispatcher);
        Preconditions.checkArgument(!supportedScales.isEmpty(), "%s supports no scales", name);
        this.supportedScales = ImmutableList.copyOf(supportedScales);
        this.supportsScale = supportsScale;
        this.targetSizes = targetSizes;
    }

    @Override
    public ScalerCategory getCategory() {
        return ScalerCategory.PIXEL_ART;
    }

    public List<ScaleFactor> getSupportedScales() {
        return supportedScales;
    }

    public List<Dimension> possibleTargets(int sourceWidth, int sourceHeight) {
        return targetSizes.possibleTargets(sourceWidth, sourceHeight);
    }

    @Override
    public ScaleFactor getDefaultScale() {
        return supportedScales.get(0);
    }

    @Override
    public boolean supports(ScaleFactor scale) {
        return supportsScale.test(scale);
    }

    @Override
    public Optional<Dimension> smallestTargetCovering(int sourceWidth, int sourceHeight, int targetWidth, int targetHeight) {
        return possibleTargets(sourceWidth, sourceHeight).stream()
                .filter(d -> d.covers(targetWidth, targetHeight))
                .min(Comparator.comparingLong(Dimension::area));
    }

    @Override
    public T createForTarget(int sourceWidth, int sourceHeight, Dimension target) {
        return create(ScaleFactor.of((double) target.width / sourceWidth, (double) target.height / sourceHeight));
    }
}
