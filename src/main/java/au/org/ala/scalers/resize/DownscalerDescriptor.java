package au.org.ala.scalers.resize;

import au.org.ala.scalers.Dimension;
import au.org.ala.scalers.Downscaler;
import au.org.ala.scalers.ScaleFactor;
import au.org.ala.scalers.ScalerCategory;
import au.org.ala.scalers.UnsupportedScaleException;
import au.org.ala.scalers.kernel.ScalerPipeline;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.IntPredicate;

/**
 * Describes a {@link Downscaler}. Its scale factors are the reciprocals of the block ratios, so ratio 2 is
 * {@code 0.5x}.
 */
public final class DownscalerDescriptor<T extends Downscaler> extends ScalerDescriptor<T> {

    private static final double RATIO_TOLERANCE = 1e-9;

    private final List<Integer> supportedRatios;
    private final IntPredicate supportsRatio;
    private final TargetSizes targetSizes;
    private final BiFunction<Integer, Integer, T> ratioFactory;

    DownscalerDescriptor(Class<T> type, String name, String author, int year, String url, String description,
                         List<Integer> supportedRatios, IntPredicate supportsRatio, TargetSizes targetSizes,
                         BiFunction<Integer, Integer, T> ratioFactory, BiFunction<T, ScalerPipeline, ScalerDispatch> dispatcher) {
        super(type, name, author, year, url, description,
                scale -> ratioFactory.apply(ratioOf(name, scale, scale.getX()), ratioOf(name, scale, scale.getY())),
                dispatcher);
        Preconditions.checkArgument(!supportedRatios.isEmpty(), "%s supports no ratios", name);
        this.supportedRatios = ImmutableList.copyOf(supportedRatios);
        this.supportsRatio = supportsRatio;
        this.targetSizes = targetSizes;
        this.ratioFactory = ratioFactory;
    }

    private static int ratioOf(String name, ScaleFactor scale, double component) {
        double ratio = 1 / component;
        long rounded = Math.round(ratio);
        if (rounded < 1 || rounded > Integer.MAX_VALUE || Math.abs(ratio - rounded) > RATIO_TOLERANCE) {
            throw UnsupportedScaleException.forScale(name, scale);
        }
        return (int) rounded;
    }

    @Override
    public ScalerCategory getCategory() {
        return ScalerCategory.DOWNSCALER;
    }

    public List<Integer> getSupportedRatios() {
        return supportedRatios;
    }

    public boolean supportsRatio(int ratio) {
        return supportsRatio.test(ratio);
    }

    public List<Dimension> possibleTargets(int sourceWidth, int sourceHeight) {
        return targetSizes.possibleTargets(sourceWidth, sourceHeight);
    }

    /**
     * @throws UnsupportedScaleException if either ratio is not supported
     */
    public T create(int ratioX, int ratioY) {
        return ratioFactory.apply(ratioX, ratioY);
    }

    @Override
    public ScaleFactor getDefaultScale() {
        return ScaleFactor.uniform(1.0 / supportedRatios.get(0));
    }

    @Override
    public boolean supports(ScaleFactor scale) {
        double rx = 1 / scale.getX();
        double ry = 1 / scale.getY();
        return isSupportedRatio(rx) && isSupportedRatio(ry);
    }

    private boolean isSupportedRatio(double ratio) {
        long rounded = Math.round(ratio);
        return Math.abs(ratio - rounded) <= RATIO_TOLERANCE && rounded <= Integer.MAX_VALUE
                && supportsRatio.test((int) rounded);
    }

    @Override
    public Optional<Dimension> smallestTargetCovering(int sourceWidth, int sourceHeight, int targetWidth, int targetHeight) {
        return possibleTargets(sourceWidth, sourceHeight).stream()
                .filter(d -> d.covers(targetWidth, targetHeight))
                .min(Comparator.comparingLong(Dimension::area));
    }

    @Override
    public T createForTarget(int sourceWidth, int sourceHeight, Dimension target) {
        int ratioX = ratioReaching(sourceWidth, target.width);
        int ratioY = ratioReaching(sourceHeight, target.height);
        if (ratioX == 0 || ratioY == 0) {
            throw new UnsupportedScaleException(String.format("%s cannot reduce %dx%d to %dx%d",
                    getName(), sourceWidth, sourceHeight, target.width, target.height));
        }
        return create(ratioX, ratioY);
    }

    private int ratioReaching(int sourceLength, int targetLength) {
        for (int ratio : supportedRatios) {
            if (sourceLength / ratio == targetLength) {
                return ratio;
            }
        }
        return 0;
    }
}
