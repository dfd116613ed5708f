package au.org.ala.scalers;

import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Decode;
import au.org.ala.scalers.color.Encode;
import au.org.ala.scalers.color.Project;
import au.org.ala.scalers.kernel.ResampleKernel;
import au.org.ala.scalers.kernel.ResampleKernelCallback;

/**
 * A continuous resampler, valid for any scale between the {@code MIN_SCALE} and {@code MAX_SCALE} constants its
 * concrete class publishes.
 */
public interface Resampler extends ScalerInfo {

    double getScaleX();

    double getScaleY();

    /**
     * @return how many source pixels either side of the mapped position the kernel reads
     */
    int getRadius();

    @Override
    default ScaleFactor getScale() {
        return ScaleFactor.of(getScaleX(), getScaleY());
    }

    /**
     * Passes this resampler's concrete {@link ResampleKernel} to {@code callback} and returns what the callback
     * returns.
     * <p>
     * The kernel type is fixed by the implementing class, so this is the only dynamic dispatch of a resample
     * operation: inside {@code callback} every call lands on one concrete kernel class. Implementations invoke the
     * callback exactly once, let its exceptions propagate unchanged and keep no reference to the callback or the
     * kernel after returning.
     *
     * @param <W> working color, accumulated in float
     * @param <K> key color used for comparisons
     * @param <P> stored pixel
     * @param <D> decoder from stored to working color
     * @param <J> projector from working to key color
     * @param <E> encoder from working to stored color
     * @param <R> result of the callback
     */
    <W extends ColorSpace4F<W>, K, P, D extends Decode<P, W>, J extends Project<W, K>, E extends Encode<W, P>, R>
    R invokeKernel(ResampleKernelCallback<W, K, P, D, J, E, R> callback);

}
