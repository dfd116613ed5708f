package au.org.ala.scalers;

import au.org.ala.scalers.color.ColorSpace4F;
import au.org.ala.scalers.color.Encode;
import au.org.ala.scalers.kernel.DownscaleKernelCallback;

/**
 * A downscaler that reduces {@code ratioX x ratioY} blocks of source pixels to one output pixel.
 * <p>
 * Concrete classes publish {@code SUPPORTED_RATIOS}, {@code supportsRatio(int)} and
 * {@code possibleTargets(int, int)} statically, mirroring {@link PixelScaler}.
 */
public interface Downscaler extends ScalerInfo {

    int getRatioX();

    int getRatioY();

    /**
     * Hands this downscaler's concrete kernel to {@code callback}. Called exactly once; exceptions thrown by the
     * callback propagate unchanged.
     */
    <W extends ColorSpace4F<W>, K, P, E extends Encode<W, P>, R> R invokeKernel(DownscaleKernelCallback<W, K, P, E, R> callback);

}
